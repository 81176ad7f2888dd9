package eu.virtualparadox.docembed.error;

/**
 * The encoder failed or returned hidden states of an unexpected shape.
 */
public class EncodeException extends EmbeddingException {

    public EncodeException(final String message) {
        super(message);
    }

    public EncodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
