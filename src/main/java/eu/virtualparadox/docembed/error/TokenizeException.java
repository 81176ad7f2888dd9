package eu.virtualparadox.docembed.error;

/**
 * The tokenizer rejected the input text.
 */
public class TokenizeException extends EmbeddingException {

    public TokenizeException(final String message) {
        super(message);
    }

    public TokenizeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
