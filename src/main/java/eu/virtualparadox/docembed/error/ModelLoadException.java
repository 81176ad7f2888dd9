package eu.virtualparadox.docembed.error;

/**
 * Configuration, tokenizer or weight files could not be fetched or parsed.
 */
public class ModelLoadException extends EmbeddingException {

    public ModelLoadException(final String message) {
        super(message);
    }

    public ModelLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
