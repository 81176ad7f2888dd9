package eu.virtualparadox.docembed.error;

/**
 * Chunking parameters that would make the window loop stall or produce empty windows.
 */
public class InvalidConfigException extends EmbeddingException {

    public InvalidConfigException(final String message) {
        super(message);
    }

    public InvalidConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
