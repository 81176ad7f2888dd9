package eu.virtualparadox.docembed.error;

/**
 * Root of every failure raised while loading a model or embedding text.
 * <p>
 * Subclasses are distinguishable by type so callers can tell a broken model
 * download apart from input the tokenizer rejected or a degenerate encoder output.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(final String message) {
        super(message);
    }

    public EmbeddingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
