package eu.virtualparadox.docembed.error;

/**
 * A pooled chunk vector has zero (or non-finite) Euclidean norm and cannot be normalized.
 */
public class DegenerateVectorException extends EmbeddingException {

    public DegenerateVectorException(final String message) {
        super(message);
    }

    public DegenerateVectorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
