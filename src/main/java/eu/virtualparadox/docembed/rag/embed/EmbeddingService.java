package eu.virtualparadox.docembed.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for texts of any length.
 */
public interface EmbeddingService {

    /**
     * Embeds a single text.
     *
     * @param text the text (non-null)
     * @return document vector of {@link #dimension()} floats
     */
    float[] embed(String text);

    /**
     * Embeds several texts one after another.
     *
     * @param texts list of texts
     * @return one vector per text, in input order
     */
    List<float[]> embedAll(List<String> texts);

    /**
     * @return length of the vectors produced
     */
    int dimension();
}
