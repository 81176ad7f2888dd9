package eu.virtualparadox.docembed.encoder;

import eu.virtualparadox.docembed.error.EncodeException;

/**
 * Transformer encoder seen as a single forward operation over one sequence.
 */
public interface Encoder extends AutoCloseable {

    /**
     * Runs one window through the encoder.
     *
     * @param tokenIds     ids of the window, batch size one
     * @param tokenTypeIds segment ids, same length as {@code tokenIds}
     * @return hidden states of shape {@code [1, tokenIds.length, hiddenSize]}
     * @throws EncodeException if the forward pass fails
     */
    float[][][] forward(long[] tokenIds, long[] tokenTypeIds);

    @Override
    default void close() {
    }
}
