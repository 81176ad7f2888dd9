package eu.virtualparadox.docembed.rag.pooling;

import eu.virtualparadox.docembed.error.EncodeException;

/**
 * Reduces one window's hidden states {@code [1, nTokens, hiddenSize]} to a single vector
 * by taking the arithmetic mean over the token axis.
 * <p>
 * No attention mask is applied: every token the tokenizer emitted, special tokens included,
 * contributes with equal weight.
 */
public class MeanPooler {

    /**
     * @param hiddenStates encoder output for a batch of one
     * @param hiddenSize   expected channel count
     * @return pooled vector of length {@code hiddenSize}
     * @throws EncodeException if the tensor does not have shape {@code [1, n > 0, hiddenSize]}
     */
    public float[] pool(final float[][][] hiddenStates, final int hiddenSize) {
        if (hiddenStates == null || hiddenStates.length != 1) {
            throw new EncodeException("Expected hidden states for exactly one sequence, got "
                    + (hiddenStates == null ? "null" : hiddenStates.length));
        }
        final float[][] tokenVectors = hiddenStates[0];
        if (tokenVectors == null || tokenVectors.length == 0) {
            throw new EncodeException("Encoder returned no token vectors");
        }

        final double[] sums = new double[hiddenSize];
        for (int i = 0; i < tokenVectors.length; i++) {
            final float[] tokenVec = tokenVectors[i];
            if (tokenVec == null || tokenVec.length != hiddenSize) {
                throw new EncodeException("Token " + i + " has "
                        + (tokenVec == null ? 0 : tokenVec.length) + " channels, expected " + hiddenSize);
            }
            for (int j = 0; j < hiddenSize; j++) {
                sums[j] += tokenVec[j];
            }
        }

        final float[] pooled = new float[hiddenSize];
        final int nTokens = tokenVectors.length;
        for (int j = 0; j < hiddenSize; j++) {
            pooled[j] = (float) (sums[j] / nTokens);
        }
        return pooled;
    }
}
