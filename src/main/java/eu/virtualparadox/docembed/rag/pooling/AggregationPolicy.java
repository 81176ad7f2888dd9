package eu.virtualparadox.docembed.rag.pooling;

import eu.virtualparadox.docembed.error.InvalidConfigException;

/**
 * Weighting applied when chunk vectors are combined into a document vector.
 * <p>
 * The opening window gets a larger weight than the rest; whether the weighted mean is
 * rescaled to unit norm afterwards is a separate switch (off by default, so the result of a
 * multi-chunk document generally has a norm below 1).
 *
 * @param firstChunkWeight weight of the first chunk (must be {@code > 0})
 * @param otherChunkWeight weight of every subsequent chunk (must be {@code > 0})
 * @param renormalize      rescale the aggregate to unit norm
 */
public record AggregationPolicy(double firstChunkWeight, double otherChunkWeight, boolean renormalize) {

    public static final double DEFAULT_FIRST_CHUNK_WEIGHT = 1.2;
    public static final double DEFAULT_OTHER_CHUNK_WEIGHT = 1.0;

    public AggregationPolicy {
        if (!(firstChunkWeight > 0.0) || !(otherChunkWeight > 0.0)
                || Double.isInfinite(firstChunkWeight) || Double.isInfinite(otherChunkWeight)) {
            throw new InvalidConfigException("Chunk weights must be positive and finite (first="
                    + firstChunkWeight + ", other=" + otherChunkWeight + ")");
        }
    }

    public static AggregationPolicy defaults() {
        return new AggregationPolicy(DEFAULT_FIRST_CHUNK_WEIGHT, DEFAULT_OTHER_CHUNK_WEIGHT, false);
    }

    public double weightOf(final int chunkIndex) {
        return chunkIndex == 0 ? firstChunkWeight : otherChunkWeight;
    }
}
