package eu.virtualparadox.docembed.rag.pooling;

import eu.virtualparadox.docembed.error.EncodeException;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Combines the ordered per-chunk unit vectors of one document into a single vector.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@code result[j] = sum_i(w_i * v_i[j]) / sum_i(w_i)} with weights from the
 *       {@link AggregationPolicy} (position-based, never content-based).</li>
 *   <li>An empty list yields an empty vector.</li>
 *   <li>A single vector is returned unchanged, whatever its weight.</li>
 *   <li>With {@link AggregationPolicy#renormalize()} set, the mean is rescaled to unit norm.</li>
 * </ul>
 */
@RequiredArgsConstructor
public class WeightedChunkAggregator {

    private final AggregationPolicy policy;
    private final VectorNormalizer normalizer;

    /**
     * @param chunkVectors chunk vectors in document order (all the same length)
     * @return weighted mean vector, or an empty array for an empty list
     * @throws EncodeException if vectors differ in length
     */
    public float[] aggregate(final List<float[]> chunkVectors) {
        if (chunkVectors == null || chunkVectors.isEmpty()) {
            return new float[0];
        }

        final int dim = chunkVectors.get(0).length;
        final double[] acc = new double[dim];
        double weightSum = 0.0;

        for (int i = 0; i < chunkVectors.size(); i++) {
            final float[] row = chunkVectors.get(i);
            if (row.length != dim) {
                throw new EncodeException("Chunk vector " + i + " has length " + row.length + ", expected " + dim);
            }
            final double weight = policy.weightOf(i);
            weightSum += weight;
            for (int j = 0; j < dim; j++) {
                acc[j] += weight * row[j];
            }
        }

        final float[] mean = new float[dim];
        for (int j = 0; j < dim; j++) {
            mean[j] = (float) (acc[j] / weightSum);
        }

        return policy.renormalize() ? normalizer.normalize(mean) : mean;
    }
}
