package eu.virtualparadox.docembed.rag.pooling;

import eu.virtualparadox.docembed.error.DegenerateVectorException;

/**
 * Rescales vectors to unit Euclidean norm.
 */
public class VectorNormalizer {

    /**
     * Returns a unit-length copy of {@code vec}; the argument is left untouched.
     *
     * @param vec input vector
     * @return {@code vec / ||vec||}
     * @throws DegenerateVectorException if the norm is zero or not finite
     */
    public float[] normalize(final float[] vec) {
        final double norm = norm(vec);
        if (norm == 0.0 || !Double.isFinite(norm)) {
            throw new DegenerateVectorException("Cannot normalize vector with norm " + norm);
        }

        final float[] out = new float[vec.length];
        for (int i = 0; i < vec.length; i++) {
            out[i] = (float) (vec[i] / norm);
        }
        return out;
    }

    public static double norm(final float[] vec) {
        double sum = 0.0;
        for (final float v : vec) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }
}
