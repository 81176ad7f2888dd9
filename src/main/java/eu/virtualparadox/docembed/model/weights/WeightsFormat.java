package eu.virtualparadox.docembed.model.weights;

/**
 * Where a model repository keeps its ONNX weights and how they are opened.
 */
public enum WeightsFormat {

    /** Root-level {@code model.onnx}, read by ONNX Runtime from its path. */
    LEGACY("model.onnx", new PathWeightsLoader()),

    /** {@code onnx/model.onnx}, memory-mapped. */
    MAPPED("onnx/model.onnx", new MappedWeightsLoader());

    private final String fileName;
    private final WeightsLoader loader;

    WeightsFormat(final String fileName, final WeightsLoader loader) {
        this.fileName = fileName;
        this.loader = loader;
    }

    public String fileName() {
        return fileName;
    }

    public WeightsLoader loader() {
        return loader;
    }

    public static WeightsFormat of(final boolean useLegacyWeights) {
        return useLegacyWeights ? LEGACY : MAPPED;
    }
}
