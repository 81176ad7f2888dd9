package eu.virtualparadox.docembed.model.weights;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;

import java.nio.file.Path;

/**
 * Lets ONNX Runtime read the model file itself.
 */
public final class PathWeightsLoader implements WeightsLoader {

    @Override
    public OrtSession load(final OrtEnvironment env,
                           final Path weights,
                           final OrtSession.SessionOptions options) throws OrtException {
        return env.createSession(weights.toString(), options);
    }
}
