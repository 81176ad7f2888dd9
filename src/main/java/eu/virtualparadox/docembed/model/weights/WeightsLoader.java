package eu.virtualparadox.docembed.model.weights;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens an ONNX Runtime session from a weights file stored in a particular way.
 */
public interface WeightsLoader {

    OrtSession load(OrtEnvironment env, Path weights, OrtSession.SessionOptions options) throws IOException, OrtException;
}
