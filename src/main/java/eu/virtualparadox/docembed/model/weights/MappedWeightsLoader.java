package eu.virtualparadox.docembed.model.weights;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Memory-maps the model file read-only and hands the direct buffer to ONNX Runtime,
 * so the weights are paged in by the OS instead of being copied onto the heap.
 */
public final class MappedWeightsLoader implements WeightsLoader {

    @Override
    public OrtSession load(final OrtEnvironment env,
                           final Path weights,
                           final OrtSession.SessionOptions options) throws IOException, OrtException {
        try (FileChannel channel = FileChannel.open(weights, StandardOpenOption.READ)) {
            // mapping stays valid after the channel is closed
            final MappedByteBuffer buffer = channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size());
            return env.createSession(buffer, options);
        }
    }
}
