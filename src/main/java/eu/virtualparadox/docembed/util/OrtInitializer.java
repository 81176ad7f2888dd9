package eu.virtualparadox.docembed.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.docembed.error.ModelLoadException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds the session options shared by every encoder session: intra-op parallelism on all
     * but one core, a single inter-op thread (windows run strictly one after another).
     */
    public static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            // leave one core free for the caller
            final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        }
        catch (OrtException e) {
            throw new ModelLoadException("Failed to initialize ONNX Runtime", e);
        }
    }
}
