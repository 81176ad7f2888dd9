package eu.virtualparadox.docembed.rag.embed;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.docembed.encoder.OnnxEncoder;
import eu.virtualparadox.docembed.error.ModelLoadException;
import eu.virtualparadox.docembed.model.ModelConfig;
import eu.virtualparadox.docembed.model.repository.ModelRepository;
import eu.virtualparadox.docembed.model.weights.WeightsFormat;
import eu.virtualparadox.docembed.rag.pooling.AggregationPolicy;
import eu.virtualparadox.docembed.tokenizer.HuggingFaceTextTokenizer;
import eu.virtualparadox.docembed.util.OrtInitializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ChunkedEmbeddingModel}s from a {@link ModelRepository}.
 * <p>
 * Loading is expensive (downloads, native session creation); build one model and reuse it.
 */
@Slf4j
@RequiredArgsConstructor
public class EmbeddingModelFactory {

    public static final String DEFAULT_REVISION = "main";
    public static final String CONFIG_FILE = "config.json";
    public static final String TOKENIZER_FILE = "tokenizer.json";

    private final ModelRepository repository;
    private final AggregationPolicy policy;

    public ChunkedEmbeddingModel create(final String modelId) {
        return create(modelId, DEFAULT_REVISION, false);
    }

    /**
     * Fetches configuration, tokenizer and weights and wires them into a model.
     *
     * @param modelId          repository id
     * @param revision         revision to load; {@code null} means {@value #DEFAULT_REVISION}
     * @param useLegacyWeights read root-level {@code model.onnx} by path instead of memory-mapping
     *                         {@code onnx/model.onnx}
     * @return ready model
     * @throws ModelLoadException if any file is missing or malformed
     */
    public ChunkedEmbeddingModel create(final String modelId, final String revision, final boolean useLegacyWeights) {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId cannot be null or blank");
        }
        final String rev = revision == null ? DEFAULT_REVISION : revision;
        final WeightsFormat format = WeightsFormat.of(useLegacyWeights);

        final Path configFile = repository.fetch(modelId, rev, CONFIG_FILE);
        final Path tokenizerFile = repository.fetch(modelId, rev, TOKENIZER_FILE);
        final Path weightsFile = repository.fetch(modelId, rev, format.fileName());

        final ModelConfig config = ModelConfig.fromJson(readConfig(configFile));
        final HuggingFaceTextTokenizer tokenizer = HuggingFaceTextTokenizer.load(tokenizerFile);

        try {
            final OrtEnvironment env = OrtEnvironment.getEnvironment();
            final OrtSession session;
            try (OrtSession.SessionOptions options = OrtInitializer.initializeOrt()) {
                session = format.loader().load(env, weightsFile, options);
            }
            log.info("Loaded {}@{} ({} weights): maxSeqLen={}, hiddenSize={}",
                    modelId, rev, format, config.maxSeqLen(), config.hiddenSize());
            return new ChunkedEmbeddingModel(config, tokenizer, new OnnxEncoder(env, session), policy);
        } catch (final IOException | OrtException e) {
            tokenizer.close();
            throw new ModelLoadException("Failed to load weights " + weightsFile, e);
        } catch (final RuntimeException e) {
            tokenizer.close();
            throw e;
        }
    }

    private static String readConfig(final Path configFile) {
        try {
            return Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new ModelLoadException("Unable to read model configuration " + configFile, e);
        }
    }
}
