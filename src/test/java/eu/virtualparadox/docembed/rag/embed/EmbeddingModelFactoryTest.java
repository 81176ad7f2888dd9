package eu.virtualparadox.docembed.rag.embed;

import eu.virtualparadox.docembed.error.ModelLoadException;
import eu.virtualparadox.docembed.model.repository.LocalModelRepository;
import eu.virtualparadox.docembed.rag.pooling.AggregationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Model loading against a local repository: failure paths detected before any native code runs,
 * and full loads of a tiny ONNX graph ({@code Gather} over a 16 x 4 word table plus a token type
 * table, summed) with a WordLevel tokenizer.
 */
class EmbeddingModelFactoryTest {

    @TempDir
    Path root;

    private EmbeddingModelFactory factory;
    private Path modelDir;

    @BeforeEach
    void setUp() throws IOException {
        factory = new EmbeddingModelFactory(new LocalModelRepository(root), AggregationPolicy.defaults());
        modelDir = Files.createDirectories(root.resolve("acme/bert-mini"));
        Files.writeString(modelDir.resolve("tokenizer.json"), "{}");
        Files.createDirectories(modelDir.resolve("onnx"));
        Files.write(modelDir.resolve("onnx/model.onnx"), new byte[]{0});
    }

    @Test
    @DisplayName("Missing config.json is a load error")
    void missingConfig() {
        assertThatThrownBy(() -> factory.create("acme/bert-mini"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("config.json");
    }

    @Test
    @DisplayName("Config without hidden_size is a load error")
    void missingHiddenSize() throws IOException {
        Files.writeString(modelDir.resolve("config.json"), "{\"max_position_embeddings\": 512}");

        assertThatThrownBy(() -> factory.create("acme/bert-mini"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("hidden_size");
    }

    @Test
    @DisplayName("Legacy flag looks for root-level model.onnx")
    void legacyWeightsMissing() throws IOException {
        Files.writeString(modelDir.resolve("config.json"), "{\"max_position_embeddings\": 512, \"hidden_size\": 384}");

        assertThatThrownBy(() -> factory.create("acme/bert-mini", "main", true))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("model.onnx");
    }

    @Test
    @DisplayName("Blank model id is rejected")
    void blankModelId() {
        assertThatThrownBy(() -> factory.create(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------- Full loads ----------

    private static EmbeddingModelFactory fixtureFactory() throws URISyntaxException {
        Path models = Path.of(EmbeddingModelFactoryTest.class.getResource("/models").toURI());
        return new EmbeddingModelFactory(new LocalModelRepository(models), AggregationPolicy.defaults());
    }

    /**
     * Hidden state of the fixture graph: word table entry plus the type-0 row (all 0.5).
     */
    private static double hidden(long id, int channel) {
        return ((id * 7 + channel * 3) % 11) + 1 + 0.5;
    }

    private static double[] normalizedMean(long... ids) {
        double[] v = new double[4];
        for (long id : ids) {
            for (int c = 0; c < 4; c++) {
                v[c] += hidden(id, c) / ids.length;
            }
        }
        double n = Math.sqrt(Arrays.stream(v).map(x -> x * x).sum());
        return Arrays.stream(v).map(x -> x / n).toArray();
    }

    private static void assertFixtureEmbedding(ChunkedEmbeddingModel model) {
        assertThat(model.getMaxInputLen()).isEqualTo(4);
        assertThat(model.getHiddenSize()).isEqualTo(4);

        // [CLS] a b c d e [SEP] -> windows [1, 4, 5, 6] and [7, 8, 2] (overlap 4 / 10 = 0)
        float[] result = model.predict("a b c d e");

        double[] first = normalizedMean(1, 4, 5, 6);
        double[] second = normalizedMean(7, 8, 2);
        assertThat(result).hasSize(4);
        for (int c = 0; c < 4; c++) {
            assertThat((double) result[c]).isCloseTo((1.2 * first[c] + second[c]) / 2.2, within(1e-5));
        }
    }

    @Test
    @DisplayName("Default load memory-maps onnx/model.onnx and embeds across windows")
    void mappedWeights() throws URISyntaxException {
        try (ChunkedEmbeddingModel model = fixtureFactory().create("acme/tiny-bert")) {
            assertFixtureEmbedding(model);
        }
    }

    @Test
    @DisplayName("Legacy load reads root model.onnx by path and gives the same embedding")
    void legacyWeights() throws URISyntaxException {
        try (ChunkedEmbeddingModel mapped = fixtureFactory().create("acme/tiny-bert", "main", false);
             ChunkedEmbeddingModel legacy = fixtureFactory().create("acme/tiny-bert", "main", true)) {
            assertFixtureEmbedding(legacy);
            assertThat(legacy.predict("l k a")).containsExactly(mapped.predict("l k a"));
        }
    }

    @Test
    @DisplayName("Single window input equals the normalized token mean")
    void singleWindow() throws URISyntaxException {
        try (ChunkedEmbeddingModel model = fixtureFactory().create("acme/tiny-bert")) {
            float[] result = model.predict("b c");
            double[] expected = normalizedMean(1, 5, 6, 2);
            for (int c = 0; c < 4; c++) {
                assertThat((double) result[c]).isCloseTo(expected[c], within(1e-5));
            }
        }
    }
}
