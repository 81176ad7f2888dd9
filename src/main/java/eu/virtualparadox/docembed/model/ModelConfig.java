package eu.virtualparadox.docembed.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.docembed.error.ModelLoadException;

/**
 * The two encoder dimensions the embedding pipeline depends on.
 *
 * @param maxSeqLen  maximum window size in tokens ({@code max_position_embeddings})
 * @param hiddenSize length of every per-token and output vector ({@code hidden_size})
 */
public record ModelConfig(int maxSeqLen, int hiddenSize) {

    static final String MAX_POSITION_EMBEDDINGS = "max_position_embeddings";
    static final String HIDDEN_SIZE = "hidden_size";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Reads the dimensions from a Hugging Face {@code config.json}; all other fields are ignored.
     *
     * @param json file contents
     * @return parsed config
     * @throws ModelLoadException if the JSON is malformed or a field is missing or not a positive integer;
     *                            a non-positive window size is thus reported at load time, before any
     *                            chunking could raise {@link eu.virtualparadox.docembed.error.InvalidConfigException}
     */
    public static ModelConfig fromJson(final String json) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new ModelLoadException("Model configuration is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ModelLoadException("Model configuration must be a JSON object");
        }
        return new ModelConfig(positiveInt(root, MAX_POSITION_EMBEDDINGS), positiveInt(root, HIDDEN_SIZE));
    }

    private static int positiveInt(final JsonNode root, final String field) {
        final JsonNode node = root.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() <= 0) {
            throw new ModelLoadException("Model configuration field '" + field + "' not found or not a positive integer");
        }
        return node.intValue();
    }
}
