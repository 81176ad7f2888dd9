package eu.virtualparadox.docembed.encoder;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.docembed.error.EncodeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@link Encoder} running an ONNX export of a BERT-style model through ONNX Runtime.
 * <p>
 * Inputs are fed by name, only when the graph declares them: {@code input_ids},
 * {@code token_type_ids} and {@code attention_mask} (all ones, windows are never padded).
 * The first graph output must be the last hidden state {@code [batch, tokens, hidden]}.
 */
@Slf4j
public final class OnnxEncoder implements Encoder {

    private final OrtEnvironment env;
    private final OrtSession session;
    private final Set<String> inputNames;

    public OnnxEncoder(final OrtEnvironment env, final OrtSession session) {
        this.env = env;
        this.session = session;
        this.inputNames = session.getInputNames();
        log.info("Model expects inputs: {}", inputNames);
    }

    @Override
    public float[][][] forward(final long[] tokenIds, final long[] tokenTypeIds) {
        if (tokenIds.length != tokenTypeIds.length) {
            throw new EncodeException("token ids and token type ids differ in length: "
                    + tokenIds.length + " vs " + tokenTypeIds.length);
        }

        final long[] mask = new long[tokenIds.length];
        Arrays.fill(mask, 1L);

        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, new long[][]{tokenIds});
             OnnxTensor tokenTypes = OnnxTensor.createTensor(env, new long[][]{tokenTypeIds});
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, new long[][]{mask})) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (inputNames.contains("input_ids")) {
                inputs.put("input_ids", inputIds);
            }
            if (inputNames.contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypes);
            }
            if (inputNames.contains("attention_mask")) {
                inputs.put("attention_mask", attentionMask);
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final Object value = result.get(0).getValue();
                if (!(value instanceof float[][][])) {
                    throw new EncodeException("Unexpected encoder output type: " + value.getClass().getSimpleName());
                }
                return (float[][][]) value;
            }
        } catch (final OrtException e) {
            throw new EncodeException("Encoder forward pass failed for " + tokenIds.length + " tokens", e);
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (final OrtException e) {
            throw new EncodeException("Unable to close ONNX session", e);
        }
    }
}
