package eu.virtualparadox.docembed.rag.embed;

import eu.virtualparadox.docembed.encoder.Encoder;
import eu.virtualparadox.docembed.ingest.chunker.TokenWindowChunker;
import eu.virtualparadox.docembed.ingest.model.TokenChunk;
import eu.virtualparadox.docembed.model.ModelConfig;
import eu.virtualparadox.docembed.rag.pooling.AggregationPolicy;
import eu.virtualparadox.docembed.rag.pooling.MeanPooler;
import eu.virtualparadox.docembed.rag.pooling.VectorNormalizer;
import eu.virtualparadox.docembed.rag.pooling.WeightedChunkAggregator;
import eu.virtualparadox.docembed.tokenizer.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * A loaded encoder that embeds text of any length.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *     <li>Tokenize the whole text (special tokens, no padding, no truncation).</li>
 *     <li>Cut the ids into windows of {@code maxSeqLen} tokens overlapping by {@code maxSeqLen / 10}.</li>
 *     <li>For each window, in order: encode with all-zero token type ids, mean-pool, normalize.</li>
 *     <li>Combine the window vectors with the position-weighted mean of {@link WeightedChunkAggregator}.</li>
 * </ol>
 * Any failure aborts the whole call; there is no partial result.
 *
 * <h2>Thread-safety</h2>
 * Holds no per-call state. The tokenizer's options are fixed at construction and ONNX sessions
 * accept concurrent runs, so one instance may serve several threads.
 */
@Slf4j
public final class ChunkedEmbeddingModel implements AutoCloseable {

    private final ModelConfig config;
    private final TextTokenizer tokenizer;
    private final Encoder encoder;

    private final TokenWindowChunker chunker;
    private final MeanPooler pooler;
    private final VectorNormalizer normalizer;
    private final WeightedChunkAggregator aggregator;

    public ChunkedEmbeddingModel(final ModelConfig config,
                                 final TextTokenizer tokenizer,
                                 final Encoder encoder,
                                 final AggregationPolicy policy) {
        this.config = config;
        this.tokenizer = tokenizer;
        this.encoder = encoder;
        this.chunker = new TokenWindowChunker();
        this.pooler = new MeanPooler();
        this.normalizer = new VectorNormalizer();
        this.aggregator = new WeightedChunkAggregator(policy, normalizer);
    }

    /**
     * Embeds {@code text} into a single vector of {@link #getHiddenSize()} floats.
     *
     * @param text input text (non-null)
     * @return document vector; empty if the tokenizer produced no tokens
     * @throws IllegalArgumentException if {@code text} is null
     * @throws eu.virtualparadox.docembed.error.EmbeddingException on any pipeline failure
     */
    public float[] predict(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final int maxSeqLen = config.maxSeqLen();
        final int overlap = TokenWindowChunker.overlapFor(maxSeqLen);
        chunker.validate(maxSeqLen, overlap);

        final long[] tokens = tokenizer.encode(text);
        final List<TokenChunk> chunks = chunker.chunk(tokens, maxSeqLen, overlap);
        log.debug("Embedding {} tokens in {} window(s) of up to {} tokens", tokens.length, chunks.size(), maxSeqLen);

        final List<float[]> vectors = new ArrayList<>(chunks.size());
        for (final TokenChunk chunk : chunks) {
            final long[] tokenTypeIds = new long[chunk.length()];
            final float[][][] hidden = encoder.forward(chunk.ids(), tokenTypeIds);
            vectors.add(normalizer.normalize(pooler.pool(hidden, config.hiddenSize())));
            log.trace("Window [{}, {}) embedded", chunk.start(), chunk.end());
        }

        return aggregator.aggregate(vectors);
    }

    public int getMaxInputLen() {
        return config.maxSeqLen();
    }

    public int getHiddenSize() {
        return config.hiddenSize();
    }

    public ModelConfig getModelConfig() {
        return config;
    }

    /**
     * Releases the encoder session and the native tokenizer. Both are attempted even if one fails.
     */
    @Override
    public void close() {
        try {
            encoder.close();
        } finally {
            tokenizer.close();
        }
    }
}
