package eu.virtualparadox.docembed.tokenizer;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import eu.virtualparadox.docembed.error.ModelLoadException;
import eu.virtualparadox.docembed.error.TokenizeException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link TextTokenizer} backed by a DJL {@link HuggingFaceTokenizer} loaded from a {@code tokenizer.json}.
 * <p>
 * Special tokens on, padding off, truncation off. These options are fixed when the instance is
 * built and never touched again, so concurrent {@link #encode(String)} calls only read shared state.
 */
@Slf4j
public final class HuggingFaceTextTokenizer implements TextTokenizer {

    private final HuggingFaceTokenizer tokenizer;

    HuggingFaceTextTokenizer(final HuggingFaceTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Loads the tokenizer definition.
     *
     * @param tokenizerPath path to {@code tokenizer.json}
     * @return ready tokenizer
     * @throws ModelLoadException if the file is missing or cannot be parsed
     */
    public static HuggingFaceTextTokenizer load(final Path tokenizerPath) {
        try {
            final HuggingFaceTokenizer tokenizer = HuggingFaceTokenizer.builder()
                    .optTokenizerPath(tokenizerPath)
                    .optAddSpecialTokens(true)
                    .optPadding(false)
                    .optTruncation(false)
                    .build();
            log.info("Loaded tokenizer: {}", tokenizerPath);
            return new HuggingFaceTextTokenizer(tokenizer);
        } catch (final IOException | RuntimeException e) {
            throw new ModelLoadException("Failed to load tokenizer from " + tokenizerPath, e);
        }
    }

    @Override
    public long[] encode(final String text) {
        try {
            final Encoding encoding = tokenizer.encode(text);
            return encoding.getIds();
        } catch (final RuntimeException e) {
            throw new TokenizeException("Tokenizer rejected input of length " + text.length(), e);
        }
    }

    @Override
    public void close() {
        tokenizer.close();
    }
}
