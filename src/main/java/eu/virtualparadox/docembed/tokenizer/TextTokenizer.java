package eu.virtualparadox.docembed.tokenizer;

import eu.virtualparadox.docembed.error.TokenizeException;

/**
 * Converts text into the token ids an encoder consumes.
 * <p>
 * Implementations insert the model's special tokens and never pad or truncate; windowing of
 * long sequences happens downstream.
 */
public interface TextTokenizer extends AutoCloseable {

    /**
     * @param text input text (non-null)
     * @return token ids, special tokens included
     * @throws TokenizeException if the input cannot be tokenized
     */
    long[] encode(String text);

    @Override
    default void close() {
    }
}
