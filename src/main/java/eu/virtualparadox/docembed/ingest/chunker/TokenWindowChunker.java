package eu.virtualparadox.docembed.ingest.chunker;

import eu.virtualparadox.docembed.error.InvalidConfigException;
import eu.virtualparadox.docembed.ingest.model.TokenChunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a token id sequence into overlapping, bounded-length windows.
 *
 * <h2>Algorithm</h2>
 * Starting at offset {@code 0}, emit the window {@code [start, min(start + maxSeqLen, n))}
 * and advance by {@code maxSeqLen - overlap} until {@code start >= n}.
 * <ul>
 *   <li>A sequence no longer than {@code maxSeqLen} yields exactly one window equal to the input.</li>
 *   <li>The final window may be shorter than {@code maxSeqLen}.</li>
 *   <li>Adjacent windows share {@code overlap} tokens, except where the final window is cut
 *       short by the end of the sequence.</li>
 *   <li>An empty sequence yields no windows.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless; output depends only on the arguments.
 */
public class TokenWindowChunker {

    /**
     * Overlap is one tenth of the window size (integer division).
     */
    public static final int OVERLAP_DIVISOR = 10;

    /**
     * Overlap used for a given window size.
     *
     * @param maxSeqLen window size in tokens
     * @return {@code maxSeqLen / 10}
     */
    public static int overlapFor(final int maxSeqLen) {
        return maxSeqLen / OVERLAP_DIVISOR;
    }

    /**
     * Checks that the window loop makes forward progress.
     *
     * @param maxSeqLen window size (must be {@code > 0})
     * @param overlap   shared tokens between windows (must be {@code >= 0} and {@code < maxSeqLen})
     * @throws InvalidConfigException if a constraint is violated
     */
    public void validate(final int maxSeqLen, final int overlap) {
        if (maxSeqLen <= 0) {
            throw new InvalidConfigException("maxSeqLen must be positive, got " + maxSeqLen);
        }
        if (overlap < 0 || overlap >= maxSeqLen) {
            throw new InvalidConfigException(
                    "overlap must be non-negative and less than maxSeqLen (overlap=" + overlap
                            + ", maxSeqLen=" + maxSeqLen + ")");
        }
    }

    /**
     * Produces the ordered windows covering {@code tokens}.
     *
     * @param tokens    source ids (non-null, not modified)
     * @param maxSeqLen window size
     * @param overlap   tokens shared by consecutive windows
     * @return ordered windows; empty for an empty input
     * @throws InvalidConfigException   if {@code maxSeqLen}/{@code overlap} are invalid; no window is produced
     * @throws IllegalArgumentException if {@code tokens} is null
     */
    public List<TokenChunk> chunk(final long[] tokens, final int maxSeqLen, final int overlap) {
        validate(maxSeqLen, overlap);
        if (tokens == null) {
            throw new IllegalArgumentException("tokens cannot be null");
        }

        final List<TokenChunk> chunks = new ArrayList<>();
        final int step = maxSeqLen - overlap;

        for (int start = 0; start < tokens.length; start += step) {
            final int end = Math.min(start + maxSeqLen, tokens.length);
            chunks.add(new TokenChunk(start, Arrays.copyOfRange(tokens, start, end)));
        }

        return chunks;
    }
}
