package eu.virtualparadox.docembed.ingest.model;

/**
 * Immutable window over a token sequence produced by chunking.
 * <p>Holds the offset of the first token in the source sequence and a private copy of the window's ids.</p>
 *
 * @param start offset of {@code ids[0]} in the source sequence
 * @param ids   token ids of this window (never shared with the source array)
 */
public record TokenChunk(int start, long[] ids) {

    public int length() {
        return ids.length;
    }

    /**
     * @return exclusive end offset in the source sequence
     */
    public int end() {
        return start + ids.length;
    }
}
