package eu.virtualparadox.docembed.ingest.chunker;

import eu.virtualparadox.docembed.error.InvalidConfigException;
import eu.virtualparadox.docembed.ingest.model.TokenChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class TokenWindowChunkerTest {

    private final TokenWindowChunker chunker = new TokenWindowChunker();

    // ---------- Helpers ----------

    private static long[] sequence(int length) {
        return LongStream.range(100, 100 + length).toArray();
    }

    /**
     * Rebuilds the source by dropping, from each chunk, the tokens already covered by its predecessor.
     */
    private static long[] reconstruct(List<TokenChunk> chunks) {
        int total = chunks.isEmpty() ? 0 : chunks.get(chunks.size() - 1).end();
        long[] out = new long[total];
        int covered = 0;
        for (TokenChunk c : chunks) {
            int skip = covered - c.start();
            for (int i = skip; i < c.length(); i++) {
                out[c.start() + i] = c.ids()[i];
            }
            covered = c.end();
        }
        return out;
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("25 tokens, window 10, overlap 1 -> [0,10), [9,19), [18,25)")
    void threeWindows() {
        long[] tokens = sequence(25);
        List<TokenChunk> chunks = chunker.chunk(tokens, 10, 1);

        assertEquals(3, chunks.size());
        assertEquals(0, chunks.get(0).start());
        assertEquals(10, chunks.get(0).end());
        assertEquals(9, chunks.get(1).start());
        assertEquals(19, chunks.get(1).end());
        assertEquals(18, chunks.get(2).start());
        assertEquals(25, chunks.get(2).end());

        assertEquals(chunks.get(0).ids()[9], chunks.get(1).ids()[0], "one shared token between windows");
        assertEquals(chunks.get(1).ids()[9], chunks.get(2).ids()[0], "one shared token between windows");
    }

    @Test
    @DisplayName("Sequences no longer than the window yield one chunk equal to the input")
    void shortSequence_singleChunk() {
        for (int len : new int[]{1, 7, 10}) {
            long[] tokens = sequence(len);
            for (int overlap : new int[]{0, 1, 5, 9}) {
                List<TokenChunk> chunks = chunker.chunk(tokens, 10, overlap);
                assertEquals(1, chunks.size());
                assertEquals(0, chunks.get(0).start());
                assertArrayEquals(tokens, chunks.get(0).ids());
            }
        }
    }

    @Test
    @DisplayName("Chunks cover the input without dropping a token and respect the window bound")
    void coverage() {
        long[] tokens = sequence(1234);
        List<TokenChunk> chunks = chunker.chunk(tokens, 128, TokenWindowChunker.overlapFor(128));

        assertArrayEquals(tokens, reconstruct(chunks));
        for (TokenChunk c : chunks) {
            assertTrue(c.length() <= 128);
        }
        for (int i = 1; i < chunks.size(); i++) {
            assertEquals(128 - 12, chunks.get(i).start() - chunks.get(i - 1).start());
        }
    }

    @Test
    @DisplayName("Chunks are copies, not views of the source")
    void chunksAreCopies() {
        long[] tokens = sequence(5);
        List<TokenChunk> chunks = chunker.chunk(tokens, 10, 1);
        tokens[0] = -1;
        assertEquals(100, chunks.get(0).ids()[0]);
    }

    @Test
    @DisplayName("Empty input yields no chunks")
    void emptyInput() {
        assertTrue(chunker.chunk(new long[0], 10, 1).isEmpty());
    }

    @Test
    @DisplayName("Overlap is a tenth of the window")
    void overlapFor() {
        assertEquals(51, TokenWindowChunker.overlapFor(512));
        assertEquals(1, TokenWindowChunker.overlapFor(10));
        assertEquals(0, TokenWindowChunker.overlapFor(9));
    }

    @Test
    @DisplayName("Overlap >= window or non-positive window is rejected up front")
    void invalidConfig() {
        long[] tokens = sequence(50);
        assertThrows(InvalidConfigException.class, () -> chunker.chunk(tokens, 10, 10));
        assertThrows(InvalidConfigException.class, () -> chunker.chunk(tokens, 10, 11));
        assertThrows(InvalidConfigException.class, () -> chunker.chunk(tokens, 0, 0));
        assertThrows(InvalidConfigException.class, () -> chunker.chunk(tokens, -5, 0));
        assertThrows(InvalidConfigException.class, () -> chunker.chunk(tokens, 10, -1));
    }

    @Test
    @DisplayName("Invalid config wins over a null token array: nothing is inspected")
    void invalidConfig_beforeAnyWork() {
        assertThrows(InvalidConfigException.class, () -> chunker.chunk(null, 4, 4));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(null, 4, 1));
    }
}
