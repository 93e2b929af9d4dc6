package org.lsmkv.core.sstable.merger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lsmkv.core.sstable.EntryIterator;
import org.lsmkv.core.sstable.SSTableEntry;
import org.lsmkv.core.sstable.SSTableReader;
import org.lsmkv.core.sstable.SSTableTestSupport;

class KWayMergerTest {

    @TempDir
    Path dir;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static EntryIterator source(SSTableEntry... entries) {
        return EntryIterator.of(List.of(entries).iterator());
    }

    private static List<SSTableEntry> drain(KWayMerger merger) throws IOException {
        List<SSTableEntry> out = new ArrayList<>();
        while (merger.hasNext()) {
            out.add(merger.next());
        }
        return out;
    }

    @Test
    void newestTimestampWinsAcrossTables() throws IOException {
        Path a = SSTableTestSupport.write(dir.resolve("a.sst"), 0, SSTableEntry.live("k1", bytes("old"), 1000));
        Path b = SSTableTestSupport.write(dir.resolve("b.sst"), 0, SSTableEntry.live("k1", bytes("new"), 2000));

        try (SSTableReader readerA = SSTableReader.open(a); SSTableReader readerB = SSTableReader.open(b)) {
            List<SSTableEntry> merged = drain(new KWayMerger(List.of(readerA.iterator(), readerB.iterator())));

            assertEquals(1, merged.size());
            assertEquals("k1", merged.get(0).getKeyString());
            assertArrayEquals(bytes("new"), merged.get(0).getValue());
        }
    }

    @Test
    void interleavesSourcesInKeyOrder() throws IOException {
        KWayMerger merger = new KWayMerger(List.of(
                source(SSTableEntry.live("a", bytes("1"), 1), SSTableEntry.live("d", bytes("4"), 1)),
                source(SSTableEntry.live("b", bytes("2"), 1), SSTableEntry.live("e", bytes("5"), 1)),
                source(),
                source(SSTableEntry.live("c", bytes("3"), 1))));

        List<String> keys = new ArrayList<>();
        for (SSTableEntry entry : drain(merger)) {
            keys.add(entry.getKeyString());
        }
        assertEquals(List.of("a", "b", "c", "d", "e"), keys);
    }

    @Test
    void newerTombstoneShadowsOlderValue() throws IOException {
        KWayMerger merger = new KWayMerger(List.of(
                source(SSTableEntry.live("k", bytes("v"), 1)),
                source(SSTableEntry.tombstone("k", 2))));

        List<SSTableEntry> merged = drain(merger);
        assertEquals(1, merged.size());
        assertTrue(merged.get(0).isDeleted());
    }

    @Test
    void equalTimestampsKeepExactlyOneFromTheFirstSource() throws IOException {
        KWayMerger merger = new KWayMerger(List.of(
                source(SSTableEntry.live("k", bytes("first"), 5), SSTableEntry.live("z", bytes("z1"), 5)),
                source(SSTableEntry.live("k", bytes("second"), 5)),
                source(SSTableEntry.live("k", bytes("third"), 5), SSTableEntry.live("z", bytes("z3"), 5))));

        List<SSTableEntry> merged = drain(merger);
        assertEquals(2, merged.size());
        assertArrayEquals(bytes("first"), merged.get(0).getValue());
        assertArrayEquals(bytes("z1"), merged.get(1).getValue());
    }

    @Test
    void shadowedSourcesStillAdvance() throws IOException {
        KWayMerger merger = new KWayMerger(List.of(
                source(SSTableEntry.live("a", bytes("new"), 9), SSTableEntry.live("b", bytes("b"), 1)),
                source(SSTableEntry.live("a", bytes("old"), 1), SSTableEntry.live("c", bytes("c"), 1))));

        List<SSTableEntry> merged = drain(merger);
        assertEquals(3, merged.size());
        assertEquals("c", merged.get(2).getKeyString());
    }

    @Test
    void exhaustedMergerThrows() throws IOException {
        KWayMerger merger = new KWayMerger(List.of(source()));

        assertFalse(merger.hasNext());
        assertThrows(NoSuchElementException.class, merger::next);
    }
}
