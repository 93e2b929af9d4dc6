package org.lsmkv.core.memtable;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.lsmkv.core.sstable.SSTableEntry;

class MemtableTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void putAndGet() {
        Memtable memtable = new Memtable();
        memtable.put("k", bytes("v"), 1);

        assertArrayEquals(bytes("v"), memtable.get("k").orElseThrow());
        assertTrue(memtable.get("missing").isEmpty());
    }

    @Test
    void overwriteReplacesEntryAndAdjustsSize() {
        Memtable memtable = new Memtable();
        memtable.put("key", bytes("12345"), 1);
        assertEquals(8, memtable.size());

        memtable.put("key", bytes("1"), 2);

        assertEquals(1, memtable.entryCount());
        assertEquals(4, memtable.size());
        assertArrayEquals(bytes("1"), memtable.get("key").orElseThrow());
    }

    @Test
    void deleteLeavesTombstone() {
        Memtable memtable = new Memtable();
        memtable.put("key", bytes("value"), 1);
        memtable.delete("key", 2);

        assertTrue(memtable.get("key").isEmpty());
        Value raw = memtable.lookup("key");
        assertTrue(raw.isDeleted());
        assertEquals(2, raw.getTimestamp());
        assertEquals(1, memtable.entryCount());
        assertEquals(3, memtable.size(), "a tombstone accounts for its key only");
        assertNull(memtable.lookup("never"));
    }

    @Test
    void iteratorIsSortedSnapshotWithTombstones() {
        Memtable memtable = new Memtable();
        memtable.put("b", bytes("2"), 1);
        memtable.put("a", bytes("1"), 2);
        memtable.delete("c", 3);

        Iterator<SSTableEntry> it = memtable.iterator();
        memtable.put("0", bytes("late"), 4);

        List<String> keys = new ArrayList<>();
        List<Boolean> deleted = new ArrayList<>();
        while (it.hasNext()) {
            SSTableEntry entry = it.next();
            keys.add(entry.getKeyString());
            deleted.add(entry.isDeleted());
        }
        assertEquals(List.of("a", "b", "c"), keys);
        assertEquals(List.of(false, false, true), deleted);
    }

    @Test
    void emptyValueIsStoredAsLive() {
        Memtable memtable = new Memtable();
        memtable.put("empty", new byte[0], 1);

        assertEquals(0, memtable.get("empty").orElseThrow().length);
        assertFalse(memtable.isEmpty());
    }

    @Test
    void rejectsNullValue() {
        Memtable memtable = new Memtable();
        assertThrows(IllegalArgumentException.class, () -> memtable.put("k", null, 1));
    }
}
