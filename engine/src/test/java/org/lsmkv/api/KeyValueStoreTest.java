package org.lsmkv.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lsmkv.core.compaction.CompactionResult;
import org.lsmkv.core.sstable.SSTableEntry;
import org.lsmkv.core.sstable.SSTableFiles;
import org.lsmkv.core.sstable.SSTableIterator;
import org.lsmkv.core.sstable.SSTableReader;
import org.lsmkv.core.sstable.SSTableTestSupport;
import org.lsmkv.core.wal.WalCorruptionException;
import org.lsmkv.core.wal.WriteAheadLog;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class KeyValueStoreTest {

    @TempDir
    Path dir;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(Optional<byte[]> value) {
        return new String(value.orElseThrow(), StandardCharsets.UTF_8);
    }

    private EngineConfig.Builder config() {
        return EngineConfig.builder(dir).compactionIntervalMs(0);
    }

    private int tableCount() throws IOException {
        return SSTableFiles.list(dir).size();
    }

    private static int segmentCount(Path dataDir) throws IOException {
        int count = 0;
        try (Stream<Path> files = Files.list(dataDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (WriteAheadLog.parseSegmentIndex(file.getFileName().toString()) >= 0) {
                    count++;
                }
            }
        }
        return count;
    }

    @Test
    void putGetDelete() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("a", bytes("1"));
            store.put("b", new byte[0]);

            assertEquals("1", text(store.get("a")));
            assertEquals(0, store.get("b").orElseThrow().length);
            assertTrue(store.get("missing").isEmpty());

            store.delete("a");
            assertTrue(store.get("a").isEmpty());

            store.put("a", bytes("again"));
            assertEquals("again", text(store.get("a")));
        }
    }

    @Test
    void writesSurviveRestartWithoutFlush() throws IOException {
        Path crashed = Files.createDirectory(dir.resolve("crashed"));
        EngineConfig liveConfig = EngineConfig.builder(dir.resolve("live")).compactionIntervalMs(0).build();
        try (KeyValueStore store = KeyValueStore.open(liveConfig)) {
            store.put("a", bytes("1"));
            store.put("b", bytes("2"));
            store.delete("b");
            store.put("c", bytes("3"));
            // copy the directory as a crash would leave it: log only, no tables
            try (Stream<Path> files = Files.list(liveConfig.getDataDir())) {
                for (Path file : (Iterable<Path>) files::iterator) {
                    Files.copy(file, crashed.resolve(file.getFileName()));
                }
            }
        }
        assertTrue(segmentCount(crashed) > 0);
        assertEquals(0, SSTableFiles.list(crashed).size());

        EngineConfig recovered = EngineConfig.builder(crashed).compactionIntervalMs(0).build();
        try (KeyValueStore reopened = KeyValueStore.open(recovered)) {
            assertEquals("1", text(reopened.get("a")));
            assertTrue(reopened.get("b").isEmpty());
            assertEquals("3", text(reopened.get("c")));
            assertEquals(1, reopened.stats().getDeletedKeys());
        }
    }

    @Test
    void closeFlushesAndReopenReadsTables() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("a", bytes("1"));
            store.put("b", bytes("2"));
        }
        assertEquals(1, tableCount());

        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            assertEquals(0, store.stats().getMemtableEntries());
            assertEquals("1", text(store.get("a")));
            assertEquals("2", text(store.get("b")));
        }
    }

    @Test
    void closeIsIdempotent() throws IOException {
        KeyValueStore store = KeyValueStore.open(config().build());
        store.put("a", bytes("1"));

        store.close();
        store.close();

        assertEquals(EngineState.CLOSED, store.getState());
        assertEquals(1, tableCount(), "second close must not flush again");
        IllegalStateException closed = assertThrows(IllegalStateException.class, () -> store.get("a"));
        assertEquals("store is closed", closed.getMessage());
        assertThrows(IllegalStateException.class, () -> store.put("a", bytes("2")));
    }

    @Test
    void flushOfEmptyStoreIsNoOp() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.flush();
            assertEquals(0, tableCount());
        }
        assertEquals(0, tableCount());
    }

    @Test
    void flushedDeleteShadowsOlderTable() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("k", bytes("old"));
            store.flush();
            store.delete("k");
            store.flush();

            assertEquals(2, tableCount());
            assertEquals(0, store.stats().getDeletedKeys());
            assertTrue(store.get("k").isEmpty());
        }
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            assertTrue(store.get("k").isEmpty());
        }
    }

    @Test
    void flushTruncatesCoveredLogSegments() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().walSegmentMaxBytes(64).build())) {
            for (int i = 0; i < 10; i++) {
                store.put("key-" + i, bytes("value-" + i));
            }
            assertTrue(segmentCount(dir) > 1);

            store.flush();

            assertEquals(1, segmentCount(dir));
            assertEquals(0, store.stats().getWal().getTotalSize());
            assertEquals("value-7", text(store.get("key-7")));
        }
    }

    @Test
    void memtableFlushesWhenFull() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().memtableMaxBytes(100).build())) {
            for (int i = 0; i < 20; i++) {
                store.put(String.format("key-%02d", i), bytes("0123456789"));
            }

            assertTrue(tableCount() >= 2);
            assertTrue(store.stats().getMemtableSize() < 100);
            for (int i = 0; i < 20; i++) {
                assertEquals("0123456789", text(store.get(String.format("key-%02d", i))));
            }
        }
    }

    @Test
    void newerTableWinsOverOlderOne() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("k", bytes("v1"));
            store.flush();
            store.put("k", bytes("v2"));
            store.flush();

            assertEquals("v2", text(store.get("k")));
        }
    }

    @Test
    void compactionKeepsLatestValuesAndDropsDeletedKeys() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("a", bytes("a1"));
            store.put("b", bytes("b1"));
            store.flush();
            store.put("a", bytes("a2"));
            store.flush();
            store.delete("b");
            store.flush();
            store.put("c", bytes("c1"));
            store.flush();

            CompactionResult result = store.compact().orElseThrow();

            assertEquals(4, result.getInputFiles().size());
            assertEquals(1, result.getTombstonesDropped());
            assertEquals(1, tableCount());
            assertEquals("a2", text(store.get("a")));
            assertTrue(store.get("b").isEmpty());
            assertEquals("c1", text(store.get("c")));
            assertFalse(store.compact().isPresent());

            try (SSTableReader reader = SSTableReader.open(result.getOutputFile().orElseThrow())) {
                List<String> keys = new ArrayList<>();
                SSTableIterator it = reader.iterator();
                while (it.hasNext()) {
                    keys.add(it.next().getKeyString());
                }
                assertEquals(List.of("a", "c"), keys);
            }
        }
    }

    @Test
    void sequenceContinuesAfterRestart() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("a", bytes("1"));
            store.flush();
            store.put("a", bytes("2"));
        }
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("a", bytes("3"));
            store.flush();
            assertEquals("3", text(store.get("a")));
        }
        List<Long> sequences = new ArrayList<>();
        for (SSTableFiles.Descriptor table : SSTableFiles.list(dir)) {
            sequences.add(table.getSequence());
        }
        sequences.sort(null);
        assertEquals(List.of(0L, 1L, 2L), sequences);
    }

    @Test
    void scanReturnsLivePrefixMatchesInOrder() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("user:3", bytes("c"));
            store.put("user:1", bytes("a"));
            store.put("order:1", bytes("o"));
            store.flush();
            store.put("user:2", bytes("b"));
            store.put("user:1", bytes("a2"));
            store.delete("user:3");
            store.put("usera", bytes("x"));

            SortedMap<String, byte[]> users = store.scan("user:", 10);
            assertEquals(List.of("user:1", "user:2"), new ArrayList<>(users.keySet()));
            assertArrayEquals(bytes("a2"), users.get("user:1"));

            assertEquals(List.of("user:1"), new ArrayList<>(store.scan("user:", 1).keySet()));
            assertEquals(4, store.scan("", 100).size());
            assertTrue(store.scan("zzz", 10).isEmpty());
            assertTrue(store.scan("user:", 0).isEmpty());
        }
    }

    @Test
    void statsDescribeMemtableTablesAndLog() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("a", bytes("1"));
            store.flush();
            store.put("b", bytes("22"));
            store.delete("c");

            EngineStats stats = store.stats();
            assertEquals(2, stats.getMemtableEntries());
            assertEquals(1 + 2 + 1, stats.getMemtableSize());
            assertEquals(1, stats.getDeletedKeys());
            assertEquals(1, stats.getSstableCount());
            assertEquals(Integer.valueOf(1), stats.getLevelCounts().get(0));
            assertEquals(3, stats.getWal().getEntryCount());

            JsonObject json = JsonParser.parseString(stats.toJson()).getAsJsonObject();
            assertEquals(2, json.get("memtableEntries").getAsLong());
            assertEquals(1, json.getAsJsonObject("levelCounts").get("0").getAsInt());
            assertTrue(json.getAsJsonObject("wal").has("currentFile"));
        }
    }

    @Test
    void leftoverTemporaryTablesAreRemovedOnOpen() throws IOException {
        Files.createDirectories(dir);
        Files.write(dir.resolve("level_0_000005.sst.tmp"), new byte[] {1, 2, 3});

        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            assertFalse(Files.exists(dir.resolve("level_0_000005.sst.tmp")));
            assertTrue(store.get("anything").isEmpty());
        }
    }

    @Test
    void corruptTableIsSkippedOnRead() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("k", bytes("good"));
            store.flush();
            Files.write(dir.resolve(SSTableFiles.fileName(0, 999)), new byte[40]);

            assertEquals("good", text(store.get("k")));
        }
    }

    @Test
    void corruptLogRefusesToOpen() throws IOException {
        try (KeyValueStore store = KeyValueStore.open(config().build())) {
            store.put("k", bytes("v"));
        }
        // the closing flush rotated to segment 1; give it a record of unknown type
        byte[] record = new byte[24];
        record[0] = 20;
        record[4] = 7;
        Files.write(dir.resolve(WriteAheadLog.segmentName(1)), record);

        assertThrows(WalCorruptionException.class, () -> KeyValueStore.open(config().build()));
    }

    @Test
    void concurrentWritersReadTheirOwnWritesWhileCompactionRuns() throws Exception {
        EngineConfig cfg = config()
                .memtableMaxBytes(512)
                .compactionIntervalMs(5)
                .maxL0Files(2)
                .build();
        int writers = 4;
        int rounds = 150;
        try (KeyValueStore store = KeyValueStore.open(cfg)) {
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                List<Future<Void>> results = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    final int writer = w;
                    Callable<Void> task = () -> {
                        for (int i = 0; i < rounds; i++) {
                            String key = "w" + writer + "-k" + (i % 10);
                            String value = "w" + writer + "-v" + i;
                            store.put(key, bytes(value));
                            assertEquals(value, text(store.get(key)));
                            if (i % 7 == 0) {
                                store.delete(key);
                                assertTrue(store.get(key).isEmpty());
                                store.put(key, bytes(value));
                                assertEquals(value, text(store.get(key)));
                            }
                        }
                        return null;
                    };
                    results.add(pool.submit(task));
                }
                for (Future<Void> result : results) {
                    result.get(60, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            for (int w = 0; w < writers; w++) {
                for (int k = 0; k < 10; k++) {
                    int lastRound = rounds - 10 + k;
                    assertEquals("w" + w + "-v" + lastRound, text(store.get("w" + w + "-k" + k)));
                }
            }
        }
    }

    private Path newestLevelZeroTable() throws IOException {
        return SSTableFiles.newestFirst(dir).get(0).getPath();
    }

    @Test
    void survivingNewerInputAgreesWithCompactionOutput(@TempDir Path saved) throws IOException {
        Path newest;
        try (KeyValueStore store = KeyValueStore.open(config().maxL0Files(2).build())) {
            store.put("k", bytes("v1"));
            store.flush();
            store.put("k", bytes("v2"));
            store.flush();
            newest = newestLevelZeroTable();
            Files.copy(newest, saved.resolve(newest.getFileName()));

            assertTrue(store.compact().isPresent());
        }
        // state after a crash that removed only the older input
        Files.copy(saved.resolve(newest.getFileName()), newest);

        try (KeyValueStore reopened = KeyValueStore.open(config().build())) {
            assertEquals(2, tableCount());
            assertEquals("v2", text(reopened.get("k")));
        }
    }

    @Test
    void survivingNewerTombstoneStillHidesKey(@TempDir Path saved) throws IOException {
        Path newest;
        try (KeyValueStore store = KeyValueStore.open(config().maxL0Files(2).build())) {
            store.put("k", bytes("v1"));
            store.flush();
            store.delete("k");
            store.flush();
            newest = newestLevelZeroTable();
            Files.copy(newest, saved.resolve(newest.getFileName()));

            assertTrue(store.compact().isPresent());
        }
        Files.copy(saved.resolve(newest.getFileName()), newest);

        try (KeyValueStore reopened = KeyValueStore.open(config().build())) {
            assertTrue(reopened.get("k").isEmpty());
        }
    }

    @Test
    void clockResumesAfterNewestFlushedTimestamp() throws IOException {
        // a table written while the wall clock ran an hour ahead
        long ahead = TimeUnit.MILLISECONDS.toNanos(System.currentTimeMillis()) + TimeUnit.HOURS.toNanos(1);
        SSTableTestSupport.write(dir.resolve(SSTableFiles.fileName(0, 0)), 0,
                SSTableEntry.live("k", bytes("old"), ahead));

        try (KeyValueStore store = KeyValueStore.open(config().maxL0Files(2).build())) {
            store.put("k", bytes("new"));
            store.flush();

            assertTrue(store.compact().isPresent());
            assertEquals(1, tableCount());
            assertEquals("new", text(store.get("k")));
        }
    }

    @Test
    void statsStillReportMemoryCountsWhenDirectoryIsGone() throws IOException {
        Path dataDir = dir.resolve("data");
        try (KeyValueStore store = KeyValueStore.open(EngineConfig.builder(dataDir).compactionIntervalMs(0).build())) {
            store.put("a", bytes("1"));
            store.delete("b");
            try (Stream<Path> files = Files.list(dataDir)) {
                for (Path file : (Iterable<Path>) files::iterator) {
                    Files.delete(file);
                }
            }
            Files.delete(dataDir);

            EngineStats stats = store.stats();
            assertEquals(2, stats.getMemtableEntries());
            assertEquals(1, stats.getDeletedKeys());
            assertEquals(0, stats.getSstableCount());
            assertTrue(stats.getLevelCounts().isEmpty());
            assertNull(stats.getWal());

            Files.createDirectories(dataDir);
        }
    }
}
