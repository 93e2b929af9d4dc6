package org.lsmkv.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.lsmkv.common.ByteArrayWrapper;
import org.lsmkv.core.compaction.CompactionEngine;
import org.lsmkv.core.compaction.CompactionManager;
import org.lsmkv.core.compaction.CompactionResult;
import org.lsmkv.core.compaction.SizeTieredStrategy;
import org.lsmkv.core.memtable.Memtable;
import org.lsmkv.core.memtable.Value;
import org.lsmkv.core.sstable.CorruptSSTableException;
import org.lsmkv.core.sstable.EntryIterator;
import org.lsmkv.core.sstable.LookupResult;
import org.lsmkv.core.sstable.SSTableEntry;
import org.lsmkv.core.sstable.SSTableFiles;
import org.lsmkv.core.sstable.SSTableReader;
import org.lsmkv.core.sstable.SSTableWriter;
import org.lsmkv.core.sstable.merger.KWayMerger;
import org.lsmkv.core.wal.EntryKind;
import org.lsmkv.core.wal.WalEntry;
import org.lsmkv.core.wal.WalStats;
import org.lsmkv.core.wal.WriteAheadLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Embedded LSM-tree store over one data directory.
 *
 * <p>Writes go to the write-ahead log, then to the memtable. A memtable that
 * reaches {@link EngineConfig#getMemtableMaxBytes()} is flushed to a level-0
 * sstable and the log segments it covered are removed. Reads check the
 * memtable, then the sstables newest first. Compaction runs on a background
 * thread and only touches files.
 *
 * <p>One read-write lock guards the memtable, the deleted-key set and the
 * timestamp clock: writers are serialized, readers run concurrently.
 */
public class KeyValueStore implements IKeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueStore.class);
    private static final int MAX_LOOKUP_ATTEMPTS = 5;

    private final EngineConfig config;
    private final Path dataDir;
    private final WriteAheadLog wal;
    private final AtomicLong sequence;
    private final CompactionEngine compactionEngine;
    private final CompactionManager compactionManager;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Memtable memtable = new Memtable();
    private final Set<String> deletedKeys = new HashSet<>();
    private long lastTimestamp;
    private EngineState state = EngineState.OPEN;

    private KeyValueStore(EngineConfig config, WriteAheadLog wal, long nextSequence) {
        this.config = config;
        this.dataDir = config.getDataDir();
        this.wal = wal;
        this.sequence = new AtomicLong(nextSequence);
        this.compactionEngine = new CompactionEngine(dataDir,
                new SizeTieredStrategy(config.getMaxL0Files(), config.getLevelBaseBytes(),
                        config.getLevelSizeMultiplier(), config.getMaxLevels()),
                config.getMaxLevels(), sequence, config.getBloomFalsePositiveRate());
        this.compactionManager = new CompactionManager(compactionEngine, config.getCompactionIntervalMs());
    }

    /**
     * Opens the store, replaying the write-ahead log into a fresh memtable.
     * A log that cannot be replayed fails the open.
     */
    public static KeyValueStore open(EngineConfig config) throws IOException {
        Path dataDir = config.getDataDir();
        Files.createDirectories(dataDir);
        SSTableFiles.deleteTempFiles(dataDir);
        long nextSequence = SSTableFiles.maxSequence(dataDir) + 1;

        WriteAheadLog wal = new WriteAheadLog(dataDir, config.getWalSegmentMaxBytes());
        try {
            KeyValueStore store = new KeyValueStore(config, wal, nextSequence);
            store.lastTimestamp = newestTableTimestamp(dataDir);
            store.replay();
            store.compactionManager.start();
            logger.info("store opened at {} with {} replayed entries", dataDir, store.memtable.entryCount());
            return store;
        } catch (IOException | RuntimeException e) {
            try {
                wal.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    /**
     * Newest entry timestamp across the tables on disk. Seeds the clock so a
     * wall clock that stepped back after a restart cannot order new writes
     * below flushed ones.
     */
    private static long newestTableTimestamp(Path dataDir) throws IOException {
        long newest = 0;
        for (SSTableFiles.Descriptor table : SSTableFiles.list(dataDir)) {
            try (SSTableReader reader = SSTableReader.open(table.getPath())) {
                newest = Math.max(newest, reader.getMetadata().getMaxTimestamp());
            } catch (CorruptSSTableException e) {
                logger.warn("skipping corrupt sstable while seeding the clock: {}", e.getMessage());
            }
        }
        return newest;
    }

    private void replay() throws IOException {
        lock.writeLock().lock();
        try {
            for (WalEntry entry : wal.readAll()) {
                if (entry.kind == EntryKind.PUT) {
                    memtable.put(entry.key, entry.value, entry.timestamp);
                    deletedKeys.remove(entry.key);
                } else {
                    memtable.delete(entry.key, entry.timestamp);
                    deletedKeys.add(entry.key);
                }
                lastTimestamp = Math.max(lastTimestamp, entry.timestamp);
            }
            if (shouldFlush()) {
                tryFlush();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void put(String key, byte[] value) throws IOException {
        Preconditions.checkArgument(key != null, "key cant be null");
        Preconditions.checkArgument(value != null, "value cant be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            long timestamp = nextTimestamp();
            wal.append(WalEntry.put(key, value, timestamp));
            memtable.put(key, value, timestamp);
            deletedKeys.remove(key);
            if (shouldFlush()) {
                tryFlush();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        Preconditions.checkArgument(key != null, "key cant be null");
        lock.readLock().lock();
        try {
            ensureOpen();
            if (deletedKeys.contains(key)) {
                return Optional.empty();
            }
            Value value = memtable.lookup(key);
            if (value != null) {
                return value.isDeleted() ? Optional.empty() : Optional.of(value.getValue());
            }
            return lookupSSTables(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Optional<byte[]> lookupSSTables(String key) throws IOException {
        for (int attempt = 1; ; attempt++) {
            try {
                return searchNewestFirst(key);
            } catch (NoSuchFileException e) {
                if (attempt >= MAX_LOOKUP_ATTEMPTS) {
                    throw e;
                }
                logger.debug("sstable {} vanished during lookup, listing again", e.getFile());
            }
        }
    }

    private Optional<byte[]> searchNewestFirst(String key) throws IOException {
        for (SSTableFiles.Descriptor table : SSTableFiles.newestFirst(dataDir)) {
            LookupResult result;
            try (SSTableReader reader = SSTableReader.open(table.getPath())) {
                result = reader.lookup(key);
            } catch (CorruptSSTableException e) {
                logger.warn("skipping corrupt sstable during lookup: {}", e.getMessage());
                continue;
            }
            switch (result.getStatus()) {
                case FOUND:
                    return result.getValue();
                case DELETED:
                    return Optional.empty();
                default:
                    break;
            }
        }
        return Optional.empty();
    }

    @Override
    public void delete(String key) throws IOException {
        Preconditions.checkArgument(key != null, "key cant be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            long timestamp = nextTimestamp();
            wal.append(WalEntry.delete(key, timestamp));
            memtable.delete(key, timestamp);
            deletedKeys.add(key);
            if (shouldFlush()) {
                tryFlush();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void flush() throws IOException {
        lock.writeLock().lock();
        try {
            ensureOpen();
            flushLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean shouldFlush() {
        return memtable.size() >= config.getMemtableMaxBytes();
    }

    private void tryFlush() {
        try {
            flushLocked();
        } catch (IOException | RuntimeException e) {
            logger.error("memtable flush failed, will retry on the next write", e);
        }
    }

    private void flushLocked() throws IOException {
        if (memtable.isEmpty() && deletedKeys.isEmpty()) {
            return;
        }
        Path path = dataDir.resolve(SSTableFiles.fileName(0, sequence.getAndIncrement()));
        SSTableWriter writer = new SSTableWriter(path, 0, memtable.entryCount(), config.getBloomFalsePositiveRate());
        try {
            Iterator<SSTableEntry> entries = memtable.iterator();
            while (entries.hasNext()) {
                writer.writeEntry(entries.next());
            }
        } catch (IOException | RuntimeException e) {
            try {
                writer.abort();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        writer.close();
        logger.info("flushed {} entries ({} bytes) to {}", memtable.entryCount(), memtable.size(), path.getFileName());

        memtable = new Memtable();
        deletedKeys.clear();
        int covered = wal.rotate();
        wal.truncate(covered);
    }

    @Override
    public SortedMap<String, byte[]> scan(String prefix, int limit) throws IOException {
        Preconditions.checkArgument(prefix != null, "prefix cant be null");
        Preconditions.checkArgument(limit >= 0, "limit must not be negative: %s", limit);
        lock.readLock().lock();
        try {
            ensureOpen();
            for (int attempt = 1; ; attempt++) {
                try {
                    return scanOnce(ByteArrayWrapper.of(prefix), limit);
                } catch (NoSuchFileException e) {
                    if (attempt >= MAX_LOOKUP_ATTEMPTS) {
                        throw e;
                    }
                    logger.debug("sstable {} vanished during scan, listing again", e.getFile());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private SortedMap<String, byte[]> scanOnce(ByteArrayWrapper prefix, int limit) throws IOException {
        SortedMap<String, byte[]> result = new TreeMap<>();
        if (limit == 0) {
            return result;
        }
        List<SSTableReader> readers = new ArrayList<>();
        try {
            List<EntryIterator> sources = new ArrayList<>();
            sources.add(EntryIterator.of(memtable.iterator()));
            for (SSTableFiles.Descriptor table : SSTableFiles.newestFirst(dataDir)) {
                try {
                    SSTableReader reader = SSTableReader.open(table.getPath());
                    readers.add(reader);
                    sources.add(reader.iterator());
                } catch (CorruptSSTableException e) {
                    logger.warn("skipping corrupt sstable during scan: {}", e.getMessage());
                }
            }

            KWayMerger merger = new KWayMerger(sources);
            while (merger.hasNext() && result.size() < limit) {
                SSTableEntry entry = merger.next();
                ByteArrayWrapper key = entry.getKey();
                if (!key.startsWith(prefix)) {
                    if (key.compareTo(prefix) > 0) {
                        break;
                    }
                    continue;
                }
                if (!entry.isDeleted()) {
                    result.put(entry.getKeyString(), entry.getValue());
                }
            }
            return result;
        } finally {
            for (SSTableReader reader : readers) {
                reader.close();
            }
        }
    }

    @Override
    public Optional<CompactionResult> compact() throws IOException {
        lock.readLock().lock();
        try {
            ensureOpen();
        } finally {
            lock.readLock().unlock();
        }
        return compactionEngine.compactIfNeeded();
    }

    @Override
    public EngineStats stats() {
        lock.readLock().lock();
        try {
            ensureOpen();
            SortedMap<Integer, Integer> levelCounts = new TreeMap<>();
            try {
                for (SSTableFiles.Descriptor table : SSTableFiles.list(dataDir)) {
                    levelCounts.merge(table.getLevel(), 1, Integer::sum);
                }
            } catch (IOException e) {
                logger.warn("stats without table counts, listing {} failed", dataDir, e);
                levelCounts.clear();
            }
            WalStats walStats = null;
            try {
                walStats = wal.stats();
            } catch (IOException e) {
                logger.warn("stats without wal figures", e);
            }
            return new EngineStats(memtable.size(), memtable.entryCount(), deletedKeys.size(),
                    levelCounts, walStats);
        } finally {
            lock.readLock().unlock();
        }
    }

    public EngineState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops background compaction, flushes the memtable and closes the log.
     * Calling it again is a no-op. A failed final flush is logged; its writes
     * stay in the log and are replayed on the next open.
     */
    @Override
    public void close() throws IOException {
        lock.writeLock().lock();
        try {
            if (state != EngineState.OPEN) {
                return;
            }
            state = EngineState.CLOSING;
        } finally {
            lock.writeLock().unlock();
        }

        compactionManager.shutdown();

        lock.writeLock().lock();
        try {
            tryFlush();
            wal.close();
            logger.info("store at {} closed", dataDir);
        } finally {
            state = EngineState.CLOSED;
            lock.writeLock().unlock();
        }
    }

    private void ensureOpen() {
        if (state != EngineState.OPEN) {
            throw new IllegalStateException("store is closed");
        }
    }

    /**
     * Nanoseconds since the epoch, strictly increasing across calls.
     */
    private long nextTimestamp() {
        Instant now = Instant.now();
        long nanos = TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        lastTimestamp = Math.max(nanos, lastTimestamp + 1);
        return lastTimestamp;
    }
}
