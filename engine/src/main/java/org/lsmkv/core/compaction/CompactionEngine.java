package org.lsmkv.core.compaction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.lsmkv.core.sstable.EntryIterator;
import org.lsmkv.core.sstable.SSTableEntry;
import org.lsmkv.core.sstable.SSTableFiles;
import org.lsmkv.core.sstable.SSTableReader;
import org.lsmkv.core.sstable.SSTableWriter;
import org.lsmkv.core.sstable.merger.KWayMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Runs compaction cycles against the tables of one data directory. Works on
 * the filesystem only: inputs are deleted after the output has been renamed
 * into place, and readers that already hold an input open keep reading it.
 * Cycles are serialized.
 */
public class CompactionEngine {
    private static final Logger logger = LoggerFactory.getLogger(CompactionEngine.class);

    private final Path dataDir;
    private final CompactionStrategy strategy;
    private final int maxLevels;
    private final AtomicLong sequence;
    private final double falsePositiveRate;
    private final ReentrantLock compactionLock = new ReentrantLock();

    public CompactionEngine(Path dataDir, CompactionStrategy strategy, int maxLevels,
                            AtomicLong sequence, double falsePositiveRate) {
        Preconditions.checkArgument(maxLevels >= 2, "at least two levels are needed to compact");
        this.dataDir = dataDir;
        this.strategy = strategy;
        this.maxLevels = maxLevels;
        this.sequence = sequence;
        this.falsePositiveRate = falsePositiveRate;
    }

    /**
     * Runs at most one job.
     *
     * @return the job's outcome, or empty when the strategy found nothing to do
     */
    public Optional<CompactionResult> compactIfNeeded() throws IOException {
        compactionLock.lock();
        try {
            List<LevelMetadata> levels = loadLevels();
            CompactionJob job = strategy.selectSSTables(levels);
            if (job == null) {
                return Optional.empty();
            }
            Path output = dataDir.resolve(SSTableFiles.fileName(job.getTargetLevel(), sequence.getAndIncrement()));
            return Optional.of(executeCompaction(job.withOutputFile(output)));
        } finally {
            compactionLock.unlock();
        }
    }

    /**
     * Groups the tables on disk by level. Tables that cannot be opened are
     * left out of this cycle.
     */
    public List<LevelMetadata> loadLevels() throws IOException {
        List<SSTableFiles.Descriptor> tables = SSTableFiles.list(dataDir);
        int levelCount = maxLevels;
        for (SSTableFiles.Descriptor table : tables) {
            levelCount = Math.max(levelCount, table.getLevel() + 1);
        }
        List<LevelMetadata> levels = new ArrayList<>(levelCount);
        for (int i = 0; i < levelCount; i++) {
            levels.add(new LevelMetadata(i));
        }
        for (SSTableFiles.Descriptor table : tables) {
            try (SSTableReader reader = SSTableReader.open(table.getPath())) {
                levels.get(table.getLevel()).addSSTable(table, reader.getMetadata().getDataSize());
            } catch (IOException e) {
                logger.warn("skipping sstable {} in this compaction cycle: {}", table.getPath().getFileName(), e.toString());
            }
        }
        return levels;
    }

    /**
     * Merges the job's inputs into its output file, then deletes the inputs.
     * A failure before the output is in place leaves the inputs untouched.
     */
    public CompactionResult executeCompaction(CompactionJob job) throws IOException {
        Path output = job.getOutputFile();
        Preconditions.checkArgument(output != null, "compaction job has no output file");
        logger.info("compacting {} tables from level {} into {}", job.getInputFiles().size(),
                job.getSourceLevel(), output.getFileName());

        long written = 0;
        long tombstonesDropped = 0;
        List<SSTableReader> readers = new ArrayList<>();
        try {
            long expectedEntries = 0;
            List<EntryIterator> sources = new ArrayList<>();
            for (Path input : job.getInputFiles()) {
                SSTableReader reader = SSTableReader.open(input);
                readers.add(reader);
                expectedEntries += reader.getMetadata().getEntryCount();
                sources.add(reader.iterator());
            }

            KWayMerger merger = new KWayMerger(sources);
            SSTableWriter writer = new SSTableWriter(output, job.getTargetLevel(), expectedEntries, falsePositiveRate);
            try {
                while (merger.hasNext()) {
                    SSTableEntry entry = merger.next();
                    if (entry.isDeleted() && job.isPurgeTombstones()) {
                        tombstonesDropped++;
                        continue;
                    }
                    writer.writeEntry(entry);
                    written++;
                }
            } catch (IOException | RuntimeException e) {
                abortQuietly(writer, e);
                throw e;
            }
            if (written == 0) {
                writer.abort();
            } else {
                writer.close();
            }
        } finally {
            closeAll(readers);
        }

        for (Path input : oldestFirst(job.getInputFiles())) {
            Files.deleteIfExists(input);
        }

        CompactionResult result = new CompactionResult(job.getSourceLevel(), job.getTargetLevel(),
                job.getInputFiles(), written == 0 ? null : output, written, tombstonesDropped);
        logger.info("compaction finished: {}", result);
        return result;
    }

    /**
     * Input deletion order. Removing the oldest inputs first means a crash part
     * way through only leaves inputs newer than anything the output absorbed
     * from the deleted ones, so they still agree with the output on every key.
     */
    @VisibleForTesting
    static List<Path> oldestFirst(List<Path> inputs) {
        List<SSTableFiles.Descriptor> tables = new ArrayList<>();
        for (Path input : inputs) {
            tables.add(SSTableFiles.parse(input)
                    .orElseThrow(() -> new IllegalArgumentException("not an sstable file name: " + input)));
        }
        tables.sort(SSTableFiles.NEWEST_FIRST.reversed());
        List<Path> ordered = new ArrayList<>();
        for (SSTableFiles.Descriptor table : tables) {
            ordered.add(table.getPath());
        }
        return ordered;
    }

    private static void abortQuietly(SSTableWriter writer, Exception cause) {
        try {
            writer.abort();
        } catch (IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }

    private static void closeAll(List<SSTableReader> readers) throws IOException {
        IOException failure = null;
        for (SSTableReader reader : readers) {
            try {
                reader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
