package org.lsmkv.core.compaction;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

public class CompactionResult {
    private final int sourceLevel;
    private final int targetLevel;
    private final ImmutableList<Path> inputFiles;
    private final Path outputFile;
    private final long entriesWritten;
    private final long tombstonesDropped;

    public CompactionResult(int sourceLevel, int targetLevel, List<Path> inputFiles, Path outputFile,
                            long entriesWritten, long tombstonesDropped) {
        this.sourceLevel = sourceLevel;
        this.targetLevel = targetLevel;
        this.inputFiles = ImmutableList.copyOf(inputFiles);
        this.outputFile = outputFile;
        this.entriesWritten = entriesWritten;
        this.tombstonesDropped = tombstonesDropped;
    }

    public int getSourceLevel() {
        return sourceLevel;
    }

    public int getTargetLevel() {
        return targetLevel;
    }

    public List<Path> getInputFiles() {
        return inputFiles;
    }

    /**
     * Empty when every merged entry was a purged tombstone.
     */
    public Optional<Path> getOutputFile() {
        return Optional.ofNullable(outputFile);
    }

    public long getEntriesWritten() {
        return entriesWritten;
    }

    public long getTombstonesDropped() {
        return tombstonesDropped;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sourceLevel", sourceLevel)
                .add("targetLevel", targetLevel)
                .add("inputs", inputFiles.size())
                .add("output", outputFile == null ? null : outputFile.getFileName())
                .add("entriesWritten", entriesWritten)
                .add("tombstonesDropped", tombstonesDropped)
                .toString();
    }
}
