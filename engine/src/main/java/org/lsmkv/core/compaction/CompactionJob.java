package org.lsmkv.core.compaction;

import java.nio.file.Path;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One merge of {@code inputFiles} into a single table at {@code targetLevel}.
 * Inputs are ordered newest first. The output path is assigned by the engine.
 */
public class CompactionJob {
    private final int sourceLevel;
    private final int targetLevel;
    private final ImmutableList<Path> inputFiles;
    private final Path outputFile;
    private final boolean purgeTombstones;

    public CompactionJob(int sourceLevel, int targetLevel, List<Path> inputFiles, boolean purgeTombstones) {
        this(sourceLevel, targetLevel, inputFiles, null, purgeTombstones);
    }

    private CompactionJob(int sourceLevel, int targetLevel, List<Path> inputFiles, Path outputFile, boolean purgeTombstones) {
        Preconditions.checkArgument(targetLevel > sourceLevel, "target level %s must be above source level %s", targetLevel, sourceLevel);
        Preconditions.checkArgument(!inputFiles.isEmpty(), "compaction job without inputs");
        this.sourceLevel = sourceLevel;
        this.targetLevel = targetLevel;
        this.inputFiles = ImmutableList.copyOf(inputFiles);
        this.outputFile = outputFile;
        this.purgeTombstones = purgeTombstones;
    }

    public CompactionJob withOutputFile(Path outputFile) {
        return new CompactionJob(sourceLevel, targetLevel, inputFiles, outputFile, purgeTombstones);
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

    public Path getOutputFile() {
        return outputFile;
    }

    /**
     * True when no table exists below the source level, so a dropped
     * tombstone cannot uncover an older value.
     */
    public boolean isPurgeTombstones() {
        return purgeTombstones;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sourceLevel", sourceLevel)
                .add("targetLevel", targetLevel)
                .add("inputs", inputFiles.size())
                .add("output", outputFile)
                .add("purgeTombstones", purgeTombstones)
                .toString();
    }
}
