package org.lsmkv.core.compaction;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lsmkv.core.sstable.SSTableFiles;

import com.google.common.base.MoreObjects;

/**
 * Snapshot of one level as seen by a compaction cycle. Tables are kept
 * newest first.
 */
public class LevelMetadata {
    private final int levelNumber;
    private final List<SSTableFiles.Descriptor> sstables;
    private long totalSize;

    public LevelMetadata(int levelNumber) {
        this.levelNumber = levelNumber;
        this.sstables = new ArrayList<>();
        this.totalSize = 0;
    }

    public void addSSTable(SSTableFiles.Descriptor sstable, long dataSize) {
        sstables.add(sstable);
        sstables.sort(SSTableFiles.NEWEST_FIRST);
        totalSize += dataSize;
    }

    public int getLevelNumber() {
        return levelNumber;
    }

    public List<SSTableFiles.Descriptor> getSstables() {
        return Collections.unmodifiableList(sstables);
    }

    public List<Path> getPaths() {
        List<Path> paths = new ArrayList<>(sstables.size());
        for (SSTableFiles.Descriptor sstable : sstables) {
            paths.add(sstable.getPath());
        }
        return paths;
    }

    public int getFileCount() {
        return sstables.size();
    }

    public long getTotalSize() {
        return totalSize;
    }

    public boolean isEmpty() {
        return sstables.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("level", levelNumber)
                .add("files", sstables.size())
                .add("totalSize", totalSize)
                .toString();
    }
}
