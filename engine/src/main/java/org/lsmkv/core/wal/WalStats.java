package org.lsmkv.core.wal;

import com.google.common.base.MoreObjects;

public class WalStats {
    private final int fileCount;
    private final long totalSize;
    private final long entryCount;
    private final String currentFile;

    public WalStats(int fileCount, long totalSize, long entryCount, String currentFile) {
        this.fileCount = fileCount;
        this.totalSize = totalSize;
        this.entryCount = entryCount;
        this.currentFile = currentFile;
    }

    public int getFileCount() {
        return fileCount;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public long getEntryCount() {
        return entryCount;
    }

    public String getCurrentFile() {
        return currentFile;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("fileCount", fileCount)
                .add("totalSize", totalSize)
                .add("entryCount", entryCount)
                .add("currentFile", currentFile)
                .toString();
    }
}
