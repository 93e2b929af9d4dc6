package org.lsmkv.api;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import org.lsmkv.core.wal.WalStats;

import com.google.common.base.MoreObjects;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Point-in-time view of a store. {@code levelCounts} maps level to the number
 * of tables on disk.
 */
public class EngineStats {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final long memtableSize;
    private final long memtableEntries;
    private final int deletedKeys;
    private final int sstableCount;
    private final TreeMap<Integer, Integer> levelCounts;
    private final WalStats wal;

    public EngineStats(long memtableSize, long memtableEntries, int deletedKeys,
                       SortedMap<Integer, Integer> levelCounts, WalStats wal) {
        this.memtableSize = memtableSize;
        this.memtableEntries = memtableEntries;
        this.deletedKeys = deletedKeys;
        this.levelCounts = new TreeMap<>(levelCounts);
        int total = 0;
        for (int count : levelCounts.values()) {
            total += count;
        }
        this.sstableCount = total;
        this.wal = wal;
    }

    public long getMemtableSize() {
        return memtableSize;
    }

    public long getMemtableEntries() {
        return memtableEntries;
    }

    public int getDeletedKeys() {
        return deletedKeys;
    }

    public int getSstableCount() {
        return sstableCount;
    }

    public SortedMap<Integer, Integer> getLevelCounts() {
        return Collections.unmodifiableSortedMap(levelCounts);
    }

    /**
     * @return the log figures, or null when they could not be read
     */
    public WalStats getWal() {
        return wal;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("memtableSize", memtableSize)
                .add("memtableEntries", memtableEntries)
                .add("deletedKeys", deletedKeys)
                .add("sstableCount", sstableCount)
                .add("levelCounts", levelCounts)
                .add("wal", wal)
                .toString();
    }
}
