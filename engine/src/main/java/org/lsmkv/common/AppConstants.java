package org.lsmkv.common;

public class AppConstants {

    private AppConstants(){}

    public static final long DEFAULT_MEMTABLE_MAX_BYTES = 4L * 1024 * 1024;
    public static final long DEFAULT_WAL_SEGMENT_MAX_BYTES = 16L * 1024 * 1024;
    public static final long DEFAULT_COMPACTION_INTERVAL_MS = 10_000;
    public static final int DEFAULT_MAX_LEVELS = 7;

    public static final int DEFAULT_MAX_L0_FILES = 4;
    public static final long DEFAULT_LEVEL_BASE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_LEVEL_SIZE_MULTIPLIER = 10;

    public static final double DEFAULT_BLOOM_FALSE_POSITIVE_RATE = 0.01;

    public static final String WAL_FILE_PREFIX = "wal-";
    public static final String WAL_FILE_SUFFIX = ".log";
    public static final String SSTABLE_FILE_PREFIX = "level_";
    public static final String SSTABLE_FILE_SUFFIX = ".sst";
    public static final String TEMP_FILE_SUFFIX = ".tmp";
}
