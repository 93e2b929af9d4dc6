package org.lsmkv.core.sstable.util;

public class SSTableConstants {
    public static final int HEADER_SIZE = Integer.BYTES + Integer.BYTES + Long.BYTES;
    public static final int FOOTER_SIZE = Long.BYTES * 4;
    public static final long FOOTER_MAGIC = 0xFACEDBEECAFEBEEFL;
    public static final int TOMBSTONE_LENGTH = -1;
    public static final int INDEX_ENTRY_INTERVAL = 128;
    public static final int WRITE_BUFFER_SIZE = 256 * 1024;
}
