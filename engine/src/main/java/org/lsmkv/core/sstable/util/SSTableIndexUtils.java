package org.lsmkv.core.sstable.util;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.TreeMap;

import org.lsmkv.common.ByteArrayWrapper;

/**
 * Sparse index block: {@code [indexSize:i32]} followed by
 * {@code ([keyLength:i32][key][offset:i64])*}, indexSize counting the whole block.
 */
public class SSTableIndexUtils {

    private SSTableIndexUtils() {}

    public static class IndexEntry {
        private final byte[] key;
        private final long offset;

        public IndexEntry(byte[] key, long offset) {
            this.key = key;
            this.offset = offset;
        }

        public byte[] getKey() { return key; }

        public long getOffset() { return offset; }
    }

    public static int calculateIndexSize(List<IndexEntry> index) {
        int size = Integer.BYTES;
        for (IndexEntry idx : index) {
            size += Integer.BYTES + idx.getKey().length + Long.BYTES;
        }
        return size;
    }

    public static void writeIndex(ByteBuffer buffer, List<IndexEntry> index) {
        buffer.putInt(calculateIndexSize(index));
        for (IndexEntry idx : index) {
            buffer.putInt(idx.getKey().length);
            buffer.put(idx.getKey());
            buffer.putLong(idx.getOffset());
        }
    }

    /**
     * @throws IllegalArgumentException when the block is malformed
     */
    public static TreeMap<ByteArrayWrapper, Long> readIndex(ByteBuffer buffer) {
        TreeMap<ByteArrayWrapper, Long> indexMap = new TreeMap<>();
        int indexSize = buffer.getInt();
        if (indexSize != buffer.limit()) {
            throw new IllegalArgumentException("index size " + indexSize + " does not match block of " + buffer.limit());
        }
        while (buffer.hasRemaining()) {
            int keyLength = buffer.getInt();
            if (keyLength < 0 || keyLength > buffer.remaining()) {
                throw new IllegalArgumentException("index key length out of bounds: " + keyLength);
            }
            byte[] keyBytes = new byte[keyLength];
            buffer.get(keyBytes);
            indexMap.put(new ByteArrayWrapper(keyBytes), buffer.getLong());
        }
        return indexMap;
    }
}
