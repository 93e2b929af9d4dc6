package org.lsmkv.core.sstable;

import java.nio.ByteBuffer;

import org.lsmkv.common.ByteArrayWrapper;

import com.google.common.base.MoreObjects;

/**
 * Per-file metadata block. Min and max keys are null for a file without entries.
 * <pre>
 * [level:i32][entryCount:i64][dataSize:i64][createdAt:i64][maxTimestamp:i64][minKeyLen:i32][minKey][maxKeyLen:i32][maxKey]
 * </pre>
 * A key length of -1 encodes a missing key. maxTimestamp is the newest entry
 * timestamp in the file, 0 when it has none.
 */
public class SSTableMetadata {
    private final int level;
    private final long entryCount;
    private final long dataSize;
    private final long createdAt;
    private final long maxTimestamp;
    private final ByteArrayWrapper minKey;
    private final ByteArrayWrapper maxKey;

    public SSTableMetadata(int level, long entryCount, long dataSize, long createdAt,
                           long maxTimestamp, ByteArrayWrapper minKey, ByteArrayWrapper maxKey) {
        this.level = level;
        this.entryCount = entryCount;
        this.dataSize = dataSize;
        this.createdAt = createdAt;
        this.maxTimestamp = maxTimestamp;
        this.minKey = minKey;
        this.maxKey = maxKey;
    }

    public int getLevel() {
        return level;
    }

    public long getEntryCount() {
        return entryCount;
    }

    public long getDataSize() {
        return dataSize;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getMaxTimestamp() {
        return maxTimestamp;
    }

    public ByteArrayWrapper getMinKey() {
        return minKey;
    }

    public ByteArrayWrapper getMaxKey() {
        return maxKey;
    }

    public boolean covers(ByteArrayWrapper key) {
        if (minKey == null || maxKey == null) {
            return false;
        }
        return key.compareTo(minKey) >= 0 && key.compareTo(maxKey) <= 0;
    }

    public int serializedSize() {
        return Integer.BYTES + Long.BYTES * 4 + keySize(minKey) + keySize(maxKey);
    }

    private static int keySize(ByteArrayWrapper key) {
        return Integer.BYTES + (key == null ? 0 : key.length());
    }

    public void writeTo(ByteBuffer buffer) {
        buffer.putInt(level);
        buffer.putLong(entryCount);
        buffer.putLong(dataSize);
        buffer.putLong(createdAt);
        buffer.putLong(maxTimestamp);
        writeKey(buffer, minKey);
        writeKey(buffer, maxKey);
    }

    private static void writeKey(ByteBuffer buffer, ByteArrayWrapper key) {
        if (key == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(key.length());
        buffer.put(key.getData());
    }

    /**
     * @throws IllegalArgumentException when the block is malformed
     */
    public static SSTableMetadata readFrom(ByteBuffer buffer) {
        int level = buffer.getInt();
        long entryCount = buffer.getLong();
        long dataSize = buffer.getLong();
        long createdAt = buffer.getLong();
        long maxTimestamp = buffer.getLong();
        ByteArrayWrapper minKey = readKey(buffer);
        ByteArrayWrapper maxKey = readKey(buffer);
        if (level < 0 || entryCount < 0 || dataSize < 0) {
            throw new IllegalArgumentException("negative field in sstable metadata");
        }
        return new SSTableMetadata(level, entryCount, dataSize, createdAt, maxTimestamp, minKey, maxKey);
    }

    private static ByteArrayWrapper readKey(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length == -1) {
            return null;
        }
        if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("metadata key length out of bounds: " + length);
        }
        byte[] key = new byte[length];
        buffer.get(key);
        return new ByteArrayWrapper(key);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("level", level)
                .add("entryCount", entryCount)
                .add("dataSize", dataSize)
                .add("maxTimestamp", maxTimestamp)
                .add("minKey", minKey)
                .add("maxKey", maxKey)
                .toString();
    }
}
