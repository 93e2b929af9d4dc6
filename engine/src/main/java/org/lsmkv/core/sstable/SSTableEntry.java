package org.lsmkv.core.sstable;

import java.util.Arrays;

import org.lsmkv.common.ByteArrayWrapper;
import org.lsmkv.core.sstable.util.SSTableConstants;

import com.google.common.base.MoreObjects;

public class SSTableEntry {
    private static final byte[] EMPTY = new byte[0];

    private final ByteArrayWrapper key;
    private final byte[] value;
    private final boolean deleted;
    private final long timestamp;

    public SSTableEntry(ByteArrayWrapper key, byte[] value, boolean deleted, long timestamp) {
        if (key == null) {
            throw new IllegalArgumentException("Key cant be null");
        }
        this.key = key;
        this.value = (deleted || value == null) ? EMPTY : value;
        this.deleted = deleted;
        this.timestamp = timestamp;
    }

    public static SSTableEntry live(String key, byte[] value, long timestamp) {
        return new SSTableEntry(ByteArrayWrapper.of(key), value, false, timestamp);
    }

    public static SSTableEntry tombstone(String key, long timestamp) {
        return new SSTableEntry(ByteArrayWrapper.of(key), null, true, timestamp);
    }

    public ByteArrayWrapper getKey() {
        return key;
    }

    public String getKeyString() {
        return key.asString();
    }

    public byte[] getValue() {
        return value;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int encodedSize() {
        return SSTableConstants.HEADER_SIZE + key.length() + value.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SSTableEntry)) {
            return false;
        }
        SSTableEntry other = (SSTableEntry) o;
        return deleted == other.deleted
                && timestamp == other.timestamp
                && key.equals(other.key)
                && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int result = key.hashCode();
        result = 31 * result + Arrays.hashCode(value);
        result = 31 * result + (deleted ? 1 : 0);
        return 31 * result + Long.hashCode(timestamp);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("key", key)
                .add("valueLength", value.length)
                .add("deleted", deleted)
                .add("timestamp", timestamp)
                .toString();
    }
}
