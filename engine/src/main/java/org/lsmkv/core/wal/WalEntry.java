package org.lsmkv.core.wal;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * One logged mutation. On disk (little-endian):
 * <pre>
 * [total_len:u32][type:u8][timestamp:i64][key_len:u32][key][value_len:u32][value]
 * </pre>
 * total_len counts every byte after itself.
 */
public class WalEntry {
    public static final int LENGTH_PREFIX = Integer.BYTES;
    public static final int MIN_BODY_SIZE = 1 + Long.BYTES + Integer.BYTES + Integer.BYTES;

    private static final byte[] EMPTY = new byte[0];

    public final EntryKind kind;
    public final String key;
    public final byte[] value;
    public final long timestamp;

    public WalEntry(EntryKind kind, String key, byte[] value, long timestamp) {
        if (kind == null || key == null) {
            throw new IllegalArgumentException("wal entry needs a kind and a key");
        }
        this.kind = kind;
        this.key = key;
        this.value = (kind == EntryKind.DELETE || value == null) ? EMPTY : value;
        this.timestamp = timestamp;
    }

    public static WalEntry put(String key, byte[] value, long timestamp) {
        return new WalEntry(EntryKind.PUT, key, value, timestamp);
    }

    public static WalEntry delete(String key, long timestamp) {
        return new WalEntry(EntryKind.DELETE, key, EMPTY, timestamp);
    }

    public int serializedSize() {
        return LENGTH_PREFIX + bodySize(key.getBytes(StandardCharsets.UTF_8).length);
    }

    private int bodySize(int keyLength) {
        return MIN_BODY_SIZE + keyLength + value.length;
    }

    public ByteBuffer serialize() {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        int bodySize = bodySize(keyBytes.length);
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH_PREFIX + bodySize).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(bodySize);
        buffer.put(kind.getCode());
        buffer.putLong(timestamp);
        buffer.putInt(keyBytes.length);
        buffer.put(keyBytes);
        buffer.putInt(value.length);
        buffer.put(value);
        buffer.flip();
        return buffer;
    }

    /**
     * Reads one record at the buffer's position. A record cut short by the end
     * of the buffer raises {@link BufferUnderflowException} and leaves the
     * position untouched.
     */
    public static WalEntry deserialize(ByteBuffer buffer) throws WalCorruptionException {
        ByteBuffer in = buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        if (in.remaining() < LENGTH_PREFIX) {
            throw new BufferUnderflowException();
        }
        int totalLength = in.getInt();
        if (totalLength == 0) {
            // zero-filled tail left behind by a crash
            throw new BufferUnderflowException();
        }
        if (totalLength < MIN_BODY_SIZE) {
            throw new WalCorruptionException("wal record length " + Integer.toUnsignedString(totalLength) + " is below the minimum");
        }
        if (in.remaining() < totalLength) {
            throw new BufferUnderflowException();
        }

        EntryKind kind = EntryKind.fromCode(in.get());
        long timestamp = in.getLong();
        int keyLength = in.getInt();
        if (keyLength < 0 || keyLength > totalLength - MIN_BODY_SIZE) {
            throw new WalCorruptionException("wal key length " + keyLength + " does not fit record of " + totalLength);
        }
        byte[] key = new byte[keyLength];
        in.get(key);
        int valueLength = in.getInt();
        if (valueLength != totalLength - MIN_BODY_SIZE - keyLength) {
            throw new WalCorruptionException("wal value length " + valueLength + " does not fit record of " + totalLength);
        }
        if (kind == EntryKind.DELETE && valueLength != 0) {
            throw new WalCorruptionException("wal delete record carries a value");
        }
        byte[] value = new byte[valueLength];
        in.get(value);

        buffer.position(in.position());
        return new WalEntry(kind, new String(key, StandardCharsets.UTF_8), value, timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WalEntry)) {
            return false;
        }
        WalEntry other = (WalEntry) o;
        return timestamp == other.timestamp
                && kind == other.kind
                && key.equals(other.key)
                && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(kind, key, timestamp) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("key", key)
                .add("valueLength", value.length)
                .add("timestamp", timestamp)
                .toString();
    }
}
