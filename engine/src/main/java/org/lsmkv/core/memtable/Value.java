package org.lsmkv.core.memtable;

public class Value {
    private static final byte[] EMPTY = new byte[0];

    private final byte[] value;
    private final long timestamp;
    private final boolean isDeleted;

    public Value(byte[] value, long timestamp, boolean isDeleted){
        this.value = (isDeleted || value == null) ? EMPTY : value;
        this.timestamp = timestamp;
        this.isDeleted = isDeleted;
    }

    public static Value tombstone(long timestamp){
        return new Value(null, timestamp, true);
    }

    public byte[] getValue(){
        return this.value;
    }

    public long getTimestamp(){
        return this.timestamp;
    }

    public boolean isDeleted(){
        return this.isDeleted;
    }

    public int getSize(){
        return value.length;
    }
}
