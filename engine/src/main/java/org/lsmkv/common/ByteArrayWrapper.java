package org.lsmkv.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

import com.google.common.primitives.UnsignedBytes;

/**
 * Key type used by the memtable, the sstable index and the merger.
 * Ordering is unsigned lexicographic over the raw bytes, so UTF-8 encoded keys
 * sort in code point order everywhere.
 */
public class ByteArrayWrapper implements Comparable<ByteArrayWrapper> {
    private static final Comparator<byte[]> ORDER = UnsignedBytes.lexicographicalComparator();

    private final byte[] data;

    public ByteArrayWrapper(byte[] data){
        if (data == null) {
            throw new IllegalArgumentException("key bytes cant be null");
        }
        this.data = data;
    }

    public static ByteArrayWrapper of(String key){
        if (key == null) {
            throw new IllegalArgumentException("key cant be null");
        }
        return new ByteArrayWrapper(key.getBytes(StandardCharsets.UTF_8));
    }

    public static int compare(byte[] left, byte[] right){
        return ORDER.compare(left, right);
    }

    @Override
    public boolean equals(Object other){
        if(!(other instanceof ByteArrayWrapper)){
            return false;
        }
        return Arrays.equals(data, ((ByteArrayWrapper) other).data);
    }

    @Override
    public int hashCode(){
        return Arrays.hashCode(data);
    }

    @Override
    public int compareTo(ByteArrayWrapper other){
        return ORDER.compare(data, other.data);
    }

    public boolean startsWith(ByteArrayWrapper prefix){
        if (prefix.data.length > data.length) {
            return false;
        }
        for (int i = 0; i < prefix.data.length; i++) {
            if (data[i] != prefix.data[i]) {
                return false;
            }
        }
        return true;
    }

    public int length(){
        return data.length;
    }

    public byte[] getData(){
        return this.data;
    }

    public String asString(){
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public String toString(){
        return asString();
    }
}
