package org.lsmkv.core.memtable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.lsmkv.common.ByteArrayWrapper;
import org.lsmkv.core.sstable.SSTableEntry;

/**
 * Sorted in-memory buffer of the most recent writes. Deletes are kept as
 * tombstones so they reach the next sstable. Size is the sum of key and value
 * bytes of the current entries; a tombstone accounts for its key only.
 */
public class Memtable {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<ByteArrayWrapper, Value> store = new TreeMap<>();
    private final Instant createdAt = Instant.now();
    private long size;

    public void put(String key, byte[] value, long timestamp) {
        if (value == null) {
            throw new IllegalArgumentException("Value cant be null");
        }
        upsert(ByteArrayWrapper.of(key), new Value(value, timestamp, false));
    }

    public void delete(String key, long timestamp) {
        upsert(ByteArrayWrapper.of(key), Value.tombstone(timestamp));
    }

    private void upsert(ByteArrayWrapper keyWrapper, Value valueObj) {
        lock.writeLock().lock();
        try {
            Value oldValue = store.put(keyWrapper, valueObj);
            if (oldValue != null) {
                size -= keyWrapper.length() + oldValue.getSize();
            }
            size += keyWrapper.length() + valueObj.getSize();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the live value, empty when the key is absent or deleted
     */
    public Optional<byte[]> get(String key) {
        Value valueObj = lookup(key);
        if (valueObj == null || valueObj.isDeleted()) {
            return Optional.empty();
        }
        return Optional.of(valueObj.getValue());
    }

    /**
     * @return the raw entry including tombstones, or null when the key was never written
     */
    public Value lookup(String key) {
        ByteArrayWrapper keyWrapper = ByteArrayWrapper.of(key);
        lock.readLock().lock();
        try {
            return store.get(keyWrapper);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long entryCount() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return entryCount() == 0;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Snapshot of the current entries in ascending key order, tombstones included.
     */
    public Iterator<SSTableEntry> iterator() {
        lock.readLock().lock();
        try {
            List<SSTableEntry> copy = new ArrayList<>(store.size());
            for (Map.Entry<ByteArrayWrapper, Value> entry : store.entrySet()) {
                Value value = entry.getValue();
                copy.add(new SSTableEntry(entry.getKey(), value.getValue(), value.isDeleted(), value.getTimestamp()));
            }
            return copy.iterator();
        } finally {
            lock.readLock().unlock();
        }
    }
}
