package org.lsmkv.api;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;
import java.util.SortedMap;

import org.lsmkv.core.compaction.CompactionResult;

public interface IKeyValueStore extends Closeable {
    public void put(String key, byte[] value) throws IOException;
    public Optional<byte[]> get(String key) throws IOException;
    public void delete(String key) throws IOException;
    public void flush() throws IOException;

    /**
     * Live keys starting with {@code prefix}, in ascending order, at most {@code limit} of them.
     */
    public SortedMap<String, byte[]> scan(String prefix, int limit) throws IOException;

    public Optional<CompactionResult> compact() throws IOException;

    /**
     * Counts that cannot be read from disk are left out rather than failing the call.
     */
    public EngineStats stats();
}
