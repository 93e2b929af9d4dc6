package org.lsmkv.core.sstable;

import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single pass, ascending-key source of entries. Not restartable.
 */
public interface EntryIterator {

    boolean hasNext();

    /**
     * @throws NoSuchElementException when exhausted
     */
    SSTableEntry next() throws IOException;

    static EntryIterator of(Iterator<SSTableEntry> entries) {
        return new EntryIterator() {
            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public SSTableEntry next() {
                return entries.next();
            }
        };
    }
}
