package org.lsmkv.core.sstable.merger;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

import org.lsmkv.core.sstable.EntryIterator;
import org.lsmkv.core.sstable.SSTableEntry;

/**
 * Merges sorted sources into one sorted stream with a single entry per key.
 * For a key present in several sources the entry with the highest timestamp
 * wins; on equal timestamps the source listed first wins.
 */
public class KWayMerger implements EntryIterator {

    private static final Comparator<HeapEntry> ORDER = Comparator
            .comparing((HeapEntry head) -> head.entry.getKey())
            .thenComparing(head -> head.entry.getTimestamp(), Comparator.reverseOrder())
            .thenComparingInt(head -> head.sourceIndex);

    private final List<? extends EntryIterator> sources;
    private final PriorityQueue<HeapEntry> heap;

    public KWayMerger(List<? extends EntryIterator> sources) throws IOException {
        this.sources = sources;
        this.heap = new PriorityQueue<>(Math.max(1, sources.size()), ORDER);
        for (int i = 0; i < sources.size(); i++) {
            refill(i);
        }
    }

    @Override
    public boolean hasNext() {
        return !heap.isEmpty();
    }

    @Override
    public SSTableEntry next() throws IOException {
        HeapEntry newest = heap.poll();
        if (newest == null) {
            throw new NoSuchElementException("merger is exhausted");
        }
        refill(newest.sourceIndex);
        while (!heap.isEmpty() && heap.peek().entry.getKey().equals(newest.entry.getKey())) {
            HeapEntry shadowed = heap.poll();
            refill(shadowed.sourceIndex);
        }
        return newest.entry;
    }

    private void refill(int sourceIndex) throws IOException {
        EntryIterator source = sources.get(sourceIndex);
        if (source.hasNext()) {
            heap.add(new HeapEntry(source.next(), sourceIndex));
        }
    }

    private static final class HeapEntry {
        private final SSTableEntry entry;
        private final int sourceIndex;

        private HeapEntry(SSTableEntry entry, int sourceIndex) {
            this.entry = entry;
            this.sourceIndex = sourceIndex;
        }
    }
}
