package org.lsmkv.core.sstable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.NoSuchElementException;

import org.lsmkv.core.sstable.util.SSTableConstants;
import org.lsmkv.core.sstable.util.SSTableEntryHeader;

/**
 * Sequential pass over the data section of one sstable. Reads ahead in
 * fixed-size windows; entries larger than a window are read on their own.
 */
public class SSTableIterator implements EntryIterator {
    private static final int READ_AHEAD_SIZE = 64 * 1024;

    private final SSTableReader reader;
    private final long end;
    private long currentOffset;
    private ByteBuffer window = ByteBuffer.allocate(0);
    private long windowStart;

    SSTableIterator(SSTableReader reader) {
        this.reader = reader;
        this.end = reader.getDataSize();
        this.currentOffset = 0;
    }

    @Override
    public boolean hasNext() {
        return currentOffset < end;
    }

    @Override
    public SSTableEntry next() throws IOException {
        if (!hasNext()) {
            throw new NoSuchElementException("no more entries in " + reader.getPath());
        }
        SSTableEntry entry = readAt(currentOffset);
        currentOffset += entry.encodedSize();
        return entry;
    }

    private SSTableEntry readAt(long offset) throws IOException {
        if (end - offset < SSTableConstants.HEADER_SIZE) {
            throw new CorruptSSTableException(reader.getPath(), "truncated entry header at offset " + offset);
        }
        if (!windowHolds(offset, SSTableConstants.HEADER_SIZE)) {
            fill(offset);
        }
        ByteBuffer view = window.duplicate();
        view.position((int) (offset - windowStart));
        SSTableEntryHeader header = SSTableEntryHeader.readFrom(view);
        reader.checkHeader(header, offset);

        int bodyLength = header.bodyLength();
        if (SSTableConstants.HEADER_SIZE + bodyLength > READ_AHEAD_SIZE) {
            return reader.readEntry(offset);
        }
        if (!windowHolds(offset, SSTableConstants.HEADER_SIZE + bodyLength)) {
            fill(offset);
            view = window.duplicate();
            view.position((int) (offset - windowStart) + SSTableConstants.HEADER_SIZE);
        }
        return SSTableReader.decode(header, view);
    }

    private boolean windowHolds(long offset, int length) {
        return offset >= windowStart && offset + length <= windowStart + window.limit();
    }

    private void fill(long offset) throws IOException {
        int length = (int) Math.min(READ_AHEAD_SIZE, end - offset);
        window = reader.readBlock(offset, length);
        windowStart = offset;
    }
}
