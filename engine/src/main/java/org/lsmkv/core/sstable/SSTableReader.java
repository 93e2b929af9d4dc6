package org.lsmkv.core.sstable;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.lsmkv.common.ByteArrayWrapper;
import org.lsmkv.core.sstable.util.SSTableConstants;
import org.lsmkv.core.sstable.util.SSTableEntryHeader;
import org.lsmkv.core.sstable.util.SSTableFooterUtils;
import org.lsmkv.core.sstable.util.SSTableFooterUtils.FooterData;
import org.lsmkv.core.sstable.util.SSTableIndexUtils;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;

/**
 * Read side of an sstable. Metadata, filter and sparse index are loaded on
 * open; entries are read on demand through positional reads, so one reader
 * may serve concurrent lookups.
 */
public class SSTableReader implements AutoCloseable {
    private final Path path;
    private final FileChannel channel;
    private final long fileSize;
    private final long dataSize;
    private final SSTableMetadata metadata;
    private final BloomFilter<byte[]> filter;
    private final TreeMap<ByteArrayWrapper, Long> indexMap;

    private SSTableReader(Path path, FileChannel channel) throws IOException {
        this.path = path;
        this.channel = channel;
        this.fileSize = channel.size();
        if (fileSize < SSTableConstants.FOOTER_SIZE) {
            throw new CorruptSSTableException(path, "file of " + fileSize + " bytes is too small to contain a footer");
        }

        FooterData footer = readFooter();
        long footerOffset = fileSize - SSTableConstants.FOOTER_SIZE;
        if (!footer.isOrderedWithin(footerOffset)) {
            throw new CorruptSSTableException(path, "section offsets out of order");
        }
        this.dataSize = footer.metadataOffset;

        try {
            this.metadata = SSTableMetadata.readFrom(readBlock(footer.metadataOffset, span(footer.metadataOffset, footer.filterOffset)));
            this.indexMap = SSTableIndexUtils.readIndex(readBlock(footer.indexOffset, span(footer.indexOffset, footerOffset)));
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new CorruptSSTableException(path, "malformed metadata or index block", e);
        }
        if (metadata.getDataSize() != dataSize) {
            throw new CorruptSSTableException(path, "metadata data size " + metadata.getDataSize()
                    + " does not match data section of " + dataSize);
        }
        if (metadata.getEntryCount() > 0 && indexMap.isEmpty()) {
            throw new CorruptSSTableException(path, "index is empty for a table with entries");
        }

        byte[] filterBytes = new byte[span(footer.filterOffset, footer.indexOffset)];
        readBlock(footer.filterOffset, filterBytes.length).get(filterBytes);
        try {
            this.filter = BloomFilter.readFrom(new ByteArrayInputStream(filterBytes), Funnels.byteArrayFunnel());
        } catch (IOException | RuntimeException e) {
            throw new CorruptSSTableException(path, "unreadable filter block", e);
        }
    }

    /**
     * Opens and validates the table at {@code path}.
     *
     * @throws CorruptSSTableException when the footer, offsets or blocks are malformed
     */
    public static SSTableReader open(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            return new SSTableReader(path, channel);
        } catch (IOException | RuntimeException e) {
            try {
                channel.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    private FooterData readFooter() throws IOException {
        ByteBuffer footerBuffer = readBlock(fileSize - SSTableConstants.FOOTER_SIZE, SSTableConstants.FOOTER_SIZE);
        try {
            return SSTableFooterUtils.readFooter(footerBuffer);
        } catch (IllegalArgumentException e) {
            throw new CorruptSSTableException(path, e.getMessage(), e);
        }
    }

    private int span(long from, long to) throws CorruptSSTableException {
        long length = to - from;
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new CorruptSSTableException(path, "block length out of range: " + length);
        }
        return (int) length;
    }

    public Optional<byte[]> get(String key) throws IOException {
        return lookup(key).getValue();
    }

    /**
     * Point lookup that tells a tombstone apart from a missing key.
     */
    public LookupResult lookup(String key) throws IOException {
        ByteArrayWrapper target = ByteArrayWrapper.of(key);
        if (!filter.mightContain(target.getData()) || !metadata.covers(target)) {
            return LookupResult.absent();
        }
        Map.Entry<ByteArrayWrapper, Long> floor = indexMap.floorEntry(target);
        if (floor == null) {
            return LookupResult.absent();
        }

        long offset = floor.getValue();
        while (offset < dataSize) {
            SSTableEntryHeader header = readHeader(offset);
            byte[] currentKey = new byte[header.keyLength];
            readBlock(offset + SSTableConstants.HEADER_SIZE, header.keyLength).get(currentKey);
            int comparison = ByteArrayWrapper.compare(currentKey, target.getData());
            if (comparison == 0) {
                if (header.isTombstone()) {
                    return LookupResult.deleted();
                }
                byte[] value = new byte[header.valueLength];
                readBlock(offset + SSTableConstants.HEADER_SIZE + header.keyLength, header.valueLength).get(value);
                return LookupResult.found(value);
            }
            if (comparison > 0) {
                return LookupResult.absent();
            }
            offset += SSTableConstants.HEADER_SIZE + header.bodyLength();
        }
        return LookupResult.absent();
    }

    public boolean mightContain(String key) {
        return filter.mightContain(ByteArrayWrapper.of(key).getData());
    }

    public SSTableMetadata getMetadata() {
        return metadata;
    }

    public Path getPath() {
        return path;
    }

    long getDataSize() {
        return dataSize;
    }

    public SSTableIterator iterator() {
        return new SSTableIterator(this);
    }

    /**
     * Decodes the entry that starts at {@code offset} of the data section.
     */
    SSTableEntry readEntry(long offset) throws IOException {
        SSTableEntryHeader header = readHeader(offset);
        ByteBuffer body = readBlock(offset + SSTableConstants.HEADER_SIZE, header.bodyLength());
        return decode(header, body);
    }

    static SSTableEntry decode(SSTableEntryHeader header, ByteBuffer body) {
        byte[] key = new byte[header.keyLength];
        body.get(key);
        byte[] value = null;
        if (!header.isTombstone()) {
            value = new byte[header.valueLength];
            body.get(value);
        }
        return new SSTableEntry(new ByteArrayWrapper(key), value, header.isTombstone(), header.timestamp);
    }

    private SSTableEntryHeader readHeader(long offset) throws IOException {
        SSTableEntryHeader header = SSTableEntryHeader.readFrom(readBlock(offset, SSTableConstants.HEADER_SIZE));
        checkHeader(header, offset);
        return header;
    }

    /**
     * @throws CorruptSSTableException when the entry would not fit in the data section
     */
    void checkHeader(SSTableEntryHeader header, long offset) throws CorruptSSTableException {
        if (header.keyLength < 0 || header.valueLength < SSTableConstants.TOMBSTONE_LENGTH) {
            throw new CorruptSSTableException(path, "negative length in entry at offset " + offset);
        }
        long end = offset + SSTableConstants.HEADER_SIZE + (long) header.keyLength
                + (header.isTombstone() ? 0 : header.valueLength);
        if (end > dataSize) {
            throw new CorruptSSTableException(path, "entry at offset " + offset + " runs past the data section");
        }
    }

    /**
     * Reads {@code length} bytes at {@code offset} into a flipped buffer.
     */
    ByteBuffer readBlock(long offset, int length) throws IOException {
        ByteBuffer block = ByteBuffer.allocate(length);
        long position = offset;
        while (block.hasRemaining()) {
            int read = channel.read(block, position);
            if (read < 0) {
                throw new CorruptSSTableException(path, "unexpected end of file at offset " + position);
            }
            position += read;
        }
        block.flip();
        return block;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
