package org.lsmkv.core.sstable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.lsmkv.common.AppConstants;
import org.lsmkv.common.ByteArrayWrapper;
import org.lsmkv.core.sstable.util.SSTableConstants;
import org.lsmkv.core.sstable.util.SSTableEntryHeader;
import org.lsmkv.core.sstable.util.SSTableFooterUtils;
import org.lsmkv.core.sstable.util.SSTableFooterUtils.FooterData;
import org.lsmkv.core.sstable.util.SSTableIndexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;

/**
 * Streams sorted entries into a new sstable. Everything goes to
 * {@code <path>.tmp} first; {@link #close()} appends the metadata, filter,
 * index and footer blocks and then renames the file into place, so a
 * half-written table is never visible under its final name.
 */
public class SSTableWriter {
    private static final Logger logger = LoggerFactory.getLogger(SSTableWriter.class);

    private final Path path;
    private final Path tempPath;
    private final int level;
    private final long expectedEntryCount;
    private final FileChannel channel;
    private final ByteBuffer buffer;
    private final List<SSTableIndexUtils.IndexEntry> index;
    private final BloomFilter<byte[]> filter;

    private long currentOffset;
    private long entryCount;
    private long maxTimestamp;
    private ByteArrayWrapper minKey;
    private ByteArrayWrapper lastKey;
    private boolean isClosed;

    public SSTableWriter(Path path, int level, long expectedEntryCount) throws IOException {
        this(path, level, expectedEntryCount, AppConstants.DEFAULT_BLOOM_FALSE_POSITIVE_RATE);
    }

    public SSTableWriter(Path path, int level, long expectedEntryCount, double falsePositiveRate) throws IOException {
        Preconditions.checkArgument(level >= 0, "level must not be negative: %s", level);
        Preconditions.checkArgument(expectedEntryCount >= 0, "expected entry count must not be negative");
        this.path = path;
        this.tempPath = path.resolveSibling(path.getFileName() + AppConstants.TEMP_FILE_SUFFIX);
        this.level = level;
        this.expectedEntryCount = expectedEntryCount;
        this.filter = BloomFilter.create(Funnels.byteArrayFunnel(), Math.max(1L, expectedEntryCount), falsePositiveRate);
        this.buffer = ByteBuffer.allocate(SSTableConstants.WRITE_BUFFER_SIZE);
        this.index = new ArrayList<>();

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.channel = FileChannel.open(tempPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
    }

    /**
     * Appends one entry. Keys must arrive in strictly increasing order.
     */
    public void writeEntry(SSTableEntry entry) throws IOException {
        Preconditions.checkState(!isClosed, "sstable writer is already closed");
        ByteArrayWrapper key = entry.getKey();
        Preconditions.checkArgument(lastKey == null || key.compareTo(lastKey) > 0,
                "keys must be strictly increasing: %s after %s", key, lastKey);

        long entryOffset = currentOffset + buffer.position();
        if (entryCount % SSTableConstants.INDEX_ENTRY_INTERVAL == 0) {
            index.add(new SSTableIndexUtils.IndexEntry(key.getData(), entryOffset));
        }

        byte[] keyBytes = key.getData();
        int valueLength = entry.isDeleted() ? SSTableConstants.TOMBSTONE_LENGTH : entry.getValue().length;
        int entrySize = entry.encodedSize();
        if (buffer.remaining() < entrySize) {
            flushBuffer();
        }
        if (entrySize > buffer.capacity()) {
            ByteBuffer large = ByteBuffer.allocate(entrySize);
            encode(large, keyBytes, valueLength, entry);
            large.flip();
            writeFully(large);
        } else {
            encode(buffer, keyBytes, valueLength, entry);
        }

        filter.put(keyBytes);
        if (minKey == null) {
            minKey = key;
        }
        lastKey = key;
        maxTimestamp = Math.max(maxTimestamp, entry.getTimestamp());
        entryCount++;
    }

    private static void encode(ByteBuffer target, byte[] key, int valueLength, SSTableEntry entry) {
        SSTableEntryHeader.writeTo(target, key.length, valueLength, entry.getTimestamp());
        target.put(key);
        if (!entry.isDeleted()) {
            target.put(entry.getValue());
        }
    }

    public long getEntryCount() {
        return entryCount;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Finalizes the table and moves it to its final name.
     *
     * @throws IllegalStateException when called twice, or when nothing was
     *         written although entries were expected
     */
    public SSTableMetadata close() throws IOException {
        Preconditions.checkState(!isClosed, "sstable writer is already closed");
        isClosed = true;
        try {
            Preconditions.checkState(entryCount > 0 || expectedEntryCount == 0,
                    "no entries written to %s, expected %s", path, expectedEntryCount);
            flushBuffer();

            long dataSize = currentOffset;
            SSTableMetadata metadata = new SSTableMetadata(level, entryCount, dataSize,
                    System.currentTimeMillis(), maxTimestamp, minKey, lastKey);
            ByteBuffer metadataBuffer = ByteBuffer.allocate(metadata.serializedSize());
            metadata.writeTo(metadataBuffer);
            metadataBuffer.flip();
            writeFully(metadataBuffer);

            long filterOffset = currentOffset;
            ByteArrayOutputStream filterBytes = new ByteArrayOutputStream();
            filter.writeTo(filterBytes);
            writeFully(ByteBuffer.wrap(filterBytes.toByteArray()));

            long indexOffset = currentOffset;
            ByteBuffer indexBuffer = ByteBuffer.allocate(SSTableIndexUtils.calculateIndexSize(index));
            SSTableIndexUtils.writeIndex(indexBuffer, index);
            indexBuffer.flip();
            writeFully(indexBuffer);

            ByteBuffer footerBuffer = ByteBuffer.allocate(SSTableConstants.FOOTER_SIZE);
            SSTableFooterUtils.writeFooter(footerBuffer, new FooterData(dataSize, filterOffset, indexOffset));
            footerBuffer.flip();
            writeFully(footerBuffer);

            channel.force(true);
            channel.close();
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("sstable {} written: level={}, entries={}, size={}", path.getFileName(), level, entryCount, currentOffset);
            return metadata;
        } catch (IOException | RuntimeException e) {
            discard(e);
            throw e;
        }
    }

    /**
     * Drops the partially written table. Does nothing once the writer is closed.
     */
    public void abort() throws IOException {
        if (isClosed) {
            return;
        }
        isClosed = true;
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(tempPath);
        }
        logger.debug("sstable {} aborted", path.getFileName());
    }

    private void discard(Exception cause) {
        try {
            channel.close();
            Files.deleteIfExists(tempPath);
        } catch (IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }

    private void flushBuffer() throws IOException {
        if (buffer.position() == 0) {
            return;
        }
        buffer.flip();
        writeFully(buffer);
        buffer.clear();
    }

    private void writeFully(ByteBuffer source) throws IOException {
        while (source.hasRemaining()) {
            currentOffset += channel.write(source, currentOffset);
        }
    }
}
