package org.lsmkv.core.wal;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

import org.lsmkv.common.AppConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Segmented, append-only log of mutations. Segments are named
 * {@code wal-NNNNNN.log}; the numbering is recovered from the directory
 * listing alone. Every append is forced to disk before it returns.
 */
public class WriteAheadLog implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(WriteAheadLog.class);

  private final Path dir;
  private final long maxSegmentBytes;
  private final ReentrantLock lock = new ReentrantLock();

  private FileChannel channel;
  private int currentIndex;
  private long currentSize;
  private long entryCount;
  private boolean forceMetadata;
  private boolean closed;

  public WriteAheadLog(Path dir, long maxSegmentBytes) throws IOException {
    Preconditions.checkArgument(maxSegmentBytes > 0, "wal segment size must be positive");
    this.dir = dir;
    this.maxSegmentBytes = maxSegmentBytes;
    Files.createDirectories(dir);

    TreeMap<Integer, Path> segments = listSegments(dir);
    if (segments.isEmpty()) {
      openSegment(0);
    } else {
      Map.Entry<Integer, Path> newest = segments.lastEntry();
      repairTail(newest.getValue());
      this.currentIndex = newest.getKey();
      this.channel = FileChannel.open(newest.getValue(), StandardOpenOption.WRITE, StandardOpenOption.APPEND);
      this.currentSize = channel.size();
    }
    logger.info("wal opened in {} at segment {} ({} bytes)", dir, segmentName(currentIndex), currentSize);
  }

  public void append(WalEntry entry) throws IOException {
    ByteBuffer record = entry.serialize();
    lock.lock();
    try {
      ensureOpen();
      if (currentSize > 0 && currentSize + record.remaining() > maxSegmentBytes) {
        rotateLocked();
      }
      int written = record.remaining();
      while (record.hasRemaining()) {
        channel.write(record);
      }
      channel.force(forceMetadata);
      forceMetadata = false;
      currentSize += written;
      entryCount++;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the current segment and starts the next one.
   *
   * @return index of the segment that was closed
   */
  public int rotate() throws IOException {
    lock.lock();
    try {
      ensureOpen();
      return rotateLocked();
    } finally {
      lock.unlock();
    }
  }

  private int rotateLocked() throws IOException {
    int previous = currentIndex;
    channel.force(true);
    channel.close();
    openSegment(previous + 1);
    logger.debug("wal rotated from {} to {}", segmentName(previous), segmentName(currentIndex));
    return previous;
  }

  private void openSegment(int index) throws IOException {
    Path path = dir.resolve(segmentName(index));
    this.channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    this.currentIndex = index;
    this.currentSize = channel.size();
    this.forceMetadata = true;
  }

  private void repairTail(Path segment) throws IOException {
    long validLength;
    long size;
    try (WalSegmentReader reader = new WalSegmentReader(segment)) {
      reader.recover();
      validLength = reader.validLength();
      size = reader.size();
    }
    if (validLength < size) {
      logger.warn("wal segment {} has a torn tail, truncating {} bytes", segment.getFileName(), size - validLength);
      try (FileChannel repair = FileChannel.open(segment, StandardOpenOption.WRITE)) {
        repair.truncate(validLength);
        repair.force(true);
      }
    }
  }

  /**
   * Reads every segment in ascending index order. A record cut short at the end
   * of a segment ends that segment's replay without error.
   */
  public List<WalEntry> readAll() throws IOException {
    lock.lock();
    try {
      List<WalEntry> entries = new ArrayList<>();
      for (Map.Entry<Integer, Path> segment : listSegments(dir).entrySet()) {
        try (WalSegmentReader reader = new WalSegmentReader(segment.getValue())) {
          entries.addAll(reader.recover());
          if (reader.hasTornTail()) {
            logger.warn("stopped replaying {} at offset {}: incomplete trailing record",
                segment.getValue().getFileName(), reader.validLength());
          }
        }
      }
      return entries;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes every segment whose index is at most {@code beforeIndex}. The open
   * segment is never deleted.
   */
  public void truncate(int beforeIndex) throws IOException {
    lock.lock();
    try {
      for (Map.Entry<Integer, Path> segment : listSegments(dir).entrySet()) {
        int index = segment.getKey();
        if (index <= beforeIndex && index != currentIndex) {
          Files.deleteIfExists(segment.getValue());
          logger.debug("wal segment {} removed", segment.getValue().getFileName());
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Entry count covers the records appended through this instance.
   */
  public WalStats stats() throws IOException {
    lock.lock();
    try {
      TreeMap<Integer, Path> segments = listSegments(dir);
      long totalSize = 0;
      for (Path segment : segments.values()) {
        totalSize += Files.size(segment);
      }
      return new WalStats(segments.size(), totalSize, entryCount, segmentName(currentIndex));
    } finally {
      lock.unlock();
    }
  }

  public int currentIndex() {
    lock.lock();
    try {
      return currentIndex;
    } finally {
      lock.unlock();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("wal is closed");
    }
  }

  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      try {
        channel.force(true);
      } finally {
        channel.close();
      }
    } finally {
      lock.unlock();
    }
  }

  public static String segmentName(int index) {
    return String.format("%s%06d%s", AppConstants.WAL_FILE_PREFIX, index, AppConstants.WAL_FILE_SUFFIX);
  }

  /**
   * @return the segment index, or -1 when the name is not a wal segment
   */
  public static int parseSegmentIndex(String fileName) {
    if (!fileName.startsWith(AppConstants.WAL_FILE_PREFIX) || !fileName.endsWith(AppConstants.WAL_FILE_SUFFIX)) {
      return -1;
    }
    String digits = fileName.substring(AppConstants.WAL_FILE_PREFIX.length(),
        fileName.length() - AppConstants.WAL_FILE_SUFFIX.length());
    if (digits.isEmpty()) {
      return -1;
    }
    for (int i = 0; i < digits.length(); i++) {
      if (!Character.isDigit(digits.charAt(i))) {
        return -1;
      }
    }
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  static TreeMap<Integer, Path> listSegments(Path dir) throws IOException {
    TreeMap<Integer, Path> segments = new TreeMap<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
      for (Path path : stream) {
        int index = parseSegmentIndex(path.getFileName().toString());
        if (index >= 0 && Files.isRegularFile(path)) {
          segments.put(index, path);
        }
      }
    }
    return segments;
  }
}
