package org.lsmkv.core.wal;

import java.io.Closeable;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every complete record of a single segment. Reading stops at the first
 * record cut short by the end of the file; {@link #validLength()} then points
 * just past the last complete record.
 */
public class WalSegmentReader implements Closeable {

  private final Path segment;
  private final FileChannel channel;
  private final long size;
  private long validLength;
  private boolean tornTail;

  public WalSegmentReader(Path segment) throws IOException {
    this.segment = segment;
    this.channel = FileChannel.open(segment, StandardOpenOption.READ);
    this.size = channel.size();
  }

  public List<WalEntry> recover() throws IOException {
    List<WalEntry> entries = new ArrayList<>();
    validLength = 0;
    tornTail = false;
    if (size == 0) {
      return entries;
    }
    if (size > Integer.MAX_VALUE) {
      throw new WalCorruptionException("wal segment too large to replay: " + segment);
    }

    ByteBuffer buffer = ByteBuffer.allocate((int) size);
    while (buffer.hasRemaining()) {
      if (channel.read(buffer, buffer.position()) < 0) {
        break;
      }
    }
    buffer.flip();

    while (buffer.hasRemaining()) {
      try {
        entries.add(WalEntry.deserialize(buffer));
        validLength = buffer.position();
      } catch (BufferUnderflowException e) {
        tornTail = true;
        break;
      }
    }
    return entries;
  }

  public long validLength() {
    return validLength;
  }

  public boolean hasTornTail() {
    return tornTail;
  }

  public long size() {
    return size;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
