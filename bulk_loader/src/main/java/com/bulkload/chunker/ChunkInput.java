package com.bulkload.chunker;

import java.io.IOException;
import java.io.InputStream;
import org.apache.hadoop.io.DataOutputBuffer;

/**
 * Buffered byte source a {@link Chunker} reads from.
 *
 * Keeps a fixed-size window over the underlying stream. Supports a single
 * byte of push-back after {@link #read()} and a bounded delimiter scan
 * ({@link #readSlice}) that reports when the window fills up before the
 * delimiter shows up, so callers can fall back to {@link #readUntil}.
 */
public class ChunkInput {

  /** Default window: 1 MiB. */
  public static final int DEFAULT_BUFFER_SIZE = 1 << 20;

  /** Outcome of a bounded delimiter scan. */
  public enum Slice {
    /** Delimiter found; the slice ends with it. */
    COMPLETE,
    /** Window is full and holds no delimiter. */
    BUFFER_FULL,
    /** Stream ended before a delimiter. */
    END_OF_STREAM,
  }

  private final InputStream in;
  private final byte[] buf;
  private int pos;
  private int limit;
  private boolean eof;
  private boolean canUnread;
  // distance unread bytes moved towards the window start in the last fill
  private int shiftedBy;

  public ChunkInput(InputStream in) {
    this(in, DEFAULT_BUFFER_SIZE);
  }

  public ChunkInput(InputStream in, int bufferSize) {
    if (bufferSize < 16) {
      throw new IllegalArgumentException("buffer too small: " + bufferSize);
    }
    this.in = in;
    this.buf = new byte[bufferSize];
  }

  /** Next byte, or -1 at end of stream. */
  public int read() throws IOException {
    if (pos == limit && !fill()) {
      canUnread = false;
      return -1;
    }
    canUnread = true;
    return buf[pos++] & 0xFF;
  }

  /** Pushes back the byte returned by the last successful {@link #read()}. */
  public void unread() {
    if (!canUnread) {
      throw new IllegalStateException("unread without a preceding read");
    }
    canUnread = false;
    pos--;
  }

  /**
   * Copies bytes up to and including {@code delim} into {@code out}, never
   * buffering more than one window. On {@link Slice#BUFFER_FULL} the window's
   * content has been copied and the rest of the line is still unread.
   */
  public Slice readSlice(byte delim, DataOutputBuffer out) throws IOException {
    canUnread = false;
    int scanFrom = pos;
    while (true) {
      for (int i = scanFrom; i < limit; i++) {
        if (buf[i] == delim) {
          out.write(buf, pos, i + 1 - pos);
          pos = i + 1;
          return Slice.COMPLETE;
        }
      }
      if (pos == 0 && limit == buf.length) {
        out.write(buf, 0, limit);
        pos = limit;
        return Slice.BUFFER_FULL;
      }
      scanFrom = limit;
      if (!fill()) {
        out.write(buf, pos, limit - pos);
        pos = limit;
        return Slice.END_OF_STREAM;
      }
      scanFrom -= shiftedBy;
    }
  }

  /**
   * Unbounded variant of {@link #readSlice}: copies until {@code delim}
   * (inclusive) however long the line is.
   *
   * @return false if the stream ended before the delimiter
   */
  public boolean readUntil(byte delim, DataOutputBuffer out)
    throws IOException {
    while (true) {
      Slice s = readSlice(delim, out);
      if (s == Slice.COMPLETE) return true;
      if (s == Slice.END_OF_STREAM) return false;
    }
  }

  /**
   * Compacts unread bytes to the start of the window and reads more.
   * Returns false once the stream is exhausted and nothing new was read.
   */
  private boolean fill() throws IOException {
    shiftedBy = 0;
    if (eof) return false;
    if (pos > 0) {
      System.arraycopy(buf, pos, buf, 0, limit - pos);
      shiftedBy = pos;
      limit -= pos;
      pos = 0;
    }
    if (limit == buf.length) return true;
    int n;
    do {
      n = in.read(buf, limit, buf.length - limit);
    } while (n == 0);
    if (n < 0) {
      eof = true;
      return false;
    }
    limit += n;
    return true;
  }
}
