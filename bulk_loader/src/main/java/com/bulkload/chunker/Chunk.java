package com.bulkload.chunker;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.apache.hadoop.io.DataOutputBuffer;

/**
 * One self-contained unit of input: one or more complete records, produced by
 * a {@link Chunker} and handed to exactly one mapper. Never mutated once
 * built: the bytes are owned by the chunk and only read through
 * {@link #openStream()} or {@link #utf8()} outside this package.
 */
public final class Chunk {

  private final byte[] data;
  private final int length;
  private final boolean endOfStream;

  /** Takes over {@code buffer}; the caller must not write to it again. */
  Chunk(DataOutputBuffer buffer, boolean endOfStream) {
    this(buffer.getData(), buffer.getLength(), endOfStream);
  }

  private Chunk(byte[] data, int length, boolean endOfStream) {
    this.data = data;
    this.length = length;
    this.endOfStream = endOfStream;
  }

  /** Chunk holding the UTF-8 bytes of {@code text}; for tests and tools. */
  public static Chunk of(String text) {
    byte[] b = text.getBytes(StandardCharsets.UTF_8);
    return new Chunk(b, b.length, false);
  }

  public int length() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  /** True if the stream this chunk came from has no further records. */
  public boolean isEndOfStream() {
    return endOfStream;
  }

  /**
   * Backing array, not a copy; only the first {@link #length()} bytes are
   * meaningful. Read only.
   */
  byte[] data() {
    return data;
  }

  public InputStream openStream() {
    return new ByteArrayInputStream(data, 0, length);
  }

  public String utf8() {
    return new String(data, 0, length, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "Chunk{length=" + length + ", endOfStream=" + endOfStream + "}";
  }
}
