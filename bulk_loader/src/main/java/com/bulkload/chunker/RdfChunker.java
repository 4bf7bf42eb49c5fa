package com.bulkload.chunker;

import java.io.IOException;
import org.apache.hadoop.io.DataOutputBuffer;

/**
 * Line-oriented chunker: every chunk holds whole lines, at most
 * {@link #LINES_PER_CHUNK} of them. RDF has no framing, so begin and end are
 * no-ops.
 */
public class RdfChunker implements Chunker {

  public static final int LINES_PER_CHUNK = 100_000;

  private static final byte NEWLINE = '\n';

  @Override
  public void begin(ChunkInput in) {}

  @Override
  public Chunk chunk(ChunkInput in) throws IOException {
    DataOutputBuffer batch = new DataOutputBuffer(1 << 20);
    for (int lineCount = 0; lineCount < LINES_PER_CHUNK; lineCount++) {
      switch (in.readSlice(NEWLINE, batch)) {
        case END_OF_STREAM:
          return new Chunk(batch, true);
        case BUFFER_FULL:
          // Rare: a line longer than the read window. Finish it unbounded.
          if (!in.readUntil(NEWLINE, batch)) {
            return new Chunk(batch, true);
          }
          break;
        case COMPLETE:
        default:
          break;
      }
    }
    return new Chunk(batch, false);
  }

  @Override
  public void end(ChunkInput in) {}
}
