package com.bulkload.chunker;

import java.io.IOException;

/**
 * Splits one input stream into independently parseable {@link Chunk}s.
 *
 * An instance serves a single stream: {@link #begin} once, {@link #chunk}
 * until a chunk reports {@link Chunk#isEndOfStream()}, then {@link #end}.
 * Implementations keep no state between streams.
 */
public interface Chunker {

  /** Consumes any framing prologue. */
  void begin(ChunkInput in) throws IOException;

  /**
   * Reads the next unit. The last call returns a (possibly empty) chunk
   * flagged end-of-stream; callers still deliver it when non-empty.
   */
  Chunk chunk(ChunkInput in) throws IOException;

  /** Verifies nothing meaningful is left unconsumed. */
  void end(ChunkInput in) throws IOException;
}
