package com.bulkload.map;

import com.bulkload.chunker.Chunk;
import java.io.IOException;

/** Worker-side consumer of chunks. One instance per worker thread. */
public interface ChunkMapper {
  void map(Chunk chunk) throws IOException;

  /** Flushes whatever is still buffered. */
  void close() throws IOException;
}
