package com.bulkload;

/**
 * Centralized counters for a bulk load run.
 */
public final class LoaderMetrics {

  private LoaderMetrics() {} // Utility class

  /** Counters for the map stage */
  public static enum MapMetrics {
    FILES_READ,
    INPUT_BYTES,
    CHUNKS_PRODUCED,
    CHUNKS_CONSUMED,
    NQUADS,
    PARSE_ERRORS,
    MAP_ENTRIES,
    MAP_FILES,
    MAP_OUTPUT_BYTES,
  }

  /** Counters for the reduce stage */
  public static enum ReduceMetrics {
    BATCHES,
    REDUCE_KEYS,
    POSTINGS,
    SEGMENTS,
  }
}
