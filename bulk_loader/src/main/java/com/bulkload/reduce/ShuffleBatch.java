package com.bulkload.reduce;

import com.bulkload.posting.MapEntry;
import java.util.List;

/**
 * Sorted map entries bound for one segment of one output store. Produced by
 * the {@link Shuffler}, consumed once by the {@link Reducer}. Entries of a
 * key are never split across batches.
 */
public final class ShuffleBatch {

  private final ShardStore store;
  private final int segmentId;
  private final List<MapEntry> entries;

  public ShuffleBatch(ShardStore store, int segmentId, List<MapEntry> entries) {
    this.store = store;
    this.segmentId = segmentId;
    this.entries = entries;
  }

  public ShardStore getStore() {
    return store;
  }

  public int getSegmentId() {
    return segmentId;
  }

  public List<MapEntry> getEntries() {
    return entries;
  }
}
