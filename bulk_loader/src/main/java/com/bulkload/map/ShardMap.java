package com.bulkload.map;

import java.util.HashMap;
import java.util.Map;

/**
 * Assigns predicates to map shards, round-robin in order of first sight.
 * Every key of a predicate lands in the same map shard.
 */
public class ShardMap {

  private final int numShards;
  private final Map<String, Integer> assigned = new HashMap<>();
  private int next;

  public ShardMap(int numShards) {
    if (numShards < 1) {
      throw new IllegalArgumentException("numShards must be >= 1");
    }
    this.numShards = numShards;
  }

  public int numShards() {
    return numShards;
  }

  public synchronized int shardFor(String predicate) {
    Integer shard = assigned.get(predicate);
    if (shard == null) {
      shard = next;
      next = (next + 1) % numShards;
      assigned.put(predicate, shard);
    }
    return shard;
  }
}
