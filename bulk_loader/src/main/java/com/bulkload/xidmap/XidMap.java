package com.bulkload.xidmap;

import com.bulkload.zero.AssignedIds;
import com.bulkload.zero.ZeroClient;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps external node ids (IRIs, blank nodes, JSON uids) to internal uids.
 *
 * A fixed number of LRU shards sit in front of an {@link XidStore}. Unknown
 * xids get a fresh uid from a block leased from zero. Evicted or flushed
 * mappings are written back to the store, so a uid, once handed out, is
 * stable for the whole map stage. Thread-safe; a shard is locked for the
 * whole lookup so concurrent first sightings of one xid agree.
 */
public class XidMap implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(XidMap.class);

  public static final int DEFAULT_SHARDS = 1 << 10;
  public static final int DEFAULT_LRU_SIZE = 1 << 19;

  /** Uids leased from zero per round trip. */
  static final long LEASE_SIZE = 10_000;
  static final Duration LEASE_TIMEOUT = Duration.ofSeconds(10);

  private final XidStore store;
  private final ZeroClient zero;
  private final Shard[] shards;

  private long nextUid = 1;
  private long leaseEnd = 0;

  public XidMap(XidStore store, ZeroClient zero) {
    this(store, zero, DEFAULT_SHARDS, DEFAULT_LRU_SIZE);
  }

  public XidMap(XidStore store, ZeroClient zero, int numShards, int lruSize) {
    if (Integer.bitCount(numShards) != 1) {
      throw new IllegalArgumentException("numShards must be a power of two");
    }
    this.store = store;
    this.zero = zero;
    this.shards = new Shard[numShards];
    int perShard = Math.max(1, lruSize / numShards);
    for (int i = 0; i < numShards; i++) {
      shards[i] = new Shard(perShard);
    }
  }

  /** Uid for {@code xid}, allocating one on first sight. */
  public long assignUid(String xid) throws IOException {
    Shard shard = shards[(xid.hashCode() & 0x7fffffff) & (shards.length - 1)];
    synchronized (shard) {
      Entry e = shard.lru.get(xid);
      if (e != null) {
        return e.uid;
      }
      Long stored = store.get(xid);
      if (stored != null) {
        e = new Entry(stored, false);
      } else {
        e = new Entry(newUid(), true);
      }
      shard.lru.put(xid, e);
      shard.evictOverflow(store);
      return e.uid;
    }
  }

  private synchronized long newUid() throws IOException {
    if (nextUid > leaseEnd) {
      AssignedIds ids = zero.assignUids(LEASE_SIZE, LEASE_TIMEOUT);
      nextUid = ids.getStartId();
      leaseEnd = ids.getEndId();
      LOG.debug("Leased uids {}", ids);
    }
    return nextUid++;
  }

  /** Writes every cached new mapping to the store and empties the cache. */
  public void evictAll() throws IOException {
    for (Shard shard : shards) {
      synchronized (shard) {
        Map<String, Long> dirty = new HashMap<>();
        for (Map.Entry<String, Entry> e : shard.lru.entrySet()) {
          if (e.getValue().dirty) {
            dirty.put(e.getKey(), e.getValue().uid);
          }
        }
        store.putAll(dirty);
        shard.lru.clear();
      }
    }
  }

  /** Number of cached mappings; for monitoring. */
  public int cachedSize() {
    int n = 0;
    for (Shard shard : shards) {
      synchronized (shard) {
        n += shard.lru.size();
      }
    }
    return n;
  }

  /** Evicts everything, then closes the store. */
  @Override
  public void close() throws IOException {
    try {
      evictAll();
    } finally {
      store.close();
    }
  }

  // ==================== CACHE SHARD ====================

  private static final class Entry {

    final long uid;
    final boolean dirty; // not yet in the store

    Entry(long uid, boolean dirty) {
      this.uid = uid;
      this.dirty = dirty;
    }
  }

  private static final class Shard {

    final int capacity;
    final LinkedHashMap<String, Entry> lru = new LinkedHashMap<>(16, 0.75f, true);

    Shard(int capacity) {
      this.capacity = capacity;
    }

    /** Drops least recently used entries, writing new ones back. */
    void evictOverflow(XidStore store) throws IOException {
      if (lru.size() <= capacity) return;
      Map<String, Long> dirty = new HashMap<>();
      Iterator<Map.Entry<String, Entry>> it = lru.entrySet().iterator();
      while (lru.size() > capacity && it.hasNext()) {
        Map.Entry<String, Entry> e = it.next();
        if (e.getValue().dirty) {
          dirty.put(e.getKey(), e.getValue().uid);
        }
        it.remove();
      }
      store.putAll(dirty);
    }
  }
}
