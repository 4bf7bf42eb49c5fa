package com.bulkload.reduce;

import com.bulkload.LoaderMetrics.ReduceMetrics;
import com.bulkload.LoaderState;
import com.bulkload.map.Mapper;
import com.bulkload.pipeline.BoundedQueue;
import com.bulkload.pipeline.Throttle;
import com.bulkload.pipeline.Workers;
import com.bulkload.posting.MapEntry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.SequenceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the sorted map files into {@link ShuffleBatch}es, one reduce shard
 * at a time per shuffler slot.
 *
 * Map shards are first grouped into reduce shards, largest first onto the
 * currently lightest reduce shard. Each group is k-way merged; a batch is cut
 * once it passes the size threshold, but only where the key changes, so
 * every key ends up in exactly one segment.
 */
public class Shuffler {

  private static final Logger LOG = LoggerFactory.getLogger(Shuffler.class);

  /** Soft size of one batch, in estimated heap bytes. */
  public static final long DEFAULT_BATCH_BYTES = 32L << 20;

  private final LoaderState state;
  private final List<ShardStore> stores;
  private final BoundedQueue<ShuffleBatch> out;
  private final long batchBytes;

  public Shuffler(
    LoaderState state,
    List<ShardStore> stores,
    BoundedQueue<ShuffleBatch> out
  ) {
    this(state, stores, out, DEFAULT_BATCH_BYTES);
  }

  Shuffler(
    LoaderState state,
    List<ShardStore> stores,
    BoundedQueue<ShuffleBatch> out,
    long batchBytes
  ) {
    this.state = state;
    this.stores = stores;
    this.out = out;
    this.batchBytes = batchBytes;
  }

  /** Shuffles every reduce shard, then closes the output queue. */
  public void run() throws IOException, InterruptedException {
    try {
      List<List<MapShard>> groups = groupMapShards(
        listMapShards(),
        stores.size()
      );
      Throttle thr = new Throttle(state.getOptions().getNumShufflers());
      ExecutorService exec = Executors.newCachedThreadPool(
        Workers.named("shuffler")
      );
      try {
        for (int i = 0; i < groups.size(); i++) {
          if (out.isAborted()) break;
          List<MapShard> group = groups.get(i);
          ShardStore store = stores.get(i);
          thr.start();
          exec.execute(() -> {
            Throwable err = null;
            try {
              shuffle(group, store);
            } catch (Throwable t) {
              err = t;
              out.abort(t);
            } finally {
              thr.done(err);
            }
          });
        }
        thr.finish();
      } finally {
        exec.shutdownNow();
      }
      out.close();
    } catch (Throwable t) {
      out.abort(t);
      throw t;
    }
  }

  // ==================== GROUPING ====================

  /** Map output directory of one map shard and its total size. */
  static final class MapShard {

    final Path dir;
    final List<Path> files;
    final long bytes;

    MapShard(Path dir, List<Path> files, long bytes) {
      this.dir = dir;
      this.files = files;
      this.bytes = bytes;
    }

    @Override
    public String toString() {
      return dir.getName() + "(" + bytes + "B)";
    }
  }

  List<MapShard> listMapShards() throws IOException {
    FileSystem fs = state.getFs();
    Path root = state.getOptions().mapOutputDir();
    List<MapShard> shards = new ArrayList<>();
    if (!fs.exists(root)) {
      LOG.warn("No map output under {}", root);
      return shards;
    }
    for (FileStatus shardDir : fs.listStatus(root)) {
      if (!shardDir.isDirectory()) continue;
      List<Path> files = new ArrayList<>();
      long bytes = 0;
      for (FileStatus f : fs.listStatus(shardDir.getPath())) {
        String name = f.getPath().getName();
        boolean mapFile =
          !name.startsWith(".") && name.endsWith(Mapper.MAP_FILE_SUFFIX);
        if (f.isFile() && mapFile) {
          files.add(f.getPath());
          bytes += f.getLen();
        }
      }
      files.sort(Comparator.comparing(Path::getName));
      shards.add(new MapShard(shardDir.getPath(), files, bytes));
    }
    shards.sort(Comparator.comparing(s -> s.dir.getName()));
    return shards;
  }

  /**
   * Assigns map shards to {@code numReduce} groups: biggest map shard first,
   * each onto the group with the fewest bytes so far (lowest index on ties).
   */
  static List<List<MapShard>> groupMapShards(
    List<MapShard> shards,
    int numReduce
  ) {
    List<MapShard> bySize = new ArrayList<>(shards);
    bySize.sort((a, b) -> Long.compare(b.bytes, a.bytes));
    List<List<MapShard>> groups = new ArrayList<>(numReduce);
    long[] load = new long[numReduce];
    for (int i = 0; i < numReduce; i++) {
      groups.add(new ArrayList<>());
    }
    for (MapShard s : bySize) {
      int lightest = 0;
      for (int i = 1; i < numReduce; i++) {
        if (load[i] < load[lightest]) lightest = i;
      }
      groups.get(lightest).add(s);
      load[lightest] += s.bytes;
    }
    return groups;
  }

  // ==================== MERGE ====================

  /** Head of one map file in the merge. */
  private static final class Cursor {

    final SequenceFile.Reader reader;
    MapEntry head;

    Cursor(SequenceFile.Reader reader) {
      this.reader = reader;
    }

    boolean advance() throws IOException {
      MapEntry e = new MapEntry();
      if (reader.next(e)) {
        head = e;
        return true;
      }
      return false;
    }
  }

  private void shuffle(List<MapShard> group, ShardStore store)
    throws IOException, InterruptedException {
    Configuration conf = state.getConf();
    List<Cursor> cursors = new ArrayList<>();
    PriorityQueue<Cursor> heap = new PriorityQueue<>(
      Math.max(1, group.size()),
      (a, b) -> a.head.compareTo(b.head)
    );
    try {
      for (MapShard shard : group) {
        for (Path file : shard.files) {
          Cursor c = new Cursor(
            new SequenceFile.Reader(conf, SequenceFile.Reader.file(file))
          );
          cursors.add(c);
          if (c.advance()) heap.add(c);
        }
      }
      LOG.info(
        "Shuffling {} map files of {} into {}",
        cursors.size(),
        group,
        store
      );

      List<MapEntry> batch = new ArrayList<>();
      long size = 0;
      byte[] prevKey = null;
      while (!heap.isEmpty()) {
        Cursor c = heap.poll();
        MapEntry e = c.head;
        if (size >= batchBytes && !Arrays.equals(prevKey, e.getKey())) {
          emit(store, batch);
          batch = new ArrayList<>();
          size = 0;
        }
        batch.add(e);
        size += e.estimatedSize();
        prevKey = e.getKey();
        if (c.advance()) heap.add(c);
      }
      if (!batch.isEmpty()) {
        emit(store, batch);
      }
    } finally {
      for (Cursor c : cursors) {
        c.reader.close();
      }
    }
  }

  private void emit(ShardStore store, List<MapEntry> batch)
    throws InterruptedException {
    out.put(new ShuffleBatch(store, store.nextSegmentId(), batch));
    state.getProgress().increment(ReduceMetrics.BATCHES, 1);
  }
}
