package com.bulkload.reduce;

import com.bulkload.LoaderMetrics.ReduceMetrics;
import com.bulkload.LoaderState;
import com.bulkload.Progress;
import com.bulkload.pipeline.BoundedQueue;
import com.bulkload.pipeline.Throttle;
import com.bulkload.pipeline.Workers;
import com.bulkload.posting.MapEntry;
import com.bulkload.posting.Posting;
import com.bulkload.posting.PostingList;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Terminal consumer of the reduce stage. Collapses each batch into one
 * posting list per key, versioned with the run's write timestamp, and writes
 * it as a segment of the batch's store. At most {@link #MAX_PENDING_WRITES}
 * segment writes are in flight.
 */
public class Reducer {

  public static final int MAX_PENDING_WRITES = 100;

  private final LoaderState state;
  private final Progress progress;
  private final BoundedQueue<ShuffleBatch> in;

  public Reducer(LoaderState state, BoundedQueue<ShuffleBatch> in) {
    this.state = state;
    this.progress = state.getProgress();
    this.in = in;
  }

  /** Returns once the queue is closed, drained and every write has landed. */
  public void run() throws IOException, InterruptedException {
    Throttle writes = new Throttle(MAX_PENDING_WRITES);
    ExecutorService writers = Executors.newCachedThreadPool(
      Workers.named("segment-writer")
    );
    Throwable primary = null;
    try {
      ShuffleBatch batch;
      while ((batch = in.take()) != null) {
        Segment seg = reduce(batch);
        writes.start();
        writers.execute(() -> {
          Throwable err = null;
          try {
            seg.write();
          } catch (Throwable t) {
            err = t;
            in.abort(t);
          } finally {
            writes.done(err);
          }
        });
      }
    } catch (Throwable t) {
      primary = t;
      in.abort(t);
      throw t;
    } finally {
      try {
        writes.finish();
      } catch (RuntimeException e) {
        if (primary == null) throw e;
        primary.addSuppressed(e);
      } finally {
        writers.shutdown();
      }
    }
  }

  /** One reduced batch, ready to be written. */
  static final class Segment {

    final ShuffleBatch batch;
    final List<byte[]> keys = new ArrayList<>();
    final List<PostingList> lists = new ArrayList<>();

    Segment(ShuffleBatch batch) {
      this.batch = batch;
    }

    void write() throws IOException {
      batch.getStore().writeSegment(batch.getSegmentId(), keys, lists);
    }
  }

  /**
   * Groups the sorted entries by key. Postings of a key come sorted by uid;
   * repeats of a uid are dropped, the first one wins.
   */
  Segment reduce(ShuffleBatch batch) {
    Segment seg = new Segment(batch);
    long version = state.getWriteTs();
    List<MapEntry> entries = batch.getEntries();
    long postings = 0;
    int i = 0;
    while (i < entries.size()) {
      byte[] key = entries.get(i).getKey();
      List<Posting> list = new ArrayList<>();
      long lastUid = 0;
      while (i < entries.size() && Arrays.equals(entries.get(i).getKey(), key)) {
        Posting p = entries.get(i).getPosting();
        if (list.isEmpty() || p.getUid() != lastUid) {
          list.add(p);
          lastUid = p.getUid();
        }
        i++;
      }
      seg.keys.add(key);
      seg.lists.add(new PostingList(version, list));
      postings += list.size();
    }
    progress.increment(ReduceMetrics.REDUCE_KEYS, seg.keys.size());
    progress.increment(ReduceMetrics.POSTINGS, postings);
    progress.increment(ReduceMetrics.SEGMENTS, 1);
    return seg;
  }
}
