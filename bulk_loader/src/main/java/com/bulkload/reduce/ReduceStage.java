package com.bulkload.reduce;

import com.bulkload.LoaderOptions;
import com.bulkload.LoaderState;
import com.bulkload.Progress;
import com.bulkload.pipeline.BoundedQueue;
import com.bulkload.pipeline.Workers;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduce stage orchestrator: opens one output store per reduce shard, runs
 * the {@link Shuffler} in the background and the {@link Reducer} in the
 * calling thread, joined by a bounded queue of batches.
 */
public class ReduceStage {

  private static final Logger LOG = LoggerFactory.getLogger(ReduceStage.class);

  static final int QUEUE_CAPACITY = 100;

  private final LoaderState state;

  public ReduceStage(LoaderState state) {
    this.state = state;
  }

  public void run() throws IOException, InterruptedException {
    state.getProgress().setPhase(Progress.Phase.REDUCE);
    LoaderOptions opts = state.getOptions();

    List<ShardStore> stores = new ArrayList<>();
    for (int i = 0; i < opts.getReduceShards(); i++) {
      ShardStore store = ShardStore.create(
        i,
        opts.shardOutputDir(i),
        state.getConf(),
        state.getWriteTs()
      );
      state.addStore(store);
      stores.add(store);
    }

    BoundedQueue<ShuffleBatch> queue = new BoundedQueue<>(QUEUE_CAPACITY);
    ExecutorService exec = Executors.newSingleThreadExecutor(
      Workers.named("shuffle")
    );
    try {
      Future<?> shuffled = exec.submit(() -> {
        new Shuffler(state, stores, queue).run();
        return null;
      });
      try {
        new Reducer(state, queue).run();
      } catch (IOException | RuntimeException e) {
        queue.abort(e); // recorded; rethrown below once the shuffler is joined
      }
      try {
        shuffled.get();
      } catch (ExecutionException e) {
        queue.abort(e.getCause());
      }
    } finally {
      exec.shutdownNow();
    }

    Throwable failure = queue.failure();
    if (failure != null) {
      throw Workers.rethrow(failure);
    }
    LOG.info("Reduce stage done: {} output stores", stores.size());
  }
}
