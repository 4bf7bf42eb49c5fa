package com.bulkload.map;

import com.bulkload.BulkLoadException;
import com.bulkload.LoaderMetrics.MapMetrics;
import com.bulkload.LoaderOptions;
import com.bulkload.LoaderState;
import com.bulkload.Progress;
import com.bulkload.chunker.Chunk;
import com.bulkload.chunker.ChunkInput;
import com.bulkload.chunker.Chunker;
import com.bulkload.chunker.InputFiles;
import com.bulkload.chunker.InputFormat;
import com.bulkload.chunker.NoInputFilesException;
import com.bulkload.pipeline.BoundedQueue;
import com.bulkload.pipeline.Throttle;
import com.bulkload.pipeline.Workers;
import com.bulkload.xidmap.XidMap;
import com.bulkload.xidmap.XidStore;
import com.bulkload.zero.ZeroClient;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map stage orchestrator.
 *
 * <pre>
 *   files ──reader (≤ N at once)──► queue(N) ──► N mapper workers ──► map_output
 * </pre>
 *
 * Readers run one chunker per file and push every non-empty chunk onto the
 * shared queue. Once every reader has finished, the queue is closed; that is
 * the only signal the workers stop on. The xid store lives exactly as long
 * as this stage and is evicted and closed on every exit path.
 *
 * Any reader or worker failure aborts the queue, which wakes every blocked
 * thread; all threads are joined before the first failure is rethrown.
 */
public class MapStage {

  private static final Logger LOG = LoggerFactory.getLogger(MapStage.class);

  private final LoaderState state;
  private final LoaderOptions opts;
  private final Progress progress;
  private final ZeroClient zero;
  private final MapperFactory mapperFactory;

  public MapStage(LoaderState state, ZeroClient zero) {
    this(state, zero, Mapper::new);
  }

  MapStage(LoaderState state, ZeroClient zero, MapperFactory mapperFactory) {
    this.state = state;
    this.opts = state.getOptions();
    this.progress = state.getProgress();
    this.zero = zero;
    this.mapperFactory = mapperFactory;
  }

  public void run() throws IOException, InterruptedException {
    progress.setPhase(Progress.Phase.MAP);
    File xidDir = new File(opts.xidDir().toUri().getPath());
    try (XidMap xids = new XidMap(XidStore.open(xidDir), zero)) {
      mapFiles(xids);
    } finally {
      // xid cache can hold a large share of the heap; reclaim before reduce
      System.gc();
    }
  }

  private void mapFiles(XidMap xids) throws IOException, InterruptedException {
    InputFormat format = opts.inputFormat();
    List<Path> files = InputFiles.find(
      state.getFs(),
      opts.inputDir(),
      format.extension()
    );
    if (files.isEmpty()) {
      throw new NoInputFilesException(format.extension(), opts.inputDir());
    }

    int n = opts.getNumWorkers();
    BoundedQueue<Chunk> queue = new BoundedQueue<>(n);
    ExecutorService workers = Executors.newFixedThreadPool(
      n,
      Workers.named("mapper")
    );
    ExecutorService readers = Executors.newCachedThreadPool(
      Workers.named("reader")
    );
    try {
      List<Future<?>> running = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        ChunkMapper mapper = mapperFactory.create(state, xids);
        running.add(
          workers.submit(() -> {
            runWorker(mapper, queue);
            return null;
          })
        );
      }

      // Main map loop
      Throttle thr = new Throttle(n);
      int fileCount = 0;
      for (Path file : files) {
        if (queue.isAborted()) break;
        thr.start();
        fileCount++;
        LOG.info(
          "Processing file ({} out of {}): {}",
          fileCount,
          files.size(),
          file
        );
        readers.execute(() -> {
          Throwable err = null;
          try {
            readFile(format.newChunker(), file, queue);
          } catch (Throwable t) {
            err = t;
            queue.abort(t);
          } finally {
            thr.done(err);
          }
        });
      }
      try {
        thr.finish();
      } catch (BulkLoadException e) {
        queue.abort(e); // keeps the reader's own cause if it got there first
      }

      if (!queue.isAborted()) {
        queue.close();
      }
      for (Future<?> f : running) {
        try {
          f.get();
        } catch (ExecutionException e) {
          queue.abort(e.getCause());
        }
      }
    } finally {
      readers.shutdownNow();
      workers.shutdownNow();
    }

    Throwable failure = queue.failure();
    if (failure != null) {
      throw Workers.rethrow(failure);
    }
    LOG.info(
      "Map stage done: {} chunks from {} files",
      progress.get(MapMetrics.CHUNKS_CONSUMED),
      files.size()
    );
  }

  private void readFile(Chunker chunker, Path file, BoundedQueue<Chunk> queue)
    throws IOException, InterruptedException {
    try (InputStream raw = InputFiles.open(state.getFs(), file, state.getConf())) {
      ChunkInput in = new ChunkInput(raw);
      chunker.begin(in);
      while (true) {
        Chunk chunk = chunker.chunk(in);
        if (!chunk.isEmpty()) {
          queue.put(chunk);
          progress.increment(MapMetrics.CHUNKS_PRODUCED, 1);
        }
        if (chunk.isEndOfStream()) break;
      }
      chunker.end(in);
    } catch (IOException e) {
      LOG.error("Error reading {}: {}", file, e.getMessage());
      throw e;
    }
    progress.increment(MapMetrics.FILES_READ, 1);
  }

  private void runWorker(ChunkMapper mapper, BoundedQueue<Chunk> queue)
    throws IOException, InterruptedException {
    try {
      Chunk chunk;
      while ((chunk = queue.take()) != null) {
        progress.increment(MapMetrics.CHUNKS_CONSUMED, 1);
        mapper.map(chunk);
      }
      mapper.close();
    } catch (Throwable t) {
      queue.abort(t);
      throw t;
    }
  }
}
