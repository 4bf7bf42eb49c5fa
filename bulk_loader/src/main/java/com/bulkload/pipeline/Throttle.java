package com.bulkload.pipeline;

import com.bulkload.BulkLoadException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counting gate for fan-out: at most {@code max} tasks between
 * {@link #start()} and {@link #done}, and {@link #finish()} joins them all.
 *
 * <pre>
 * Throttle thr = new Throttle(n);
 * for (Task t : tasks) {
 *   thr.start();
 *   executor.execute(() -&gt; { ... thr.done(err); });
 * }
 * thr.finish();
 * </pre>
 */
public class Throttle {

  private final int max;
  private final Semaphore slots;
  private final AtomicReference<Throwable> firstError =
    new AtomicReference<>();

  public Throttle(int max) {
    if (max < 1) {
      throw new IllegalArgumentException("max must be >= 1: " + max);
    }
    this.max = max;
    this.slots = new Semaphore(max);
  }

  /** Blocks until a slot is free. */
  public void start() throws InterruptedException {
    slots.acquire();
  }

  /** Releases a slot taken by {@link #start()}; {@code err} may be null. */
  public void done(Throwable err) {
    if (err != null) {
      firstError.compareAndSet(null, err);
    }
    slots.release();
  }

  /**
   * Waits for every started task to call {@link #done}, then rethrows the
   * first reported error.
   */
  public void finish() throws InterruptedException {
    slots.acquire(max);
    slots.release(max);
    Throwable err = firstError.get();
    if (err != null) {
      throw BulkLoadException.wrap("throttled task failed", err);
    }
  }

  /** Slots currently free. */
  public int available() {
    return slots.availablePermits();
  }
}
