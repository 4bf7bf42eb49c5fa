package com.bulkload;

import com.bulkload.LoaderMetrics.MapMetrics;
import com.bulkload.LoaderMetrics.ReduceMetrics;
import java.io.Closeable;
import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.mapreduce.Counter;
import org.apache.hadoop.mapreduce.Counters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run-wide counters plus a background reporter that logs throughput for the
 * current phase. Counters are safe to bump from any thread.
 */
public class Progress implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(Progress.class);

  public static final Duration REPORT_INTERVAL = Duration.ofSeconds(2);

  public enum Phase {
    NOTHING,
    MAP,
    REDUCE,
  }

  private final Counters counters = new Counters();
  private final long startNanos = System.nanoTime();

  private volatile Phase phase = Phase.NOTHING;
  private volatile long phaseStartNanos = startNanos;
  private ScheduledExecutorService reporter;

  public void increment(Enum<?> key, long n) {
    counters.findCounter(key).increment(n);
  }

  public long get(Enum<?> key) {
    return counters.findCounter(key).getValue();
  }

  public Phase getPhase() {
    return phase;
  }

  public void setPhase(Phase phase) {
    LOG.info("Entering {} phase", phase);
    this.phaseStartNanos = System.nanoTime();
    this.phase = phase;
  }

  /** Starts periodic logging; idempotent. */
  public synchronized void startReporting(Duration interval) {
    if (reporter != null) return;
    reporter = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "progress-reporter");
      t.setDaemon(true);
      return t;
    });
    long ms = interval.toMillis();
    reporter.scheduleAtFixedRate(this::report, ms, ms, TimeUnit.MILLISECONDS);
  }

  void report() {
    double secs = Math.max(1e-3, (System.nanoTime() - phaseStartNanos) / 1e9);
    switch (phase) {
      case MAP:
        long nquads = get(MapMetrics.NQUADS);
        LOG.info(
          "MAP {} nquads: {} ({}/s) chunks: {}/{} map entries: {}",
          elapsed(),
          nquads,
          (long) (nquads / secs),
          get(MapMetrics.CHUNKS_CONSUMED),
          get(MapMetrics.CHUNKS_PRODUCED),
          get(MapMetrics.MAP_ENTRIES)
        );
        break;
      case REDUCE:
        long keys = get(ReduceMetrics.REDUCE_KEYS);
        LOG.info(
          "REDUCE {} keys: {} ({}/s) segments: {}",
          elapsed(),
          keys,
          (long) (keys / secs),
          get(ReduceMetrics.SEGMENTS)
        );
        break;
      default:
        break;
    }
  }

  private String elapsed() {
    long s = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startNanos);
    return String.format("%02d:%02d:%02d", s / 3600, (s / 60) % 60, s % 60);
  }

  /** Prints every non-zero counter and the total run time. */
  public void printSummary(PrintStream out) {
    out.println("\n━━━ SUMMARY ━━━");
    printGroup(out, MapMetrics.values());
    printGroup(out, ReduceMetrics.values());
    out.printf(
      "Total: %.1fs%n",
      (System.nanoTime() - startNanos) / 1e9
    );
  }

  private void printGroup(PrintStream out, Enum<?>[] keys) {
    for (Enum<?> key : keys) {
      Counter c = counters.findCounter(key);
      if (c.getValue() != 0) {
        out.printf("  %-18s %,d%n", key.name(), c.getValue());
      }
    }
  }

  @Override
  public synchronized void close() {
    if (reporter != null) {
      reporter.shutdownNow();
      reporter = null;
    }
  }
}
