package com.bulkload.pipeline;

import com.bulkload.BulkLoadException;
import java.io.IOException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Thread naming and failure propagation shared by the stage orchestrators. */
public final class Workers {

  private Workers() {} // Utility class

  /** Daemon threads named {@code prefix-0}, {@code prefix-1}, ... */
  public static ThreadFactory named(String prefix) {
    AtomicInteger ids = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + ids.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  /**
   * Rethrows a failure collected from another thread, keeping its type when
   * it is unchecked or an IOException. Never returns normally; the return
   * type lets callers write {@code throw rethrow(t)}.
   */
  public static IOException rethrow(Throwable t) throws IOException {
    if (t instanceof IOException) throw (IOException) t;
    if (t instanceof RuntimeException) throw (RuntimeException) t;
    if (t instanceof Error) throw (Error) t;
    throw new BulkLoadException("stage failed", t);
  }
}
