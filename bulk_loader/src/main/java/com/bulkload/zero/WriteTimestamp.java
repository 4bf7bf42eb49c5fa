package com.bulkload.zero;

import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains the single write timestamp every record of a run is stamped with.
 * Retries for as long as it takes: a load cannot start without it.
 */
public final class WriteTimestamp {

  private static final Logger LOG = LoggerFactory.getLogger(WriteTimestamp.class);

  public static final Duration ATTEMPT_TIMEOUT = Duration.ofSeconds(1);
  public static final Duration RETRY_BACKOFF = Duration.ofSeconds(1);

  private WriteTimestamp() {} // Utility class

  public static long obtain(ZeroClient zero) throws InterruptedException {
    return obtain(zero, RETRY_BACKOFF);
  }

  static long obtain(ZeroClient zero, Duration backoff)
    throws InterruptedException {
    while (true) {
      try {
        return zero.timestamps(1, ATTEMPT_TIMEOUT).getStartId();
      } catch (IOException e) {
        LOG.warn("Error communicating with zero, retrying: {}", e.getMessage());
      }
      Thread.sleep(backoff.toMillis());
    }
  }
}
