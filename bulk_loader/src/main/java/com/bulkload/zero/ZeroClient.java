package com.bulkload.zero;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Client of zero, the cluster's timestamp and uid authority. Both calls
 * lease a contiguous block of {@code num} values.
 */
public interface ZeroClient extends Closeable {

  AssignedIds timestamps(long num, Duration timeout) throws IOException;

  AssignedIds assignUids(long num, Duration timeout) throws IOException;

  /** Opens a client for an address; failing to connect is final. */
  @FunctionalInterface
  interface Connector {
    ZeroClient connect(String addr) throws IOException;
  }
}
