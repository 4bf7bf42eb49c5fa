package com.bulkload;

/**
 * Fatal failure of a load. There is no partial success: once raised the run
 * stops.
 */
public class BulkLoadException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public BulkLoadException(String message) {
    super(message);
  }

  public BulkLoadException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns {@code t} itself if already a BulkLoadException, else wraps it. */
  public static BulkLoadException wrap(String message, Throwable t) {
    if (t instanceof BulkLoadException) {
      return (BulkLoadException) t;
    }
    return new BulkLoadException(message + ": " + t, t);
  }
}
