package com.bulkload.zero;

import java.io.IOException;

/** Zero could not be reached. */
public class ZeroUnavailableException extends IOException {

  private static final long serialVersionUID = 1L;

  public ZeroUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
