package com.bulkload.map;

import java.io.IOException;

/** A single record in a chunk could not be turned into edges. */
public class RecordParseException extends IOException {

  private static final long serialVersionUID = 1L;

  public RecordParseException(String message) {
    super(message);
  }

  public RecordParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
