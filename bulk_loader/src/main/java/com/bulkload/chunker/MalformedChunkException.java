package com.bulkload.chunker;

import java.io.IOException;

/** Input whose array/object/string structure cannot be split into chunks. */
public class MalformedChunkException extends IOException {

  private static final long serialVersionUID = 1L;

  public MalformedChunkException(String message) {
    super(message);
  }
}
