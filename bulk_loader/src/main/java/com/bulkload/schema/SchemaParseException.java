package com.bulkload.schema;

import java.io.IOException;

/** The schema file is not valid. */
public class SchemaParseException extends IOException {

  private static final long serialVersionUID = 1L;

  public SchemaParseException(int line, String message) {
    super("schema line " + line + ": " + message);
  }
}
