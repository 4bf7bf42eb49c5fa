package com.bulkload.chunker;

import java.io.IOException;
import org.apache.hadoop.fs.Path;

/** Discovery found no file with the expected extension. */
public class NoInputFilesException extends IOException {

  private static final long serialVersionUID = 1L;

  public NoInputFilesException(String ext, Path dir) {
    super("No *" + ext + " files found in " + dir + ".");
  }
}
