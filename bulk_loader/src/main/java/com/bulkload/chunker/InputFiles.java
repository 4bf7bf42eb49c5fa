package com.bulkload.chunker;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.LocatedFileStatus;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RemoteIterator;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.CompressionCodecFactory;

/**
 * Input discovery and opening.
 *
 * Compression is decided from the file name only; content is never sniffed.
 */
public final class InputFiles {

  public static final String GZIP_SUFFIX = ".gz";

  private InputFiles() {} // Utility class

  /**
   * Recursively lists files under {@code dir} named {@code *<ext>} or
   * {@code *<ext>.gz}, sorted by path.
   */
  public static List<Path> find(FileSystem fs, Path dir, String ext)
    throws IOException {
    if (!fs.exists(dir)) {
      throw new FileNotFoundException("input directory not found: " + dir);
    }
    List<Path> files = new ArrayList<>();
    RemoteIterator<LocatedFileStatus> it = fs.listFiles(dir, true);
    while (it.hasNext()) {
      Path p = it.next().getPath();
      if (matches(p.getName(), ext)) {
        files.add(p);
      }
    }
    Collections.sort(files);
    return files;
  }

  static boolean matches(String name, String ext) {
    return name.endsWith(ext) || name.endsWith(ext + GZIP_SUFFIX);
  }

  /** Opens {@code file}, decompressing when its suffix names a codec. */
  public static InputStream open(FileSystem fs, Path file, Configuration conf)
    throws IOException {
    InputStream raw = fs.open(file);
    CompressionCodec codec = new CompressionCodecFactory(conf).getCodec(file);
    if (codec == null) {
      return raw;
    }
    try {
      return codec.createInputStream(raw);
    } catch (IOException e) {
      raw.close();
      throw new IOException("could not create " + codec.getDefaultExtension() +
        " reader for file " + file, e);
    }
  }
}
