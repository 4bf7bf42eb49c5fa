package com.bulkload.chunker;

import static org.junit.jupiter.api.Assertions.*;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("InputFiles")
class InputFilesTest {

  @TempDir
  Path tmp;

  private Configuration conf;
  private FileSystem fs;

  @BeforeEach
  void setUp() throws IOException {
    conf = new Configuration();
    fs = FileSystem.getLocal(conf);
  }

  private static void write(Path p, String text) throws IOException {
    Files.createDirectories(p.getParent());
    Files.write(p, text.getBytes(StandardCharsets.UTF_8));
  }

  private static void writeGzip(Path p, String text) throws IOException {
    Files.createDirectories(p.getParent());
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(p))) {
      out.write(text.getBytes(StandardCharsets.UTF_8));
    }
  }

  private static org.apache.hadoop.fs.Path hpath(Path p) {
    return new org.apache.hadoop.fs.Path(p.toUri());
  }

  @Test
  @DisplayName("should find plain and gzipped files recursively, sorted")
  void shouldFindFilesRecursively() throws IOException {
    write(tmp.resolve("b.rdf"), "x");
    writeGzip(tmp.resolve("sub/a.rdf.gz"), "x");
    write(tmp.resolve("sub/deeper/c.rdf"), "x");
    write(tmp.resolve("notes.txt"), "x");
    write(tmp.resolve("d.json"), "x");

    List<org.apache.hadoop.fs.Path> files = InputFiles.find(
      fs,
      hpath(tmp),
      InputFormat.RDF.extension()
    );

    assertEquals(3, files.size());
    assertEquals("b.rdf", files.get(0).getName());
    assertEquals("a.rdf.gz", files.get(1).getName());
    assertEquals("c.rdf", files.get(2).getName());
  }

  @Test
  @DisplayName("should return nothing when no file matches")
  void shouldReturnEmptyList() throws IOException {
    write(tmp.resolve("a.json"), "[]");
    assertTrue(InputFiles.find(fs, hpath(tmp), ".rdf").isEmpty());
  }

  @Test
  @DisplayName("should fail on a missing directory")
  void shouldFailOnMissingDir() {
    assertThrows(
      FileNotFoundException.class,
      () -> InputFiles.find(fs, hpath(tmp.resolve("missing")), ".rdf")
    );
  }

  @Test
  @DisplayName("should decompress by file name only")
  void shouldDecompressBySuffix() throws IOException {
    writeGzip(tmp.resolve("a.rdf.gz"), "<a> <b> <c> .\n");
    write(tmp.resolve("b.rdf"), "<d> <e> <f> .\n");

    try (InputStream in = InputFiles.open(fs, hpath(tmp.resolve("a.rdf.gz")), conf)) {
      assertEquals("<a> <b> <c> .\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
    try (InputStream in = InputFiles.open(fs, hpath(tmp.resolve("b.rdf")), conf)) {
      assertEquals("<d> <e> <f> .\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  @Test
  @DisplayName("should match extensions with and without .gz")
  void shouldMatchExtensions() {
    assertTrue(InputFiles.matches("x.rdf", ".rdf"));
    assertTrue(InputFiles.matches("x.rdf.gz", ".rdf"));
    assertFalse(InputFiles.matches("x.rdf.bz2", ".rdf"));
    assertFalse(InputFiles.matches("x.json", ".rdf"));
  }
}
