package com.bulkload.chunker;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RdfChunker")
class RdfChunkerTest {

  private static List<Chunk> chunkAll(String input, int bufferSize)
    throws IOException {
    ChunkInput in = new ChunkInput(
      new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
      bufferSize
    );
    RdfChunker chunker = new RdfChunker();
    List<Chunk> chunks = new ArrayList<>();
    chunker.begin(in);
    while (true) {
      Chunk c = chunker.chunk(in);
      chunks.add(c);
      if (c.isEndOfStream()) break;
    }
    chunker.end(in);
    return chunks;
  }

  private static String concat(List<Chunk> chunks) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (Chunk c : chunks) {
      out.write(c.data(), 0, c.length());
    }
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private static String lines(int n) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < n; i++) {
      sb.append("<s").append(i).append("> <p> \"v").append(i).append("\" .\n");
    }
    return sb.toString();
  }

  @Nested
  @DisplayName("Reassembly")
  class ReassemblyTests {

    @Test
    @DisplayName("should reproduce the input byte for byte")
    void shouldReproduceInput() throws IOException {
      String input = lines(50) + "<last> <p> \"no newline\" .";
      assertEquals(input, concat(chunkAll(input, 64)));
    }

    @Test
    @DisplayName("should reproduce multi-byte UTF-8 input across small windows")
    void shouldReproduceUtf8() throws IOException {
      String input = "<a> <name> \"Zoë ünïcödé 名前\" .\n<b> <name> \"ß\" .\n";
      assertEquals(input, concat(chunkAll(input, 16)));
    }

    @Test
    @DisplayName("should signal end of stream on empty input")
    void shouldHandleEmptyInput() throws IOException {
      List<Chunk> chunks = chunkAll("", 16);
      assertEquals(1, chunks.size());
      assertTrue(chunks.get(0).isEmpty());
      assertTrue(chunks.get(0).isEndOfStream());
    }
  }

  @Nested
  @DisplayName("Line boundaries")
  class LineBoundaryTests {

    @Test
    @DisplayName("should end every non-final chunk with a newline")
    void shouldNotSplitLines() throws IOException {
      String input = lines(RdfChunker.LINES_PER_CHUNK * 2 + 7);
      List<Chunk> chunks = chunkAll(input, 32);
      for (int i = 0; i < chunks.size() - 1; i++) {
        Chunk c = chunks.get(i);
        assertEquals('\n', c.data()[c.length() - 1], "chunk " + i);
      }
      assertEquals(input, concat(chunks));
    }

    @Test
    @DisplayName("should keep a line longer than the read window whole")
    void shouldKeepLongLineWhole() throws IOException {
      StringBuilder longValue = new StringBuilder();
      for (int i = 0; i < 500; i++) longValue.append('x');
      String longLine = "<s> <p> \"" + longValue + "\" .\n";
      String input = "<a> <p> \"1\" .\n" + longLine + "<b> <p> \"2\" .\n";

      List<Chunk> chunks = chunkAll(input, 16);

      assertEquals(input, concat(chunks));
      assertTrue(chunks.get(0).utf8().contains(longLine));
    }

    @Test
    @DisplayName("should cut a new chunk after the line-count threshold")
    void shouldCutAtThreshold() throws IOException {
      List<Chunk> chunks = chunkAll(lines(RdfChunker.LINES_PER_CHUNK + 1), 1 << 16);

      assertEquals(2, chunks.size());
      assertFalse(chunks.get(0).isEndOfStream());
      assertTrue(chunks.get(1).isEndOfStream());
      assertEquals(
        RdfChunker.LINES_PER_CHUNK,
        chunks.get(0).utf8().split("\n").length
      );
      assertEquals("<s100000> <p> \"v100000\" .\n", chunks.get(1).utf8());
    }

    @Test
    @DisplayName("should return an empty final chunk on an exact multiple")
    void shouldReturnEmptyFinalChunk() throws IOException {
      List<Chunk> chunks = chunkAll(lines(RdfChunker.LINES_PER_CHUNK), 1 << 16);

      assertEquals(2, chunks.size());
      assertTrue(chunks.get(1).isEmpty());
      assertTrue(chunks.get(1).isEndOfStream());
    }
  }
}
