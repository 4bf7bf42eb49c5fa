package com.bulkload.map;

import static org.junit.jupiter.api.Assertions.*;

import com.bulkload.LoaderMetrics.MapMetrics;
import com.bulkload.LoaderOptions;
import com.bulkload.LoaderState;
import com.bulkload.Progress;
import com.bulkload.TestStates;
import com.bulkload.chunker.Chunk;
import com.bulkload.chunker.MalformedChunkException;
import com.bulkload.chunker.NoInputFilesException;
import com.bulkload.xidmap.XidMap;
import com.bulkload.zero.FakeZeroClient;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPOutputStream;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("MapStage")
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class MapStageTest {

  private static final String SCHEMA = "name: string @index(exact) .\n";

  @TempDir
  Path tempDir;

  @BeforeEach
  void setUp() throws IOException {
    Files.createDirectories(tempDir.resolve("in"));
  }

  /** Counts what the stage hands to its mappers. */
  private static class CountingFactory implements MapperFactory {

    final AtomicInteger created = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();
    final AtomicInteger chunks = new AtomicInteger();
    final AtomicInteger lines = new AtomicInteger();
    volatile String failOn;

    @Override
    public ChunkMapper create(LoaderState state, XidMap xids) {
      created.incrementAndGet();
      return new ChunkMapper() {
        @Override
        public void map(Chunk chunk) throws IOException {
          String text = chunk.utf8();
          if (failOn != null && text.contains(failOn)) {
            throw new IOException("cannot map " + failOn);
          }
          chunks.incrementAndGet();
          lines.addAndGet(text.split("\n").length);
        }

        @Override
        public void close() {
          closed.incrementAndGet();
        }
      };
    }
  }

  private void writeRdf(String name, int lines) throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines; i++) {
      sb.append("<n").append(i).append("> <name> \"").append(name).append("\" .\n");
    }
    Files.write(
      tempDir.resolve("in").resolve(name),
      sb.toString().getBytes(StandardCharsets.UTF_8)
    );
  }

  @Nested
  @DisplayName("Scheduling")
  class SchedulingTests {

    @Test
    @DisplayName("should consume every chunk it produces")
    void shouldConsumeAllChunks() throws Exception {
      Configuration conf = TestStates.conf(tempDir, SCHEMA);
      conf.setInt(LoaderOptions.NUM_WORKERS, 3);
      for (int i = 0; i < 7; i++) {
        writeRdf("f" + i + ".rdf", 20);
      }
      LoaderState state = TestStates.state(conf);
      CountingFactory factory = new CountingFactory();

      new MapStage(state, new FakeZeroClient(1), factory).run();

      Progress progress = state.getProgress();
      assertEquals(3, factory.created.get());
      assertEquals(3, factory.closed.get());
      assertEquals(7, progress.get(MapMetrics.FILES_READ));
      assertEquals(
        progress.get(MapMetrics.CHUNKS_PRODUCED),
        progress.get(MapMetrics.CHUNKS_CONSUMED)
      );
      assertEquals(progress.get(MapMetrics.CHUNKS_PRODUCED), factory.chunks.get());
      assertEquals(140, factory.lines.get());
    }

    @Test
    @DisplayName("should fail before starting mappers when there is no input")
    void shouldFailWithoutInput() throws IOException {
      Files.write(tempDir.resolve("notes.txt"), new byte[] { 'x' });
      LoaderState state = TestStates.state(TestStates.conf(tempDir, SCHEMA));
      CountingFactory factory = new CountingFactory();

      assertThrows(
        NoInputFilesException.class,
        () -> new MapStage(state, new FakeZeroClient(1), factory).run()
      );
      assertEquals(0, factory.created.get());
    }

    @Test
    @DisplayName("should read gzipped input")
    void shouldReadGzip() throws Exception {
      try (
        OutputStream out = new GZIPOutputStream(
          Files.newOutputStream(tempDir.resolve("in").resolve("g.rdf.gz"))
        )
      ) {
        out.write(
          "<a> <name> \"x\" .\n<b> <name> \"y\" .\n".getBytes(StandardCharsets.UTF_8)
        );
      }
      LoaderState state = TestStates.state(TestStates.conf(tempDir, SCHEMA));
      CountingFactory factory = new CountingFactory();

      new MapStage(state, new FakeZeroClient(1), factory).run();

      assertEquals(2, factory.lines.get());
    }
  }

  @Nested
  @DisplayName("Failures")
  class FailureTests {

    @Test
    @DisplayName("should spill and close the xid store when a mapper fails")
    void shouldCloseXidStoreOnFailure() throws Exception {
      writeRdf("a.rdf", 3);
      LoaderState state = TestStates.state(TestStates.conf(tempDir, SCHEMA));
      AtomicReference<XidMap> seen = new AtomicReference<>();
      MapperFactory factory = (s, xids) -> {
        seen.set(xids);
        return new ChunkMapper() {
          @Override
          public void map(Chunk chunk) throws IOException {
            for (int i = 0; i < 10; i++) {
              xids.assignUid("node-" + i);
            }
            throw new IOException("mapper broke");
          }

          @Override
          public void close() {}
        };
      };

      IOException e = assertThrows(
        IOException.class,
        () -> new MapStage(state, new FakeZeroClient(1), factory).run()
      );
      assertEquals("mapper broke", e.getMessage());

      XidMap xids = seen.get();
      assertEquals(0, xids.cachedSize());
      assertThrows(IOException.class, () -> xids.assignUid("late"));

      Path db = tempDir.resolve("tmp").resolve("xids").resolve("xids.db");
      try (
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + db);
        Statement stmt = conn.createStatement();
        ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM xids")
      ) {
        assertTrue(rs.next());
        assertEquals(10, rs.getLong(1));
      }
    }

    @Test
    @DisplayName("should propagate a mapper failure and stop")
    void shouldPropagateMapperFailure() throws IOException {
      Configuration conf = TestStates.conf(tempDir, SCHEMA);
      for (int i = 0; i < 5; i++) {
        writeRdf("f" + i + ".rdf", 10);
      }
      LoaderState state = TestStates.state(conf);
      CountingFactory factory = new CountingFactory();
      factory.failOn = "f3.rdf";

      IOException e = assertThrows(
        IOException.class,
        () -> new MapStage(state, new FakeZeroClient(1), factory).run()
      );
      assertEquals("cannot map f3.rdf", e.getMessage());
    }

    @Test
    @DisplayName("should propagate malformed input")
    void shouldPropagateMalformedInput() throws IOException {
      Configuration conf = TestStates.conf(tempDir, SCHEMA);
      conf.unset(LoaderOptions.RDF_DIR);
      conf.set(LoaderOptions.JSON_DIR, tempDir.resolve("in").toString());
      Files.write(
        tempDir.resolve("in").resolve("bad.json"),
        "[{\"name\": \"a\"} ; ]".getBytes(StandardCharsets.UTF_8)
      );
      LoaderState state = TestStates.state(conf);

      assertThrows(
        MalformedChunkException.class,
        () -> new MapStage(state, new FakeZeroClient(1), new CountingFactory()).run()
      );
    }

    @Test
    @DisplayName("should propagate bad records from the real mapper")
    void shouldPropagateBadRecords() throws IOException {
      Files.write(
        tempDir.resolve("in").resolve("bad.rdf"),
        "<a> <name> \"ok\" .\n<a> <name> <b> .\n".getBytes(StandardCharsets.UTF_8)
      );
      LoaderState state = TestStates.state(TestStates.conf(tempDir, SCHEMA));

      assertThrows(
        RecordParseException.class,
        () -> new MapStage(state, new FakeZeroClient(1)).run()
      );
    }
  }

  @Test
  @DisplayName("should write map output with the real mapper")
  void shouldWriteMapOutput() throws Exception {
    writeRdf("a.rdf", 10);
    writeRdf("b.rdf", 10);
    LoaderState state = TestStates.state(TestStates.conf(tempDir, SCHEMA));

    new MapStage(state, new FakeZeroClient(1)).run();

    assertFalse(MapOutput.files(state).isEmpty());
    // per quad: data, exact index, _predicate_
    assertEquals(60, MapOutput.readAll(state).size());
    assertTrue(Files.exists(tempDir.resolve("tmp").resolve("xids")));
  }
}
