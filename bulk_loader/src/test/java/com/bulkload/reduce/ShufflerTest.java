package com.bulkload.reduce;

import static org.junit.jupiter.api.Assertions.*;

import com.bulkload.LoaderMetrics.ReduceMetrics;
import com.bulkload.LoaderState;
import com.bulkload.TestStates;
import com.bulkload.chunker.Chunk;
import com.bulkload.map.Mapper;
import com.bulkload.pipeline.BoundedQueue;
import com.bulkload.posting.MapEntry;
import com.bulkload.xidmap.XidMap;
import com.bulkload.xidmap.XidStore;
import com.bulkload.zero.FakeZeroClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.hadoop.fs.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Shuffler")
class ShufflerTest {

  @TempDir
  java.nio.file.Path tempDir;

  private static Shuffler.MapShard shard(String name, long bytes) {
    return new Shuffler.MapShard(new Path("/m/" + name), new ArrayList<>(), bytes);
  }

  private static List<String> names(List<Shuffler.MapShard> group) {
    List<String> out = new ArrayList<>();
    for (Shuffler.MapShard s : group) {
      out.add(s.dir.getName());
    }
    return out;
  }

  /** Runs two mappers over the same quads so every key shows up twice. */
  private LoaderState mapTwice(String rdf) throws IOException {
    LoaderState state = TestStates.state(
      TestStates.conf(tempDir, "friend: [uid] .\nname: string .\n")
    );
    try (
      XidMap xids = new XidMap(
        XidStore.open(tempDir.resolve("xids").toFile()),
        new FakeZeroClient(1)
      )
    ) {
      for (int i = 0; i < 2; i++) {
        Mapper m = new Mapper(state, xids);
        m.map(Chunk.of(rdf));
        m.close();
      }
    }
    return state;
  }

  private static List<ShuffleBatch> drain(BoundedQueue<ShuffleBatch> q)
    throws InterruptedException {
    List<ShuffleBatch> out = new ArrayList<>();
    ShuffleBatch b;
    while ((b = q.take()) != null) {
      out.add(b);
    }
    return out;
  }

  @Nested
  @DisplayName("Grouping")
  class GroupingTests {

    @Test
    @DisplayName("should put the biggest map shard on the lightest group")
    void shouldBalanceBySize() {
      List<List<Shuffler.MapShard>> groups = Shuffler.groupMapShards(
        List.of(shard("a", 100), shard("b", 50), shard("c", 40), shard("d", 30)),
        2
      );

      assertEquals(List.of("a"), names(groups.get(0)));
      assertEquals(List.of("b", "c", "d"), names(groups.get(1)));
    }

    @Test
    @DisplayName("should break ties towards the lowest group")
    void shouldBreakTiesLow() {
      List<List<Shuffler.MapShard>> groups = Shuffler.groupMapShards(
        List.of(shard("a", 10), shard("b", 10), shard("c", 10)),
        2
      );

      assertEquals(List.of("a", "c"), names(groups.get(0)));
      assertEquals(List.of("b"), names(groups.get(1)));
    }

    @Test
    @DisplayName("should leave extra groups empty")
    void shouldLeaveEmptyGroups() {
      List<List<Shuffler.MapShard>> groups = Shuffler.groupMapShards(
        List.of(shard("a", 10)),
        3
      );

      assertEquals(3, groups.size());
      assertTrue(groups.get(1).isEmpty());
      assertTrue(groups.get(2).isEmpty());
    }
  }

  @Nested
  @DisplayName("Listing")
  class ListingTests {

    @Test
    @DisplayName("should return nothing when map output is missing")
    void shouldHandleMissingOutput() throws IOException {
      LoaderState state = TestStates.state(TestStates.conf(tempDir, "name: string ."));
      Shuffler s = new Shuffler(state, List.of(), new BoundedQueue<>(1));

      assertTrue(s.listMapShards().isEmpty());
    }

    @Test
    @DisplayName("should only count map files")
    void shouldOnlyCountMapFiles() throws IOException {
      LoaderState state = mapTwice("<a> <name> \"x\" .\n");
      java.nio.file.Path shardDir = java.nio.file.Paths
        .get(state.getOptions().mapOutputDir().toUri())
        .resolve("000");
      Files.write(shardDir.resolve("notes.txt"), "x".getBytes(StandardCharsets.UTF_8));
      Files.write(shardDir.resolve(".hidden.map"), "x".getBytes(StandardCharsets.UTF_8));

      List<Shuffler.MapShard> shards =
        new Shuffler(state, List.of(), new BoundedQueue<>(1)).listMapShards();

      assertEquals(1, shards.size());
      assertEquals(2, shards.get(0).files.size());
      assertTrue(shards.get(0).bytes > 0);
    }
  }

  @Nested
  @DisplayName("Merging")
  class MergeTests {

    @Test
    @DisplayName("should merge map files in key order without splitting keys")
    void shouldMergeSorted() throws Exception {
      StringBuilder rdf = new StringBuilder();
      for (int i = 0; i < 40; i++) {
        rdf.append("<n").append(i).append("> <friend> <n").append(i + 1).append("> .\n");
        rdf.append("<n").append(i).append("> <name> \"v").append(i).append("\" .\n");
      }
      LoaderState state = mapTwice(rdf.toString());
      ShardStore store = ShardStore.create(
        0,
        state.getOptions().shardOutputDir(0),
        state.getConf(),
        TestStates.WRITE_TS
      );
      BoundedQueue<ShuffleBatch> q = new BoundedQueue<>(10_000);

      new Shuffler(state, List.of(store), q, 1).run();
      List<ShuffleBatch> batches = drain(q);

      int total = 0;
      MapEntry prev = null;
      for (int b = 0; b < batches.size(); b++) {
        ShuffleBatch batch = batches.get(b);
        assertEquals(b, batch.getSegmentId());
        assertSame(store, batch.getStore());
        List<MapEntry> entries = batch.getEntries();
        if (prev != null) {
          assertFalse(
            Arrays.equals(prev.getKey(), entries.get(0).getKey()),
            "key split across batches"
          );
        }
        for (MapEntry e : entries) {
          if (prev != null) {
            assertTrue(prev.compareTo(e) <= 0, "out of order");
          }
          prev = e;
        }
        total += entries.size();
      }
      // 40 edges, 40 names, 40 + 40 _predicate_ entries, each mapped twice
      assertEquals(320, total);
      assertEquals(batches.size(), state.getProgress().get(ReduceMetrics.BATCHES));
    }

    @Test
    @DisplayName("should emit everything in one batch under the default size")
    void shouldUseOneBatch() throws Exception {
      LoaderState state = mapTwice("<a> <name> \"x\" .\n<b> <name> \"y\" .\n");
      ShardStore store = ShardStore.create(
        0,
        state.getOptions().shardOutputDir(0),
        state.getConf(),
        TestStates.WRITE_TS
      );
      BoundedQueue<ShuffleBatch> q = new BoundedQueue<>(10);

      new Shuffler(state, List.of(store), q).run();
      List<ShuffleBatch> batches = drain(q);

      assertEquals(1, batches.size());
      assertEquals(8, batches.get(0).getEntries().size());
    }
  }
}
