package com.bulkload;

import static org.junit.jupiter.api.Assertions.*;

import com.bulkload.chunker.InputFormat;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LoaderOptions")
class LoaderOptionsTest {

  @TempDir
  Path tempDir;

  private Configuration conf() throws IOException {
    return TestStates.conf(tempDir, "name: string .");
  }

  @Nested
  @DisplayName("Defaults and derived paths")
  class DefaultTests {

    @Test
    @DisplayName("should read defaults from bulk-default.xml")
    void shouldUseDefaults() throws IOException {
      LoaderOptions opts = LoaderOptions.from(conf());

      assertEquals(InputFormat.RDF, opts.inputFormat());
      assertEquals(64L << 20, opts.mapBufferBytes());
      assertTrue(opts.isExpandEdges());
      assertFalse(opts.isStoreXids());
      assertFalse(opts.isIgnoreErrors());
      assertTrue(opts.isCleanupTmp());
      assertEquals(1, opts.getMapShards());
      assertEquals(1, opts.getReduceShards());
      assertEquals("localhost:6080", opts.getZeroAddr());
    }

    @Test
    @DisplayName("should lay out tmp and output directories")
    void shouldDerivePaths() throws IOException {
      LoaderOptions opts = LoaderOptions.from(conf());

      assertEquals("map_output", opts.mapOutputDir().getName());
      assertEquals(opts.getTmpDir(), opts.mapOutputDir().getParent());
      assertEquals("xids", opts.xidDir().getName());
      assertEquals("p", opts.shardOutputDir(3).getName());
      assertEquals("3", opts.shardOutputDir(3).getParent().getName());
      assertEquals(opts.getOutDir(), opts.shardOutputDir(3).getParent().getParent());
      assertEquals("file", opts.inputDir().toUri().getScheme());
    }

    @Test
    @DisplayName("should pick json when only the json directory is set")
    void shouldPickJson() throws IOException {
      Configuration conf = conf();
      conf.unset(LoaderOptions.RDF_DIR);
      conf.set(LoaderOptions.JSON_DIR, tempDir.toString());

      assertEquals(InputFormat.JSON, LoaderOptions.from(conf).inputFormat());
    }
  }

  @Nested
  @DisplayName("Validation")
  class ValidationTests {

    @Test
    @DisplayName("should require exactly one input directory")
    void shouldRequireOneInput() throws IOException {
      Configuration both = conf();
      both.set(LoaderOptions.JSON_DIR, tempDir.toString());
      Configuration none = conf();
      none.unset(LoaderOptions.RDF_DIR);

      assertThrows(IllegalArgumentException.class, () -> LoaderOptions.from(both));
      assertThrows(IllegalArgumentException.class, () -> LoaderOptions.from(none));
    }

    @Test
    @DisplayName("should require a schema file")
    void shouldRequireSchema() throws IOException {
      Configuration conf = conf();
      conf.unset(LoaderOptions.SCHEMA_FILE);

      assertThrows(IllegalArgumentException.class, () -> LoaderOptions.from(conf));
    }

    @Test
    @DisplayName("should reject non-positive counts")
    void shouldRejectZeroCounts() throws IOException {
      Configuration conf = conf();
      conf.setInt(LoaderOptions.NUM_WORKERS, 0);

      IllegalArgumentException e = assertThrows(
        IllegalArgumentException.class,
        () -> LoaderOptions.from(conf)
      );
      assertTrue(e.getMessage().contains(LoaderOptions.NUM_WORKERS));
    }

    @Test
    @DisplayName("should reject more reduce shards than map shards")
    void shouldRejectTooManyReduceShards() throws IOException {
      Configuration conf = conf();
      conf.setInt(LoaderOptions.MAP_SHARDS, 2);
      conf.setInt(LoaderOptions.REDUCE_SHARDS, 3);

      assertThrows(IllegalArgumentException.class, () -> LoaderOptions.from(conf));
    }
  }
}
