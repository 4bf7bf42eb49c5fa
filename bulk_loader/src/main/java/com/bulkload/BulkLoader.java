package com.bulkload;

import com.bulkload.chunker.NoInputFilesException;
import com.bulkload.zero.HttpZeroClient;
import com.bulkload.zero.ZeroClient;
import java.io.IOException;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk loader driver.
 *
 * PIPELINE:
 * - MAP: input files → chunks → N mappers → sorted map files per map shard
 * - REDUCE: map shards grouped per reduce shard → k-way merge → segments
 * - SCHEMA: written into every output store, which is then closed
 *
 * All settings come from the Configuration ({@code bulk-default.xml},
 * {@code -D key=value}, {@code -conf file.xml}); see {@link LoaderOptions}.
 *
 * OUTPUT:
 * - <bulk.out.dir>/<i>/p : segments, schema and _SUCCESS of reduce shard i
 */
public class BulkLoader extends Configured implements Tool {

  private static final Logger LOG = LoggerFactory.getLogger(BulkLoader.class);

  private final ZeroClient.Connector connector;

  public BulkLoader() {
    this(HttpZeroClient::connect);
  }

  public BulkLoader(ZeroClient.Connector connector) {
    this.connector = connector;
  }

  @Override
  public int run(String[] args) throws Exception {
    Configuration conf = getConf();
    LoaderOptions opts;
    try {
      opts = LoaderOptions.from(conf);
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid options: " + e.getMessage());
      printUsage();
      return 1;
    }
    FileSystem fs = FileSystem.getLocal(conf);

    System.out.println(
      "╔════════════════════════════════════════════════════╗"
    );
    System.out.println("║                    Bulk Loader                     ║");
    System.out.println(
      "╚════════════════════════════════════════════════════╝"
    );
    System.out.println(opts);

    if (!isEmptyOrMissing(fs, opts.getOutDir())) {
      System.err.println(
        "Output directory " + opts.getOutDir() + " exists and is not empty"
      );
      return 1;
    }
    Path tmp = opts.getTmpDir();
    if (opts.isSkipMapPhase()) {
      if (!fs.exists(opts.mapOutputDir())) {
        System.err.println(
          "Map phase skipped but no map output found under " + opts.mapOutputDir()
        );
        return 1;
      }
    } else {
      fs.delete(tmp, true);
      fs.mkdirs(tmp);
    }

    System.out.println("Connecting to zero at " + opts.getZeroAddr());
    long t0 = System.currentTimeMillis();
    try (
      ZeroClient zero = connector.connect(opts.getZeroAddr());
      Loader loader = new Loader(opts, conf, fs, zero)
    ) {
      if (!opts.isSkipMapPhase()) {
        System.out.println("\n━━━ MAP ━━━");
        loader.mapStage();
      }
      System.out.println("\n━━━ REDUCE ━━━");
      loader.reduceStage();
      loader.writeSchema();
      loader.cleanup();
    } catch (NoInputFilesException e) {
      System.out.println(e.getMessage());
      return 1;
    } catch (IOException | RuntimeException e) {
      LOG.error("Bulk load failed", e);
      System.err.println("Bulk load failed: " + e.getMessage());
      return 1;
    }

    if (opts.isCleanupTmp()) {
      fs.delete(tmp, true);
    }
    System.out.printf(
      "Done in %.1fs, output: %s%n",
      (System.currentTimeMillis() - t0) / 1000.0,
      opts.getOutDir()
    );
    return 0;
  }

  private static boolean isEmptyOrMissing(FileSystem fs, Path dir)
    throws IOException {
    if (!fs.exists(dir)) return true;
    FileStatus[] children = fs.listStatus(dir);
    return children.length == 0;
  }

  private static void printUsage() {
    System.err.println(
      "Usage: bulk -D " + LoaderOptions.SCHEMA_FILE + "=<file> " +
      "(-D " + LoaderOptions.RDF_DIR + "=<dir> | -D " +
      LoaderOptions.JSON_DIR + "=<dir>) [-D key=value ...]"
    );
    System.err.println("  Defaults and all keys: bulk-default.xml");
  }

  public static void main(String[] args) throws Exception {
    System.exit(ToolRunner.run(new BulkLoader(), args));
  }
}
