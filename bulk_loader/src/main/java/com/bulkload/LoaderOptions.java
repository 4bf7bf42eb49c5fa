package com.bulkload;

import com.bulkload.chunker.InputFormat;
import java.io.IOException;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

/**
 * Immutable snapshot of the run parameters, read once from the
 * {@link Configuration} at startup.
 */
public final class LoaderOptions {

  // ==================== CONFIGURATION KEYS ====================

  public static final String RDF_DIR = "bulk.rdf.dir";
  public static final String JSON_DIR = "bulk.json.dir";
  public static final String SCHEMA_FILE = "bulk.schema.file";
  public static final String OUT_DIR = "bulk.out.dir";
  public static final String TMP_DIR = "bulk.tmp.dir";
  public static final String NUM_WORKERS = "bulk.num.workers";
  public static final String MAP_BUFFER_MB = "bulk.map.buffer.mb";
  public static final String EXPAND_EDGES = "bulk.expand.edges";
  public static final String SKIP_MAP_PHASE = "bulk.skip.map.phase";
  public static final String CLEANUP_TMP = "bulk.cleanup.tmp";
  public static final String NUM_SHUFFLERS = "bulk.num.shufflers";
  public static final String STORE_XIDS = "bulk.store.xids";
  public static final String ZERO_ADDR = "bulk.zero.addr";
  public static final String IGNORE_ERRORS = "bulk.ignore.errors";
  public static final String MAP_SHARDS = "bulk.map.shards";
  public static final String REDUCE_SHARDS = "bulk.reduce.shards";

  static {
    Configuration.addDefaultResource("bulk-default.xml");
  }

  private final String rdfDir;
  private final String jsonDir;
  private final Path inputDir;
  private final Path schemaFile;
  private final Path outDir;
  private final Path tmpDir;
  private final int numWorkers;
  private final int mapBufferMb;
  private final boolean expandEdges;
  private final boolean skipMapPhase;
  private final boolean cleanupTmp;
  private final int numShufflers;
  private final boolean storeXids;
  private final String zeroAddr;
  private final boolean ignoreErrors;
  private final int mapShards;
  private final int reduceShards;

  private LoaderOptions(Configuration conf, FileSystem fs) {
    rdfDir = conf.getTrimmed(RDF_DIR, "");
    jsonDir = conf.getTrimmed(JSON_DIR, "");
    String in = rdfDir.isEmpty() ? jsonDir : rdfDir;
    inputDir = in.isEmpty() ? null : fs.makeQualified(new Path(in));
    String schema = conf.getTrimmed(SCHEMA_FILE, "");
    schemaFile = schema.isEmpty() ? null : fs.makeQualified(new Path(schema));
    outDir = fs.makeQualified(new Path(conf.getTrimmed(OUT_DIR, "out")));
    tmpDir = fs.makeQualified(new Path(conf.getTrimmed(TMP_DIR, "tmp")));
    numWorkers = conf.getInt(
      NUM_WORKERS,
      Runtime.getRuntime().availableProcessors()
    );
    mapBufferMb = conf.getInt(MAP_BUFFER_MB, 64);
    expandEdges = conf.getBoolean(EXPAND_EDGES, true);
    skipMapPhase = conf.getBoolean(SKIP_MAP_PHASE, false);
    cleanupTmp = conf.getBoolean(CLEANUP_TMP, true);
    numShufflers = conf.getInt(NUM_SHUFFLERS, 1);
    storeXids = conf.getBoolean(STORE_XIDS, false);
    zeroAddr = conf.getTrimmed(ZERO_ADDR, "localhost:6080");
    ignoreErrors = conf.getBoolean(IGNORE_ERRORS, false);
    mapShards = conf.getInt(MAP_SHARDS, 1);
    reduceShards = conf.getInt(REDUCE_SHARDS, 1);
  }

  /**
   * Reads and validates the options.
   *
   * @throws IllegalArgumentException if the combination is unusable
   */
  public static LoaderOptions from(Configuration conf, FileSystem fs) {
    LoaderOptions opt = new LoaderOptions(conf, fs);
    opt.validate();
    return opt;
  }

  public static LoaderOptions from(Configuration conf) throws IOException {
    return from(conf, FileSystem.getLocal(conf));
  }

  private void validate() {
    if (rdfDir.isEmpty() == jsonDir.isEmpty()) {
      throw new IllegalArgumentException(
        "exactly one of " + RDF_DIR + " and " + JSON_DIR + " must be set"
      );
    }
    if (schemaFile == null) {
      throw new IllegalArgumentException(SCHEMA_FILE + " must be set");
    }
    atLeastOne(NUM_WORKERS, numWorkers);
    atLeastOne(MAP_BUFFER_MB, mapBufferMb);
    atLeastOne(NUM_SHUFFLERS, numShufflers);
    atLeastOne(MAP_SHARDS, mapShards);
    atLeastOne(REDUCE_SHARDS, reduceShards);
    if (reduceShards > mapShards) {
      throw new IllegalArgumentException(
        REDUCE_SHARDS + " (" + reduceShards + ") must not exceed " +
        MAP_SHARDS + " (" + mapShards + ")"
      );
    }
  }

  private static void atLeastOne(String key, int value) {
    if (value < 1) {
      throw new IllegalArgumentException(key + " must be >= 1, got " + value);
    }
  }

  // ==================== DERIVED VALUES ====================

  public InputFormat inputFormat() {
    return rdfDir.isEmpty() ? InputFormat.JSON : InputFormat.RDF;
  }

  public Path inputDir() {
    return inputDir;
  }

  /** Output store directory of reduce shard {@code i}. */
  public Path shardOutputDir(int i) {
    return new Path(new Path(outDir, String.valueOf(i)), "p");
  }

  public Path mapOutputDir() {
    return new Path(tmpDir, "map_output");
  }

  public Path xidDir() {
    return new Path(tmpDir, "xids");
  }

  public long mapBufferBytes() {
    return (long) mapBufferMb << 20;
  }

  // ==================== GETTERS ====================

  public Path getSchemaFile() {
    return schemaFile;
  }

  public Path getOutDir() {
    return outDir;
  }

  public Path getTmpDir() {
    return tmpDir;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  public boolean isExpandEdges() {
    return expandEdges;
  }

  public boolean isSkipMapPhase() {
    return skipMapPhase;
  }

  public boolean isCleanupTmp() {
    return cleanupTmp;
  }

  public int getNumShufflers() {
    return numShufflers;
  }

  public boolean isStoreXids() {
    return storeXids;
  }

  public String getZeroAddr() {
    return zeroAddr;
  }

  public boolean isIgnoreErrors() {
    return ignoreErrors;
  }

  public int getMapShards() {
    return mapShards;
  }

  public int getReduceShards() {
    return reduceShards;
  }

  @Override
  public String toString() {
    return (
      "input=" + inputDir() + " (" + inputFormat() + ")" +
      ", schema=" + schemaFile +
      ", out=" + outDir +
      ", tmp=" + tmpDir +
      ", workers=" + numWorkers +
      ", mapShards=" + mapShards +
      ", reduceShards=" + reduceShards +
      ", shufflers=" + numShufflers
    );
  }
}
