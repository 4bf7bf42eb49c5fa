package com.bulkload;

import com.bulkload.map.MapStage;
import com.bulkload.map.Mapper;
import com.bulkload.reduce.ReduceStage;
import com.bulkload.reduce.ShardStore;
import com.bulkload.schema.SchemaEntry;
import com.bulkload.schema.SchemaParser;
import com.bulkload.schema.SchemaStore;
import com.bulkload.schema.ValueType;
import com.bulkload.zero.WriteTimestamp;
import com.bulkload.zero.ZeroClient;
import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One bulk load run: bootstraps the shared state (write timestamp, schema,
 * progress), then drives the stages in order. Each stage returns only once
 * its output is fully written.
 */
public class Loader implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(Loader.class);

  private final LoaderState state;
  private final ZeroClient zero;

  public Loader(
    LoaderOptions opts,
    Configuration conf,
    FileSystem fs,
    ZeroClient zero
  ) throws IOException, InterruptedException {
    this.zero = zero;
    long writeTs = WriteTimestamp.obtain(zero);
    LOG.info("Write timestamp: {}", writeTs);

    SchemaStore schema = new SchemaStore(
      SchemaParser.read(fs, opts.getSchemaFile(), conf)
    );
    addInitialSchema(schema, opts);

    Progress progress = new Progress();
    this.state = new LoaderState(opts, conf, fs, progress, schema, writeTs);
    progress.startReporting(Progress.REPORT_INTERVAL);
  }

  /** Predicates the loader itself writes, unless the schema file has them. */
  static void addInitialSchema(SchemaStore schema, LoaderOptions opts) {
    if (opts.isExpandEdges()) {
      schema.addIfAbsent(
        new SchemaEntry(
          Mapper.PREDICATE_ATTR,
          ValueType.STRING,
          true,
          Collections.emptyList(),
          false,
          true
        )
      );
    }
    if (opts.isStoreXids()) {
      schema.addIfAbsent(
        new SchemaEntry(
          Mapper.XID_ATTR,
          ValueType.STRING,
          false,
          Collections.singletonList("exact"),
          false,
          true
        )
      );
    }
  }

  public LoaderState getState() {
    return state;
  }

  public void mapStage() throws IOException, InterruptedException {
    new MapStage(state, zero).run();
  }

  public void reduceStage() throws IOException, InterruptedException {
    new ReduceStage(state).run();
  }

  /** Stamps the final schema into every output store. */
  public void writeSchema() throws IOException {
    for (ShardStore store : state.getStores()) {
      state.getSchema().write(store);
    }
  }

  /** Closes the output stores and prints the run summary. */
  public void cleanup() throws IOException {
    for (ShardStore store : state.getStores()) {
      store.close();
    }
    state.getProgress().printSummary(System.out);
  }

  @Override
  public void close() {
    state.getProgress().close();
  }
}
