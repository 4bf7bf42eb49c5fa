package com.bulkload;

import com.bulkload.map.ShardMap;
import com.bulkload.reduce.ShardStore;
import com.bulkload.schema.SchemaStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;

/**
 * Handles shared by every stage of one run. Built once by {@link Loader} and
 * passed to each stage's constructor.
 *
 * <ul>
 *   <li>write-once: {@link #getWriteTs()}</li>
 *   <li>read-only after construction: options, shard map, schema</li>
 *   <li>append-only: output stores, added by the reduce orchestrator</li>
 * </ul>
 */
public class LoaderState {

  private final LoaderOptions options;
  private final Configuration conf;
  private final FileSystem fs;
  private final Progress progress;
  private final SchemaStore schema;
  private final ShardMap shards;
  private final long writeTs;

  private final List<ShardStore> stores = new ArrayList<>();
  private final AtomicInteger mapFileId = new AtomicInteger();

  public LoaderState(
    LoaderOptions options,
    Configuration conf,
    FileSystem fs,
    Progress progress,
    SchemaStore schema,
    long writeTs
  ) {
    this.options = options;
    this.conf = conf;
    this.fs = fs;
    this.progress = progress;
    this.schema = schema;
    this.shards = new ShardMap(options.getMapShards());
    this.writeTs = writeTs;
  }

  public LoaderOptions getOptions() {
    return options;
  }

  public Configuration getConf() {
    return conf;
  }

  public FileSystem getFs() {
    return fs;
  }

  public Progress getProgress() {
    return progress;
  }

  public SchemaStore getSchema() {
    return schema;
  }

  public ShardMap getShards() {
    return shards;
  }

  /** Version stamped on every posting list of the run. */
  public long getWriteTs() {
    return writeTs;
  }

  public void addStore(ShardStore store) {
    synchronized (stores) {
      stores.add(store);
    }
  }

  /** Snapshot of the output stores opened so far. */
  public List<ShardStore> getStores() {
    synchronized (stores) {
      return Collections.unmodifiableList(new ArrayList<>(stores));
    }
  }

  /** Unique id for the next map output file, across all mappers. */
  public int nextMapFileId() {
    return mapFileId.getAndIncrement();
  }
}
