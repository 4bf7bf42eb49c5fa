package com.bulkload.reduce;

import com.bulkload.posting.PostingList;
import com.bulkload.schema.SchemaEntry;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.BytesWritable;
import org.apache.hadoop.io.MapFile;
import org.apache.hadoop.io.SequenceFile.CompressionType;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.DefaultCodec;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * Output store of one reduce shard: a directory of sorted, non-overlapping
 * MapFile segments ({@code segment-000000}, ...) keyed by raw key bytes, a
 * {@code schema} MapFile and, once closed, a {@code _SUCCESS} marker.
 */
public class ShardStore implements Closeable {

  public static final String SEGMENT_PREFIX = "segment-";
  public static final String SCHEMA = "schema";
  public static final String SUCCESS_MARKER = "_SUCCESS";

  private final int shardId;
  private final Path dir;
  private final Configuration conf;
  private final FileSystem fs;
  private final long version;
  private final CompressionCodec codec;
  private final AtomicInteger segmentIds = new AtomicInteger();
  private boolean closed;

  private ShardStore(
    int shardId,
    Path dir,
    Configuration conf,
    FileSystem fs,
    long version
  ) {
    this.shardId = shardId;
    this.dir = dir;
    this.conf = conf;
    this.fs = fs;
    this.version = version;
    this.codec = ReflectionUtils.newInstance(DefaultCodec.class, conf);
  }

  public static ShardStore create(
    int shardId,
    Path dir,
    Configuration conf,
    long version
  ) throws IOException {
    FileSystem fs = dir.getFileSystem(conf);
    if (!fs.mkdirs(dir)) {
      throw new IOException("cannot create output store " + dir);
    }
    return new ShardStore(shardId, dir, conf, fs, version);
  }

  public int getShardId() {
    return shardId;
  }

  public Path getDir() {
    return dir;
  }

  /** Write timestamp of every posting list in this store. */
  public long getVersion() {
    return version;
  }

  public int nextSegmentId() {
    return segmentIds.getAndIncrement();
  }

  public Path segmentPath(int segmentId) {
    return new Path(dir, String.format("%s%06d", SEGMENT_PREFIX, segmentId));
  }

  /**
   * Writes one segment. Keys must be strictly increasing; {@code lists}
   * holds the posting list of each key.
   */
  public void writeSegment(
    int segmentId,
    List<byte[]> keys,
    List<PostingList> lists
  ) throws IOException {
    if (keys.size() != lists.size()) {
      throw new IllegalArgumentException("keys and posting lists differ in size");
    }
    BytesWritable k = new BytesWritable();
    try (
      MapFile.Writer w = new MapFile.Writer(
        conf,
        segmentPath(segmentId),
        MapFile.Writer.keyClass(BytesWritable.class),
        MapFile.Writer.valueClass(PostingList.class),
        MapFile.Writer.compression(CompressionType.BLOCK, codec)
      )
    ) {
      for (int i = 0; i < keys.size(); i++) {
        byte[] key = keys.get(i);
        k.set(key, 0, key.length);
        w.append(k, lists.get(i));
      }
    }
  }

  /** Segment directories written so far, in id order. */
  public List<Path> segments() throws IOException {
    List<Path> out = new ArrayList<>();
    for (FileStatus st : fs.listStatus(dir)) {
      String name = st.getPath().getName();
      if (st.isDirectory() && name.startsWith(SEGMENT_PREFIX)) {
        out.add(st.getPath());
      }
    }
    out.sort(Comparator.comparing(Path::getName));
    return out;
  }

  /** Writes the schema as predicate → schema line. */
  public void writeSchema(List<SchemaEntry> entries) throws IOException {
    Text[] preds = new Text[entries.size()];
    for (int i = 0; i < preds.length; i++) {
      preds[i] = new Text(entries.get(i).getPredicate());
    }
    // MapFile wants Text order, which is byte order, not String order
    Integer[] order = new Integer[preds.length];
    for (int i = 0; i < order.length; i++) order[i] = i;
    Arrays.sort(order, (a, b) -> preds[a].compareTo(preds[b]));

    Text value = new Text();
    try (
      MapFile.Writer w = new MapFile.Writer(
        conf,
        new Path(dir, SCHEMA),
        MapFile.Writer.keyClass(Text.class),
        MapFile.Writer.valueClass(Text.class)
      )
    ) {
      for (int i : order) {
        value.set(entries.get(i).toString());
        w.append(preds[i], value);
      }
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) return;
    closed = true;
    fs.create(new Path(dir, SUCCESS_MARKER), true).close();
  }

  @Override
  public String toString() {
    return "ShardStore{" + shardId + ", " + dir + "}";
  }
}
