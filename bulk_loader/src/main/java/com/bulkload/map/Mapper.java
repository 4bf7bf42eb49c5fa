package com.bulkload.map;

import com.bulkload.LoaderMetrics.MapMetrics;
import com.bulkload.LoaderOptions;
import com.bulkload.LoaderState;
import com.bulkload.Progress;
import com.bulkload.chunker.Chunk;
import com.bulkload.chunker.InputFormat;
import com.bulkload.posting.Keys;
import com.bulkload.posting.MapEntry;
import com.bulkload.posting.Posting;
import com.bulkload.schema.SchemaEntry;
import com.bulkload.schema.ValueType;
import com.bulkload.xidmap.XidMap;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.NullWritable;
import org.apache.hadoop.io.SequenceFile;
import org.apache.hadoop.io.SequenceFile.CompressionType;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.DefaultCodec;
import org.apache.hadoop.util.ReflectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns chunks into sorted map output.
 *
 * Each record is parsed into N-Quads, node ids are resolved through the
 * {@link XidMap} and every quad becomes one or more {@link MapEntry}s: the
 * data entry, plus reverse, index, {@code _predicate_} and {@code xid}
 * entries as configured. Entries are buffered per map shard; once the buffer
 * passes {@code bulk.map.buffer.mb} every shard is sorted and written as a
 * block-compressed SequenceFile {@code <tmp>/map_output/<shard>/<id>.map}.
 *
 * Not thread-safe: one instance per worker.
 */
public class Mapper implements ChunkMapper {

  private static final Logger LOG = LoggerFactory.getLogger(Mapper.class);

  public static final String PREDICATE_ATTR = "_predicate_";
  public static final String XID_ATTR = "xid";
  public static final String MAP_FILE_SUFFIX = ".map";

  private static final String BLANK_PREFIX = "_:";

  private final LoaderState state;
  private final LoaderOptions opts;
  private final Progress progress;
  private final XidMap xids;
  private final InputFormat format;
  private final JsonRecordParser jsonParser = new JsonRecordParser();
  private final CompressionCodec codec;

  // Per map shard buffers
  private final List<List<MapEntry>> buffers;
  private long bufferedBytes;

  public Mapper(LoaderState state, XidMap xids) {
    this.state = state;
    this.opts = state.getOptions();
    this.progress = state.getProgress();
    this.xids = xids;
    this.format = opts.inputFormat();
    this.codec = ReflectionUtils.newInstance(DefaultCodec.class, state.getConf());
    int shards = state.getShards().numShards();
    this.buffers = new ArrayList<>(shards);
    for (int i = 0; i < shards; i++) {
      buffers.add(new ArrayList<>());
    }
  }

  @Override
  public void map(Chunk chunk) throws IOException {
    progress.increment(MapMetrics.INPUT_BYTES, chunk.length());
    if (format == InputFormat.RDF) {
      try (
        BufferedReader r = new BufferedReader(
          new InputStreamReader(chunk.openStream(), StandardCharsets.UTF_8)
        )
      ) {
        String line;
        while ((line = r.readLine()) != null) {
          try {
            NQuad nq = RdfParser.parse(line);
            if (nq != null) {
              addRecord(Collections.singletonList(nq));
            }
          } catch (RecordParseException e) {
            skipOrThrow(e);
          }
        }
      }
    } else {
      try {
        addRecord(jsonParser.parse(chunk.utf8()));
      } catch (RecordParseException e) {
        skipOrThrow(e);
      }
    }
    if (bufferedBytes >= opts.mapBufferBytes()) {
      flushAll();
    }
  }

  private void skipOrThrow(RecordParseException e) throws RecordParseException {
    if (!opts.isIgnoreErrors()) {
      throw e;
    }
    progress.increment(MapMetrics.PARSE_ERRORS, 1);
    LOG.warn("Skipping record: {}", e.getMessage());
  }

  /** Converts a whole record first, so a failing record adds nothing. */
  private void addRecord(List<NQuad> quads) throws IOException {
    List<MapEntry> pending = new ArrayList<>();
    for (NQuad nq : quads) {
      toEntries(nq, pending);
    }
    for (MapEntry e : pending) {
      int shard = state.getShards().shardFor(Keys.attr(e.getKey()));
      buffers.get(shard).add(e);
      bufferedBytes += e.estimatedSize();
    }
    progress.increment(MapMetrics.NQUADS, quads.size());
    progress.increment(MapMetrics.MAP_ENTRIES, pending.size());
  }

  // ==================== ENTRY GENERATION ====================

  void toEntries(NQuad nq, List<MapEntry> out) throws IOException {
    String pred = nq.getPredicate();
    long sid = xids.assignUid(nq.getSubject());
    SchemaEntry schema = state.getSchema().getOrInfer(pred, nq.isUidEdge());

    if (nq.isUidEdge()) {
      if (schema.getType() != ValueType.UID) {
        throw new RecordParseException(
          "predicate " + pred + " is of type " + schema.getType().schemaName() +
          " but got a node: " + nq
        );
      }
      long oid = xids.assignUid(nq.getObjectId());
      out.add(new MapEntry(Keys.dataKey(pred, sid), Posting.uid(oid)));
      if (schema.isReverse()) {
        out.add(new MapEntry(Keys.reverseKey(pred, oid), Posting.uid(sid)));
      }
      addXid(nq.getObjectId(), oid, out);
    } else {
      ValueType type = literalType(schema, nq);
      String value = nq.getObjectValue();
      out.add(
        new MapEntry(
          Keys.dataKey(pred, sid),
          Posting.value(type, value, nq.getLang(), schema.isList())
        )
      );
      for (String tok : schema.getTokenizers()) {
        byte tokId = Tokenizers.id(tok);
        for (String token : Tokenizers.tokens(tok, value)) {
          out.add(new MapEntry(Keys.indexKey(pred, tokId, token), Posting.uid(sid)));
        }
      }
    }

    if (opts.isExpandEdges()) {
      out.add(
        new MapEntry(
          Keys.dataKey(PREDICATE_ATTR, sid),
          Posting.value(ValueType.STRING, pred, "", true)
        )
      );
    }
    addXid(nq.getSubject(), sid, out);
  }

  /** Type the literal is stored as: the schema's, unless it is default. */
  private static ValueType literalType(SchemaEntry schema, NQuad nq)
    throws RecordParseException {
    if (schema.getType() == ValueType.UID) {
      throw new RecordParseException(
        "predicate " + schema.getPredicate() + " is of type uid but got a literal: " + nq
      );
    }
    ValueType type = schema.getType() == ValueType.DEFAULT
      ? nq.getObjectType()
      : schema.getType();
    try {
      type.validate(nq.getObjectValue());
    } catch (IllegalArgumentException e) {
      throw new RecordParseException(e.getMessage() + ": " + nq, e);
    }
    return type;
  }

  private void addXid(String xid, long uid, List<MapEntry> out) {
    if (!opts.isStoreXids() || xid.startsWith(BLANK_PREFIX)) {
      return;
    }
    out.add(
      new MapEntry(
        Keys.dataKey(XID_ATTR, uid),
        Posting.value(ValueType.STRING, xid, "", false)
      )
    );
    out.add(
      new MapEntry(
        Keys.indexKey(XID_ATTR, Tokenizers.EXACT, xid),
        Posting.uid(uid)
      )
    );
  }

  // ==================== MAP OUTPUT ====================

  private void flushAll() throws IOException {
    for (int shard = 0; shard < buffers.size(); shard++) {
      flush(shard);
    }
    bufferedBytes = 0;
  }

  private void flush(int shard) throws IOException {
    List<MapEntry> entries = buffers.get(shard);
    if (entries.isEmpty()) return;
    Collections.sort(entries);

    Path dir = new Path(opts.mapOutputDir(), String.format("%03d", shard));
    Path file = new Path(
      dir,
      String.format("%06d%s", state.nextMapFileId(), MAP_FILE_SUFFIX)
    );
    try (
      SequenceFile.Writer w = SequenceFile.createWriter(
        state.getConf(),
        SequenceFile.Writer.file(file),
        SequenceFile.Writer.keyClass(MapEntry.class),
        SequenceFile.Writer.valueClass(NullWritable.class),
        SequenceFile.Writer.compression(CompressionType.BLOCK, codec)
      )
    ) {
      for (MapEntry e : entries) {
        w.append(e, NullWritable.get());
      }
    }
    progress.increment(MapMetrics.MAP_FILES, 1);
    progress.increment(
      MapMetrics.MAP_OUTPUT_BYTES,
      state.getFs().getFileStatus(file).getLen()
    );
    LOG.debug("Wrote {} entries to {}", entries.size(), file);
    buffers.set(shard, new ArrayList<>());
  }

  @Override
  public void close() throws IOException {
    flushAll();
  }
}
