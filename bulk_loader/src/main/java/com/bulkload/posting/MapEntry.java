package com.bulkload.posting;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;

/**
 * A (key, posting) pair emitted by the map stage.
 *
 * Ordered by key bytes (unsigned, lexicographic, the same order the output
 * stores use), then by posting uid. Map files are written in this order and
 * the shuffler merges on it.
 */
public class MapEntry implements WritableComparable<MapEntry> {

  private byte[] key;
  private Posting posting;

  public MapEntry() {
    this.posting = new Posting();
  }

  public MapEntry(byte[] key, Posting posting) {
    this.key = key;
    this.posting = posting;
  }

  public byte[] getKey() {
    return key;
  }

  public Posting getPosting() {
    return posting;
  }

  public int estimatedSize() {
    return 16 + key.length + posting.estimatedSize();
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeInt(key.length);
    out.write(key);
    posting.write(out);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    key = new byte[in.readInt()];
    in.readFully(key);
    posting.readFields(in);
  }

  @Override
  public int compareTo(MapEntry o) {
    int cmp = compareKeys(key, o.key);
    return cmp != 0 ? cmp : Long.compare(posting.getUid(), o.posting.getUid());
  }

  public static int compareKeys(byte[] a, byte[] b) {
    return WritableComparator.compareBytes(a, 0, a.length, b, 0, b.length);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(key) * 31 + posting.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof MapEntry) {
      MapEntry o = (MapEntry) obj;
      return Arrays.equals(key, o.key) && posting.equals(o.posting);
    }
    return false;
  }
}
