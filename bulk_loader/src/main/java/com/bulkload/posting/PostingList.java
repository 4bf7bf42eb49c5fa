package com.bulkload.posting;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.hadoop.io.Writable;

/**
 * All postings of one key, sorted by uid, stamped with the write timestamp
 * of the run that produced them.
 */
public class PostingList implements Writable {

  private long version;
  private List<Posting> postings = new ArrayList<>();

  public PostingList() {}

  public PostingList(long version, List<Posting> postings) {
    this.version = version;
    this.postings = postings;
  }

  public long getVersion() {
    return version;
  }

  public List<Posting> getPostings() {
    return Collections.unmodifiableList(postings);
  }

  /** Uids of the postings, in order. */
  public long[] uids() {
    long[] out = new long[postings.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = postings.get(i).getUid();
    }
    return out;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeLong(version);
    out.writeInt(postings.size());
    for (Posting p : postings) {
      p.write(out);
    }
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    version = in.readLong();
    int n = in.readInt();
    postings = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Posting p = new Posting();
      p.readFields(in);
      postings.add(p);
    }
  }

  @Override
  public String toString() {
    return "PostingList{version=" + version + ", postings=" + postings + "}";
  }
}
