package com.bulkload.posting;

import com.bulkload.schema.ValueType;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.hadoop.io.MD5Hash;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.Writable;

/**
 * One posting: an edge to a node (uid posting) or a literal value.
 *
 * Binary format: uid (8 bytes), value type (1 byte), value length (4 bytes)
 * + value bytes, language as {@link Text}.
 */
public class Posting implements Writable {

  /** Uid of a single-valued literal. */
  public static final long VALUE_UID = Long.MAX_VALUE;

  private static final byte[] EMPTY = new byte[0];

  private long uid;
  private byte valueType = ValueType.UID.id();
  private byte[] value = EMPTY;
  private String lang = "";

  public Posting() {}

  private Posting(long uid, byte valueType, byte[] value, String lang) {
    this.uid = uid;
    this.valueType = valueType;
    this.value = value;
    this.lang = lang;
  }

  public static Posting uid(long uid) {
    return new Posting(uid, ValueType.UID.id(), EMPTY, "");
  }

  /**
   * Literal posting. List-typed and language-tagged values get a uid derived
   * from their content so several can live under one key.
   */
  public static Posting value(ValueType type, String value, String lang, boolean list) {
    byte[] v = value.getBytes(StandardCharsets.UTF_8);
    long uid = VALUE_UID;
    if (list) {
      uid = fingerprint(v);
    } else if (!lang.isEmpty()) {
      uid = fingerprint(lang.getBytes(StandardCharsets.UTF_8));
    }
    return new Posting(uid, type.id(), v, lang);
  }

  static long fingerprint(byte[] b) {
    // never collides with VALUE_UID: sign bit and lowest bit cleared
    return MD5Hash.digest(b).halfDigest() & (Long.MAX_VALUE - 1);
  }

  public long getUid() {
    return uid;
  }

  public boolean isValue() {
    return valueType != ValueType.UID.id();
  }

  public ValueType getValueType() {
    return ValueType.fromId(valueType);
  }

  public byte[] getValue() {
    return value;
  }

  public String getValueString() {
    return new String(value, StandardCharsets.UTF_8);
  }

  public String getLang() {
    return lang;
  }

  /** Approximate heap footprint, used to size map buffers. */
  public int estimatedSize() {
    return 24 + value.length + lang.length();
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeLong(uid);
    out.writeByte(valueType);
    out.writeInt(value.length);
    out.write(value);
    Text.writeString(out, lang);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    uid = in.readLong();
    valueType = in.readByte();
    value = new byte[in.readInt()];
    in.readFully(value);
    lang = Text.readString(in);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Posting) {
      Posting o = (Posting) obj;
      return (
        uid == o.uid &&
        valueType == o.valueType &&
        Arrays.equals(value, o.value) &&
        lang.equals(o.lang)
      );
    }
    return false;
  }

  @Override
  public int hashCode() {
    return (int) (uid * 31) ^ Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    if (!isValue()) {
      return "Posting{uid=" + uid + "}";
    }
    return "Posting{uid=" + uid + ", " + getValueType().schemaName() + "=" +
      getValueString() + (lang.isEmpty() ? "" : "@" + lang) + "}";
  }
}
