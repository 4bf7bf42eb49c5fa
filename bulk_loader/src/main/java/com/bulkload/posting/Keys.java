package com.bulkload.posting;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Binary key layout of the output stores:
 *
 * <pre>
 *   [0x00][u16 attr length][attr utf8][kind][payload]
 *   DATA     payload = u64 subject uid
 *   INDEX    payload = tokenizer id + token utf8
 *   REVERSE  payload = u64 object uid
 * </pre>
 *
 * All keys of one predicate share a prefix, so they sort together.
 */
public final class Keys {

  public static final byte DEFAULT_PREFIX = 0x00;

  public static final byte DATA = 0x00;
  public static final byte INDEX = 0x02;
  public static final byte REVERSE = 0x04;

  private Keys() {} // Utility class

  public static byte[] dataKey(String attr, long uid) {
    return withUid(attr, DATA, uid);
  }

  public static byte[] reverseKey(String attr, long uid) {
    return withUid(attr, REVERSE, uid);
  }

  public static byte[] indexKey(String attr, byte tokenizer, String token) {
    byte[] t = token.getBytes(StandardCharsets.UTF_8);
    ByteBuffer b = header(attr, INDEX, 1 + t.length);
    b.put(tokenizer).put(t);
    return b.array();
  }

  /** Predicate the key belongs to. */
  public static String attr(byte[] key) {
    int len = ((key[1] & 0xFF) << 8) | (key[2] & 0xFF);
    return new String(key, 3, len, StandardCharsets.UTF_8);
  }

  /** One of {@link #DATA}, {@link #INDEX}, {@link #REVERSE}. */
  public static byte kind(byte[] key) {
    return key[3 + attrLength(key)];
  }

  /** Uid of a DATA or REVERSE key. */
  public static long uid(byte[] key) {
    byte kind = kind(key);
    if (kind != DATA && kind != REVERSE) {
      throw new IllegalArgumentException("key kind " + kind + " carries no uid");
    }
    return ByteBuffer.wrap(key, 4 + attrLength(key), 8).getLong();
  }

  /** Token of an INDEX key, without the tokenizer id. */
  public static String token(byte[] key) {
    int off = 5 + attrLength(key);
    return new String(key, off, key.length - off, StandardCharsets.UTF_8);
  }

  private static int attrLength(byte[] key) {
    return ((key[1] & 0xFF) << 8) | (key[2] & 0xFF);
  }

  private static byte[] withUid(String attr, byte kind, long uid) {
    ByteBuffer b = header(attr, kind, 8);
    b.putLong(uid);
    return b.array();
  }

  private static ByteBuffer header(String attr, byte kind, int payload) {
    byte[] a = attr.getBytes(StandardCharsets.UTF_8);
    if (a.length > 0xFFFF) {
      throw new IllegalArgumentException("predicate name too long: " + a.length);
    }
    ByteBuffer b = ByteBuffer.allocate(4 + a.length + payload);
    b.put(DEFAULT_PREFIX).putShort((short) a.length).put(a).put(kind);
    return b;
  }
}
