package com.bulkload.chunker;

import java.io.IOException;
import org.apache.hadoop.io.DataOutputBuffer;

/**
 * Chunker for a single top-level JSON array of objects:
 * {@code [ {...}, {...}, ... ]}.
 *
 * Each chunk is one array element, found by tracking brace depth. Quoted
 * strings are copied opaquely (honouring backslash escapes) so braces inside
 * literals do not count. Nothing else about the JSON is checked; the mapper's
 * parser does that. Works on bytes: every structural character is ASCII and
 * never appears inside a multi-byte UTF-8 sequence.
 */
public class JsonChunker implements Chunker {

  @Override
  public void begin(ChunkInput in) throws IOException {
    // Step past '[' so chunk() can read one element at a time instead of
    // holding the whole array in memory.
    if (!skipSpace(in)) {
      throw new MalformedChunkException("json file is empty, expected an array");
    }
    int ch = in.read();
    if (ch != '[') {
      throw new MalformedChunkException(
        "json file must contain array. Found: " + describe(ch)
      );
    }
  }

  @Override
  public Chunk chunk(ChunkInput in) throws IOException {
    DataOutputBuffer out = new DataOutputBuffer(1 << 16);
    if (!skipSpace(in)) {
      return new Chunk(out, true);
    }
    int ch = in.read();
    if (ch != '{') {
      throw new MalformedChunkException(
        "expected json map start. Found: " + describe(ch)
      );
    }
    out.write(ch);

    int depth = 1; // the opening brace is already consumed
    while (depth > 0) {
      ch = in.read();
      if (ch < 0) {
        throw new MalformedChunkException("malformed json: unterminated object");
      }
      out.write(ch);
      switch (ch) {
        case '{':
          depth++;
          break;
        case '}':
          depth--;
          break;
        case '"':
          copyQuoted(in, out);
          break;
        default:
          break;
      }
    }

    // An element is followed by ',' or by the closing ']'.
    if (!skipSpace(in)) {
      throw new MalformedChunkException(
        "malformed json: input ended after an object, expected ',' or ']'"
      );
    }
    ch = in.read();
    switch (ch) {
      case ']':
        return new Chunk(out, true);
      case ',':
        return new Chunk(out, false);
      default:
        // Keep this element; the next call reports the stray token.
        in.unread();
        return new Chunk(out, false);
    }
  }

  @Override
  public void end(ChunkInput in) throws IOException {
    if (skipSpace(in)) {
      throw new MalformedChunkException("not all of json file consumed");
    }
  }

  /**
   * Copies the rest of a string literal whose opening quote was already
   * written, up to and including the closing quote.
   */
  static void copyQuoted(ChunkInput in, DataOutputBuffer out)
    throws IOException {
    while (true) {
      int ch = in.read();
      if (ch < 0) {
        throw new MalformedChunkException("malformed json: unterminated string");
      }
      out.write(ch);
      if (ch == '\\') {
        int esc = in.read();
        if (esc < 0) {
          throw new MalformedChunkException("malformed json: unterminated string");
        }
        out.write(esc);
        continue;
      }
      if (ch == '"') {
        return;
      }
    }
  }

  /**
   * Skips whitespace.
   *
   * @return false if the stream ended
   */
  static boolean skipSpace(ChunkInput in) throws IOException {
    while (true) {
      int ch = in.read();
      if (ch < 0) {
        return false;
      }
      if (!isSpace(ch)) {
        in.unread();
        return true;
      }
    }
  }

  private static boolean isSpace(int ch) {
    return (
      ch == ' ' ||
      ch == '\t' ||
      ch == '\n' ||
      ch == '\r' ||
      ch == 0x0B ||
      ch == '\f'
    );
  }

  private static String describe(int ch) {
    return ch < 0 ? "end of input" : "'" + (char) ch + "'";
  }
}
