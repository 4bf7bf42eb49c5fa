package com.bulkload.map;

import com.bulkload.schema.ValueType;
import java.util.HashMap;
import java.util.Map;

/**
 * Parses one N-Quad line:
 *
 * <pre>
 *   subject predicate object [label] .
 *   subject, label : &lt;iri&gt; | _:blank
 *   predicate      : &lt;iri&gt;
 *   object         : &lt;iri&gt; | _:blank | "literal"[@lang | ^^&lt;type&gt;]
 * </pre>
 */
public final class RdfParser {

  private static final String XS = "xs:";
  private static final String XSD = "http://www.w3.org/2001/XMLSchema#";

  private static final Map<String, ValueType> XS_TYPES = new HashMap<>();

  static {
    XS_TYPES.put("string", ValueType.STRING);
    XS_TYPES.put("int", ValueType.INT);
    XS_TYPES.put("integer", ValueType.INT);
    XS_TYPES.put("long", ValueType.INT);
    XS_TYPES.put("float", ValueType.FLOAT);
    XS_TYPES.put("double", ValueType.FLOAT);
    XS_TYPES.put("decimal", ValueType.FLOAT);
    XS_TYPES.put("boolean", ValueType.BOOL);
    XS_TYPES.put("dateTime", ValueType.DATETIME);
    XS_TYPES.put("date", ValueType.DATETIME);
  }

  private final String line;
  private int pos;

  private RdfParser(String line) {
    this.line = line;
  }

  /**
   * @return the quad, or null for a blank or comment line
   */
  public static NQuad parse(String line) throws RecordParseException {
    String trimmed = line.trim();
    if (trimmed.isEmpty() || trimmed.charAt(0) == '#') {
      return null;
    }
    return new RdfParser(trimmed).quad();
  }

  private NQuad quad() throws RecordParseException {
    String subject = node("subject");
    skipSpace();
    if (peek() != '<') {
      throw error("predicate must be an IRI");
    }
    String predicate = iri();
    skipSpace();

    String objectId = null;
    String value = null;
    ValueType type = ValueType.DEFAULT;
    String lang = "";
    if (peek() == '"') {
      value = literal();
      if (peek() == '@') {
        pos++;
        lang = word();
        if (lang.isEmpty()) {
          throw error("empty language tag");
        }
      } else if (peek() == '^') {
        expect("^^");
        type = xsType(iri());
      }
    } else {
      objectId = node("object");
    }

    skipSpace();
    String label = "";
    if (peek() == '<' || peek() == '_') {
      label = node("label");
      skipSpace();
    }
    if (peek() != '.') {
      throw error("expected '.' at end of quad");
    }
    pos++;
    skipSpace();
    if (pos < line.length() && peek() != '#') {
      throw error("trailing content after '.'");
    }

    if (objectId != null) {
      return NQuad.edge(subject, predicate, objectId, label);
    }
    return NQuad.literal(subject, predicate, value, type, lang, label);
  }

  // ==================== TERMS ====================

  private String node(String what) throws RecordParseException {
    skipSpace();
    char c = peek();
    if (c == '<') {
      return iri();
    }
    if (c == '_') {
      expect("_:");
      String name = word();
      if (name.isEmpty()) {
        throw error("empty blank node in " + what);
      }
      return "_:" + name;
    }
    throw error("invalid " + what);
  }

  private String iri() throws RecordParseException {
    int close = line.indexOf('>', pos);
    if (close < 0) {
      throw error("unterminated IRI");
    }
    String iri = line.substring(pos + 1, close);
    if (iri.isEmpty()) {
      throw error("empty IRI");
    }
    pos = close + 1;
    return iri;
  }

  private String literal() throws RecordParseException {
    StringBuilder sb = new StringBuilder();
    pos++; // opening quote
    while (pos < line.length()) {
      char c = line.charAt(pos++);
      if (c == '"') {
        return sb.toString();
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (pos >= line.length()) break;
      char e = line.charAt(pos++);
      switch (e) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 'u':
          if (pos + 4 > line.length()) {
            throw error("truncated \\u escape");
          }
          try {
            sb.append((char) Integer.parseInt(line.substring(pos, pos + 4), 16));
          } catch (NumberFormatException ex) {
            throw error("invalid \\u escape");
          }
          pos += 4;
          break;
        default:
          sb.append(e);
      }
    }
    throw error("unterminated literal");
  }

  private String word() {
    int start = pos;
    while (pos < line.length()) {
      char c = line.charAt(pos);
      if (Character.isWhitespace(c) || c == '<' || c == '>' || c == '"') break;
      if (c == '.' && endsTerm(pos + 1)) break;
      pos++;
    }
    return line.substring(start, pos);
  }

  private ValueType xsType(String iri) throws RecordParseException {
    String name;
    if (iri.startsWith(XS)) {
      name = iri.substring(XS.length());
    } else if (iri.startsWith(XSD)) {
      name = iri.substring(XSD.length());
    } else {
      throw error("unsupported literal type <" + iri + ">");
    }
    ValueType t = XS_TYPES.get(name);
    if (t == null) {
      throw error("unsupported literal type <" + iri + ">");
    }
    return t;
  }

  // ==================== CURSOR ====================

  /** A '.' followed by this position closes the quad. */
  private boolean endsTerm(int next) {
    return next == line.length() || Character.isWhitespace(line.charAt(next));
  }

  private char peek() {
    return pos < line.length() ? line.charAt(pos) : '\0';
  }

  private void skipSpace() {
    while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
      pos++;
    }
  }

  private void expect(String s) throws RecordParseException {
    if (!line.startsWith(s, pos)) {
      throw error("expected '" + s + "'");
    }
    pos += s.length();
  }

  private RecordParseException error(String msg) {
    return new RecordParseException(msg + " at column " + pos + ": " + line);
  }
}
