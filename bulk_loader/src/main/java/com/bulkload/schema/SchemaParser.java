package com.bulkload.schema;

import com.bulkload.chunker.InputFiles;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

/**
 * Parses schema files, one predicate per line:
 *
 * <pre>
 * # comment
 * name: string @index(exact, term) .
 * friend: [uid] @reverse .
 * &lt;http://schema.org/age&gt;: int .
 * </pre>
 */
public final class SchemaParser {

  /** Tokenizers {@code @index} accepts. */
  public static final Set<String> TOKENIZERS = Set.of("exact", "term");

  private static final Pattern LINE = Pattern.compile(
    "^(<[^>]+>|[^\\s:<>]+)\\s*:\\s*(\\[\\s*\\w+\\s*\\]|\\w+)\\s*(.*?)\\s*\\.$"
  );
  private static final Pattern DIRECTIVE = Pattern.compile(
    "@(\\w+)(?:\\(([^)]*)\\))?"
  );

  private SchemaParser() {} // Utility class

  /** Reads and parses a schema file, gunzipping {@code .gz} files. */
  public static List<SchemaEntry> read(FileSystem fs, Path file, Configuration conf)
    throws IOException {
    try (InputStream in = InputFiles.open(fs, file, conf)) {
      return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  public static List<SchemaEntry> parse(String text) throws SchemaParseException {
    Map<String, SchemaEntry> entries = new LinkedHashMap<>();
    String[] lines = text.split("\r?\n");
    for (int i = 0; i < lines.length; i++) {
      String line = stripComment(lines[i]).trim();
      if (line.isEmpty()) continue;
      SchemaEntry e = parseLine(i + 1, line);
      if (entries.put(e.getPredicate(), e) != null) {
        throw new SchemaParseException(
          i + 1,
          "predicate " + e.getPredicate() + " defined twice"
        );
      }
    }
    return new ArrayList<>(entries.values());
  }

  private static SchemaEntry parseLine(int lineNo, String line)
    throws SchemaParseException {
    Matcher m = LINE.matcher(line);
    if (!m.matches()) {
      throw new SchemaParseException(lineNo, "cannot parse '" + line + "'");
    }
    String predicate = m.group(1);
    if (predicate.startsWith("<")) {
      predicate = predicate.substring(1, predicate.length() - 1);
    }

    String typeSpec = m.group(2);
    boolean list = typeSpec.startsWith("[");
    String typeName = list
      ? typeSpec.substring(1, typeSpec.length() - 1).trim()
      : typeSpec;
    ValueType type = ValueType.fromName(typeName);
    if (type == null) {
      throw new SchemaParseException(lineNo, "unknown type '" + typeName + "'");
    }

    List<String> tokenizers = new ArrayList<>();
    boolean reverse = false;
    String rest = m.group(3);
    Matcher d = DIRECTIVE.matcher(rest);
    int end = 0;
    while (d.find()) {
      String between = rest.substring(end, d.start());
      if (!between.isBlank()) {
        throw new SchemaParseException(
          lineNo,
          "unexpected '" + between.trim() + "'"
        );
      }
      end = d.end();
      String name = d.group(1);
      switch (name) {
        case "index":
          if (type == ValueType.UID) {
            throw new SchemaParseException(
              lineNo,
              "@index is not allowed on uid"
            );
          }
          tokenizers.addAll(parseTokenizers(lineNo, d.group(2)));
          break;
        case "reverse":
          if (type != ValueType.UID) {
            throw new SchemaParseException(
              lineNo,
              "@reverse is only allowed on uid"
            );
          }
          reverse = true;
          break;
        case "count":
        case "upsert":
        case "lang":
          // accepted; the loader writes nothing extra for these
          break;
        default:
          throw new SchemaParseException(lineNo, "unknown directive @" + name);
      }
    }
    String trailing = rest.substring(end);
    if (!trailing.isBlank()) {
      throw new SchemaParseException(
        lineNo,
        "unexpected '" + trailing.trim() + "'"
      );
    }
    return new SchemaEntry(predicate, type, list, tokenizers, reverse, true);
  }

  private static List<String> parseTokenizers(int lineNo, String args)
    throws SchemaParseException {
    List<String> out = new ArrayList<>();
    if (args == null || args.isBlank()) {
      throw new SchemaParseException(lineNo, "@index needs at least one tokenizer");
    }
    for (String tok : args.split(",")) {
      String t = tok.trim();
      if (!TOKENIZERS.contains(t)) {
        throw new SchemaParseException(lineNo, "unsupported tokenizer '" + t + "'");
      }
      out.add(t);
    }
    return out;
  }

  private static String stripComment(String line) {
    // '#' inside <...> is part of an IRI
    boolean inIri = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '<') inIri = true;
      else if (c == '>') inIri = false;
      else if (c == '#' && !inIri) return line.substring(0, i);
    }
    return line;
  }
}
