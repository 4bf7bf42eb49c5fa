package com.bulkload.map;

import com.bulkload.schema.ValueType;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Flattens one JSON record object into N-Quads.
 *
 * The {@code uid} field names the node; without it the node gets a fresh
 * blank id unique to this run. Scalars become literal edges, nested objects
 * become uid edges to the nested node (flattened recursively) and arrays give
 * one edge per element. A key of the form {@code name@lang} tags string
 * values with a language.
 */
public class JsonRecordParser {

  public static final String UID_FIELD = "uid";

  /**
   * Generated blank ids carry a random token drawn once per run, so they
   * cannot collide with a {@code uid} given in the input.
   */
  static final String BLANK_PREFIX =
    "_:json." + Long.toHexString(new SecureRandom().nextLong()) + ".";

  private static final AtomicLong BLANK_IDS = new AtomicLong();

  private final Gson gson = new Gson();

  public List<NQuad> parse(String record) throws RecordParseException {
    JsonObject obj;
    try {
      obj = gson.fromJson(record, JsonObject.class);
    } catch (JsonParseException e) {
      throw new RecordParseException(
        "invalid json record: " + e.getMessage(),
        e
      );
    }
    if (obj == null) {
      throw new RecordParseException("empty json record");
    }
    List<NQuad> out = new ArrayList<>();
    flatten(obj, out);
    return out;
  }

  /** Emits the quads of {@code obj} and returns its node id. */
  private String flatten(JsonObject obj, List<NQuad> out)
    throws RecordParseException {
    String subject = nodeId(obj);
    for (Map.Entry<String, JsonElement> field : obj.entrySet()) {
      String key = field.getKey();
      if (key.equals(UID_FIELD)) continue;

      String predicate = key;
      String lang = "";
      int at = key.lastIndexOf('@');
      if (at > 0) {
        predicate = key.substring(0, at);
        lang = key.substring(at + 1);
      }

      JsonElement value = field.getValue();
      if (value.isJsonArray()) {
        for (JsonElement item : value.getAsJsonArray()) {
          if (item.isJsonArray()) {
            throw new RecordParseException(
              "nested arrays are not supported: " + key
            );
          }
          emit(subject, predicate, lang, item, out);
        }
      } else {
        emit(subject, predicate, lang, value, out);
      }
    }
    return subject;
  }

  private void emit(
    String subject,
    String predicate,
    String lang,
    JsonElement value,
    List<NQuad> out
  ) throws RecordParseException {
    if (value.isJsonNull()) {
      return;
    }
    if (value.isJsonObject()) {
      String child = flatten(value.getAsJsonObject(), out);
      out.add(NQuad.edge(subject, predicate, child, ""));
      return;
    }
    JsonPrimitive p = value.getAsJsonPrimitive();
    ValueType type;
    if (p.isBoolean()) {
      type = ValueType.BOOL;
    } else if (p.isNumber()) {
      type = isIntegral(p) ? ValueType.INT : ValueType.FLOAT;
    } else {
      type = ValueType.DEFAULT;
    }
    if (!lang.isEmpty() && type != ValueType.DEFAULT) {
      throw new RecordParseException(
        "language tag on non-string value of " + predicate
      );
    }
    out.add(NQuad.literal(subject, predicate, p.getAsString(), type, lang, ""));
  }

  private static String nodeId(JsonObject obj) throws RecordParseException {
    JsonElement uid = obj.get(UID_FIELD);
    if (uid == null || uid.isJsonNull()) {
      return BLANK_PREFIX + BLANK_IDS.getAndIncrement();
    }
    if (!uid.isJsonPrimitive()) {
      throw new RecordParseException("uid must be a string or number: " + uid);
    }
    String id = uid.getAsString();
    if (id.isEmpty()) {
      throw new RecordParseException("empty uid");
    }
    return id;
  }

  private static boolean isIntegral(JsonPrimitive p) {
    String s = p.getAsString();
    return s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0;
  }
}
