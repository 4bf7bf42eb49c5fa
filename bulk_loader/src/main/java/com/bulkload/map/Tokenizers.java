package com.bulkload.map;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Index tokenizers named in {@code @index(...)}. */
public final class Tokenizers {

  public static final byte TERM = 0x01;
  public static final byte EXACT = 0x02;

  private Tokenizers() {} // Utility class

  public static byte id(String name) {
    switch (name) {
      case "exact":
        return EXACT;
      case "term":
        return TERM;
      default:
        throw new IllegalArgumentException("unknown tokenizer " + name);
    }
  }

  /** Distinct index tokens of {@code value} under tokenizer {@code name}. */
  public static List<String> tokens(String name, String value) {
    if (id(name) == EXACT) {
      return List.of(value);
    }
    // term: lower-cased runs of letters and digits
    Set<String> terms = new LinkedHashSet<>();
    int start = -1;
    for (int i = 0; i <= value.length(); i++) {
      boolean word =
        i < value.length() && Character.isLetterOrDigit(value.charAt(i));
      if (word && start < 0) {
        start = i;
      } else if (!word && start >= 0) {
        terms.add(value.substring(start, i).toLowerCase(Locale.ROOT));
        start = -1;
      }
    }
    return new ArrayList<>(terms);
  }
}
