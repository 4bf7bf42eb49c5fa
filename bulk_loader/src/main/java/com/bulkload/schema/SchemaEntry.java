package com.bulkload.schema;

import java.util.Collections;
import java.util.List;

/** Schema of one predicate. Immutable. */
public final class SchemaEntry {

  private final String predicate;
  private final ValueType type;
  private final boolean list;
  private final List<String> tokenizers;
  private final boolean reverse;
  private final boolean explicit;

  public SchemaEntry(
    String predicate,
    ValueType type,
    boolean list,
    List<String> tokenizers,
    boolean reverse,
    boolean explicit
  ) {
    this.predicate = predicate;
    this.type = type;
    this.list = list;
    this.tokenizers = Collections.unmodifiableList(tokenizers);
    this.reverse = reverse;
    this.explicit = explicit;
  }

  /** Entry for a predicate only seen in data. */
  static SchemaEntry inferred(String predicate, boolean uidObject) {
    return new SchemaEntry(
      predicate,
      uidObject ? ValueType.UID : ValueType.DEFAULT,
      uidObject,
      Collections.emptyList(),
      false,
      false
    );
  }

  public String getPredicate() {
    return predicate;
  }

  public ValueType getType() {
    return type;
  }

  public boolean isList() {
    return list;
  }

  public List<String> getTokenizers() {
    return tokenizers;
  }

  public boolean isReverse() {
    return reverse;
  }

  /** True if declared in the schema file rather than inferred from data. */
  public boolean isExplicit() {
    return explicit;
  }

  /** Schema file syntax, e.g. {@code name: string @index(exact) .} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(predicate).append(": ");
    sb.append(list ? "[" + type.schemaName() + "]" : type.schemaName());
    if (!tokenizers.isEmpty()) {
      sb.append(" @index(").append(String.join(", ", tokenizers)).append(")");
    }
    if (reverse) {
      sb.append(" @reverse");
    }
    return sb.append(" .").toString();
  }
}
