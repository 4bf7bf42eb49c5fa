package com.bulkload.schema;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/** Scalar types a predicate may hold, plus {@link #UID} for node edges. */
public enum ValueType {
  DEFAULT(0, "default"),
  STRING(1, "string"),
  INT(2, "int"),
  FLOAT(3, "float"),
  BOOL(4, "bool"),
  DATETIME(5, "datetime"),
  UID(6, "uid");

  private final byte id;
  private final String schemaName;

  ValueType(int id, String schemaName) {
    this.id = (byte) id;
    this.schemaName = schemaName;
  }

  public byte id() {
    return id;
  }

  public String schemaName() {
    return schemaName;
  }

  public static ValueType fromName(String name) {
    for (ValueType t : values()) {
      if (t.schemaName.equals(name)) return t;
    }
    return null;
  }

  public static ValueType fromId(byte id) {
    for (ValueType t : values()) {
      if (t.id == id) return t;
    }
    throw new IllegalArgumentException("unknown value type id " + id);
  }

  /**
   * Checks that {@code value} is a valid literal of this type.
   *
   * @throws IllegalArgumentException if it is not
   */
  public void validate(String value) {
    try {
      switch (this) {
        case INT:
          Long.parseLong(value.trim());
          break;
        case FLOAT:
          Double.parseDouble(value.trim());
          break;
        case BOOL:
          if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
            throw new IllegalArgumentException("not a bool: " + value);
          }
          break;
        case DATETIME:
          parseDateTime(value.trim());
          break;
        case UID:
          throw new IllegalArgumentException("literal given for uid type: " + value);
        default:
          break;
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a valid " + schemaName + ": " + value, e);
    }
  }

  private static void parseDateTime(String v) {
    try {
      OffsetDateTime.parse(v);
      return;
    } catch (DateTimeParseException ignored) {
      // next layout
    }
    try {
      LocalDateTime.parse(v);
      return;
    } catch (DateTimeParseException ignored) {
      // next layout
    }
    try {
      LocalDate.parse(v);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("not a valid datetime: " + v, e);
    }
  }
}
