package com.bulkload.map;

import com.bulkload.schema.ValueType;

/**
 * One parsed edge. The object is either a node id ({@link #getObjectId()})
 * or a literal ({@link #getObjectValue()} with its type and language).
 */
public final class NQuad {

  private final String subject;
  private final String predicate;
  private final String objectId;
  private final String objectValue;
  private final ValueType objectType;
  private final String lang;
  private final String label;

  private NQuad(
    String subject,
    String predicate,
    String objectId,
    String objectValue,
    ValueType objectType,
    String lang,
    String label
  ) {
    this.subject = subject;
    this.predicate = predicate;
    this.objectId = objectId;
    this.objectValue = objectValue;
    this.objectType = objectType;
    this.lang = lang;
    this.label = label;
  }

  public static NQuad edge(String subject, String predicate, String objectId, String label) {
    return new NQuad(subject, predicate, objectId, null, ValueType.UID, "", label);
  }

  public static NQuad literal(
    String subject,
    String predicate,
    String value,
    ValueType type,
    String lang,
    String label
  ) {
    return new NQuad(subject, predicate, null, value, type, lang, label);
  }

  public String getSubject() {
    return subject;
  }

  public String getPredicate() {
    return predicate;
  }

  public boolean isUidEdge() {
    return objectId != null;
  }

  public String getObjectId() {
    return objectId;
  }

  public String getObjectValue() {
    return objectValue;
  }

  /** {@link ValueType#UID} for node edges, else the literal's declared type. */
  public ValueType getObjectType() {
    return objectType;
  }

  /** Language tag, empty if none. */
  public String getLang() {
    return lang;
  }

  /** Graph label, empty if none. Carried but not stored. */
  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    String obj = isUidEdge()
      ? "<" + objectId + ">"
      : "\"" + objectValue + "\"" + (lang.isEmpty() ? "" : "@" + lang);
    return "<" + subject + "> <" + predicate + "> " + obj + " .";
  }
}
