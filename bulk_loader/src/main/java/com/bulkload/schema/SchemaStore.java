package com.bulkload.schema;

import com.bulkload.reduce.ShardStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Predicate schemas for the run. Starts from the schema file; predicates
 * first met in data are added with an inferred type. Safe for concurrent use
 * by all mappers.
 */
public class SchemaStore {

  private final ConcurrentHashMap<String, SchemaEntry> entries =
    new ConcurrentHashMap<>();

  public SchemaStore(List<SchemaEntry> initial) {
    for (SchemaEntry e : initial) {
      entries.put(e.getPredicate(), e);
    }
  }

  /** Adds {@code e} unless the predicate already has a schema. */
  public void addIfAbsent(SchemaEntry e) {
    entries.putIfAbsent(e.getPredicate(), e);
  }

  public SchemaEntry get(String predicate) {
    return entries.get(predicate);
  }

  /**
   * Schema of {@code predicate}, inferring one from the first value seen if
   * it has none: uid for node objects, default for literals.
   */
  public SchemaEntry getOrInfer(String predicate, boolean uidObject) {
    return entries.computeIfAbsent(
      predicate,
      p -> SchemaEntry.inferred(p, uidObject)
    );
  }

  /** All entries ordered by predicate. */
  public List<SchemaEntry> entries() {
    List<SchemaEntry> out = new ArrayList<>(entries.values());
    out.sort(Comparator.comparing(SchemaEntry::getPredicate));
    return out;
  }

  /** Stamps the complete schema into an output store. */
  public void write(ShardStore store) throws IOException {
    store.writeSchema(entries());
  }
}
