package com.bulkload.zero;

/** A contiguous block {@code [startId, endId]} handed out by zero. */
public final class AssignedIds {

  private final long startId;
  private final long endId;

  public AssignedIds(long startId, long endId) {
    if (endId < startId) {
      throw new IllegalArgumentException(
        "empty id range [" + startId + ", " + endId + "]"
      );
    }
    this.startId = startId;
    this.endId = endId;
  }

  public long getStartId() {
    return startId;
  }

  public long getEndId() {
    return endId;
  }

  public long size() {
    return endId - startId + 1;
  }

  @Override
  public String toString() {
    return "AssignedIds[" + startId + ", " + endId + "]";
  }
}
