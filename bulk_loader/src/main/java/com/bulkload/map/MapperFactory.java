package com.bulkload.map;

import com.bulkload.LoaderState;
import com.bulkload.xidmap.XidMap;

/** Creates the mapper owned by one worker. */
@FunctionalInterface
public interface MapperFactory {
  ChunkMapper create(LoaderState state, XidMap xids);
}
