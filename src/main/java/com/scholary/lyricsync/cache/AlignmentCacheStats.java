package com.scholary.lyricsync.cache;

/** Snapshot of the alignment cache counters. */
public record AlignmentCacheStats(long size, long hits, long misses, long evictions) {

  public double hitRate() {
    long requests = hits + misses;
    return requests == 0 ? 0.0 : (double) hits / requests;
  }
}
