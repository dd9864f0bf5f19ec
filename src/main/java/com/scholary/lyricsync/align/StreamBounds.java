package com.scholary.lyricsync.align;

/**
 * Time range covered by the transcript, used to bound runs that have no anchor on one side.
 *
 * @param start track start, normally 0
 * @param end end of the last usable transcript word, or the configured default span
 */
public record StreamBounds(double start, double end) {

  public StreamBounds {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }
}
