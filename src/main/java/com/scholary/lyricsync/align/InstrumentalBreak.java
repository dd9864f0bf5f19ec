package com.scholary.lyricsync.align;

/**
 * A stretch of the track with no lyrics, long enough to mark in the output.
 *
 * @param start end of the preceding line, or 0 for a lead-in
 * @param end start of the following line
 */
public record InstrumentalBreak(double start, double end) {

  public double duration() {
    return end - start;
  }
}
