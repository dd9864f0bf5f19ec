package com.scholary.lyricsync.align;

/** A lyrics word with its assigned time span in seconds. */
public record TimedWord(String text, double start, double end) {

  public TimedWord {
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }
}
