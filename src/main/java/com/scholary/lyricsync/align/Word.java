package com.scholary.lyricsync.align;

/**
 * A single transcribed word with timing and recognition confidence.
 *
 * <p>Times are in seconds from the start of the track. {@code originalText} is the provider's
 * uncorrected form when it supplied one, otherwise {@code null}.
 */
public record Word(String text, String originalText, double start, double end, double confidence) {

  public Word {
    if (text == null) {
      throw new IllegalArgumentException("Word text cannot be null");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("Confidence must be within [0, 1]");
    }
  }

  /** A word with no original form and the default confidence of zero. */
  public Word(String text, double start, double end) {
    this(text, null, start, end, 0.0);
  }

  public Word(String text, double start, double end, double confidence) {
    this(text, null, start, end, confidence);
  }

  public double duration() {
    return end - start;
  }
}
