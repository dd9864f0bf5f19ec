package com.scholary.lyricsync.align;

/**
 * Position in the transcript before which every word is committed to a matched line.
 *
 * <p>Only moves forward. One instance belongs to one alignment run and is never shared.
 */
public final class TranscriptCursor {

  private final int limit;
  private int position;

  public TranscriptCursor(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("Transcript length cannot be negative");
    }
    this.limit = limit;
  }

  public int position() {
    return position;
  }

  public boolean exhausted() {
    return position >= limit;
  }

  /**
   * Commit every word before {@code newPosition}.
   *
   * @throws IllegalStateException if that would move the cursor backwards or past the end
   */
  public void advanceTo(int newPosition) {
    if (newPosition < position) {
      throw new IllegalStateException(
          "Cursor cannot rewind from " + position + " to " + newPosition);
    }
    if (newPosition > limit) {
      throw new IllegalStateException(
          "Cursor cannot move to " + newPosition + " past transcript end " + limit);
    }
    position = newPosition;
  }
}
