package com.scholary.lyricsync.align;

/**
 * Thrown when an assembled timing track breaks ordering or completeness.
 *
 * <p>This signals a defect in the alignment passes, not bad input. No output is produced, because
 * an invalid timing track is worse than none.
 */
public class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
