package com.scholary.lyricsync.transcript;

/**
 * Exception thrown when a transcript record cannot be aligned at all.
 *
 * <p>Covers unreadable JSON, missing metadata and empty lyrics. The caller gets no partial output.
 */
public class InvalidTranscriptException extends RuntimeException {

  public InvalidTranscriptException(String message) {
    super(message);
  }

  public InvalidTranscriptException(String message, Throwable cause) {
    super(message, cause);
  }
}
