package com.scholary.lyricsync.api;

import com.scholary.lyricsync.align.InvariantViolationException;
import com.scholary.lyricsync.transcript.InvalidTranscriptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps alignment failures to HTTP responses.
 *
 * <p>Bad input is the caller's problem (400); an invariant violation is ours (500).
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidTranscriptException.class)
  public ResponseEntity<ErrorResponse> handleInvalidTranscript(InvalidTranscriptException ex) {
    LOGGER.warn("Invalid transcript: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "invalid_transcript", ex.getMessage());
  }

  @ExceptionHandler(InvariantViolationException.class)
  public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException ex) {
    LOGGER.error("Alignment produced an invalid track: {}", ex.getMessage(), ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "invariant_violation", ex.getMessage());
  }

  private static ResponseEntity<ErrorResponse> error(
      HttpStatus status, String error, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ErrorResponse(error, message));
  }
}
