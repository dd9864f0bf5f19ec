package com.scholary.lyricsync.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lyricsync.transcript.TranscriptDocument.Metadata;
import com.scholary.lyricsync.transcript.TranscriptDocument.WordEntry;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.stereotype.Component;

/**
 * Reads and validates transcript records.
 *
 * <p>Validation only rejects records that cannot be aligned at all (see
 * {@link InvalidTranscriptException}); poor timing inside the word list is left to the
 * {@link TranscriptSanitizer}.
 */
@Component
public class TranscriptReader {

  private final ObjectMapper objectMapper;

  public TranscriptReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Read a transcript record from a JSON stream.
   *
   * @throws IOException if the stream cannot be read
   * @throws InvalidTranscriptException if the content is not a valid transcript record
   */
  public TranscriptDocument read(InputStream in) throws IOException {
    TranscriptDocument document;
    try {
      document = objectMapper.readValue(in, TranscriptDocument.class);
    } catch (JsonProcessingException e) {
      throw new InvalidTranscriptException("Malformed transcript record: " + e.getOriginalMessage(), e);
    }
    validate(document);
    return document;
  }

  /**
   * Check that a record carries everything alignment needs.
   *
   * @throws InvalidTranscriptException naming the first missing or malformed field
   */
  public void validate(TranscriptDocument document) {
    if (document == null) {
      throw new InvalidTranscriptException("Transcript record is empty");
    }
    Metadata metadata = document.metadata();
    if (metadata == null) {
      throw new InvalidTranscriptException("Transcript record has no metadata");
    }
    if (isBlank(metadata.artist())) {
      throw new InvalidTranscriptException("metadata.artist is required");
    }
    if (isBlank(metadata.track())) {
      throw new InvalidTranscriptException("metadata.track is required");
    }
    if (isBlank(metadata.originalLyrics())) {
      throw new InvalidTranscriptException("metadata.original_lyrics is required and cannot be blank");
    }
    if (metadata.timingInfo() != null && metadata.timingInfo().startOffset() != null
        && !Double.isFinite(metadata.timingInfo().startOffset())) {
      throw new InvalidTranscriptException("metadata.timing_info.start_offset must be a number");
    }
    if (document.words() == null) {
      throw new InvalidTranscriptException("Transcript record has no words array");
    }
    for (int i = 0; i < document.words().size(); i++) {
      WordEntry entry = document.words().get(i);
      if (entry == null) {
        throw new InvalidTranscriptException("words[" + i + "] is null");
      }
      if (entry.word() == null) {
        throw new InvalidTranscriptException("words[" + i + "].word is required");
      }
      if (entry.start() == null || entry.end() == null) {
        throw new InvalidTranscriptException("words[" + i + "] needs start and end");
      }
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
