package com.scholary.lyricsync.api;

import com.scholary.lyricsync.align.AlignmentResult;
import com.scholary.lyricsync.service.LyricSyncService;
import com.scholary.lyricsync.transcript.TranscriptDocument;
import com.scholary.lyricsync.transcript.TranscriptReader;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for lyrics alignment.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Aligning a transcript record to a word-timed track (JSON)
 *   <li>Aligning a transcript record straight to LRC text
 * </ul>
 *
 * <p>Alignment is synchronous; a song's record is small and the computation is in-memory. Request
 * bodies go through {@link TranscriptReader}, so malformed JSON and missing fields are reported
 * the same way.
 */
@RestController
@Tag(name = "Alignment", description = "Transcript to lyrics alignment API")
public class AlignmentController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentController.class);

  private final LyricSyncService lyricSyncService;
  private final TranscriptReader transcriptReader;

  public AlignmentController(LyricSyncService lyricSyncService, TranscriptReader transcriptReader) {
    this.lyricSyncService = lyricSyncService;
    this.transcriptReader = transcriptReader;
  }

  /** Align a transcript record and return the timing track. */
  @PostMapping(
      value = "/api/align",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Align transcript",
      description = "Align a word-level transcript against its lyrics and return per-word timing",
      requestBody =
          @RequestBody(
              content = @Content(schema = @Schema(implementation = TranscriptDocument.class))))
  public ResponseEntity<AlignmentResponse> align(InputStream body) throws IOException {
    TranscriptDocument document = transcriptReader.read(body);
    LOGGER.info("Alignment request: words={}", document.words().size());
    AlignmentResult result = lyricSyncService.align(document);
    return ResponseEntity.ok(AlignmentResponse.from(result));
  }

  /** Align a transcript record and return LRC text. */
  @PostMapping(
      value = "/api/align/lrc",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Align transcript to LRC",
      description = "Align a word-level transcript against its lyrics and return enhanced LRC",
      requestBody =
          @RequestBody(
              content = @Content(schema = @Schema(implementation = TranscriptDocument.class))))
  public ResponseEntity<String> alignToLrc(InputStream body) throws IOException {
    TranscriptDocument document = transcriptReader.read(body);
    LOGGER.info("LRC request: words={}", document.words().size());
    return ResponseEntity.ok()
        .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
        .body(lyricSyncService.alignToLrc(document));
  }
}
