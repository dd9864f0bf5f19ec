package com.scholary.lyricsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lyricsync.align.AlignmentResult;
import com.scholary.lyricsync.align.LyricsAligner;
import com.scholary.lyricsync.cache.AlignmentCache;
import com.scholary.lyricsync.cache.AlignmentCacheStats;
import com.scholary.lyricsync.lrc.LrcWriter;
import com.scholary.lyricsync.transcript.InvalidTranscriptException;
import com.scholary.lyricsync.transcript.TranscriptDocument;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers: aligns transcript records, reusing cached results, and renders LRC.
 */
@Service
public class LyricSyncService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LyricSyncService.class);

  private final LyricsAligner aligner;
  private final AlignmentCache alignmentCache;
  private final LrcWriter lrcWriter;
  private final ObjectMapper objectMapper;

  public LyricSyncService(
      LyricsAligner aligner,
      AlignmentCache alignmentCache,
      LrcWriter lrcWriter,
      ObjectMapper objectMapper) {
    this.aligner = aligner;
    this.alignmentCache = alignmentCache;
    this.lrcWriter = lrcWriter;
    this.objectMapper = objectMapper;
  }

  /**
   * Align a transcript record, or return the cached result for an identical record.
   *
   * @param document the transcript record
   * @return the alignment result
   */
  public AlignmentResult align(TranscriptDocument document) {
    AtomicBoolean aligned = new AtomicBoolean();
    AlignmentResult result =
        alignmentCache.get(
            cacheKey(document),
            key -> {
              aligned.set(true);
              return aligner.align(document);
            });

    if (!aligned.get()) {
      LOGGER.info(
          "Using cached alignment for {} - {}",
          document.metadata().artist(),
          document.metadata().track());
    }
    AlignmentCacheStats stats = alignmentCache.stats();
    LOGGER.debug(
        "Alignment cache: size={}, hitRate={}, evictions={}",
        stats.size(),
        String.format("%.2f", stats.hitRate()),
        stats.evictions());
    return result;
  }

  /**
   * Align a transcript record and render it as LRC.
   *
   * @param document the transcript record
   * @return LRC text
   */
  public String alignToLrc(TranscriptDocument document) {
    return lrcWriter.write(align(document));
  }

  private String cacheKey(TranscriptDocument document) {
    try {
      return AlignmentCache.generateKey(objectMapper.writeValueAsBytes(document));
    } catch (JsonProcessingException e) {
      throw new InvalidTranscriptException("Transcript record cannot be serialized", e);
    }
  }
}
