package com.scholary.lyricsync.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A transcript record as produced by the transcription step.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "metadata": {
 *     "artist": "Artist",
 *     "track": "Track",
 *     "original_lyrics": "First line\nSecond line",
 *     "timing_info": {"start_offset": 0.0}
 *   },
 *   "words": [
 *     {"word": "first", "start": 1.0, "end": 1.5, "confidence": 0.93, "original_word": "first"}
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptDocument(Metadata metadata, List<WordEntry> words) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metadata(
      String artist,
      String track,
      @JsonProperty("original_lyrics") String originalLyrics,
      @JsonProperty("timing_info") TimingInfo timingInfo) {

    /** Seconds to add to every rendered timestamp, 0 when absent. */
    public double startOffset() {
      if (timingInfo == null || timingInfo.startOffset() == null) {
        return 0.0;
      }
      return timingInfo.startOffset();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TimingInfo(@JsonProperty("start_offset") Double startOffset) {}

  /**
   * One transcribed word. {@code confidence} and {@code original_word} are optional.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WordEntry(
      String word,
      Double start,
      Double end,
      Double confidence,
      @JsonProperty("original_word") String originalWord) {}
}
