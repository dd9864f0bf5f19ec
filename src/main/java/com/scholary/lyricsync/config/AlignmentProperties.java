package com.scholary.lyricsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning knobs for lyrics alignment.
 *
 * <p>Every threshold the matcher and interpolator use lives here so callers can override it from
 * application.yml or build their own instance in code.
 */
@ConfigurationProperties(prefix = "alignment")
@Validated
public record AlignmentProperties(
    @Valid @DefaultValue MatchingProperties matching,
    @Valid @DefaultValue InterpolationProperties interpolation,
    @Valid @DefaultValue OutputProperties output,
    @Valid @DefaultValue CacheProperties cache) {

  /**
   * Window search and scoring.
   *
   * @param minScore a line is matched when its best window scores at least this
   * @param maxLookaheadWords how many window start positions past the cursor are tried
   * @param minWindowDelta smallest window size relative to the line's word count
   * @param maxWindowDelta largest window size relative to the line's word count
   * @param exactMatchMultiplier applied to the similarity of an exact word pair, clamped at 1.0
   * @param wholeLineMultiplier applied to the window score when every line word matched exactly
   * @param repeatedLookaheadWords lookahead for lines whose text occurs more than once
   * @param repeatThresholdStep how much {@code minScore} drops for each earlier occurrence of a
   *     repeated line; 0 keeps one threshold for every line
   * @param repeatMinScore floor for the lowered threshold of repeated lines
   */
  public record MatchingProperties(
      @DefaultValue("0.4") @DecimalMin("0.0") double minScore,
      @DefaultValue("100") @Positive int maxLookaheadWords,
      @DefaultValue("-2") @Max(0) int minWindowDelta,
      @DefaultValue("4") @Min(0) int maxWindowDelta,
      @DefaultValue("2.0") @DecimalMin("1.0") double exactMatchMultiplier,
      @DefaultValue("1.2") @DecimalMin("1.0") double wholeLineMultiplier,
      @DefaultValue("150") @Positive int repeatedLookaheadWords,
      @DefaultValue("0.0") @DecimalMin("0.0") double repeatThresholdStep,
      @DefaultValue("0.35") @DecimalMin("0.0") double repeatMinScore) {}

  /**
   * Timing synthesis for unmatched lines.
   *
   * @param gapReserveRatio share of a run's span kept as silence between lines
   * @param breakRatio a span longer than this multiple of the natural estimate holds a break
   * @param estimatedWordSeconds natural sung duration of one word
   * @param defaultSpanSeconds track length assumed when the transcript has no usable word
   */
  public record InterpolationProperties(
      @DefaultValue("0.10") @DecimalMin("0.0") @DecimalMax("0.9") double gapReserveRatio,
      @DefaultValue("3.0") @DecimalMin("1.0") double breakRatio,
      @DefaultValue("0.5") @Positive double estimatedWordSeconds,
      @DefaultValue("300.0") @Positive double defaultSpanSeconds) {}

  /**
   * Rendering of the timing track.
   *
   * @param breakMarkerSeconds silences at least this long are reported as instrumental breaks
   * @param instrumentalMarkers whether LRC output shows instrumental breaks
   */
  public record OutputProperties(
      @DefaultValue("5.0") @Positive double breakMarkerSeconds,
      @DefaultValue("true") boolean instrumentalMarkers) {}

  public record CacheProperties(
      @DefaultValue("500") @Positive int maxSize,
      @DefaultValue("24") @Positive int ttlHours) {}

  /** The documented defaults, for use outside a Spring context. */
  public static AlignmentProperties defaults() {
    return new AlignmentProperties(
        new MatchingProperties(0.4, 100, -2, 4, 2.0, 1.2, 150, 0.0, 0.35),
        new InterpolationProperties(0.10, 3.0, 0.5, 300.0),
        new OutputProperties(5.0, true),
        new CacheProperties(500, 24));
  }
}
