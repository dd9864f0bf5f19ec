package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges matched and interpolated lines into the final timing track and validates it.
 *
 * <p>Validation checks that every lyrics line appears exactly once, in order, with its word count,
 * and that timing never goes backwards: within a word, between words of a line, and between
 * lines. Any failure throws {@link InvariantViolationException}.
 */
@Component
public class TimingAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimingAssembler.class);
  private static final StructuredLogger EVENTS = new StructuredLogger(LOGGER);

  // Absorbs floating point noise from interpolation arithmetic.
  private static final double TOLERANCE = 1e-9;

  private final double breakMarkerSeconds;

  public TimingAssembler(AlignmentProperties properties) {
    this.breakMarkerSeconds = properties.output().breakMarkerSeconds();
  }

  /**
   * Assemble the timing track.
   *
   * @param lines all lyrics lines, in order
   * @param results the matching pass output
   * @param interpolated the interpolation pass output
   * @return the validated track
   * @throws InvariantViolationException if the merged lines are incomplete or out of order
   */
  public TimingTrack assemble(
      List<LyricsLine> lines, List<MatchResult> results, List<TimedLine> interpolated) {
    TimedLine[] byIndex = new TimedLine[lines.size()];

    for (MatchResult result : results) {
      if (result.matched()) {
        place(byIndex, new TimedLine(result.lineIndex(), result.words(), Provenance.MATCHED));
      }
    }
    for (TimedLine line : interpolated) {
      place(byIndex, line);
    }

    List<TimedLine> merged = new ArrayList<>(lines.size());
    for (int i = 0; i < byIndex.length; i++) {
      if (byIndex[i] == null) {
        throw new InvariantViolationException("Line " + i + " has no timing");
      }
      merged.add(byIndex[i]);
    }

    validate(lines, merged);
    return new TimingTrack(merged, findBreaks(merged));
  }

  /**
   * Check completeness and monotonicity of a timing track.
   *
   * @throws InvariantViolationException on the first violation found
   */
  public void validate(List<LyricsLine> lines, List<TimedLine> track) {
    if (track.size() != lines.size()) {
      throw new InvariantViolationException(
          "Track has " + track.size() + " lines, lyrics have " + lines.size());
    }
    double previousEnd = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < track.size(); i++) {
      TimedLine line = track.get(i);
      if (line.lineIndex() != i) {
        throw new InvariantViolationException(
            "Line at position " + i + " has index " + line.lineIndex());
      }
      if (line.words().size() != lines.get(i).wordCount()) {
        throw new InvariantViolationException(
            "Line " + i + " has " + line.words().size() + " timed words, lyrics have "
                + lines.get(i).wordCount());
      }
      for (int w = 0; w < line.words().size(); w++) {
        TimedWord word = line.words().get(w);
        if (!Double.isFinite(word.start()) || !Double.isFinite(word.end()) || word.start() < 0) {
          throw new InvariantViolationException(
              "Line " + i + " word " + w + " has invalid time " + word.start() + "-" + word.end());
        }
        if (word.start() < previousEnd - TOLERANCE) {
          throw new InvariantViolationException(
              "Line " + i + " word " + w + " starts at " + word.start()
                  + " before the previous word ends at " + previousEnd);
        }
        previousEnd = word.end();
      }
    }
  }

  private List<InstrumentalBreak> findBreaks(List<TimedLine> track) {
    List<InstrumentalBreak> breaks = new ArrayList<>();
    double previousEnd = 0.0;
    for (TimedLine line : track) {
      if (line.start() - previousEnd >= breakMarkerSeconds) {
        InstrumentalBreak gap = new InstrumentalBreak(previousEnd, line.start());
        EVENTS.logInstrumentalBreak(gap.start(), gap.end());
        breaks.add(gap);
      }
      previousEnd = line.end();
    }
    return breaks;
  }

  private static void place(TimedLine[] byIndex, TimedLine line) {
    int index = line.lineIndex();
    if (index < 0 || index >= byIndex.length) {
      throw new InvariantViolationException("Timed line index " + index + " is out of range");
    }
    if (byIndex[index] != null) {
      throw new InvariantViolationException("Line " + index + " was timed twice");
    }
    byIndex[index] = line;
  }
}
