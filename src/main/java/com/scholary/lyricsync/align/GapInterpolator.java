package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.config.AlignmentProperties.InterpolationProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Second pass of alignment: synthesizes timing for lines the matcher could not place.
 *
 * <p>Each maximal run of unmatched lines is laid out between the previous anchor's end (or the
 * stream start) and the next anchor's start (or the stream end):
 *
 * <ul>
 *   <li>a share of the span ({@code gapReserveRatio}) is split evenly into {@code k + 1} gaps
 *       around and between the {@code k} lines
 *   <li>the rest is shared among the lines in proportion to their word counts
 *   <li>each line's share is split evenly among its words
 * </ul>
 *
 * <p>When a run is bounded by at least one anchor and its span exceeds {@code breakRatio} times
 * the natural duration of its words, the span holds an instrumental break. The lines are then
 * packed into the natural duration, next to the previous anchor (or before the first anchor for a
 * lead-in run), and the remaining time is left empty.
 */
@Component
public class GapInterpolator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GapInterpolator.class);
  private static final StructuredLogger EVENTS = new StructuredLogger(LOGGER);

  private final InterpolationProperties interpolation;

  public GapInterpolator(AlignmentProperties properties) {
    this.interpolation = properties.interpolation();
  }

  /**
   * Time every unmatched line.
   *
   * @param lines all lyrics lines, in order
   * @param results the matching pass output, one per line in the same order
   * @param bounds the transcript's time range
   * @return timed lines for the unmatched lines only, in line order
   */
  public List<TimedLine> interpolate(
      List<LyricsLine> lines, List<MatchResult> results, StreamBounds bounds) {
    if (lines.size() != results.size()) {
      throw new IllegalArgumentException(
          "Expected one match result per line: " + lines.size() + " lines, "
              + results.size() + " results");
    }

    List<TimedLine> timed = new ArrayList<>();
    int index = 0;
    while (index < results.size()) {
      if (results.get(index).matched()) {
        index++;
        continue;
      }
      int runStart = index;
      while (index < results.size() && !results.get(index).matched()) {
        index++;
      }
      Optional<Anchor> previous =
          runStart > 0 ? results.get(runStart - 1).anchor() : Optional.empty();
      Optional<Anchor> next =
          index < results.size() ? results.get(index).anchor() : Optional.empty();
      timed.addAll(fillRun(lines.subList(runStart, index), previous, next, bounds));
    }
    return timed;
  }

  /**
   * Time one run of consecutive unmatched lines.
   *
   * @param run the unmatched lines
   * @param previous anchor before the run, empty at the stream start
   * @param next anchor after the run, empty at the stream end
   * @param bounds the transcript's time range
   * @return one timed line per run line
   */
  public List<TimedLine> fillRun(
      List<LyricsLine> run, Optional<Anchor> previous, Optional<Anchor> next, StreamBounds bounds) {
    if (run.isEmpty()) {
      return List.of();
    }
    int totalWords = run.stream().mapToInt(LyricsLine::wordCount).sum();
    double estimate = totalWords * interpolation.estimatedWordSeconds();

    double from = previous.map(Anchor::end).orElse(bounds.start());
    double to;
    if (next.isPresent()) {
      to = Math.max(from, next.get().start());
    } else {
      to = Math.max(from, bounds.end());
      if (previous.isPresent() && to - from < estimate) {
        // Nothing bounds the tail of the track, so the lines may run past the last word.
        to = from + estimate;
      }
    }
    double span = to - from;

    boolean anchored = previous.isPresent() || next.isPresent();
    boolean breakDetected = anchored && span > interpolation.breakRatio() * estimate;

    double fillStart = from;
    double fill = span;
    if (breakDetected) {
      fill = estimate;
      fillStart = previous.isPresent() ? from : to - estimate;
    }

    Provenance provenance = breakDetected ? Provenance.BREAK_ADJACENT : Provenance.INTERPOLATED;
    List<TimedLine> timed = layout(run, totalWords, fillStart, fill, from, to, provenance);

    EVENTS.logGapInterpolated(
        run.get(0).index(), run.get(run.size() - 1).index(), from, to, breakDetected);
    return timed;
  }

  private List<TimedLine> layout(
      List<LyricsLine> run,
      int totalWords,
      double fillStart,
      double fill,
      double lowerBound,
      double upperBound,
      Provenance provenance) {
    double reserve = interpolation.gapReserveRatio();
    double gap = fill * reserve / (run.size() + 1);
    double wordsSpan = fill * (1.0 - reserve);

    List<TimedLine> timed = new ArrayList<>(run.size());
    double cursor = fillStart + gap;
    for (LyricsLine line : run) {
      int count = line.wordCount();
      double lineDuration = wordsSpan * count / totalWords;
      double perWord = lineDuration / count;

      List<TimedWord> words = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        double start = cursor + i * perWord;
        double end = i == count - 1 ? cursor + lineDuration : cursor + (i + 1) * perWord;
        start = clamp(start, lowerBound, upperBound);
        end = clamp(end, start, upperBound);
        words.add(new TimedWord(line.words().get(i), start, end));
      }
      timed.add(new TimedLine(line.index(), words, provenance));
      cursor += lineDuration + gap;
    }
    LOGGER.trace("Laid out {} lines over [{}, {}]", run.size(), fillStart, fillStart + fill);
    return timed;
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
