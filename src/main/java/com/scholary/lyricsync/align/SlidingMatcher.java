package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.config.AlignmentProperties.MatchingProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * First pass of alignment: walks the lyrics lines in order and finds each one in the transcript.
 *
 * <p>For every line, windows of {@code N + minWindowDelta} to {@code N + maxWindowDelta} words are
 * tried at each start position from the cursor up to the lookahead bound. The best window wins; if
 * it reaches the threshold the line is matched and the cursor moves past the window, otherwise the
 * line is left for interpolation and the cursor stays put.
 *
 * <p>Matched lines keep their original spelling and take the transcript's timing.
 */
@Component
public class SlidingMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SlidingMatcher.class);
  private static final StructuredLogger EVENTS = new StructuredLogger(LOGGER);

  // Scores closer than this are ties; the earlier candidate is kept.
  private static final double SCORE_EPSILON = 1e-9;

  private final WindowScorer windowScorer;
  private final MatchingProperties matching;

  public SlidingMatcher(WindowScorer windowScorer, AlignmentProperties properties) {
    this.windowScorer = windowScorer;
    this.matching = properties.matching();
  }

  /**
   * Match every line against the transcript, starting from a fresh cursor.
   *
   * @param lines the lyrics lines in order
   * @param transcript usable transcript words in time order
   * @return one result per line, in line order
   */
  public List<MatchResult> match(List<LyricsLine> lines, List<Word> transcript) {
    return match(lines, transcript, RepeatedLines.detect(lines));
  }

  /**
   * Match every line, searching further ahead for lines that repeat.
   *
   * <p>A later occurrence of a repeated line has to skip whatever lies between it and the
   * previous occurrence, so it gets {@code repeatedLookaheadWords} instead of the normal bound.
   * When {@code repeatThresholdStep} is set, its threshold also drops by that step per earlier
   * occurrence, down to {@code repeatMinScore}.
   *
   * @param lines the lyrics lines in order
   * @param transcript usable transcript words in time order
   * @param repeats repeated lines among {@code lines}
   * @return one result per line, in line order
   */
  public List<MatchResult> match(
      List<LyricsLine> lines, List<Word> transcript, RepeatedLines repeats) {
    TranscriptCursor cursor = new TranscriptCursor(transcript.size());
    List<MatchResult> results = new ArrayList<>(lines.size());
    for (LyricsLine line : lines) {
      int lookahead =
          repeats.isRepeated(line.index())
              ? matching.repeatedLookaheadWords()
              : matching.maxLookaheadWords();
      double minScore = threshold(repeats.occurrence(line.index()));
      results.add(matchLine(line, transcript, cursor, lookahead, minScore));
    }
    LOGGER.debug(
        "Matching pass finished: {} lines, cursor at {}/{}",
        lines.size(),
        cursor.position(),
        transcript.size());
    return results;
  }

  /**
   * Match a single line from the cursor's position, committing the cursor on success.
   *
   * @param line the lyrics line
   * @param transcript usable transcript words in time order
   * @param cursor the run's cursor
   * @return the line's match result
   */
  public MatchResult matchLine(LyricsLine line, List<Word> transcript, TranscriptCursor cursor) {
    return matchLine(line, transcript, cursor, matching.maxLookaheadWords(), matching.minScore());
  }

  private MatchResult matchLine(
      LyricsLine line,
      List<Word> transcript,
      TranscriptCursor cursor,
      int lookahead,
      double minScore) {
    if (cursor.exhausted()) {
      EVENTS.logLineUnmatched(line.index(), 0.0, cursor.position());
      return MatchResult.unmatched(line.index(), 0.0);
    }

    Optional<WindowScore> best = findBestWindow(line, transcript, cursor.position(), lookahead);
    double bestScore = best.map(WindowScore::score).orElse(0.0);

    if (best.isEmpty() || bestScore < minScore) {
      EVENTS.logLineUnmatched(line.index(), bestScore, cursor.position());
      return MatchResult.unmatched(line.index(), bestScore);
    }

    WindowScore winner = best.get();
    cursor.advanceTo(winner.end());
    EVENTS.logLineMatched(
        line.index(), winner.score(), winner.start(), winner.length(), cursor.position());
    return MatchResult.matched(
        line.index(), winner.score(), assignTiming(line, winner.window()),
        winner.start(), winner.length());
  }

  /**
   * Search all window offsets and sizes for the best-scoring window.
   *
   * <p>Ties keep the candidate found first: the earliest offset, then the smallest size.
   *
   * @param line the lyrics line
   * @param transcript usable transcript words
   * @param from first offset to try
   * @return the best window, or empty if the transcript has no words from {@code from} on
   */
  public Optional<WindowScore> findBestWindow(LyricsLine line, List<Word> transcript, int from) {
    return findBestWindow(line, transcript, from, matching.maxLookaheadWords());
  }

  Optional<WindowScore> findBestWindow(
      LyricsLine line, List<Word> transcript, int from, int lookahead) {
    // long: the lookahead may be Integer.MAX_VALUE.
    int lastOffset = (int) Math.min((long) from + lookahead, transcript.size());
    int lineLength = line.wordCount();

    WindowScore best = null;
    for (int offset = from; offset < lastOffset; offset++) {
      int remaining = transcript.size() - offset;
      int previousLength = 0;
      for (int delta = matching.minWindowDelta(); delta <= matching.maxWindowDelta(); delta++) {
        int length = Math.min(Math.max(lineLength + delta, 1), remaining);
        if (length == previousLength) {
          continue;
        }
        previousLength = length;

        WindowScore candidate = windowScorer.score(line, transcript, offset, length);
        if (best == null || candidate.score() > best.score() + SCORE_EPSILON) {
          best = candidate;
        }
      }
    }
    return Optional.ofNullable(best);
  }

  // Lowered per earlier occurrence, floored at repeatMinScore, never above minScore.
  private double threshold(int occurrence) {
    if (occurrence == 0) {
      return matching.minScore();
    }
    double lowered =
        Math.max(
            matching.repeatMinScore(),
            matching.minScore() - matching.repeatThresholdStep() * occurrence);
    return Math.min(matching.minScore(), lowered);
  }

  /**
   * Give each line word a time span from the matched window.
   *
   * <p>With equal lengths each word takes its paired transcript word's span. Otherwise the window
   * is treated as a timeline of {@code W} word slots and line word {@code i} covers slots
   * {@code i*W/N} to {@code (i+1)*W/N}.
   */
  static List<TimedWord> assignTiming(LyricsLine line, List<Word> window) {
    List<String> words = line.words();
    int lineLength = words.size();
    int windowLength = window.size();
    List<TimedWord> timed = new ArrayList<>(lineLength);

    if (lineLength == windowLength) {
      for (int i = 0; i < lineLength; i++) {
        Word heard = window.get(i);
        timed.add(new TimedWord(words.get(i), heard.start(), heard.end()));
      }
      return timed;
    }

    for (int i = 0; i < lineLength; i++) {
      double from = (double) i * windowLength / lineLength;
      double to = (double) (i + 1) * windowLength / lineLength;
      double start = timeAt(window, from);
      double end = Math.max(start, timeAt(window, to));
      timed.add(new TimedWord(words.get(i), start, end));
    }
    return timed;
  }

  // Time at a fractional slot position; slot k spans window word k's start to end.
  private static double timeAt(List<Word> window, double slot) {
    int index = (int) Math.floor(slot);
    if (index >= window.size()) {
      return window.get(window.size() - 1).end();
    }
    Word word = window.get(index);
    return word.start() + (slot - index) * word.duration();
  }
}
