package com.scholary.lyricsync.align;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of matching one lyrics line against the transcript.
 *
 * <p>A matched result carries the line's original words with transcript timing; an unmatched one
 * carries only the line index and the best score that was seen.
 *
 * @param lineIndex index of the lyrics line
 * @param matched whether the best window reached the threshold
 * @param score best window score found, 0 when no window could be tried
 * @param words timed original words, empty when unmatched
 * @param windowStart transcript index of the winning window, -1 when unmatched
 * @param windowLength length of the winning window, 0 when unmatched
 */
public record MatchResult(
    int lineIndex,
    boolean matched,
    double score,
    List<TimedWord> words,
    int windowStart,
    int windowLength) {

  public MatchResult {
    words = List.copyOf(words);
    if (matched && words.isEmpty()) {
      throw new IllegalArgumentException("A matched line needs timed words");
    }
  }

  public static MatchResult matched(int lineIndex, double score, List<TimedWord> words,
      int windowStart, int windowLength) {
    return new MatchResult(lineIndex, true, score, words, windowStart, windowLength);
  }

  public static MatchResult unmatched(int lineIndex, double bestScore) {
    return new MatchResult(lineIndex, false, bestScore, List.of(), -1, 0);
  }

  /** The anchor this result provides, if it matched. */
  public Optional<Anchor> anchor() {
    if (!matched) {
      return Optional.empty();
    }
    return Optional.of(
        new Anchor(lineIndex, words.get(0).start(), words.get(words.size() - 1).end()));
  }
}
