package com.scholary.lyricsync.align;

import org.springframework.stereotype.Component;

/**
 * Word-to-word similarity and the positional weighting curve used when scoring windows.
 *
 * <p>All comparisons are made on {@link WordNormalizer normalized} forms.
 */
@Component
public class SimilarityScorer {

  /**
   * Similarity between two words in [0, 1].
   *
   * <p>One minus the edit distance divided by the longer normalized length. Identical normalized
   * forms score 1, including two punctuation-only tokens such as {@code &} and {@code -}.
   */
  public double similarity(String a, String b) {
    String left = WordNormalizer.normalize(a);
    String right = WordNormalizer.normalize(b);
    if (left.equals(right)) {
      return 1.0;
    }
    int maxLength = Math.max(left.length(), right.length());
    return 1.0 - (double) levenshteinDistance(left, right) / maxLength;
  }

  /** True when both words have the same normalized form. */
  public boolean exact(String a, String b) {
    return WordNormalizer.normalize(a).equals(WordNormalizer.normalize(b));
  }

  /**
   * Weight of a position inside a window of the given length.
   *
   * <p>{@code 1 - |pos - center| / (windowLength * 1.5)} with {@code center = windowLength / 2},
   * clamped at 0. Highest in the middle, where transcription is most reliable.
   */
  public double positionWeight(int position, int windowLength) {
    if (windowLength <= 0) {
      return 0.0;
    }
    int center = windowLength / 2;
    double weight = 1.0 - Math.abs(position - center) / (windowLength * 1.5);
    return Math.max(0.0, weight);
  }

  static int levenshteinDistance(String s1, String s2) {
    int[] previous = new int[s2.length() + 1];
    int[] current = new int[s2.length() + 1];
    for (int j = 0; j <= s2.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= s1.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= s2.length(); j++) {
        int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
        current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[s2.length()];
  }
}
