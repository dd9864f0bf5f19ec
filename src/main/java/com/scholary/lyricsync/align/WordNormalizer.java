package com.scholary.lyricsync.align;

import java.util.Locale;

/**
 * Canonical form of a word for comparison.
 *
 * <p>Lowercases and keeps only letters and digits, so "Tree," and "tree" compare equal. Letters of
 * any script, and their combining marks, are kept, so text in scripts without case passes through unchanged.
 */
public final class WordNormalizer {

  private WordNormalizer() {}

  /**
   * Normalize a word for comparison.
   *
   * @param word raw word, may be null
   * @return the normalized form, never null
   */
  public static String normalize(String word) {
    if (word == null) {
      return "";
    }
    String lower = word.toLowerCase(Locale.ROOT);
    StringBuilder normalized = new StringBuilder(lower.length());
    lower.codePoints()
        .filter(cp -> Character.isLetterOrDigit(cp) || isMark(cp))
        .forEach(normalized::appendCodePoint);
    return normalized.toString();
  }

  // Vowel signs and diacritics in abugidas are marks, not letters.
  private static boolean isMark(int codePoint) {
    int type = Character.getType(codePoint);
    return type == Character.NON_SPACING_MARK
        || type == Character.COMBINING_SPACING_MARK
        || type == Character.ENCLOSING_MARK;
  }
}
