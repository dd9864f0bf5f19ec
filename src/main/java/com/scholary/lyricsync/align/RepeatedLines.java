package com.scholary.lyricsync.align;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lyrics lines whose text occurs more than once, such as choruses.
 *
 * <p>Lines are compared on their normalized words, so "Na na, hey!" and "na na hey" count as the
 * same line. Each occurrence knows how many earlier occurrences precede it.
 */
public final class RepeatedLines {

  private final List<List<Integer>> groups;
  private final Map<Integer, Integer> occurrences;

  private RepeatedLines(List<List<Integer>> groups, Map<Integer, Integer> occurrences) {
    this.groups = groups;
    this.occurrences = occurrences;
  }

  /**
   * Group the lines by normalized text.
   *
   * @param lines lyrics lines in order
   * @return the groups with more than one line, in order of first occurrence
   */
  public static RepeatedLines detect(List<LyricsLine> lines) {
    Map<String, List<Integer>> byText = new LinkedHashMap<>();
    for (LyricsLine line : lines) {
      String text = normalizedText(line);
      if (!text.isEmpty()) {
        byText.computeIfAbsent(text, key -> new ArrayList<>()).add(line.index());
      }
    }

    List<List<Integer>> groups = new ArrayList<>();
    Map<Integer, Integer> occurrences = new HashMap<>();
    for (List<Integer> indexes : byText.values()) {
      if (indexes.size() < 2) {
        continue;
      }
      groups.add(List.copyOf(indexes));
      for (int i = 0; i < indexes.size(); i++) {
        occurrences.put(indexes.get(i), i);
      }
    }
    return new RepeatedLines(Collections.unmodifiableList(groups), occurrences);
  }

  public boolean isRepeated(int lineIndex) {
    return occurrences.containsKey(lineIndex);
  }

  /** Number of earlier lines with the same text; 0 for first occurrences and unique lines. */
  public int occurrence(int lineIndex) {
    return occurrences.getOrDefault(lineIndex, 0);
  }

  /** Line indexes of each repeated text, in lyrics order. */
  public List<List<Integer>> groups() {
    return groups;
  }

  /** Number of lines that belong to some group. */
  public int lineCount() {
    return occurrences.size();
  }

  private static String normalizedText(LyricsLine line) {
    StringBuilder text = new StringBuilder();
    for (String word : line.words()) {
      String normalized = WordNormalizer.normalize(word);
      if (normalized.isEmpty()) {
        continue;
      }
      if (text.length() > 0) {
        text.append(' ');
      }
      text.append(normalized);
    }
    return text.toString();
  }
}
