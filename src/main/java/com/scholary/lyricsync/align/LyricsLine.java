package com.scholary.lyricsync.align;

import java.util.ArrayList;
import java.util.List;

/**
 * One non-blank line of the canonical lyrics.
 *
 * @param index 0-based position among the non-blank lines
 * @param words surface words exactly as written in the lyrics
 * @param stanzaStart true when one or more blank lines preceded this line
 */
public record LyricsLine(int index, List<String> words, boolean stanzaStart) {

  public LyricsLine {
    if (words == null || words.isEmpty()) {
      throw new IllegalArgumentException("A lyrics line needs at least one word");
    }
    words = List.copyOf(words);
  }

  public int wordCount() {
    return words.size();
  }

  public String text() {
    return String.join(" ", words);
  }

  /**
   * Split lyrics text into lines of whitespace-separated words.
   *
   * <p>Blank lines are not returned; they only mark the following line as a stanza start.
   *
   * @param lyrics newline-separated lyrics
   * @return the non-blank lines in order
   */
  public static List<LyricsLine> parse(String lyrics) {
    List<LyricsLine> lines = new ArrayList<>();
    if (lyrics == null) {
      return lines;
    }
    boolean pendingStanza = false;
    for (String rawLine : lyrics.split("\\R")) {
      List<String> words = extractWords(rawLine);
      if (words.isEmpty()) {
        pendingStanza = !lines.isEmpty();
        continue;
      }
      lines.add(new LyricsLine(lines.size(), words, pendingStanza));
      pendingStanza = false;
    }
    return lines;
  }

  private static List<String> extractWords(String text) {
    List<String> words = new ArrayList<>();
    for (String word : text.trim().split("\\s+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}
