package com.scholary.lyricsync.align;

import java.util.List;

/**
 * A lyrics line with per-word timing: the unit of the final timing track.
 *
 * @param lineIndex index of the source lyrics line
 * @param words original words with their time spans, in order
 * @param provenance how the timing was obtained
 */
public record TimedLine(int lineIndex, List<TimedWord> words, Provenance provenance) {

  public TimedLine {
    words = List.copyOf(words);
    if (words.isEmpty()) {
      throw new IllegalArgumentException("A timed line needs at least one word");
    }
  }

  public double start() {
    return words.get(0).start();
  }

  public double end() {
    return words.get(words.size() - 1).end();
  }
}
