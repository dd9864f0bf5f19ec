package com.scholary.lyricsync.transcript;

import com.scholary.lyricsync.align.Word;
import java.util.List;

/**
 * Transcript words fit for alignment, with counts of what had to be fixed on the way.
 *
 * @param words usable words, in non-decreasing, non-overlapping time order
 * @param droppedWords entries discarded for invalid or out-of-order timing or empty text
 * @param adjustedWords entries kept after clamping their timing or confidence
 */
public record SanitizedTranscript(List<Word> words, int droppedWords, int adjustedWords) {

  public SanitizedTranscript {
    words = List.copyOf(words);
  }

  public boolean isEmpty() {
    return words.isEmpty();
  }
}
