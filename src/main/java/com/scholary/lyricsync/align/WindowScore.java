package com.scholary.lyricsync.align;

import java.util.List;

/**
 * Score of one lyrics line against one candidate window of transcript words.
 *
 * @param start index of the window's first word in the transcript
 * @param length number of transcript words in the window
 * @param score aggregate score, 0 to roughly the whole-line multiplier
 * @param window the transcript words of the window, in order
 * @param exactMatches number of line words paired with an exactly matching transcript word
 */
public record WindowScore(int start, int length, double score, List<Word> window, int exactMatches) {

  public WindowScore {
    window = List.copyOf(window);
  }

  /** Index just past the window, where the cursor moves when the window is committed. */
  public int end() {
    return start + length;
  }
}
