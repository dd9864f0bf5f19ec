package com.scholary.lyricsync.align;

import java.util.List;

/**
 * How well the transcript supported the alignment.
 *
 * <p>{@code degraded} is set when the output leans on interpolation because of the transcript:
 * no usable words, no line matched, or entries had to be dropped or repaired. The run still
 * produced a complete, valid track.
 *
 * <p>{@code repeatedLines} counts lyrics lines whose text occurs more than once.
 */
public record AlignmentReport(
    int totalLines,
    int matchedLines,
    int interpolatedLines,
    int breakAdjacentLines,
    int repeatedLines,
    int transcriptWords,
    int droppedWords,
    int adjustedWords,
    boolean degraded,
    List<String> warnings) {

  public AlignmentReport {
    warnings = List.copyOf(warnings);
  }
}
