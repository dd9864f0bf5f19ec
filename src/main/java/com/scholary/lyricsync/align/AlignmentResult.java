package com.scholary.lyricsync.align;

import java.util.List;

/**
 * Everything produced by aligning one transcript record.
 *
 * @param artist passed through from the record's metadata
 * @param track passed through from the record's metadata
 * @param startOffset seconds to add to every timestamp when rendering
 * @param length track length in seconds, at least the end of the last timed word
 * @param lyrics the parsed lyrics lines
 * @param timing the validated timing track, one line per lyrics line
 * @param report match statistics and data quality warnings
 */
public record AlignmentResult(
    String artist,
    String track,
    double startOffset,
    double length,
    List<LyricsLine> lyrics,
    TimingTrack timing,
    AlignmentReport report) {

  public AlignmentResult {
    lyrics = List.copyOf(lyrics);
  }
}
