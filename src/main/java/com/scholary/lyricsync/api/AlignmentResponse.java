package com.scholary.lyricsync.api;

import com.scholary.lyricsync.align.AlignmentReport;
import com.scholary.lyricsync.align.AlignmentResult;
import com.scholary.lyricsync.align.InstrumentalBreak;
import com.scholary.lyricsync.align.TimedLine;
import java.util.List;

/**
 * Response for a completed alignment.
 *
 * <p>Contains the word-timed lines, detected instrumental breaks and the alignment report.
 */
public record AlignmentResponse(
    String artist,
    String track,
    double startOffset,
    double length,
    List<TimedLine> lines,
    List<InstrumentalBreak> breaks,
    AlignmentReport report) {

  public static AlignmentResponse from(AlignmentResult result) {
    return new AlignmentResponse(
        result.artist(),
        result.track(),
        result.startOffset(),
        result.length(),
        result.timing().lines(),
        result.timing().breaks(),
        result.report());
  }
}
