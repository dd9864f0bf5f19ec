package com.scholary.lyricsync.align;

import java.util.List;

/**
 * The validated result of alignment: one timed line per lyrics line, plus the silences between
 * them that are long enough to count as instrumental breaks.
 */
public record TimingTrack(List<TimedLine> lines, List<InstrumentalBreak> breaks) {

  public TimingTrack {
    lines = List.copyOf(lines);
    breaks = List.copyOf(breaks);
  }

  public long count(Provenance provenance) {
    return lines.stream().filter(line -> line.provenance() == provenance).count();
  }
}
