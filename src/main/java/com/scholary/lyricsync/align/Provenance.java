package com.scholary.lyricsync.align;

/** Where a timed line's timing came from. */
public enum Provenance {
  /** Timing taken from a matched transcript window. */
  MATCHED,
  /** Timing synthesized between anchors or stream boundaries. */
  INTERPOLATED,
  /** Synthesized next to a detected instrumental break, packed to natural speed. */
  BREAK_ADJACENT
}
