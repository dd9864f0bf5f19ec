package com.scholary.lyricsync.lrc;

import com.scholary.lyricsync.align.AlignmentResult;
import com.scholary.lyricsync.align.InstrumentalBreak;
import com.scholary.lyricsync.align.LyricsLine;
import com.scholary.lyricsync.align.TimedLine;
import com.scholary.lyricsync.align.TimedWord;
import com.scholary.lyricsync.config.AlignmentProperties;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Writes timing tracks as enhanced LRC (word-timed karaoke lyrics).
 *
 * <p>Format:
 *
 * <pre>
 * [ar:Artist]
 * [ti:Track]
 * [length:03:12.40]
 * [00:12.30]&lt;00:12.30&gt;First &lt;00:12.71&gt;line
 * [00:14.05]&lt;00:14.05&gt;Second &lt;00:14.50&gt;line
 *
 * [00:16.20]♪ INSTRUMENTAL [00:21.80] ♪
 *
 * [00:38.00]&lt;00:38.00&gt;Next &lt;00:38.40&gt;verse
 * </pre>
 *
 * <p>Blank lines in the lyrics come back as blank lines before the following line. Every timestamp
 * is shifted by the record's start offset.
 */
@Component
public class LrcWriter {

  private final boolean instrumentalMarkers;

  public LrcWriter(AlignmentProperties properties) {
    this.instrumentalMarkers = properties.output().instrumentalMarkers();
  }

  /** Render an alignment result as LRC text. */
  public String write(AlignmentResult result) {
    double offset = result.startOffset();
    StringBuilder lrc = new StringBuilder();

    lrc.append("[ar:").append(result.artist()).append("]\n");
    lrc.append("[ti:").append(result.track()).append("]\n");
    lrc.append("[length:").append(formatTimestamp(result.length() + offset)).append("]\n");

    List<LyricsLine> lyrics = result.lyrics();
    List<TimedLine> lines = result.timing().lines();
    Iterator<InstrumentalBreak> breaks = result.timing().breaks().iterator();
    InstrumentalBreak nextBreak = nextBreak(breaks);

    for (int i = 0; i < lines.size(); i++) {
      TimedLine line = lines.get(i);
      boolean blankBefore = lyrics.get(i).stanzaStart();

      if (nextBreak != null && nextBreak.end() <= line.start()) {
        separate(lrc);
        lrc.append('[').append(formatTimestamp(nextBreak.start() + offset)).append("]")
            .append("♪ INSTRUMENTAL [").append(formatTimestamp(nextBreak.duration())).append("] ♪\n");
        blankBefore = true;
        nextBreak = nextBreak(breaks);
      }
      if (blankBefore) {
        separate(lrc);
      }

      lrc.append('[').append(formatTimestamp(line.start() + offset)).append(']');
      List<TimedWord> words = line.words();
      for (int w = 0; w < words.size(); w++) {
        if (w > 0) {
          lrc.append(' ');
        }
        TimedWord word = words.get(w);
        lrc.append('<').append(formatTimestamp(word.start() + offset)).append('>')
            .append(word.text());
      }
      lrc.append('\n');
    }
    return lrc.toString();
  }

  /** Render an alignment result as UTF-8 LRC bytes. */
  public byte[] writeBytes(AlignmentResult result) {
    return write(result).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Format a time in seconds as an LRC timestamp.
   *
   * <p>Format: mm:ss.hh (minutes:seconds.hundredths). Minutes grow past two digits for long
   * tracks; negative times render as 00:00.00.
   */
  public static String formatTimestamp(double seconds) {
    long hundredths = Math.max(0L, Math.round(seconds * 100.0));
    long minutes = hundredths / 6000;
    long secs = (hundredths % 6000) / 100;
    long fraction = hundredths % 100;
    return String.format(Locale.ROOT, "%02d:%02d.%02d", minutes, secs, fraction);
  }

  private InstrumentalBreak nextBreak(Iterator<InstrumentalBreak> breaks) {
    return instrumentalMarkers && breaks.hasNext() ? breaks.next() : null;
  }

  // Adds one blank line unless the output already ends with one.
  private static void separate(StringBuilder lrc) {
    if (lrc.length() >= 2 && lrc.charAt(lrc.length() - 1) == '\n'
        && lrc.charAt(lrc.length() - 2) == '\n') {
      return;
    }
    lrc.append('\n');
  }
}
