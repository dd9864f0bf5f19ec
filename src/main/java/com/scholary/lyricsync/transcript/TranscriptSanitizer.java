package com.scholary.lyricsync.transcript;

import com.scholary.lyricsync.align.Word;
import com.scholary.lyricsync.transcript.TranscriptDocument.WordEntry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw transcript entries into words the matcher can rely on.
 *
 * <p>Speech recognizers occasionally emit negative, reversed or out-of-order timestamps. Rather
 * than failing, such entries are dropped:
 *
 * <ul>
 *   <li>non-finite or negative times, or {@code end < start}
 *   <li>a start earlier than the previous kept word's start
 * </ul>
 *
 * <p>Words that normalize to nothing, such as {@code &}, are kept: lyrics carry the same tokens
 * and positional pairing needs them in place.
 *
 * <p>A word that starts inside the previous kept word is clamped to start where that word ends,
 * and confidences outside [0, 1] are clamped into range. Missing confidence counts as 0.
 */
@Component
public class TranscriptSanitizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSanitizer.class);

  public SanitizedTranscript sanitize(List<WordEntry> entries) {
    List<Word> words = new ArrayList<>(entries.size());
    int dropped = 0;
    int adjusted = 0;
    Word previous = null;

    for (int i = 0; i < entries.size(); i++) {
      WordEntry entry = entries.get(i);
      double start = entry.start();
      double end = entry.end();

      if (!Double.isFinite(start) || !Double.isFinite(end) || start < 0 || end < start) {
        LOGGER.debug("Dropping word {} '{}' with invalid timing {}-{}", i, entry.word(), start, end);
        dropped++;
        continue;
      }
      if (previous != null && start < previous.start()) {
        LOGGER.debug(
            "Dropping word {} '{}' starting at {} before previous word at {}",
            i,
            entry.word(),
            start,
            previous.start());
        dropped++;
        continue;
      }

      boolean changed = false;
      if (previous != null && start < previous.end()) {
        start = previous.end();
        end = Math.max(end, start);
        changed = true;
      }
      double confidence = entry.confidence() == null ? 0.0 : entry.confidence();
      if (Double.isNaN(confidence)) {
        confidence = 0.0;
        changed = true;
      } else if (confidence < 0.0 || confidence > 1.0) {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        changed = true;
      }
      if (changed) {
        adjusted++;
      }

      Word word = new Word(entry.word(), entry.originalWord(), start, end, confidence);
      words.add(word);
      previous = word;
    }

    if (dropped > 0 || adjusted > 0) {
      LOGGER.warn(
          "Sanitized transcript: kept={}, dropped={}, adjusted={}",
          words.size(),
          dropped,
          adjusted);
    }
    return new SanitizedTranscript(words, dropped, adjusted);
  }
}
