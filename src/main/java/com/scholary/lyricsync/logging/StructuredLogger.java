package com.scholary.lyricsync.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log alignment events with structured fields that can be queried in a log
 * store.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a line that matched a transcript window. */
  public void logLineMatched(
      int lineIndex, double score, int windowStart, int windowLength, int cursor) {
    try {
      MDC.put("event_type", "line_matched");
      MDC.put("line_index", String.valueOf(lineIndex));
      MDC.put("score", String.valueOf(score));
      MDC.put("windowStart", String.valueOf(windowStart));
      MDC.put("windowLength", String.valueOf(windowLength));
      MDC.put("cursor", String.valueOf(cursor));

      logger.debug(
          "Line matched: index={}, score={}, window=[{}+{}], cursor={}",
          lineIndex,
          String.format("%.3f", score),
          windowStart,
          windowLength,
          cursor);
    } finally {
      clearEventFields();
    }
  }

  /** Log a line left for interpolation. */
  public void logLineUnmatched(int lineIndex, double bestScore, int cursor) {
    try {
      MDC.put("event_type", "line_unmatched");
      MDC.put("line_index", String.valueOf(lineIndex));
      MDC.put("score", String.valueOf(bestScore));
      MDC.put("cursor", String.valueOf(cursor));

      logger.debug(
          "Line unmatched: index={}, bestScore={}, cursor={}",
          lineIndex,
          String.format("%.3f", bestScore),
          cursor);
    } finally {
      clearEventFields();
    }
  }

  /** Log a run of unmatched lines that received synthetic timing. */
  public void logGapInterpolated(
      int firstLine, int lastLine, double spanStart, double spanEnd, boolean breakDetected) {
    try {
      MDC.put("event_type", "gap_interpolated");
      MDC.put("firstLine", String.valueOf(firstLine));
      MDC.put("lastLine", String.valueOf(lastLine));
      MDC.put("start", String.valueOf(spanStart));
      MDC.put("end", String.valueOf(spanEnd));
      MDC.put("breakDetected", String.valueOf(breakDetected));

      logger.debug(
          "Gap interpolated: lines=[{}-{}], span=[{}-{}], break={}",
          firstLine,
          lastLine,
          spanStart,
          spanEnd,
          breakDetected);
    } finally {
      clearEventFields();
    }
  }

  /** Log a silence long enough to be an instrumental break. */
  public void logInstrumentalBreak(double start, double end) {
    try {
      MDC.put("event_type", "instrumental_break");
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("durationSeconds", String.valueOf(end - start));

      logger.debug("Instrumental break: range=[{}-{}], duration={}s", start, end, end - start);
    } finally {
      clearEventFields();
    }
  }

  /** Log lyrics lines that occur more than once. */
  public void logRepeatedLines(List<List<Integer>> groups) {
    try {
      MDC.put("event_type", "repeated_lines");
      MDC.put("groups", String.valueOf(groups.size()));

      logger.info("Repeated lines: groups={}, lines={}", groups.size(), groups);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of an alignment run. */
  public void logAlignmentCompleted(
      int totalLines, int matchedLines, int interpolatedLines, int transcriptWords, long elapsedMs) {
    try {
      MDC.put("event_type", "alignment_completed");
      MDC.put("totalLines", String.valueOf(totalLines));
      MDC.put("matchedLines", String.valueOf(matchedLines));
      MDC.put("interpolatedLines", String.valueOf(interpolatedLines));
      MDC.put("transcriptWords", String.valueOf(transcriptWords));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Alignment completed: lines={}, matched={}, interpolated={}, words={}, took={}ms",
          totalLines,
          matchedLines,
          interpolatedLines,
          transcriptWords,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a run whose output relies on interpolation because the transcript was poor. */
  public void logAlignmentDegraded(String reason, int matchedLines, int interpolatedLines) {
    try {
      MDC.put("event_type", "alignment_degraded");
      MDC.put("reason", reason);
      MDC.put("matchedLines", String.valueOf(matchedLines));
      MDC.put("interpolatedLines", String.valueOf(interpolatedLines));

      logger.warn(
          "Alignment degraded: reason={}, matched={}, interpolated={}",
          reason,
          matchedLines,
          interpolatedLines);
    } finally {
      clearEventFields();
    }
  }

  /** Set alignment context in MDC. */
  public static void setAlignmentContext(String alignmentId, String artist, String track) {
    MDC.put("alignmentId", alignmentId);
    MDC.put("artist", artist);
    MDC.put("track", track);
  }

  /** Clear alignment context from MDC. */
  public static void clearAlignmentContext() {
    MDC.remove("alignmentId");
    MDC.remove("artist");
    MDC.remove("track");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("line_index");
    MDC.remove("score");
    MDC.remove("windowStart");
    MDC.remove("windowLength");
    MDC.remove("cursor");
    MDC.remove("firstLine");
    MDC.remove("lastLine");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("breakDetected");
    MDC.remove("durationSeconds");
    MDC.remove("totalLines");
    MDC.remove("matchedLines");
    MDC.remove("interpolatedLines");
    MDC.remove("transcriptWords");
    MDC.remove("elapsedMs");
    MDC.remove("reason");
    MDC.remove("groups");
  }
}
