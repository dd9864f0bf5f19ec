package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import com.scholary.lyricsync.transcript.InvalidTranscriptException;
import com.scholary.lyricsync.transcript.SanitizedTranscript;
import com.scholary.lyricsync.transcript.TranscriptDocument;
import com.scholary.lyricsync.transcript.TranscriptDocument.Metadata;
import com.scholary.lyricsync.transcript.TranscriptReader;
import com.scholary.lyricsync.transcript.TranscriptSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aligns a transcript against canonical lyrics.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>validate the record and split the lyrics into lines
 *   <li>drop or repair unusable transcript words
 *   <li>match lines to transcript windows ({@link SlidingMatcher})
 *   <li>synthesize timing for the rest ({@link GapInterpolator})
 *   <li>merge and validate ({@link TimingAssembler})
 * </ol>
 *
 * <p>The run is deterministic: the same record always gives the same track.
 */
@Service
public class LyricsAligner {

  private static final Logger LOGGER = LoggerFactory.getLogger(LyricsAligner.class);
  private static final StructuredLogger EVENTS = new StructuredLogger(LOGGER);

  private final TranscriptReader transcriptReader;
  private final TranscriptSanitizer sanitizer;
  private final SlidingMatcher matcher;
  private final GapInterpolator interpolator;
  private final TimingAssembler assembler;
  private final AlignmentProperties properties;

  public LyricsAligner(
      TranscriptReader transcriptReader,
      TranscriptSanitizer sanitizer,
      SlidingMatcher matcher,
      GapInterpolator interpolator,
      TimingAssembler assembler,
      AlignmentProperties properties) {
    this.transcriptReader = transcriptReader;
    this.sanitizer = sanitizer;
    this.matcher = matcher;
    this.interpolator = interpolator;
    this.assembler = assembler;
    this.properties = properties;
  }

  /**
   * Align a transcript record.
   *
   * @param document the transcript record with its lyrics
   * @return the timing track with its report
   * @throws InvalidTranscriptException if the record is missing required data
   * @throws InvariantViolationException if the produced track is invalid
   */
  public AlignmentResult align(TranscriptDocument document) {
    transcriptReader.validate(document);
    Metadata metadata = document.metadata();

    String alignmentId = UUID.randomUUID().toString();
    StructuredLogger.setAlignmentContext(alignmentId, metadata.artist(), metadata.track());
    try {
      long startedAt = System.currentTimeMillis();

      List<LyricsLine> lines = LyricsLine.parse(metadata.originalLyrics());
      if (lines.isEmpty()) {
        throw new InvalidTranscriptException("metadata.original_lyrics has no words");
      }
      SanitizedTranscript transcript = sanitizer.sanitize(document.words());
      LOGGER.info(
          "Aligning {} lyrics lines against {} transcript words",
          lines.size(),
          transcript.words().size());

      RepeatedLines repeats = RepeatedLines.detect(lines);
      if (!repeats.groups().isEmpty()) {
        EVENTS.logRepeatedLines(repeats.groups());
      }

      StreamBounds bounds = streamBounds(transcript.words());
      TimingTrack timing = alignLines(lines, transcript.words(), bounds, repeats);
      AlignmentReport report = report(lines, transcript, timing, repeats);

      EVENTS.logAlignmentCompleted(
          report.totalLines(),
          report.matchedLines(),
          report.interpolatedLines(),
          report.transcriptWords(),
          System.currentTimeMillis() - startedAt);
      if (report.degraded()) {
        EVENTS.logAlignmentDegraded(
            String.join("; ", report.warnings()),
            report.matchedLines(),
            report.interpolatedLines());
      }

      double lastEnd = timing.lines().get(timing.lines().size() - 1).end();
      return new AlignmentResult(
          metadata.artist(),
          metadata.track(),
          metadata.startOffset(),
          Math.max(bounds.end(), lastEnd),
          lines,
          timing,
          report);
    } finally {
      StructuredLogger.clearAlignmentContext();
    }
  }

  /**
   * Run the two alignment passes and assemble the result.
   *
   * @param lines the lyrics lines
   * @param transcript usable transcript words in time order
   * @param bounds time range of the transcript
   * @param repeats repeated lines among {@code lines}
   * @return the validated timing track
   */
  public TimingTrack alignLines(
      List<LyricsLine> lines, List<Word> transcript, StreamBounds bounds, RepeatedLines repeats) {
    List<MatchResult> results = matcher.match(lines, transcript, repeats);
    List<TimedLine> interpolated = interpolator.interpolate(lines, results, bounds);
    return assembler.assemble(lines, results, interpolated);
  }

  /** Time range of the transcript, or the default span when it has no usable word. */
  public StreamBounds streamBounds(List<Word> transcript) {
    if (transcript.isEmpty()) {
      return new StreamBounds(0.0, properties.interpolation().defaultSpanSeconds());
    }
    return new StreamBounds(0.0, transcript.get(transcript.size() - 1).end());
  }

  private AlignmentReport report(
      List<LyricsLine> lines,
      SanitizedTranscript transcript,
      TimingTrack timing,
      RepeatedLines repeats) {
    int matched = (int) timing.count(Provenance.MATCHED);
    int breakAdjacent = (int) timing.count(Provenance.BREAK_ADJACENT);
    int interpolated = lines.size() - matched;

    List<String> warnings = new ArrayList<>();
    if (transcript.isEmpty()) {
      warnings.add("transcript has no usable words");
    } else if (matched == 0) {
      warnings.add("no lyrics line matched the transcript");
    }
    if (transcript.droppedWords() > 0) {
      warnings.add(transcript.droppedWords() + " transcript words dropped as unusable");
    }
    if (transcript.adjustedWords() > 0) {
      warnings.add(transcript.adjustedWords() + " transcript words had timing or confidence clamped");
    }

    return new AlignmentReport(
        lines.size(),
        matched,
        interpolated,
        breakAdjacent,
        repeats.lineCount(),
        transcript.words().size(),
        transcript.droppedWords(),
        transcript.adjustedWords(),
        !warnings.isEmpty(),
        warnings);
  }
}
