package com.scholary.lyricsync.align;

import static com.scholary.lyricsync.align.TestTranscripts.concat;
import static com.scholary.lyricsync.align.TestTranscripts.spoken;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.transcript.InvalidTranscriptException;
import com.scholary.lyricsync.transcript.TranscriptDocument;
import com.scholary.lyricsync.transcript.TranscriptDocument.Metadata;
import com.scholary.lyricsync.transcript.TranscriptDocument.WordEntry;
import com.scholary.lyricsync.transcript.TranscriptReader;
import com.scholary.lyricsync.transcript.TranscriptSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LyricsAlignerTest {

  private static final String LYRICS =
      "Sitting under the cypress tree\n"
          + "Waiting for the rain to fall\n"
          + "\n"
          + "Every cloud is passing over me\n"
          + "Nothing left to hold at all";

  private LyricsAligner aligner;

  @BeforeEach
  void setUp() {
    AlignmentProperties properties = AlignmentProperties.defaults();
    aligner =
        new LyricsAligner(
            new TranscriptReader(new ObjectMapper()),
            new TranscriptSanitizer(),
            new SlidingMatcher(new WindowScorer(new SimilarityScorer(), properties), properties),
            new GapInterpolator(properties),
            new TimingAssembler(properties),
            properties);
  }

  @Test
  void align_perfectTranscriptMatchesEveryLineExactly() {
    List<Word> transcript = verbatim(LYRICS, 2.0);

    AlignmentResult result = aligner.align(document(LYRICS, transcript));

    assertThat(result.timing().lines()).hasSize(4)
        .allMatch(line -> line.provenance() == Provenance.MATCHED);
    int position = 0;
    for (TimedLine line : result.timing().lines()) {
      for (TimedWord word : line.words()) {
        assertThat(word.start()).isEqualTo(transcript.get(position).start());
        assertThat(word.end()).isEqualTo(transcript.get(position).end());
        position++;
      }
    }
    assertThat(result.report().matchedLines()).isEqualTo(4);
    assertThat(result.report().degraded()).isFalse();
    assertThat(result.lyrics().get(2).stanzaStart()).isTrue();
  }

  @Test
  void align_perfectTranscriptMatchesLinesWithPunctuationOnlyWords() {
    String lyrics = "Me & you\nDancing all night long";
    List<Word> transcript =
        concat(spoken(0.0, 0.5, "Me & you"), spoken(2.0, 0.5, "Dancing all night long"));

    AlignmentResult result = aligner.align(document(lyrics, transcript));

    assertThat(result.timing().lines()).allMatch(line -> line.provenance() == Provenance.MATCHED);
    TimedWord ampersand = result.timing().lines().get(0).words().get(1);
    assertThat(ampersand.text()).isEqualTo("&");
    assertThat(ampersand.start()).isEqualTo(0.5);
    assertThat(result.timing().lines().get(1).start()).isEqualTo(2.0);
    assertThat(result.report().droppedWords()).isZero();
    assertThat(result.report().degraded()).isFalse();
  }

  @Test
  void align_reportsRepeatedLinesAndMatchesEachOccurrence() {
    String lyrics = "Na na, hey!\nKiss him goodbye\nna na hey";
    List<Word> transcript =
        concat(
            concat(spoken(0.0, 0.5, "na na hey"), spoken(3.0, 0.5, "kiss him goodbye")),
            spoken(6.0, 0.5, "na na hey"));

    AlignmentResult result = aligner.align(document(lyrics, transcript));

    assertThat(result.report().repeatedLines()).isEqualTo(2);
    assertThat(result.report().matchedLines()).isEqualTo(3);
    assertThat(result.timing().lines().get(2).start()).isEqualTo(6.0);
    assertThat(result.timing().lines().get(0).words())
        .extracting(TimedWord::text)
        .containsExactly("Na", "na,", "hey!");
  }

  @Test
  void align_keepsOriginalSpelling() {
    List<Word> transcript = verbatim(LYRICS.toLowerCase().replace(",", ""), 0.0);

    AlignmentResult result = aligner.align(document(LYRICS, transcript));

    assertThat(result.timing().lines().get(0).words())
        .extracting(TimedWord::text)
        .containsExactly("Sitting", "under", "the", "cypress", "tree");
  }

  @Test
  void align_noisyTranscriptsAlwaysGiveCompleteMonotonicTracks() {
    List<LyricsLine> lines = LyricsLine.parse(LYRICS);
    for (long seed = 1; seed <= 25; seed++) {
      List<Word> transcript = corrupted(LYRICS, new Random(seed));

      AlignmentResult result = aligner.align(document(LYRICS, transcript));

      assertCompleteAndMonotonic(lines, result.timing());
    }
  }

  @Test
  void align_isDeterministic() {
    List<Word> transcript = corrupted(LYRICS, new Random(42));

    AlignmentResult first = aligner.align(document(LYRICS, transcript));
    AlignmentResult second = aligner.align(document(LYRICS, transcript));

    assertThat(second).isEqualTo(first);
  }

  @Test
  void align_unrelatedTranscriptFallsBackToInterpolationOverWholeDuration() {
    List<Word> transcript = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      transcript.add(new Word("zzz", i * 2.0, i * 2.0 + 1.6, 1.0));
    }

    AlignmentResult result = aligner.align(document(LYRICS, transcript));

    assertCompleteAndMonotonic(LyricsLine.parse(LYRICS), result.timing());
    assertThat(result.timing().lines())
        .allMatch(line -> line.provenance() == Provenance.INTERPOLATED);
    assertThat(result.report().matchedLines()).isZero();
    assertThat(result.report().interpolatedLines()).isEqualTo(4);
    assertThat(result.report().degraded()).isTrue();
    assertThat(result.report().warnings()).contains("no lyrics line matched the transcript");
    assertThat(result.timing().lines().get(0).start()).isBetween(0.0, 10.0);
    assertThat(result.timing().lines().get(3).end()).isBetween(70.0, 79.6);
  }

  @Test
  void align_withoutUsableWordsUsesDefaultSpan() {
    AlignmentResult result = aligner.align(document(LYRICS, List.of()));

    assertCompleteAndMonotonic(LyricsLine.parse(LYRICS), result.timing());
    assertThat(result.report().transcriptWords()).isZero();
    assertThat(result.report().warnings()).contains("transcript has no usable words");
    assertThat(result.timing().lines().get(3).end()).isLessThanOrEqualTo(300.0);
    assertThat(result.length()).isEqualTo(300.0);
  }

  @Test
  void align_longGapBetweenAnchorsBecomesBreak() {
    String lyrics = "one two three four\nalpha beta gamma delta\nfive six seven eight";
    List<Word> transcript =
        concat(spoken(0.0, 0.5, "one two three four"), spoken(100.0, 0.5, "five six seven eight"));

    AlignmentResult result = aligner.align(document(lyrics, transcript));

    TimedLine interpolated = result.timing().lines().get(1);
    assertThat(interpolated.provenance()).isEqualTo(Provenance.BREAK_ADJACENT);
    assertThat(interpolated.end()).isLessThan(5.0);
    assertThat(result.report().breakAdjacentLines()).isEqualTo(1);
    assertThat(result.timing().breaks())
        .anySatisfy(gap -> assertThat(gap.end()).isEqualTo(100.0));
  }

  @Test
  void align_dropsWordsWithInvalidTimingAndReportsDegradation() {
    List<WordEntry> entries = new ArrayList<>(entries(verbatim(LYRICS, 1.0)));
    entries.add(3, new WordEntry("glitch", -4.0, -3.0, 1.0, null));
    TranscriptDocument document =
        new TranscriptDocument(new Metadata("Artist", "Track", LYRICS, null), entries);

    AlignmentResult result = aligner.align(document);

    assertThat(result.report().droppedWords()).isEqualTo(1);
    assertThat(result.report().degraded()).isTrue();
    assertThat(result.report().matchedLines()).isEqualTo(4);
  }

  @Test
  void align_rejectsRecordsWithoutLyrics() {
    assertThatThrownBy(() -> aligner.align(document("  \n \n", List.of())))
        .isInstanceOf(InvalidTranscriptException.class);
    assertThatThrownBy(() -> aligner.align(new TranscriptDocument(null, List.of())))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("metadata");
  }

  private static void assertCompleteAndMonotonic(List<LyricsLine> lines, TimingTrack track) {
    assertThat(track.lines()).hasSameSizeAs(lines);
    double previousEnd = 0.0;
    for (int i = 0; i < lines.size(); i++) {
      TimedLine line = track.lines().get(i);
      assertThat(line.lineIndex()).isEqualTo(i);
      assertThat(line.words()).hasSize(lines.get(i).wordCount());
      for (TimedWord word : line.words()) {
        assertThat(word.start()).isGreaterThanOrEqualTo(previousEnd - 1e-9);
        assertThat(word.end()).isGreaterThanOrEqualTo(word.start());
        previousEnd = word.end();
      }
    }
  }

  /** The lyrics read out word by word, 0.4s per word and a pause between lines. */
  private static List<Word> verbatim(String lyrics, double start) {
    List<Word> words = new ArrayList<>();
    double time = start;
    for (LyricsLine line : LyricsLine.parse(lyrics)) {
      words.addAll(spoken(time, 0.4, line.text()));
      time += line.wordCount() * 0.4 + 1.5;
    }
    return words;
  }

  /** The lyrics with words dropped, misheard or inserted, and uneven confidence. */
  private static List<Word> corrupted(String lyrics, Random random) {
    List<Word> words = new ArrayList<>();
    double time = random.nextDouble() * 5;
    for (LyricsLine line : LyricsLine.parse(lyrics)) {
      for (String lyric : line.words()) {
        double roll = random.nextDouble();
        if (roll < 0.1) {
          continue;
        }
        String heard = roll < 0.25 ? lyric.substring(0, Math.max(1, lyric.length() - 2)) : lyric;
        double length = 0.2 + random.nextDouble() * 0.4;
        words.add(new Word(heard, time, time + length, 0.3 + random.nextDouble() * 0.7));
        time += length + random.nextDouble() * 0.2;
        if (random.nextDouble() < 0.1) {
          words.add(new Word("yeah", time, time + 0.3, random.nextDouble()));
          time += 0.4;
        }
      }
      time += random.nextDouble() * (random.nextDouble() < 0.2 ? 30 : 2);
    }
    return words;
  }

  private static TranscriptDocument document(String lyrics, List<Word> words) {
    return new TranscriptDocument(new Metadata("Artist", "Track", lyrics, null), entries(words));
  }

  private static List<WordEntry> entries(List<Word> words) {
    List<WordEntry> entries = new ArrayList<>();
    for (Word word : words) {
      entries.add(
          new WordEntry(word.text(), word.start(), word.end(), word.confidence(), word.originalText()));
    }
    return entries;
  }
}
