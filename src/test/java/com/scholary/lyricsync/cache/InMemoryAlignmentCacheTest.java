package com.scholary.lyricsync.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.lyricsync.align.AlignmentReport;
import com.scholary.lyricsync.align.AlignmentResult;
import com.scholary.lyricsync.align.LyricsLine;
import com.scholary.lyricsync.align.Provenance;
import com.scholary.lyricsync.align.TimedLine;
import com.scholary.lyricsync.align.TimedWord;
import com.scholary.lyricsync.align.TimingTrack;
import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.transcript.InvalidTranscriptException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InMemoryAlignmentCacheTest {

  private final InMemoryAlignmentCache cache =
      new InMemoryAlignmentCache(AlignmentProperties.defaults());

  @Test
  void get_alignsOnceAndThenServesCachedResult() {
    AlignmentResult result = result();
    AtomicInteger alignments = new AtomicInteger();

    AlignmentResult first = cache.get("key", key -> {
      alignments.incrementAndGet();
      return result;
    });
    AlignmentResult second = cache.get("key", key -> {
      alignments.incrementAndGet();
      return result();
    });

    assertThat(first).isSameAs(result);
    assertThat(second).isSameAs(result);
    assertThat(alignments).hasValue(1);
    AlignmentCacheStats stats = cache.stats();
    assertThat(stats.size()).isEqualTo(1);
    assertThat(stats.hits()).isEqualTo(1);
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.hitRate()).isEqualTo(0.5);
  }

  @Test
  void get_doesNotCacheFailedAlignments() {
    assertThatThrownBy(
            () ->
                cache.get(
                    "key",
                    key -> {
                      throw new InvalidTranscriptException("metadata.artist is required");
                    }))
        .isInstanceOf(InvalidTranscriptException.class);

    assertThat(cache.get("key", key -> result()).report().matchedLines()).isEqualTo(1);
    assertThat(cache.stats().misses()).isEqualTo(2);
  }

  @Test
  void stats_startEmpty() {
    assertThat(cache.stats()).isEqualTo(new AlignmentCacheStats(0, 0, 0, 0));
    assertThat(cache.stats().hitRate()).isZero();
  }

  @Test
  void generateKey_isStableSha256Hex() {
    byte[] record = "{\"words\":[]}".getBytes(StandardCharsets.UTF_8);

    String key = AlignmentCache.generateKey(record);

    assertThat(key).hasSize(64).matches("[0-9a-f]+");
    assertThat(AlignmentCache.generateKey(record)).isEqualTo(key);
    assertThat(AlignmentCache.generateKey("{}".getBytes(StandardCharsets.UTF_8))).isNotEqualTo(key);
  }

  private static AlignmentResult result() {
    TimedLine line =
        new TimedLine(0, List.of(new TimedWord("la", 1.0, 1.5)), Provenance.MATCHED);
    return new AlignmentResult(
        "Artist",
        "Track",
        0.0,
        1.5,
        List.of(new LyricsLine(0, List.of("la"), false)),
        new TimingTrack(List.of(line), List.of()),
        new AlignmentReport(1, 1, 0, 0, 0, 1, 0, 0, false, List.of()));
  }
}
