package com.scholary.lyricsync.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class TranscriptReaderTest {

  private final TranscriptReader reader = new TranscriptReader(new ObjectMapper());

  @Test
  void read_parsesFullRecord() throws Exception {
    String json =
        """
        {
          "metadata": {
            "artist": "Artist",
            "track": "Track",
            "original_lyrics": "First line\\nSecond line",
            "timing_info": {"start_offset": 1.5},
            "source": "ignored"
          },
          "words": [
            {"word": "first", "start": 1.0, "end": 1.5, "confidence": 0.9, "original_word": "furst"},
            {"word": "line", "start": 1.5, "end": 2.0}
          ]
        }
        """;

    TranscriptDocument document = reader.read(stream(json));

    assertThat(document.metadata().artist()).isEqualTo("Artist");
    assertThat(document.metadata().originalLyrics()).isEqualTo("First line\nSecond line");
    assertThat(document.metadata().startOffset()).isEqualTo(1.5);
    assertThat(document.words()).hasSize(2);
    assertThat(document.words().get(0).originalWord()).isEqualTo("furst");
    assertThat(document.words().get(1).confidence()).isNull();
  }

  @Test
  void read_defaultsOptionalFields() throws Exception {
    TranscriptDocument document =
        reader.read(
            stream("{\"metadata\":{\"artist\":\"A\",\"track\":\"T\",\"original_lyrics\":\"la\"},\"words\":[]}"));

    assertThat(document.metadata().startOffset()).isZero();
    assertThat(document.words()).isEmpty();
  }

  @Test
  void read_rejectsMalformedJson() {
    assertThatThrownBy(() -> reader.read(stream("{\"metadata\": ")))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("Malformed");
  }

  @Test
  void read_rejectsMissingMetadataFields() {
    assertThatThrownBy(() -> reader.read(stream("{\"words\": []}")))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("metadata");
    assertThatThrownBy(
            () ->
                reader.read(
                    stream("{\"metadata\":{\"track\":\"T\",\"original_lyrics\":\"la\"},\"words\":[]}")))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("artist");
  }

  @Test
  void read_rejectsEmptyLyrics() {
    assertThatThrownBy(
            () ->
                reader.read(
                    stream("{\"metadata\":{\"artist\":\"A\",\"track\":\"T\",\"original_lyrics\":\" \"},\"words\":[]}")))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("original_lyrics");
  }

  @Test
  void read_rejectsWordsWithoutTiming() {
    String json =
        "{\"metadata\":{\"artist\":\"A\",\"track\":\"T\",\"original_lyrics\":\"la\"},"
            + "\"words\":[{\"word\":\"la\",\"start\":1.0}]}";

    assertThatThrownBy(() -> reader.read(stream(json)))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("words[0]");
  }

  @Test
  void read_rejectsMissingWordsArray() {
    assertThatThrownBy(
            () ->
                reader.read(
                    stream("{\"metadata\":{\"artist\":\"A\",\"track\":\"T\",\"original_lyrics\":\"la\"}}")))
        .isInstanceOf(InvalidTranscriptException.class)
        .hasMessageContaining("words");
  }

  private static InputStream stream(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }
}
