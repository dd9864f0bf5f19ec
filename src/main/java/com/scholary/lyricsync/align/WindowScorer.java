package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.config.AlignmentProperties.MatchingProperties;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scores a lyrics line against a window of transcript words.
 *
 * <p>Pairing is strictly positional: line word {@code i} against window word {@code i}, over the
 * first {@code min(N, W)} positions. Per position:
 *
 * <pre>
 * wordScore = min(1, similarity * (exact ? 2 : 1)) * positionWeight(i, W) * confidence
 * </pre>
 *
 * <p>The window score is {@code sum(wordScore) / sum(positionWeight)}, scaled by the share of line
 * words the window covers, and multiplied by 1.2 when every line word was paired with an exact
 * match.
 */
@Component
public class WindowScorer {

  private final SimilarityScorer similarityScorer;
  private final MatchingProperties matching;

  public WindowScorer(SimilarityScorer similarityScorer, AlignmentProperties properties) {
    this.similarityScorer = similarityScorer;
    this.matching = properties.matching();
  }

  /**
   * Score one window.
   *
   * @param line the lyrics line
   * @param transcript the full transcript
   * @param start index of the window's first word
   * @param length window length, at least 1
   * @return the score with the window it was computed on
   */
  public WindowScore score(LyricsLine line, List<Word> transcript, int start, int length) {
    if (length < 1 || start < 0 || start + length > transcript.size()) {
      throw new IllegalArgumentException(
          "Window [" + start + ", " + (start + length) + ") outside transcript of "
              + transcript.size() + " words");
    }
    List<Word> window = transcript.subList(start, start + length);
    List<String> lineWords = line.words();
    int overlap = Math.min(lineWords.size(), length);

    double totalScore = 0.0;
    double totalWeight = 0.0;
    int exactMatches = 0;
    for (int i = 0; i < overlap; i++) {
      String lyric = lineWords.get(i);
      Word heard = window.get(i);

      double similarity = similarityScorer.similarity(lyric, heard.text());
      if (similarityScorer.exact(lyric, heard.text())) {
        similarity = Math.min(1.0, similarity * matching.exactMatchMultiplier());
        exactMatches++;
      }
      double weight = similarityScorer.positionWeight(i, length);
      totalScore += similarity * weight * heard.confidence();
      totalWeight += weight;
    }

    double score = 0.0;
    if (totalWeight > 0) {
      double coverage = (double) overlap / lineWords.size();
      score = totalScore / totalWeight * coverage;
      if (exactMatches == lineWords.size()) {
        score *= matching.wholeLineMultiplier();
      }
    }
    return new WindowScore(start, length, score, window, exactMatches);
  }
}
