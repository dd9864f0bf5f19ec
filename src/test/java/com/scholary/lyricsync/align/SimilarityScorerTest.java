package com.scholary.lyricsync.align;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SimilarityScorerTest {

  private final SimilarityScorer scorer = new SimilarityScorer();

  @Test
  void similarity_identicalAfterNormalization() {
    assertThat(scorer.similarity("Tree,", "tree")).isEqualTo(1.0);
  }

  @Test
  void similarity_usesEditDistanceOverLongerWord() {
    // tree -> the: substitute r, drop one e
    assertThat(scorer.similarity("tree", "the")).isCloseTo(0.5, within(1e-9));
    assertThat(scorer.similarity("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7.0, within(1e-9));
  }

  @Test
  void similarity_disjointWordsScoreZero() {
    assertThat(scorer.similarity("abc", "xyz")).isEqualTo(0.0);
  }

  @Test
  void similarity_punctuationOnlyTokensAreIdentical() {
    assertThat(scorer.similarity("&", "&")).isEqualTo(1.0);
    assertThat(scorer.similarity("!!", "-")).isEqualTo(1.0);
    assertThat(scorer.similarity("&", "and")).isEqualTo(0.0);
    assertThat(scorer.similarity("", "word")).isEqualTo(0.0);
  }

  @Test
  void exact_comparesNormalizedForms() {
    assertThat(scorer.exact("Cypress!", "cypress")).isTrue();
    assertThat(scorer.exact("cypress", "cypres")).isFalse();
    assertThat(scorer.exact("&", "&")).isTrue();
    assertThat(scorer.exact("&", "you")).isFalse();
  }

  @Test
  void positionWeight_peaksAtCenter() {
    assertThat(scorer.positionWeight(2, 5)).isEqualTo(1.0);
    assertThat(scorer.positionWeight(0, 5)).isCloseTo(1.0 - 2 / 7.5, within(1e-9));
    assertThat(scorer.positionWeight(4, 5)).isCloseTo(1.0 - 2 / 7.5, within(1e-9));
    assertThat(scorer.positionWeight(0, 1)).isEqualTo(1.0);
  }

  @Test
  void positionWeight_clampsAtZero() {
    assertThat(scorer.positionWeight(10, 2)).isEqualTo(0.0);
    assertThat(scorer.positionWeight(0, 0)).isEqualTo(0.0);
  }

  @Test
  void levenshteinDistance_countsEdits() {
    assertThat(SimilarityScorer.levenshteinDistance("kitten", "sitting")).isEqualTo(3);
    assertThat(SimilarityScorer.levenshteinDistance("", "abc")).isEqualTo(3);
    assertThat(SimilarityScorer.levenshteinDistance("same", "same")).isZero();
  }
}
