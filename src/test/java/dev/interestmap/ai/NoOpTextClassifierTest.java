package dev.interestmap.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NoOpTextClassifierTest {

    private final NoOpTextClassifier classifier = new NoOpTextClassifier();

    @Test
    @DisplayName("Should always return false for isEnabled")
    void shouldReturnFalseForIsEnabled() {
        assertThat(classifier.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should return empty scores for any text")
    void shouldReturnEmptyScores() {
        assertThat(classifier.classify("eu gosto muito de programar em python").isEmpty()).isTrue();
        assertThat(classifier.classify("")).isNotNull();
    }

    @Test
    @DisplayName("Should expose no keywords or labels")
    void shouldExposeNothing() {
        assertThat(classifier.keywordTerms()).isEmpty();
        assertThat(classifier.labels()).isEmpty();
    }
}
