package dev.interestmap.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SoftmaxClassifierTest {

    @Test
    @DisplayName("Should return uniform probabilities for zero logits")
    void shouldReturnUniformForZeroLogits() {
        SoftmaxClassifier classifier = new SoftmaxClassifier(new double[3][2], new double[3]);

        double[] probabilities = classifier.predictProba(new double[] {5.0, -1.0});

        assertThat(probabilities).containsExactly(new double[] {1.0 / 3, 1.0 / 3, 1.0 / 3}, within(1e-12));
    }

    @Test
    @DisplayName("Should favour the class with the largest logit")
    void shouldFavourLargestLogit() {
        SoftmaxClassifier classifier = new SoftmaxClassifier(
                new double[][] {{1.0, 0.0}, {0.0, 1.0}},
                new double[] {0.0, 0.0});

        double[] probabilities = classifier.predictProba(new double[] {0.0, Math.log(3.0)});

        assertThat(probabilities[0]).isCloseTo(0.25, within(1e-12));
        assertThat(probabilities[1]).isCloseTo(0.75, within(1e-12));
    }

    @Test
    @DisplayName("Should stay finite for very large logits")
    void shouldStayFiniteForLargeLogits() {
        SoftmaxClassifier classifier = new SoftmaxClassifier(
                new double[][] {{1000.0}, {999.0}},
                new double[] {0.0, 0.0});

        double[] probabilities = classifier.predictProba(new double[] {1.0});

        assertThat(Arrays.stream(probabilities).allMatch(Double::isFinite)).isTrue();
        assertThat(Arrays.stream(probabilities).sum()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should reject ragged coefficient rows")
    void shouldRejectRaggedRows() {
        assertThatThrownBy(() -> new SoftmaxClassifier(new double[][] {{1.0}, {1.0, 2.0}}, new double[2]))
                .isInstanceOf(ModelIncompatibleException.class);
    }

    @Test
    @DisplayName("Should reject intercept count mismatch")
    void shouldRejectInterceptMismatch() {
        assertThatThrownBy(() -> new SoftmaxClassifier(new double[2][1], new double[3]))
                .isInstanceOf(ModelIncompatibleException.class);
    }
}
