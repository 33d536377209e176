package dev.interestmap.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionCatalogTest {

    private static Question question(int id, String... areas) {
        LinkedHashMap<String, QuestionOption> options = new LinkedHashMap<>();
        for (int i = 0; i < areas.length; i++) {
            options.put(String.valueOf(i + 1), QuestionOption.builder()
                    .text("Option " + (i + 1))
                    .area(areas[i])
                    .build());
        }
        return Question.builder().id(id).prompt("Question " + id).options(options).build();
    }

    @Test
    @DisplayName("Should find questions by id")
    void shouldFindQuestionsById() {
        QuestionCatalog catalog = QuestionCatalog.of(question(1, "Tech"), question(7, "Arts"));

        assertThat(catalog.find(7)).isPresent();
        assertThat(catalog.find(2)).isEmpty();
        assertThat(catalog.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should collect areas in first-declared order")
    void shouldCollectAreaOrder() {
        QuestionCatalog catalog = QuestionCatalog.of(
                question(1, "Tech", "Arts"),
                question(2, "Sports", "Tech", null));

        assertThat(catalog.getAreaOrder()).containsExactly("Tech", "Arts", "Sports");
    }

    @Test
    @DisplayName("Should reject duplicate question ids")
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> QuestionCatalog.of(question(1, "Tech"), question(1, "Arts")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate question id");
    }

    @Test
    @DisplayName("Should load the bundled catalog")
    void shouldLoadBundledCatalog() throws Exception {
        try (InputStream input = getClass().getResourceAsStream("/questions.json")) {
            QuestionCatalog catalog = new ObjectMapper().readValue(input, QuestionCatalog.class);

            assertThat(catalog.size()).isEqualTo(5);
            assertThat(catalog.getAreaOrder()).hasSize(9).startsWith("Technology and Computing");
            assertThat(catalog.find(5).orElseThrow().getOption("1").getWeight()).isEqualTo(2.0);
            assertThat(catalog.getQuestions()).extracting(Question::getId).containsExactly(1, 2, 3, 4, 5);
        }
    }

    @Test
    @DisplayName("Empty catalog has no areas")
    void emptyCatalogHasNoAreas() {
        assertThat(QuestionCatalog.empty().getAreaOrder()).isEqualTo(List.of());
    }
}
