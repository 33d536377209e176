package dev.interestmap;

import dev.interestmap.model.MappingMethod;
import dev.interestmap.model.MappingResult;
import dev.interestmap.model.QuestionCatalog;
import dev.interestmap.model.QuestionResponse;
import dev.interestmap.service.InterestMappingEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class MappingFlowTest {

    private static final String TECH = "Technology and Computing";

    @MockitoBean
    private MappingRunner mappingRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private InterestMappingEngine engine;

    @Autowired
    private QuestionCatalog questionCatalog;

    @Test
    @DisplayName("Should map a technology-leaning learner end to end")
    void shouldMapTechnologyLearner() {
        List<QuestionResponse> responses = List.of(
                QuestionResponse.of(1, "1"),
                QuestionResponse.of(2, "1", "2"),
                QuestionResponse.of(3, "1"),
                QuestionResponse.of(4, "2"),
                QuestionResponse.of(5, "1"));

        MappingResult result = engine.mapInterests(responses, questionCatalog,
                "Eu gosto de programar em Python e criar software, tb curto matemática!");

        assertThat(result.getAnalysisDetails().method()).isEqualTo(MappingMethod.HYBRID);
        assertThat(result.getRecommendedArea()).isEqualTo(TECH);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getTextScores().get(TECH)).isEqualTo(1.0);
        assertThat(result.getTopAreas()).hasSizeLessThanOrEqualTo(3);
        assertThat(result.getAnalysisDetails().agreementScore()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Should give identical results for a repeated submission")
    void shouldBeStableAcrossCalls() {
        List<QuestionResponse> responses = List.of(QuestionResponse.of(5, "4"));
        String text = "Adoro arte, música e desenho desde pequeno.";

        MappingResult first = engine.mapInterests(responses, questionCatalog, text);
        MappingResult second = engine.mapInterests(responses, questionCatalog, text);

        assertThat(second).isEqualTo(first);
        assertThat(first.getRecommendedArea()).isEqualTo("Arts and Culture");
    }
}
