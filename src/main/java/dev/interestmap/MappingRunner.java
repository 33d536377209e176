package dev.interestmap;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.interestmap.model.AreaContribution;
import dev.interestmap.model.MappingResult;
import dev.interestmap.model.QuestionCatalog;
import dev.interestmap.model.Submission;
import dev.interestmap.service.InterestMappingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;

/**
 * Maps a single submission file against the configured question catalog and
 * logs the recommendation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingRunner {

    private static final String SEPARATOR = "========================================";

    private final InterestMappingEngine engine;
    private final QuestionCatalog questionCatalog;
    private final ObjectMapper objectMapper;

    @Value("${mapper.submission-file:}")
    private String submissionFile;

    /**
     * Reads the submission file and maps it.
     *
     * @return the mapping result, or null when no submission file is configured
     */
    public MappingResult execute() {
        if (submissionFile == null || submissionFile.isBlank()) {
            log.info("No mapper.submission-file configured - nothing to map");
            return null;
        }

        Submission submission = readSubmission(new File(submissionFile));
        log.info(SEPARATOR);
        log.info("Interest Mapping Starting");
        log.info("Responses: {}, free text: {}", submission.getResponses().size(),
                submission.getFreeText() != null && !submission.getFreeText().isBlank());
        log.info(SEPARATOR);

        MappingResult result = engine.mapInterests(
                submission.getResponses(), questionCatalog, submission.getFreeText());

        log.info("Recommended area: {} (confidence: {})",
                result.hasRecommendation() ? result.getRecommendedArea() : "none",
                String.format("%.1f%%", result.getConfidence() * 100));
        log.info("Text quality: {}", String.format("%.1f%%", result.getTextQuality() * 100));
        for (AreaContribution area : result.getTopAreas()) {
            log.info("  - {} ({}) questionnaire: {} text: {}", area.area(),
                    String.format("%.1f%%", area.percentage()),
                    String.format("%.2f", area.questionnaireContribution()),
                    String.format("%.2f", area.textContribution()));
        }
        log.info("Method: {}, agreement: {}", result.getAnalysisDetails().method(),
                String.format("%.2f", result.getAnalysisDetails().agreementScore()));
        log.info(SEPARATOR);
        return result;
    }

    private Submission readSubmission(File file) {
        if (!file.exists()) {
            throw new IllegalStateException("Submission file not found: " + file.getAbsolutePath());
        }
        try {
            return objectMapper.readValue(file, Submission.class);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read submission file " + file.getAbsolutePath(), e);
        }
    }
}
