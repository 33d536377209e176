package dev.interestmap.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A selectable answer of a {@link Question}. Options without an area
 * contribute nothing to the questionnaire score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionOption {
    private String text;
    private String area;

    @Builder.Default
    private double weight = 1.0;

    public boolean hasArea() {
        return area != null && !area.isBlank();
    }
}
