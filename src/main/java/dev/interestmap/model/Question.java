package dev.interestmap.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A multiple-choice question. Option ids are unique within a question and
 * keep their declaration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Question {
    private int id;

    @JsonAlias("question")
    private String prompt;

    @Builder.Default
    private LinkedHashMap<String, QuestionOption> options = new LinkedHashMap<>();

    public QuestionOption getOption(String optionId) {
        return options == null ? null : options.get(optionId);
    }

    public Map<String, QuestionOption> optionsView() {
        return options == null ? Map.of() : Collections.unmodifiableMap(options);
    }
}
