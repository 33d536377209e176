package dev.interestmap.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The options a learner selected for one question, in selection order.
 * Repeated option ids are kept so validation can reject them.
 */
public record QuestionResponse(int questionId, List<String> selectedOptions) {

    public QuestionResponse {
        selectedOptions = selectedOptions == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(selectedOptions));
    }

    public static QuestionResponse of(int questionId, String... optionIds) {
        return new QuestionResponse(questionId, Arrays.asList(optionIds));
    }

    public static QuestionResponse of(int questionId, Collection<String> optionIds) {
        return new QuestionResponse(questionId, new ArrayList<>(optionIds));
    }
}
