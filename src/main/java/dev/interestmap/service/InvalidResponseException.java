package dev.interestmap.service;

import lombok.Getter;

/**
 * A questionnaire submission cannot be scored as given. Names the offending
 * question and, where relevant, option.
 */
@Getter
public class InvalidResponseException extends RuntimeException {

    private final int questionId;
    private final String optionId;

    public InvalidResponseException(int questionId, String message) {
        this(questionId, null, message);
    }

    public InvalidResponseException(int questionId, String optionId, String message) {
        super(message);
        this.questionId = questionId;
        this.optionId = optionId;
    }
}
