package dev.interestmap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, read-only set of questions a submission is scored against.
 * Declaration order of questions and options defines the area order used
 * to break ties between equally scored areas.
 */
public final class QuestionCatalog {

    private final List<Question> questions;
    private final Map<Integer, Question> byId;
    private final List<String> areaOrder;

    @JsonCreator
    public QuestionCatalog(@JsonProperty("questions") List<Question> questions) {
        List<Question> source = questions != null ? questions : List.of();
        Map<Integer, Question> index = new LinkedHashMap<>();
        for (Question question : source) {
            if (index.putIfAbsent(question.getId(), question) != null) {
                throw new IllegalArgumentException("Duplicate question id in catalog: " + question.getId());
            }
        }
        this.questions = Collections.unmodifiableList(new ArrayList<>(source));
        this.byId = Collections.unmodifiableMap(index);
        this.areaOrder = List.copyOf(collectAreas(source));
    }

    public static QuestionCatalog of(Question... questions) {
        return new QuestionCatalog(List.of(questions));
    }

    public static QuestionCatalog empty() {
        return new QuestionCatalog(List.of());
    }

    @JsonProperty("questions")
    public List<Question> getQuestions() {
        return questions;
    }

    public Optional<Question> find(int questionId) {
        return Optional.ofNullable(byId.get(questionId));
    }

    public int size() {
        return questions.size();
    }

    /**
     * Distinct areas in the order they are first declared by an option.
     */
    public List<String> getAreaOrder() {
        return areaOrder;
    }

    private static Set<String> collectAreas(List<Question> questions) {
        Set<String> areas = new LinkedHashSet<>();
        for (Question question : questions) {
            for (QuestionOption option : question.optionsView().values()) {
                if (option.hasArea()) {
                    areas.add(option.getArea());
                }
            }
        }
        return areas;
    }
}
