package dev.interestmap.text;

import dev.interestmap.ai.ModelArtifact;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the fixed-order feature vector the artifact's scaler and classifier
 * were fitted on:
 * <pre>
 * [embedding] ++ [score, matches, score/vocab, matches/words per area]
 *             ++ [8 linguistic features] ++ [pattern hits per area]
 * </pre>
 * Area order always comes from {@link ModelArtifact#areaOrder()}.
 * Word-based features work on the set of distinct words, matching how the
 * artifact was built.
 */
public class TextFeatureExtractor {

    static final double WHOLE_WORD_MULTIPLIER = 1.5;
    static final int LONG_WORD_LENGTH = 6;

    private final ModelArtifact artifact;

    public TextFeatureExtractor(ModelArtifact artifact) {
        this.artifact = Objects.requireNonNull(artifact);
    }

    /**
     * Concatenates the embedding with the manual feature block.
     *
     * @param processedText output of {@link TextNormalizer#normalize(String)}
     * @param embedding     embedding of the same processed text
     */
    public double[] buildFeatureVector(String processedText, double[] embedding) {
        double[] manual = manualFeatures(processedText);
        double[] vector = Arrays.copyOf(embedding, embedding.length + manual.length);
        System.arraycopy(manual, 0, vector, embedding.length, manual.length);
        return vector;
    }

    /**
     * Everything after the embedding: per-area keyword tuples, linguistic
     * features, per-area pattern counts.
     */
    public double[] manualFeatures(String processedText) {
        String text = processedText == null ? "" : processedText;
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> words = distinctWords(lower);
        List<String> areas = artifact.areaOrder();

        double[] features = new double[areas.size() * ModelArtifact.FEATURES_PER_AREA
                + ModelArtifact.LINGUISTIC_FEATURE_COUNT];
        int cursor = 0;

        KeywordTally tally = tallyKeywords(lower, words, areas);
        for (int i = 0; i < areas.size(); i++) {
            Set<String> vocabulary = artifact.categoryVocabulary().getOrDefault(areas.get(i), Set.of());
            double score = tally.scores()[i];
            double matches = tally.matches()[i];
            features[cursor++] = score;
            features[cursor++] = matches;
            features[cursor++] = score / Math.max(vocabulary.size(), 1);
            features[cursor++] = matches / Math.max(words.size(), 1);
        }

        for (double value : linguisticFeatures(text, words)) {
            features[cursor++] = value;
        }

        for (String area : areas) {
            features[cursor++] = countPatternHits(lower, artifact.categoryPatterns().getOrDefault(area, List.of()));
        }
        return features;
    }

    double[] linguisticFeatures(String text, Set<String> words) {
        int wordCount = words.size();
        int charCount = codePoints(text);
        long longWords = words.stream().filter(w -> codePoints(w) > LONG_WORD_LENGTH).count();
        long exclamations = text.chars().filter(c -> c == '!' || c == '?').count();
        long commas = text.chars().filter(c -> c == ',').count();
        long upper = text.codePoints().filter(Character::isUpperCase).count();
        long keywordWords = words.stream().filter(artifact.keywordWeights()::containsKey).count();

        return new double[] {
                wordCount,
                charCount,
                longWords,
                exclamations,
                commas,
                // diversity over an already distinct word set; kept for vector layout
                (double) words.size() / Math.max(wordCount, 1),
                (double) upper / Math.max(charCount, 1),
                (double) keywordWords / Math.max(wordCount, 1)
        };
    }

    private KeywordTally tallyKeywords(String lower, Set<String> words, List<String> areas) {
        double[] scores = new double[areas.size()];
        double[] matches = new double[areas.size()];
        for (Map.Entry<String, Map<String, Double>> term : artifact.keywordWeights().entrySet()) {
            if (!lower.contains(term.getKey())) {
                continue;
            }
            boolean wholeWord = words.contains(term.getKey());
            for (Map.Entry<String, Double> areaWeight : term.getValue().entrySet()) {
                int index = areas.indexOf(areaWeight.getKey());
                if (index < 0) {
                    continue;
                }
                if (wholeWord) {
                    scores[index] += areaWeight.getValue() * WHOLE_WORD_MULTIPLIER;
                    matches[index] += 1;
                } else {
                    scores[index] += areaWeight.getValue();
                }
            }
        }
        return new KeywordTally(scores, matches);
    }

    private static int countPatternHits(String lower, List<Pattern> patterns) {
        int hits = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(lower).find()) {
                hits++;
            }
        }
        return hits;
    }

    static Set<String> distinctWords(String text) {
        Set<String> words = new LinkedHashSet<>();
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                words.add(token);
            }
        }
        return words;
    }

    private static int codePoints(String value) {
        return value.codePointCount(0, value.length());
    }

    private record KeywordTally(double[] scores, double[] matches) {
    }
}
