package dev.interestmap.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.interestmap.ai.JsonModelArtifact;
import dev.interestmap.ai.ModelArtifact;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextFeatureExtractorTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static ModelArtifact artifact;
    private static JsonNode golden;

    private final TextNormalizer normalizer = new TextNormalizer();

    @BeforeAll
    static void loadFixtures() throws IOException {
        try (InputStream input = TextFeatureExtractorTest.class.getResourceAsStream("/fixtures/test-artifact.json")) {
            artifact = JsonModelArtifact.read(input, objectMapper);
        }
        try (InputStream input = TextFeatureExtractorTest.class.getResourceAsStream("/fixtures/feature-golden.json")) {
            golden = objectMapper.readTree(input);
        }
    }

    @Nested
    @DisplayName("Reference vector")
    class GoldenTests {

        @Test
        @DisplayName("Should normalize the reference text identically")
        void shouldNormalizeReferenceText() {
            assertThat(normalizer.normalize(golden.get("rawText").asText()))
                    .isEqualTo(golden.get("processedText").asText());
        }

        @Test
        @DisplayName("Should reproduce the reference manual features element by element")
        void shouldReproduceManualFeatures() {
            TextFeatureExtractor extractor = new TextFeatureExtractor(artifact);
            JsonNode expected = golden.get("manualFeatures");

            double[] actual = extractor.manualFeatures(golden.get("processedText").asText());

            assertThat(actual).hasSize(expected.size());
            for (int i = 0; i < actual.length; i++) {
                assertThat(actual[i]).as("feature %d", i).isCloseTo(expected.get(i).asDouble(), within(1e-12));
            }
        }
    }

    @Nested
    @DisplayName("Layout")
    class LayoutTests {

        @Test
        @DisplayName("Should order area blocks alphabetically when the artifact declares no order")
        void shouldUseSortedAreaOrder() {
            assertThat(artifact.areaOrder())
                    .containsExactly("Arts and Culture", "Exact Sciences", "Technology and Computing");
        }

        @Test
        @DisplayName("Should prefix the embedding and match the scaler width")
        void shouldPrefixEmbedding() {
            TextFeatureExtractor extractor = new TextFeatureExtractor(artifact);
            double[] embedding = {1, 2, 3, 4, 5, 6, 7, 8};

            double[] vector = extractor.buildFeatureVector("eu gosto de programar", embedding);

            assertThat(vector).hasSize(artifact.featureDimension());
            assertThat(vector).startsWith(1, 2, 3, 4, 5, 6, 7, 8);
        }

        @Test
        @DisplayName("Should yield only zeros for empty text")
        void shouldYieldZerosForEmptyText() {
            double[] features = new TextFeatureExtractor(artifact).manualFeatures("");

            assertThat(features).hasSize(artifact.manualFeatureCount()).containsOnly(0.0);
        }
    }

    @Nested
    @DisplayName("Keyword matching")
    class KeywordTests {

        @Test
        @DisplayName("Should boost whole-word keyword matches")
        void shouldBoostWholeWordMatches() {
            double[] features = new TextFeatureExtractor(artifact).manualFeatures("gosto de arte");

            // Arts and Culture is the first block: score, matches
            assertThat(features[0]).isEqualTo(2.0 * TextFeatureExtractor.WHOLE_WORD_MULTIPLIER);
            assertThat(features[1]).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should add plain weight without a match for substring hits")
        void shouldScoreSubstringWithoutMatch() {
            double[] features = new TextFeatureExtractor(artifact).manualFeatures("uma parte");

            assertThat(features[0]).isEqualTo(2.0);
            assertThat(features[1]).isZero();
        }

        @Test
        @DisplayName("Should count each matching pattern once")
        void shouldCountPatternHits() {
            TextFeatureExtractor extractor = new TextFeatureExtractor(artifact);
            double[] features = extractor.manualFeatures("programo software e programei mais software");

            int techPatternIndex = features.length - 1;
            assertThat(features[techPatternIndex]).isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("Should work on distinct words")
    void shouldWorkOnDistinctWords() {
        assertThat(TextFeatureExtractor.distinctWords("a b a  c b")).containsExactly("a", "b", "c");
        assertThat(TextFeatureExtractor.distinctWords("")).isEmpty();
    }
}
