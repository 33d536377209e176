package dev.interestmap.ai;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only capabilities of a pretrained text classification model.
 * Implementations are loaded once and shared across threads.
 */
public interface ModelArtifact {

    /** Keyword tuple plus pattern count per area. */
    int FEATURES_PER_AREA = 5;

    int LINGUISTIC_FEATURE_COUNT = 8;

    /**
     * Class labels in the order {@link #predictProba(double[])} reports them.
     */
    List<String> labels();

    /**
     * Area order of the per-area feature blocks. Part of the model contract.
     */
    List<String> areaOrder();

    /**
     * term -> (area -> weight)
     */
    Map<String, Map<String, Double>> keywordWeights();

    Map<String, List<Pattern>> categoryPatterns();

    Map<String, Set<String>> categoryVocabulary();

    EmbedderDescriptor embedder();

    /**
     * Number of features the scaler accepts.
     */
    int featureDimension();

    double[] transform(double[] features);

    double[] predictProba(double[] scaledFeatures);

    default int manualFeatureCount() {
        return areaOrder().size() * FEATURES_PER_AREA + LINGUISTIC_FEATURE_COUNT;
    }

    default int expectedEmbeddingDimension() {
        return featureDimension() - manualFeatureCount();
    }
}
