package dev.interestmap.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link ModelArtifact} read from a portable JSON document. All tables are
 * copied into unmodifiable structures at load time; iteration order of the
 * keyword table is the document order.
 */
@Slf4j
public final class JsonModelArtifact implements ModelArtifact {

    private final String version;
    private final List<String> labels;
    private final List<String> areaOrder;
    private final Map<String, Map<String, Double>> keywordWeights;
    private final Map<String, List<Pattern>> categoryPatterns;
    private final Map<String, Set<String>> categoryVocabulary;
    private final EmbedderDescriptor embedder;
    private final StandardScaler scaler;
    private final SoftmaxClassifier classifier;

    private JsonModelArtifact(ArtifactDocument document) {
        if (document.getLabels() == null || document.getLabels().isEmpty()) {
            throw new ModelLoadException("Artifact declares no labels");
        }
        if (document.getScaler() == null || document.getClassifier() == null) {
            throw new ModelLoadException("Artifact is missing its scaler or classifier");
        }
        this.version = document.getVersion();
        this.labels = List.copyOf(document.getLabels());
        this.keywordWeights = copyKeywords(document.getKeywordWeights());
        this.categoryPatterns = compilePatterns(document.getCategoryPatterns());
        this.categoryVocabulary = copyVocabulary(document.getCategoryVocab());
        this.areaOrder = document.getAreaOrder() != null && !document.getAreaOrder().isEmpty()
                ? List.copyOf(document.getAreaOrder())
                : categoryVocabulary.keySet().stream().sorted().toList();
        this.scaler = new StandardScaler(document.getScaler().getMean(), document.getScaler().getScale());
        this.classifier = new SoftmaxClassifier(
                document.getClassifier().getCoefficients(), document.getClassifier().getIntercepts());

        EmbedderSection declared = document.getEmbedder();
        this.embedder = declared == null
                ? new EmbedderDescriptor(null, expectedEmbeddingDimension())
                : new EmbedderDescriptor(declared.getName(), declared.getDimension());

        validateLayout();
    }

    /**
     * Parses and validates an artifact document.
     *
     * @throws ModelLoadException         if the document cannot be read
     * @throws ModelIncompatibleException if its tables disagree in size
     */
    public static JsonModelArtifact read(InputStream input, ObjectMapper objectMapper) {
        try {
            ArtifactDocument document = objectMapper.readValue(input, ArtifactDocument.class);
            JsonModelArtifact artifact = new JsonModelArtifact(document);
            log.info("Loaded model artifact {} with {} labels: {}",
                    artifact.version != null ? artifact.version : "(unversioned)",
                    artifact.labels.size(), artifact.labels);
            return artifact;
        } catch (IOException e) {
            throw new ModelLoadException("Could not read model artifact", e);
        }
    }

    /**
     * Builds an artifact from an already parsed document.
     */
    public static JsonModelArtifact from(ArtifactDocument document) {
        return new JsonModelArtifact(document);
    }

    private void validateLayout() {
        if (classifier.classCount() != labels.size()) {
            throw new ModelIncompatibleException("Classifier has " + classifier.classCount()
                    + " classes but artifact declares " + labels.size() + " labels");
        }
        if (classifier.featureDimension() != scaler.dimension()) {
            throw new ModelIncompatibleException("Scaler dimension " + scaler.dimension()
                    + " does not match classifier input " + classifier.featureDimension());
        }
        if (expectedEmbeddingDimension() <= 0) {
            throw new ModelIncompatibleException("Scaler dimension " + scaler.dimension()
                    + " leaves no room for an embedding next to " + manualFeatureCount() + " manual features");
        }
        if (embedder.dimension() > 0 && embedder.dimension() != expectedEmbeddingDimension()) {
            throw new ModelIncompatibleException("Embedder " + embedder.name() + " declares dimension "
                    + embedder.dimension() + " but scaler expects " + expectedEmbeddingDimension());
        }
    }

    public String version() {
        return version;
    }

    @Override
    public List<String> labels() {
        return labels;
    }

    @Override
    public List<String> areaOrder() {
        return areaOrder;
    }

    @Override
    public Map<String, Map<String, Double>> keywordWeights() {
        return keywordWeights;
    }

    @Override
    public Map<String, List<Pattern>> categoryPatterns() {
        return categoryPatterns;
    }

    @Override
    public Map<String, Set<String>> categoryVocabulary() {
        return categoryVocabulary;
    }

    @Override
    public EmbedderDescriptor embedder() {
        return embedder;
    }

    @Override
    public int featureDimension() {
        return scaler.dimension();
    }

    @Override
    public double[] transform(double[] features) {
        return scaler.transform(features);
    }

    @Override
    public double[] predictProba(double[] scaledFeatures) {
        return classifier.predictProba(scaledFeatures);
    }

    private static Map<String, Map<String, Double>> copyKeywords(Map<String, LinkedHashMap<String, Double>> source) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((term, weights) -> copy.put(term,
                    Collections.unmodifiableMap(new LinkedHashMap<>(weights))));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, List<Pattern>> compilePatterns(Map<String, List<String>> source) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        if (source == null) {
            return Collections.unmodifiableMap(compiled);
        }
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String regex : entry.getValue()) {
                try {
                    patterns.add(Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS));
                } catch (PatternSyntaxException e) {
                    throw new ModelLoadException("Invalid pattern for area '" + entry.getKey() + "': " + regex, e);
                }
            }
            compiled.put(entry.getKey(), List.copyOf(patterns));
        }
        return Collections.unmodifiableMap(compiled);
    }

    private static Map<String, Set<String>> copyVocabulary(Map<String, List<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((area, terms) -> copy.put(area,
                    Collections.unmodifiableSet(new LinkedHashSet<>(terms))));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * On-disk layout of an artifact.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArtifactDocument {
        private String version;
        private List<String> labels;
        private List<String> areaOrder;
        private EmbedderSection embedder;
        private ScalerSection scaler;
        private ClassifierSection classifier;
        private LinkedHashMap<String, LinkedHashMap<String, Double>> keywordWeights;
        private LinkedHashMap<String, List<String>> categoryPatterns;
        private LinkedHashMap<String, List<String>> categoryVocab;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbedderSection {
        private String name;
        private int dimension;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScalerSection {
        private double[] mean;
        private double[] scale;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClassifierSection {
        private double[][] coefficients;
        private double[] intercepts;
    }
}
