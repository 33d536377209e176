package dev.interestmap.ai;

import dev.interestmap.ai.embedding.EmbeddingProvider;
import dev.interestmap.cache.TextScoreCache;
import dev.interestmap.metrics.MappingMetrics;
import dev.interestmap.model.ScoreMap;
import dev.interestmap.text.TextFeatureExtractor;
import dev.interestmap.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * TextClassifier backed by a loaded {@link ModelArtifact} and a resolved
 * {@link EmbeddingProvider}. Embedding and inference run under a timeout;
 * any failure degrades to an empty score map instead of failing the caller.
 */
@Slf4j
public class ModelTextClassifier implements TextClassifier {

    private final ModelArtifact artifact;
    private final EmbeddingProvider embeddingProvider;
    private final TextFeatureExtractor featureExtractor;
    private final TextScoreCache cache;
    private final MappingMetrics metrics;
    private final Duration inferenceTimeout;
    private final int minTextLength;

    public ModelTextClassifier(ModelArtifact artifact, EmbeddingProvider embeddingProvider,
                               TextScoreCache cache, MappingMetrics metrics,
                               Duration inferenceTimeout, int minTextLength) {
        this.artifact = Objects.requireNonNull(artifact);
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider);
        this.featureExtractor = new TextFeatureExtractor(artifact);
        this.cache = Objects.requireNonNull(cache);
        this.metrics = Objects.requireNonNull(metrics);
        this.inferenceTimeout = Objects.requireNonNull(inferenceTimeout);
        this.minTextLength = minTextLength;
        log.info("Text classification enabled with {} labels, embedder '{}', timeout {}",
                artifact.labels().size(), embeddingProvider.getName(), inferenceTimeout);
    }

    @Override
    public ScoreMap classify(String processedText) {
        if (TextNormalizer.length(processedText) < minTextLength) {
            return ScoreMap.empty();
        }

        Optional<ScoreMap> cached = cache.get(processedText);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        long start = System.nanoTime();
        ScoreMap scores = Mono.fromCallable(() -> infer(processedText))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(inferenceTimeout)
                .doOnSuccess(result -> {
                    metrics.recordClassification();
                    cache.put(processedText, result);
                })
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("Text classification timed out after {} - continuing without text signal",
                                inferenceTimeout);
                        metrics.recordClassificationTimeout();
                    } else {
                        log.warn("Text classification failed: {} - continuing without text signal",
                                e.getMessage(), e);
                        metrics.recordClassificationFailure();
                    }
                    return Mono.just(ScoreMap.empty());
                })
                .block();
        metrics.recordInferenceLatency(Duration.ofNanos(System.nanoTime() - start));

        return scores != null ? scores : ScoreMap.empty();
    }

    private ScoreMap infer(String processedText) {
        double[] embedding = embeddingProvider.embed(processedText);
        double[] features = featureExtractor.buildFeatureVector(processedText, embedding);
        double[] probabilities = artifact.predictProba(artifact.transform(features));

        List<String> labels = artifact.labels();
        Map<String, Double> byArea = new LinkedHashMap<>();
        for (int i = 0; i < probabilities.length && i < labels.size(); i++) {
            byArea.put(labels.get(i), probabilities[i]);
        }
        log.debug("Text probabilities: {}", byArea);
        return ScoreMap.normalize(byArea);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Set<String> keywordTerms() {
        return artifact.keywordWeights().keySet();
    }

    @Override
    public List<String> labels() {
        return artifact.labels();
    }
}
