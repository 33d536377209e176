package dev.interestmap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.interestmap.ai.JsonModelArtifact;
import dev.interestmap.ai.ModelArtifact;
import dev.interestmap.ai.ModelLoadException;
import dev.interestmap.ai.ModelTextClassifier;
import dev.interestmap.ai.NoOpTextClassifier;
import dev.interestmap.ai.TextClassifier;
import dev.interestmap.ai.embedding.EmbeddingProvider;
import dev.interestmap.ai.embedding.EmbeddingProviderResolver;
import dev.interestmap.ai.embedding.HashingEmbeddingProvider;
import dev.interestmap.ai.embedding.RemoteEmbeddingProvider;
import dev.interestmap.cache.CaffeineTextScoreCache;
import dev.interestmap.cache.NoOpTextScoreCache;
import dev.interestmap.cache.TextScoreCache;
import dev.interestmap.metrics.MappingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the model artifact once at startup and wires the text classifier.
 * An unusable artifact disables the text path unless classifier.required is set.
 */
@Slf4j
@Configuration
public class TextClassifierConfig {

    @Bean
    public TextScoreCache textScoreCache(ClassifierConfig classifierConfig) {
        ClassifierConfig.CacheSettings settings = classifierConfig.getCache();
        if (!settings.isEnabled()) {
            log.info("Text score cache disabled");
            return new NoOpTextScoreCache();
        }
        log.info("Text score cache enabled (max size: {}, ttl: {})", settings.getMaxSize(), settings.getTtl());
        return new CaffeineTextScoreCache(settings.getMaxSize(), settings.getTtl());
    }

    @Bean
    public TextClassifier textClassifier(ClassifierConfig classifierConfig, MappingConfig mappingConfig,
                                         ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                         TextScoreCache textScoreCache, MappingMetrics metrics) {
        if (!classifierConfig.isEnabled()) {
            return new NoOpTextClassifier();
        }
        String artifactPath = classifierConfig.getArtifactPath();
        if (artifactPath == null || artifactPath.isBlank()) {
            log.warn("classifier.artifact-path not set. Text analysis will be skipped.");
            return failOrDisable(classifierConfig, new ModelLoadException("No model artifact configured"));
        }

        try {
            ModelArtifact artifact = loadArtifact(resourceLoader.getResource(artifactPath), objectMapper);
            EmbeddingProviderResolver resolver = new EmbeddingProviderResolver(
                    createProviders(classifierConfig.getEmbedders()), classifierConfig.getEmbedderFallbacks());
            EmbeddingProvider provider = resolver.resolve(artifact.embedder(), artifact.expectedEmbeddingDimension());
            return new ModelTextClassifier(artifact, provider, textScoreCache, metrics,
                    classifierConfig.getInferenceTimeout(), mappingConfig.getMinTextLength());
        } catch (ModelLoadException e) {
            log.error("Model artifact {} is unusable: {}", artifactPath, e.getMessage());
            return failOrDisable(classifierConfig, e);
        }
    }

    static ModelArtifact loadArtifact(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            throw new ModelLoadException("Model artifact not found: " + resource.getDescription());
        }
        try (InputStream input = resource.getInputStream()) {
            return JsonModelArtifact.read(input, objectMapper);
        } catch (IOException e) {
            throw new ModelLoadException("Could not open model artifact " + resource.getDescription(), e);
        }
    }

    static List<EmbeddingProvider> createProviders(List<ClassifierConfig.EmbedderDefinition> definitions) {
        return definitions.stream()
                .map(TextClassifierConfig::createProvider)
                .toList();
    }

    private static EmbeddingProvider createProvider(ClassifierConfig.EmbedderDefinition definition) {
        String name = definition.getName();
        if (name == null || name.isBlank()) {
            throw new ModelLoadException("Embedder definition without a name");
        }
        if (definition.getType() == null) {
            throw new ModelLoadException("Embedder '" + name + "' has no type");
        }
        if (definition.getDimension() <= 0) {
            throw new ModelLoadException("Embedder '" + name + "' needs a positive dimension, got "
                    + definition.getDimension());
        }
        if (definition.getType() == ClassifierConfig.EmbedderType.REMOTE
                && (isBlank(definition.getBaseUrl()) || isBlank(definition.getPath()))) {
            throw new ModelLoadException("Remote embedder '" + name + "' needs a base-url and a path");
        }
        return switch (definition.getType()) {
            case HASHING -> new HashingEmbeddingProvider(definition.getName(), definition.getDimension());
            case REMOTE -> new RemoteEmbeddingProvider(definition.getName(), definition.getDimension(),
                    definition.getBaseUrl(), definition.getPath(), definition.getApiKey(), definition.getTimeout());
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static TextClassifier failOrDisable(ClassifierConfig classifierConfig, ModelLoadException cause) {
        if (classifierConfig.isRequired()) {
            throw new IllegalStateException("Text classifier is required but could not be loaded", cause);
        }
        return new NoOpTextClassifier();
    }
}
