package dev.interestmap.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the free-text classifier, its embedders and its cache.
 * Loaded from application.yml under 'classifier' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "classifier")
public class ClassifierConfig {

    private boolean enabled = true;
    // fail startup instead of falling back to questionnaire-only scoring
    private boolean required = false;
    private String artifactPath;
    private Duration inferenceTimeout = Duration.ofSeconds(5);
    private List<String> embedderFallbacks = new ArrayList<>();
    private List<EmbedderDefinition> embedders = new ArrayList<>();
    private CacheSettings cache = new CacheSettings();

    public enum EmbedderType {
        HASHING,
        REMOTE
    }

    @Data
    public static class EmbedderDefinition {
        private String name;
        private EmbedderType type = EmbedderType.HASHING;
        private int dimension;
        private String baseUrl;
        private String path = "/v1/embeddings";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class CacheSettings {
        private boolean enabled = true;
        private int maxSize = 1000;
        private Duration ttl = Duration.ofHours(24);
    }
}
