package dev.interestmap.ai.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Embedder backed by an HTTP inference service speaking the common
 * {@code /v1/embeddings} shape: {@code {"model": ..., "input": [...]}} in,
 * {@code {"data": [{"embedding": [...]}]}} out.
 */
@Slf4j
public class RemoteEmbeddingProvider implements EmbeddingProvider {

    private final WebClient webClient;
    private final String name;
    private final int dimension;
    private final String path;
    private final Duration timeout;

    public RemoteEmbeddingProvider(String name, int dimension, String baseUrl, String path,
                                   String apiKey, Duration timeout) {
        this.name = Objects.requireNonNull(name);
        this.dimension = dimension;
        this.path = Objects.requireNonNull(path);
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(10);

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.webClient = builder.build();
        log.info("Remote embedding provider '{}' configured at {} (dim: {})", name, baseUrl, dimension);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public double[] embed(String text) {
        EmbeddingResponse response = webClient.post()
                .uri(path)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(new EmbeddingRequest(name, List.of(text == null ? "" : text)))
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .timeout(timeout)
                .retryWhen(Retry.backoff(2, Duration.ofMillis(200))
                        .filter(this::isRetryableError)
                        .doBeforeRetry(signal -> log.debug("Retrying embedding call to '{}' (attempt {})",
                                name, signal.totalRetries() + 1)))
                .block();

        double[] embedding = extractEmbedding(response);
        if (dimension > 0 && embedding.length != dimension) {
            throw new IllegalStateException("Embedding service '" + name + "' returned dimension "
                    + embedding.length + ", expected " + dimension);
        }
        return EmbeddingProvider.l2Normalize(embedding);
    }

    private boolean isRetryableError(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError()
                    || responseException.getStatusCode().value() == 429;
        }
        return throwable instanceof TimeoutException;
    }

    private double[] extractEmbedding(EmbeddingResponse response) {
        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null) {
            throw new IllegalStateException("Embedding service '" + name + "' returned no embedding");
        }
        return response.data().get(0).embedding();
    }

    record EmbeddingRequest(String model, List<String> input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(double[] embedding) {
    }
}
