package dev.interestmap.ai.embedding;

import dev.interestmap.ai.EmbedderDescriptor;
import dev.interestmap.ai.ModelIncompatibleException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the embedding provider for an artifact: the one it declares, else the
 * first entry of the fallback list whose probed output dimension matches what
 * the scaler expects. Runs once at startup.
 */
@Slf4j
public class EmbeddingProviderResolver {

    static final String PROBE_TEXT = "teste";

    private final Map<String, EmbeddingProvider> providers;
    private final List<String> fallbacks;

    public EmbeddingProviderResolver(List<EmbeddingProvider> providers, List<String> fallbacks) {
        this.providers = new LinkedHashMap<>();
        for (EmbeddingProvider provider : providers) {
            this.providers.putIfAbsent(provider.getName(), provider);
        }
        this.fallbacks = fallbacks != null ? List.copyOf(fallbacks) : List.of();
    }

    /**
     * @throws ModelIncompatibleException if no candidate produces {@code expectedDimension}
     */
    public EmbeddingProvider resolve(EmbedderDescriptor declared, int expectedDimension) {
        Set<String> candidates = new LinkedHashSet<>();
        if (declared != null && declared.name() != null && !declared.name().isBlank()) {
            candidates.add(declared.name());
        }
        candidates.addAll(fallbacks);

        List<String> rejected = new ArrayList<>();
        for (String candidate : candidates) {
            EmbeddingProvider provider = providers.get(candidate);
            if (provider == null) {
                log.debug("Embedding provider '{}' is not registered", candidate);
                rejected.add(candidate + " (not registered)");
                continue;
            }
            try {
                int dimension = provider.embed(PROBE_TEXT).length;
                if (dimension == expectedDimension) {
                    log.info("Using embedding provider '{}' (dim: {})", candidate, dimension);
                    return provider;
                }
                log.warn("Embedding provider '{}' yields dimension {}, scaler expects {}",
                        candidate, dimension, expectedDimension);
                rejected.add(candidate + " (dim " + dimension + ")");
            } catch (RuntimeException e) {
                log.warn("Embedding provider '{}' failed its probe: {}", candidate, e.getMessage());
                rejected.add(candidate + " (" + e.getClass().getSimpleName() + ")");
            }
        }
        throw new ModelIncompatibleException("No embedding provider produces dimension "
                + expectedDimension + "; tried " + rejected);
    }
}
