package com.placeguide.recommend.embed;

import com.placeguide.recommend.resilience.CircuitBreaker;
import com.placeguide.recommend.resilience.RecommendResilienceRegistry;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final CircuitBreaker embedBreaker;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        RecommendResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.embedBreaker = resilienceRegistry.getEmbedBreaker();
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs) {
        return embed(text, timeBudgetMs, null, null);
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId) {
        String queryText = text == null ? null : text.trim();
        Optional<List<Double>> cached = cacheService.get(queryText);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<Double> vector = properties.getMode() == EmbeddingMode.TOY
            ? toyEmbedder.embed(queryText)
            : callEndpoint(queryText, timeBudgetMs, traceId, requestId);
        cacheService.put(queryText, vector);
        return vector;
    }

    private List<Double> callEndpoint(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (!embedBreaker.allowRequest()) {
            log.debug("embedding breaker open, skipping endpoint trace_id={}", traceId);
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<Double> vector = embeddingGateway.embed(text, timeBudgetMs, traceId, requestId);
            embedBreaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException e) {
            embedBreaker.recordFailure();
            log.warn("embedding failed reason={} trace_id={}", e.getMessage(), traceId);
            throw e;
        }
    }
}
