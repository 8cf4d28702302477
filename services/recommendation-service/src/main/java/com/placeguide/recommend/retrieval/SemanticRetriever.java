package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.embed.EmbeddingProvider;
import com.placeguide.recommend.embed.EmbeddingUnavailableException;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.model.Tags;
import com.placeguide.recommend.model.Venue;
import com.placeguide.recommend.resilience.CircuitBreaker;
import com.placeguide.recommend.resilience.RecommendResilienceRegistry;
import com.placeguide.recommend.store.CandidateStore;
import com.placeguide.recommend.store.StoreRequestException;
import com.placeguide.recommend.store.StoreUnavailableException;
import com.placeguide.recommend.store.VenueSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SemanticRetriever implements Retriever {
    private final CandidateStore candidateStore;
    private final EmbeddingProvider embeddingProvider;
    private final RetrievalProperties properties;
    private final RecommendResilienceRegistry resilienceRegistry;

    public SemanticRetriever(
        CandidateStore candidateStore,
        EmbeddingProvider embeddingProvider,
        RetrievalProperties properties,
        RecommendResilienceRegistry resilienceRegistry
    ) {
        this.candidateStore = candidateStore;
        this.embeddingProvider = embeddingProvider;
        this.properties = properties;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public String name() {
        return "semantic";
    }

    @Override
    public RetrievalStageResult retrieve(RetrievalStageContext context) {
        Query query = context.getQuery();
        String text = query.getText();
        if (text == null || text.isBlank() || context.getLimit() <= 0) {
            return RetrievalStageResult.success(List.of(), 0L);
        }
        long started = System.nanoTime();

        List<Double> vector;
        try {
            vector = embeddingProvider.embed(
                text,
                context.getTimeBudgetMs(),
                context.getTraceId(),
                context.getRequestId()
            );
        } catch (EmbeddingUnavailableException e) {
            return RetrievalStageResult.unavailable(e.getMessage());
        }
        if (vector == null || vector.isEmpty() || context.shouldStop()) {
            return RetrievalStageResult.success(List.of(), 0L);
        }

        CircuitBreaker breaker = resilienceRegistry.getVectorBreaker();
        if (!breaker.allowRequest()) {
            return RetrievalStageResult.unavailable("vector_circuit_open");
        }
        double minRating = query.getMinRating() != null ? query.getMinRating() : properties.getDefaultMinRating();
        Set<String> wantedTags = Tags.normalizeAll(query.getTags());
        int fetchLimit = properties.fetchLimit(context.getLimit(), !wantedTags.isEmpty());

        List<VenueSimilarity> hits;
        try {
            hits = StoreCalls.withSingleRetry(
                "vector search",
                () -> candidateStore.searchSimilar(vector, minRating, fetchLimit, context.getTimeBudgetMs())
            );
            breaker.recordSuccess();
        } catch (StoreUnavailableException e) {
            breaker.recordFailure();
            return RetrievalStageResult.unavailable(e.getMessage());
        } catch (StoreRequestException e) {
            return RetrievalStageResult.error(e.getMessage());
        }

        List<VenueSimilarity> ordered = new ArrayList<>(hits);
        ordered.sort(Comparator.comparingDouble(VenueSimilarity::similarity).reversed());
        for (VenueSimilarity hit : ordered) {
            if (context.shouldStop() || context.isFull()) {
                break;
            }
            Venue venue = hit.venue();
            double rating = venue.getRating() == null ? 0.0 : venue.getRating();
            if (rating < minRating) {
                continue;
            }
            if (!wantedTags.isEmpty() && !Tags.anyMatch(venue.getTags(), wantedTags)) {
                continue;
            }
            context.gather(Candidate.fromSimilarity(venue, hit.similarity()));
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        return RetrievalStageResult.success(context.snapshot(), tookMs);
    }
}
