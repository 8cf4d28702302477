package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.model.Tags;
import com.placeguide.recommend.model.Venue;
import com.placeguide.recommend.resilience.CircuitBreaker;
import com.placeguide.recommend.resilience.RecommendResilienceRegistry;
import com.placeguide.recommend.store.CandidateStore;
import com.placeguide.recommend.store.StoreRequestException;
import com.placeguide.recommend.store.StoreUnavailableException;
import com.placeguide.recommend.store.VenueDistance;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class GeoRetriever implements Retriever {
    private static final Comparator<VenueDistance> RATING_THEN_DISTANCE = Comparator
        .comparing((VenueDistance hit) -> hit.venue().getRating(), Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparingDouble(VenueDistance::distanceMeters);

    private final CandidateStore candidateStore;
    private final RetrievalProperties properties;
    private final RecommendResilienceRegistry resilienceRegistry;

    public GeoRetriever(
        CandidateStore candidateStore,
        RetrievalProperties properties,
        RecommendResilienceRegistry resilienceRegistry
    ) {
        this.candidateStore = candidateStore;
        this.properties = properties;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public String name() {
        return "geo";
    }

    @Override
    public RetrievalStageResult retrieve(RetrievalStageContext context) {
        Query query = context.getQuery();
        GeoPoint point = query.getPoint();
        if (point == null || context.getLimit() <= 0) {
            return RetrievalStageResult.success(List.of(), 0L);
        }
        CircuitBreaker breaker = resilienceRegistry.getGeoBreaker();
        if (!breaker.allowRequest()) {
            return RetrievalStageResult.unavailable("geo_circuit_open");
        }

        int radius = query.getRadiusMeters() != null ? query.getRadiusMeters() : properties.getDefaultRadiusMeters();
        double minRating = query.getMinRating() != null ? query.getMinRating() : properties.getDefaultMinRating();
        Set<String> wantedTags = Tags.normalizeAll(query.getTags());
        int fetchLimit = properties.fetchLimit(context.getLimit(), !wantedTags.isEmpty());

        long started = System.nanoTime();
        List<VenueDistance> hits;
        try {
            hits = StoreCalls.withSingleRetry(
                "geo search",
                () -> candidateStore.searchNearby(point, radius, minRating, fetchLimit)
            );
            breaker.recordSuccess();
        } catch (StoreUnavailableException e) {
            breaker.recordFailure();
            return RetrievalStageResult.unavailable(e.getMessage());
        } catch (StoreRequestException e) {
            return RetrievalStageResult.error(e.getMessage());
        }

        // store ordering is trusted only after the hard filters are re-applied
        List<VenueDistance> ordered = new ArrayList<>(hits);
        ordered.sort(RATING_THEN_DISTANCE);
        for (VenueDistance hit : ordered) {
            if (context.shouldStop() || context.isFull()) {
                break;
            }
            if (!accept(hit, radius, minRating, wantedTags)) {
                continue;
            }
            context.gather(Candidate.fromDistance(hit.venue(), hit.distanceMeters(), radius));
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        return RetrievalStageResult.success(context.snapshot(), tookMs);
    }

    private boolean accept(VenueDistance hit, int radius, double minRating, Set<String> wantedTags) {
        Venue venue = hit.venue();
        if (venue.getLocation() == null || hit.distanceMeters() > radius) {
            return false;
        }
        double rating = venue.getRating() == null ? 0.0 : venue.getRating();
        if (rating < minRating) {
            return false;
        }
        return wantedTags.isEmpty() || Tags.anyMatch(venue.getTags(), wantedTags);
    }
}
