package com.placeguide.recommend.store;

import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Venue;
import com.placeguide.recommend.store.jdbc.JdbcErrors;
import com.placeguide.recommend.store.jdbc.VenueRepository;
import com.placeguide.recommend.store.qdrant.QdrantGateway;
import com.placeguide.recommend.store.qdrant.QdrantHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class PlaceCandidateStore implements CandidateStore {
    private static final Logger log = LoggerFactory.getLogger(PlaceCandidateStore.class);

    private final VenueRepository venueRepository;
    private final QdrantGateway qdrantGateway;

    public PlaceCandidateStore(VenueRepository venueRepository, QdrantGateway qdrantGateway) {
        this.venueRepository = venueRepository;
        this.qdrantGateway = qdrantGateway;
    }

    @Override
    public List<VenueDistance> searchNearby(GeoPoint point, int radiusMeters, double minRating, int limit) {
        try {
            return venueRepository.findNearby(point, radiusMeters, minRating, limit);
        } catch (DataAccessException e) {
            throw JdbcErrors.translate("geo search", e);
        }
    }

    @Override
    public List<VenueSimilarity> searchSimilar(List<Double> vector, double minRating, int limit, Integer timeBudgetMs) {
        List<QdrantHit> hits = qdrantGateway.search(vector, limit, minRating, timeBudgetMs);
        if (hits.isEmpty()) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>(hits.size());
        for (QdrantHit hit : hits) {
            ids.add(hit.getId());
        }
        Map<Long, Venue> hydrated = hydrate(ids);
        List<VenueSimilarity> results = new ArrayList<>(hits.size());
        for (QdrantHit hit : hits) {
            Venue venue = hydrated.get(hit.getId());
            if (venue == null) {
                venue = hit.toVenue();
            }
            results.add(new VenueSimilarity(venue, hit.getScore()));
        }
        return results;
    }

    @Override
    public Optional<Venue> findVenue(long venueId) {
        try {
            return Optional.ofNullable(venueRepository.findByIds(List.of(venueId)).get(venueId));
        } catch (DataAccessException e) {
            throw JdbcErrors.translate("venue lookup", e);
        }
    }

    private Map<Long, Venue> hydrate(List<Long> ids) {
        try {
            return venueRepository.findByIds(ids);
        } catch (DataAccessException e) {
            log.debug("venue hydration failed; falling back to vector payloads", e);
            return Map.of();
        }
    }
}
