package com.placeguide.recommend.store;

import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Venue;
import java.util.List;
import java.util.Optional;

public interface CandidateStore {

    /**
     * Venues with a location inside the radius and rated at least {@code minRating}, ordered by rating
     * descending then distance ascending.
     */
    List<VenueDistance> searchNearby(GeoPoint point, int radiusMeters, double minRating, int limit);

    List<VenueSimilarity> searchSimilar(List<Double> vector, double minRating, int limit, Integer timeBudgetMs);

    Optional<Venue> findVenue(long venueId);
}
