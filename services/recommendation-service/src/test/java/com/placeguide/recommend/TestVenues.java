package com.placeguide.recommend;

import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.Venue;
import java.util.List;

public final class TestVenues {
    private TestVenues() {
    }

    public static Venue venue(long id, String district, Double rating, String... tags) {
        return Venue.builder(id)
            .name("venue-" + id)
            .city("Москва")
            .district(district)
            .location(new GeoPoint(55.75, 37.62))
            .rating(rating)
            .reviewsCount((int) id)
            .tags(List.of(tags))
            .build();
    }

    public static Candidate semantic(long id, String district, double similarity, String... tags) {
        return Candidate.fromSimilarity(venue(id, district, 4.0, tags), similarity);
    }
}
