package com.placeguide.recommend.model;

import java.util.List;

public final class Query {
    private final QueryMode mode;
    private final GeoPoint point;
    private final String text;
    private final List<String> tags;
    private final Integer radiusMeters;
    private final Double minRating;

    public Query(QueryMode mode, GeoPoint point, String text, List<String> tags, Integer radiusMeters, Double minRating) {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        boolean hasText = text != null && !text.isBlank();
        if ((mode == QueryMode.GEO || mode == QueryMode.HYBRID) && point == null) {
            throw new IllegalArgumentException(mode + " query requires a point");
        }
        if ((mode == QueryMode.SEMANTIC || mode == QueryMode.HYBRID) && !hasText) {
            throw new IllegalArgumentException(mode + " query requires text");
        }
        if (radiusMeters != null && radiusMeters <= 0) {
            throw new IllegalArgumentException("radius must be positive");
        }
        if (minRating != null && (minRating < 0.0 || minRating > 5.0)) {
            throw new IllegalArgumentException("min rating out of range: " + minRating);
        }
        this.mode = mode;
        this.point = point;
        this.text = hasText ? text.trim() : null;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.radiusMeters = radiusMeters;
        this.minRating = minRating;
    }

    public static Query clarify() {
        return new Query(QueryMode.CLARIFY, null, null, null, null, null);
    }

    public static Query geo(GeoPoint point, Integer radiusMeters, Double minRating) {
        return new Query(QueryMode.GEO, point, null, null, radiusMeters, minRating);
    }

    public static Query semantic(String text) {
        return new Query(QueryMode.SEMANTIC, null, text, null, null, null);
    }

    public QueryMode getMode() {
        return mode;
    }

    public GeoPoint getPoint() {
        return point;
    }

    public String getText() {
        return text;
    }

    public List<String> getTags() {
        return tags;
    }

    public Integer getRadiusMeters() {
        return radiusMeters;
    }

    public Double getMinRating() {
        return minRating;
    }
}
