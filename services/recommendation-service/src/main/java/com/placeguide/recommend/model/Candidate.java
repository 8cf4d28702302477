package com.placeguide.recommend.model;

public final class Candidate {
    private final Venue venue;
    private final Double similarity;
    private final Double distanceMeters;
    private final double retrievalSignal;
    private final Double score;
    private final double adjustment;

    private Candidate(
        Venue venue,
        Double similarity,
        Double distanceMeters,
        double retrievalSignal,
        Double score,
        double adjustment
    ) {
        if (venue == null) {
            throw new IllegalArgumentException("venue is required");
        }
        this.venue = venue;
        this.similarity = similarity;
        this.distanceMeters = distanceMeters;
        this.retrievalSignal = retrievalSignal;
        this.score = score;
        this.adjustment = adjustment;
    }

    public static Candidate fromSimilarity(Venue venue, double similarity) {
        return new Candidate(venue, similarity, null, clamp(similarity), null, 0.0);
    }

    public static Candidate fromDistance(Venue venue, double distanceMeters, int radiusMeters) {
        double signal = 0.0;
        if (radiusMeters > 0) {
            double bounded = Math.min(Math.max(distanceMeters, 0.0), radiusMeters);
            signal = 1.0 - bounded / radiusMeters;
        }
        return new Candidate(venue, null, distanceMeters, clamp(signal), null, 0.0);
    }

    public Candidate withDistance(double distanceMeters) {
        return new Candidate(venue, similarity, distanceMeters, retrievalSignal, score, adjustment);
    }

    public Candidate withScore(double score, double adjustment) {
        return new Candidate(venue, similarity, distanceMeters, retrievalSignal, score, adjustment);
    }

    public Venue getVenue() {
        return venue;
    }

    public long getVenueId() {
        return venue.getId();
    }

    public Double getSimilarity() {
        return similarity;
    }

    public Double getDistanceMeters() {
        return distanceMeters;
    }

    public double getRetrievalSignal() {
        return retrievalSignal;
    }

    public Double getScore() {
        return score;
    }

    public double getAdjustment() {
        return adjustment;
    }

    public double effectiveScore() {
        return score == null ? retrievalSignal : score;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
