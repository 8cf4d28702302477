package com.placeguide.recommend.scoring;

public record ScoreBreakdown(
    long venueId,
    double signal,
    int preferredMatches,
    int avoidedMatches,
    double preferredBoost,
    double avoidedPenalty,
    double districtBoost,
    double dislikedPenalty
) {
    public double adjustment() {
        return preferredBoost - avoidedPenalty + districtBoost - dislikedPenalty;
    }

    public double score() {
        return signal + adjustment();
    }
}
