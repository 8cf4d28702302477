package com.placeguide.recommend.scoring;

import com.placeguide.recommend.execution.StageDeadline;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Tags;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.model.Venue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class PersonalizationScorer {
    private static final Comparator<Candidate> SCORE_ORDER = Comparator
        .comparingDouble(Candidate::effectiveScore).reversed()
        .thenComparing(candidate -> candidate.getVenue().getRating(), Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(candidate -> candidate.getVenue().getReviewsCount(), Comparator.reverseOrder());

    private final ScoringProperties properties;

    public PersonalizationScorer(ScoringProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    public List<Candidate> score(List<Candidate> candidates, Optional<UserProfile> profile) {
        return score(candidates, profile, StageDeadline.none());
    }

    public List<Candidate> score(List<Candidate> candidates, Optional<UserProfile> profile, StageDeadline deadline) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<Candidate> scored = new ArrayList<>(candidates.size());
        if (profile == null || profile.isEmpty()) {
            for (Candidate candidate : candidates) {
                scored.add(candidate.withScore(candidate.getRetrievalSignal(), 0.0));
            }
            return scored;
        }
        UserProfile userProfile = profile.get();
        for (Candidate candidate : candidates) {
            if (deadline.isExpired()) {
                throw new ScoringTimeoutException("scoring exceeded " + deadline.getBudgetMs() + "ms");
            }
            ScoreBreakdown breakdown = explain(candidate, userProfile);
            scored.add(candidate.withScore(breakdown.score(), breakdown.adjustment()));
        }
        // List.sort is stable, full ties keep retrieval order
        scored.sort(SCORE_ORDER);
        return scored;
    }

    public ScoreBreakdown explain(Candidate candidate, UserProfile profile) {
        Venue venue = candidate.getVenue();
        Set<String> venueTags = venue.getNormalizedTags();
        int preferredMatches = Tags.countMatches(venueTags, profile.getPreferredTags());
        int avoidedMatches = Tags.countMatches(venueTags, profile.getAvoidedTags());

        double preferredBoost = properties.getPreferredTagWeight()
            * Math.min(preferredMatches, properties.getPreferredTagCap());
        double avoidedPenalty = properties.getAvoidedTagWeight() * avoidedMatches;
        double districtBoost = profile.isFavoriteDistrict(venue.getDistrict())
            ? properties.getFavoriteDistrictWeight()
            : 0.0;
        double dislikedPenalty = profile.getHistory().isDisliked(venue.getId())
            ? properties.getDislikedVenuePenalty()
            : 0.0;

        return new ScoreBreakdown(
            venue.getId(),
            candidate.getRetrievalSignal(),
            preferredMatches,
            avoidedMatches,
            preferredBoost,
            avoidedPenalty,
            districtBoost,
            dislikedPenalty
        );
    }
}
