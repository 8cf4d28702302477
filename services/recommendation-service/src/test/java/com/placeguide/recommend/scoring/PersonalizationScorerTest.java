package com.placeguide.recommend.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.placeguide.recommend.TestVenues;
import com.placeguide.recommend.execution.StageDeadline;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.InteractionHistory;
import com.placeguide.recommend.model.UserProfile;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PersonalizationScorerTest {
    private final PersonalizationScorer scorer = new PersonalizationScorer(new ScoringProperties());

    @Test
    void withoutProfileScoreIsRetrievalSignalAndOrderIsKept() {
        List<Candidate> candidates = List.of(
            TestVenues.semantic(1, "Арбат", 0.4),
            TestVenues.semantic(2, "Арбат", 0.9),
            TestVenues.semantic(3, "Арбат", 0.6)
        );

        List<Candidate> scored = scorer.score(candidates, Optional.empty());

        assertThat(scored).extracting(Candidate::getVenueId).containsExactly(1L, 2L, 3L);
        assertThat(scored).extracting(Candidate::getScore).containsExactly(0.4, 0.9, 0.6);
        assertThat(scored).extracting(Candidate::getAdjustment).containsOnly(0.0);
    }

    @Test
    void avoidedTagOutranksHigherSimilarity() {
        UserProfile profile = new UserProfile(7L, Set.of(), Set.of("шумно"), Set.of(), InteractionHistory.empty());
        Candidate noisyBar = TestVenues.semantic(1, "Арбат", 0.92, "шумно", "бар");
        Candidate untagged = TestVenues.semantic(2, "Арбат", 0.88);

        List<Candidate> scored = scorer.score(List.of(noisyBar, untagged), Optional.of(profile));

        assertThat(scored).extracting(Candidate::getVenueId).containsExactly(2L, 1L);
    }

    @Test
    void disjointTagsGetZeroAdjustment() {
        UserProfile profile = new UserProfile(
            7L, Set.of("музей"), Set.of("караоке"), Set.of(), InteractionHistory.empty()
        );
        Candidate park = TestVenues.semantic(1, "Хамовники", 0.5, "парк", "прогулки");

        Candidate scored = scorer.score(List.of(park), Optional.of(profile)).get(0);

        assertThat(scored.getAdjustment()).isEqualTo(0.0);
        assertThat(scored.getScore()).isEqualTo(0.5);
    }

    @Test
    void preferredBoostIsCappedAtThreeMatches() {
        UserProfile profile = new UserProfile(
            7L, Set.of("a", "b", "c", "d", "e"), Set.of(), Set.of(), InteractionHistory.empty()
        );
        Candidate candidate = TestVenues.semantic(1, "Арбат", 0.5, "A", "b", "c", "d", "e");

        ScoreBreakdown breakdown = scorer.explain(candidate, profile);

        assertThat(breakdown.preferredMatches()).isEqualTo(5);
        assertThat(breakdown.preferredBoost()).isCloseTo(0.3, offset(1e-9));
    }

    @Test
    void singleAvoidedTagOutweighsFullPreferredBoost() {
        UserProfile profile = new UserProfile(
            7L, Set.of("a", "b", "c"), Set.of("x"), Set.of(), InteractionHistory.empty()
        );
        Candidate mixed = TestVenues.semantic(1, "Арбат", 0.5, "a", "b", "c", "x");

        assertThat(scorer.explain(mixed, profile).adjustment()).isNegative();
    }

    @Test
    void overlappingTagFiresBothBoostAndPenalty() {
        UserProfile profile = new UserProfile(7L, Set.of("бар"), Set.of("бар"), Set.of(), InteractionHistory.empty());

        ScoreBreakdown breakdown = scorer.explain(TestVenues.semantic(1, "Арбат", 0.5, "бар"), profile);

        assertThat(breakdown.preferredBoost()).isCloseTo(0.1, offset(1e-9));
        assertThat(breakdown.avoidedPenalty()).isCloseTo(0.35, offset(1e-9));
    }

    @Test
    void favoriteDistrictIsBoosted() {
        UserProfile profile = new UserProfile(7L, Set.of(), Set.of(), Set.of("Хамовники"), InteractionHistory.empty());

        List<Candidate> scored = scorer.score(List.of(
            TestVenues.semantic(1, "Арбат", 0.6),
            TestVenues.semantic(2, "Хамовники", 0.5)
        ), Optional.of(profile));

        assertThat(scored).extracting(Candidate::getVenueId).containsExactly(2L, 1L);
    }

    @Test
    void dislikedVenueSinksButIsNotRemoved() {
        InteractionHistory history = new InteractionHistory(Map.of(), Map.of(1L, 1));
        UserProfile profile = new UserProfile(7L, Set.of(), Set.of(), Set.of(), history);

        List<Candidate> scored = scorer.score(List.of(
            TestVenues.semantic(1, "Арбат", 0.99),
            TestVenues.semantic(2, "Арбат", 0.2),
            TestVenues.semantic(3, "Арбат", 0.1)
        ), Optional.of(profile));

        assertThat(scored).extracting(Candidate::getVenueId).containsExactly(2L, 3L, 1L);
    }

    @Test
    void likedMoreOftenThanDislikedIsNotPenalized() {
        InteractionHistory history = new InteractionHistory(Map.of(1L, 2), Map.of(1L, 1));
        UserProfile profile = new UserProfile(7L, Set.of(), Set.of(), Set.of(), history);

        assertThat(scorer.explain(TestVenues.semantic(1, "Арбат", 0.5), profile).dislikedPenalty()).isZero();
    }

    @Test
    void tiesBreakByRatingThenReviewCount() {
        UserProfile profile = UserProfile.empty(7L);
        Candidate lowRated = Candidate.fromSimilarity(TestVenues.venue(1, "Арбат", 4.1), 0.5);
        Candidate fewReviews = Candidate.fromSimilarity(TestVenues.venue(2, "Арбат", 4.5), 0.5);
        Candidate manyReviews = Candidate.fromSimilarity(TestVenues.venue(9, "Арбат", 4.5), 0.5);

        List<Candidate> scored = scorer.score(List.of(lowRated, fewReviews, manyReviews), Optional.of(profile));

        assertThat(scored).extracting(Candidate::getVenueId).containsExactly(9L, 2L, 1L);
    }

    @Test
    void scoringIsDeterministic() {
        UserProfile profile = new UserProfile(
            7L, Set.of("кафе"), Set.of("шумно"), Set.of("Арбат"), InteractionHistory.empty()
        );
        List<Candidate> candidates = List.of(
            TestVenues.semantic(1, "Арбат", 0.5, "кафе"),
            TestVenues.semantic(2, "Тверской", 0.7, "шумно"),
            TestVenues.semantic(3, "Арбат", 0.6),
            TestVenues.semantic(4, "Тверской", 0.6, "кафе")
        );

        List<Candidate> first = scorer.score(candidates, Optional.of(profile));
        List<Candidate> second = scorer.score(candidates, Optional.of(profile));

        assertThat(second).extracting(Candidate::getVenueId)
            .containsExactlyElementsOf(first.stream().map(Candidate::getVenueId).toList());
        assertThat(second).extracting(Candidate::getScore)
            .containsExactlyElementsOf(first.stream().map(Candidate::getScore).toList());
    }

    @Test
    void rejectsAvoidedWeightThatDoesNotExceedPreferredBoost() {
        ScoringProperties properties = new ScoringProperties();
        properties.setAvoidedTagWeight(0.3);

        assertThatThrownBy(() -> new PersonalizationScorer(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("avoided-tag-weight");
    }

    @Test
    void favoriteDistrictMatchesRegardlessOfCase() {
        UserProfile profile = new UserProfile(7L, Set.of(), Set.of(), Set.of("Арбат"), InteractionHistory.empty());
        Candidate candidate = TestVenues.semantic(1, " арбат ", 0.5, "кафе");

        ScoreBreakdown breakdown = scorer.explain(candidate, profile);

        assertThat(breakdown.districtBoost()).isEqualTo(new ScoringProperties().getFavoriteDistrictWeight());
    }

    @Test
    void expiredDeadlineStopsScoring() {
        UserProfile profile = new UserProfile(7L, Set.of("кафе"), Set.of(), Set.of(), InteractionHistory.empty());
        List<Candidate> candidates = List.of(
            TestVenues.semantic(1, "Арбат", 0.9, "кафе"),
            TestVenues.semantic(2, "Тверской", 0.8, "бар")
        );

        assertThatThrownBy(() -> scorer.score(candidates, Optional.of(profile), StageDeadline.after(0)))
            .isInstanceOf(ScoringTimeoutException.class);
    }
}
