package com.placeguide.recommend.merge;

import static org.assertj.core.api.Assertions.assertThat;

import com.placeguide.recommend.TestVenues;
import com.placeguide.recommend.model.Candidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class HybridMergeTest {

    @Test
    void venueFoundByBothPathsAppearsOnceWithBothSignals() {
        List<Candidate> semantic = List.of(
            TestVenues.semantic(1, "Арбат", 0.9),
            TestVenues.semantic(2, "Арбат", 0.8)
        );
        List<Candidate> geo = List.of(
            Candidate.fromDistance(TestVenues.venue(2, "Арбат", 4.0), 250.0, 5000),
            Candidate.fromDistance(TestVenues.venue(3, "Арбат", 4.0), 400.0, 5000)
        );

        List<Candidate> merged = HybridMerge.merge(semantic, geo, 60);

        assertThat(merged).extracting(Candidate::getVenueId).containsExactlyInAnyOrder(1L, 2L, 3L);
        Candidate both = merged.stream().filter(c -> c.getVenueId() == 2L).findFirst().orElseThrow();
        assertThat(both.getSimilarity()).isEqualTo(0.8);
        assertThat(both.getDistanceMeters()).isEqualTo(250.0);
        assertThat(both.getRetrievalSignal()).isEqualTo(0.8);
    }

    @Test
    void venueFoundByBothPathsRanksFirst() {
        List<Candidate> semantic = List.of(
            TestVenues.semantic(1, "Арбат", 0.9),
            TestVenues.semantic(2, "Арбат", 0.8)
        );
        List<Candidate> geo = List.of(
            Candidate.fromDistance(TestVenues.venue(3, "Арбат", 4.0), 100.0, 5000),
            Candidate.fromDistance(TestVenues.venue(2, "Арбат", 4.0), 250.0, 5000)
        );

        List<Candidate> merged = HybridMerge.merge(semantic, geo, 60);

        assertThat(merged).extracting(Candidate::getVenueId).containsExactly(2L, 1L, 3L);
    }

    @Test
    void equalRanksPreferSemanticHits() {
        List<Candidate> semantic = List.of(TestVenues.semantic(1, "Арбат", 0.5));
        List<Candidate> geo = List.of(Candidate.fromDistance(TestVenues.venue(7, "Арбат", 4.0), 10.0, 5000));

        List<Candidate> merged = HybridMerge.merge(semantic, geo, 60);

        assertThat(merged).extracting(Candidate::getVenueId).containsExactly(1L, 7L);
    }

    @Test
    void interleavesSingleSourceHits() {
        List<Candidate> semantic = List.of(
            TestVenues.semantic(1, "Арбат", 0.9),
            TestVenues.semantic(2, "Арбат", 0.8)
        );
        List<Candidate> geo = List.of(
            Candidate.fromDistance(TestVenues.venue(3, "Арбат", 4.0), 10.0, 5000),
            Candidate.fromDistance(TestVenues.venue(4, "Арбат", 4.0), 20.0, 5000)
        );

        List<Candidate> merged = HybridMerge.merge(semantic, geo, 60);

        assertThat(merged).extracting(Candidate::getVenueId).containsExactly(1L, 3L, 2L, 4L);
    }

    @Test
    void handlesEmptyInputs() {
        assertThat(HybridMerge.merge(List.of(), null, 60)).isEmpty();
        assertThat(HybridMerge.merge(null, List.of(TestVenues.semantic(5, "Арбат", 0.3)), 0))
            .extracting(Candidate::getVenueId)
            .containsExactly(5L);
    }
}
