package com.placeguide.recommend.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.placeguide.recommend.TestVenues;
import com.placeguide.recommend.execution.CancellationToken;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.GeoPoint;
import com.placeguide.recommend.model.InteractionHistory;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.retrieval.CandidateRetriever;
import com.placeguide.recommend.retrieval.RetrievalOutcome;
import com.placeguide.recommend.retrieval.RetrievalProperties;
import com.placeguide.recommend.retrieval.RetrievalTimeoutException;
import com.placeguide.recommend.retrieval.RetrievalUnavailableException;
import com.placeguide.recommend.scoring.PersonalizationScorer;
import com.placeguide.recommend.scoring.ScoringProperties;
import com.placeguide.recommend.scoring.ScoringTimeoutException;
import com.placeguide.recommend.selection.SelectionPolicy;
import com.placeguide.recommend.selection.SelectionProperties;
import com.placeguide.recommend.selection.SelectionTimeoutException;
import com.placeguide.recommend.store.ProfileStore;
import com.placeguide.recommend.store.StoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrchestrationLoopTest {
    private static final Query SEMANTIC = Query.semantic("уютное кафе");

    @Mock
    private CandidateRetriever candidateRetriever;

    @Mock
    private ProfileStore profileStore;

    private ExecutorService profileExecutor;
    private SimpleMeterRegistry meterRegistry;
    private OrchestrationLoop loop;

    @BeforeEach
    void setUp() {
        profileExecutor = Executors.newFixedThreadPool(2);
        meterRegistry = new SimpleMeterRegistry();
        loop = newLoop(new PersonalizationScorer(new ScoringProperties()));
    }

    @AfterEach
    void tearDown() {
        profileExecutor.shutdownNow();
    }

    @Test
    void clarifyQueryAsksFollowUpWithoutRetrieving() {
        TurnResult result = loop.run(TurnCommand.of(Query.clarify(), 7L));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.CLARIFICATION);
        assertThat(result.getFinalState()).isEqualTo(TurnState.CLARIFYING);
        assertThat(result.getVenues()).isEmpty();
        assertThat(result.getClarifyingQuestion()).isNotBlank();
        verifyNoInteractions(candidateRetriever, profileStore);
    }

    @Test
    void fullTurnWalksEveryStageAndPersonalizes() {
        stubRetrieval(List.of(
            TestVenues.semantic(1, "Арбат", 0.9, "шумно", "бар"),
            TestVenues.semantic(2, "Тверской", 0.85, "кафе"),
            TestVenues.semantic(3, "Хамовники", 0.6, "музей"),
            TestVenues.semantic(4, "Басманный", 0.5, "парк")
        ));
        when(profileStore.findProfile(7L)).thenReturn(Optional.of(
            new UserProfile(7L, Set.of(), Set.of("шумно"), Set.of(), InteractionHistory.empty())
        ));

        TurnResult result = loop.run(TurnCommand.of(SEMANTIC, 7L));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.RECOMMENDATIONS);
        assertThat(result.getStates()).containsExactly(
            TurnState.AWAITING_QUERY,
            TurnState.RETRIEVING,
            TurnState.SCORING,
            TurnState.SELECTING,
            TurnState.DONE
        );
        assertThat(result.getVenues()).extracting(Candidate::getVenueId).containsExactly(2L, 3L, 1L, 4L);
        assertThat(result.getClarifyingQuestion()).isNull();
        assertThat(meterRegistry.counter("rec_turn_total", "outcome", "recommendations").count()).isEqualTo(1.0);
    }

    @Test
    void profileFailureScoresLikeAnonymousTurn() {
        List<Candidate> candidates = List.of(
            TestVenues.semantic(1, "Арбат", 0.9, "бар"),
            TestVenues.semantic(2, "Тверской", 0.7, "кафе"),
            TestVenues.semantic(3, "Хамовники", 0.8, "музей")
        );
        stubRetrieval(candidates);
        when(profileStore.findProfile(7L)).thenThrow(new StoreUnavailableException("db down"));

        TurnResult withFailedProfile = loop.run(TurnCommand.of(SEMANTIC, 7L));
        TurnResult anonymous = loop.run(TurnCommand.of(SEMANTIC, null));

        assertThat(withFailedProfile.getOutcome()).isEqualTo(TurnOutcome.RECOMMENDATIONS);
        assertThat(withFailedProfile.getWarnings()).isEmpty();
        assertThat(withFailedProfile.getVenues()).extracting(Candidate::getVenueId)
            .containsExactlyElementsOf(ids(anonymous.getVenues()));
        assertThat(withFailedProfile.getVenues()).extracting(Candidate::getScore)
            .containsExactlyElementsOf(anonymous.getVenues().stream().map(Candidate::getScore).toList());
        assertThat(meterRegistry.counter("rec_profile_unavailable_total").count()).isEqualTo(1.0);
    }

    @Test
    void emptyRetrievalEndsDoneWithNoMatches() {
        stubRetrieval(List.of());

        TurnResult result = loop.run(TurnCommand.of(SEMANTIC, null));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.NO_MATCHES);
        assertThat(result.getFinalState()).isEqualTo(TurnState.DONE);
        assertThat(result.getStates()).contains(TurnState.SCORING, TurnState.SELECTING);
        assertThat(result.getVenues()).isEmpty();
        assertThat(result.getClarifyingQuestion()).isNull();
    }

    @Test
    void shortSelectionIsInsufficientMatches() {
        stubRetrieval(List.of(
            TestVenues.semantic(1, "Арбат", 0.9, "бар"),
            TestVenues.semantic(2, "Тверской", 0.7, "кафе")
        ));

        TurnResult result = loop.run(TurnCommand.of(SEMANTIC, null));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.INSUFFICIENT_MATCHES);
        assertThat(result.getVenues()).hasSize(2);
        assertThat(result.getRelaxationLevel()).isEqualTo(2);
    }

    @Test
    void unavailableStoreBecomesTryAgainOutcome() {
        when(candidateRetriever.retrieve(any(), anyInt(), any(), any(), any(), any()))
            .thenThrow(new RetrievalUnavailableException("geo retrieval failed: down"));

        TurnResult result = loop.run(TurnCommand.of(Query.geo(new GeoPoint(55.75, 37.62), null, null), null));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.UNAVAILABLE);
        assertThat(result.getFinalState()).isEqualTo(TurnState.FAILED);
        assertThat(result.getMessage()).isNotBlank();
        assertThat(result.getWarnings()).containsExactly("retrieval_unavailable");
    }

    @Test
    void retrievalTimeoutWithoutCandidatesIsUnavailable() {
        when(candidateRetriever.retrieve(any(), anyInt(), any(), any(), any(), any()))
            .thenThrow(new RetrievalTimeoutException("semantic retrieval exceeded 70ms"));

        TurnResult result = loop.run(TurnCommand.of(SEMANTIC, null));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.UNAVAILABLE);
        assertThat(result.getWarnings()).containsExactly("retrieval_timeout");
    }

    @Test
    void cancellationDuringRetrievalStopsBeforeScoring() {
        when(candidateRetriever.retrieve(any(), anyInt(), any(), any(), any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(3);
            token.cancel("superseded");
            return new RetrievalOutcome(List.of(TestVenues.semantic(1, "Арбат", 0.9)), List.of(), false);
        });

        TurnResult result = loop.run(TurnCommand.of(SEMANTIC, null));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.CANCELLED);
        assertThat(result.getStates()).containsExactly(
            TurnState.AWAITING_QUERY,
            TurnState.RETRIEVING,
            TurnState.CANCELLED
        );
        assertThat(result.getVenues()).isEmpty();
    }

    @Test
    void alreadyCancelledTurnNeverRetrieves() {
        CancellationToken token = CancellationToken.create();
        token.cancel("superseded");

        TurnResult result = loop.run(new TurnCommand(SEMANTIC, 7L, null, token, "trace-1", "req-1"));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.CANCELLED);
        verifyNoInteractions(candidateRetriever, profileStore);
    }

    @Test
    void scoringTimeoutFallsBackToRetrievalOrder() {
        PersonalizationScorer slowScorer = mock(PersonalizationScorer.class);
        when(slowScorer.score(any(), any(), any())).thenThrow(new ScoringTimeoutException("scoring exceeded 30ms"));
        when(slowScorer.score(any(), any())).thenAnswer(invocation -> {
            List<Candidate> candidates = invocation.getArgument(0);
            List<Candidate> scored = new ArrayList<>();
            for (Candidate candidate : candidates) {
                scored.add(candidate.withScore(candidate.getRetrievalSignal(), 0.0));
            }
            return scored;
        });
        stubRetrieval(List.of(
            TestVenues.semantic(1, "Арбат", 0.9, "бар"),
            TestVenues.semantic(2, "Тверской", 0.7, "кафе"),
            TestVenues.semantic(3, "Хамовники", 0.8, "музей")
        ));

        TurnResult result = newLoop(slowScorer, new SelectionPolicy(new SelectionProperties()))
            .run(new TurnCommand(SEMANTIC, null, 200, null, "trace-1", "req-1"));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.RECOMMENDATIONS);
        assertThat(result.getWarnings()).containsExactly("scoring_timeout");
        assertThat(result.getVenues()).extracting(Candidate::getVenueId).containsExactly(1L, 2L, 3L);
        assertThat(meterRegistry.counter("rec_stage_timeout_total", "stage", "scoring").count()).isEqualTo(1.0);
    }

    @Test
    void selectionTimeoutReturnsTopWithoutDiversity() {
        SelectionPolicy slowPolicy = mock(SelectionPolicy.class);
        when(slowPolicy.select(any(), any())).thenThrow(new SelectionTimeoutException("selection exceeded 30ms"));
        when(slowPolicy.topWithoutDiversity(any())).thenAnswer(invocation -> invocation.getArgument(0));
        stubRetrieval(List.of(
            TestVenues.semantic(1, "Арбат", 0.9, "бар"),
            TestVenues.semantic(2, "Арбат", 0.8, "бар"),
            TestVenues.semantic(3, "Арбат", 0.7, "бар")
        ));

        TurnResult result = newLoop(new PersonalizationScorer(new ScoringProperties()), slowPolicy)
            .run(new TurnCommand(SEMANTIC, null, 200, null, "trace-1", "req-1"));

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.RECOMMENDATIONS);
        assertThat(result.getWarnings()).containsExactly("selection_timeout");
        assertThat(result.getRelaxationLevel()).isZero();
        assertThat(result.getVenues()).extracting(Candidate::getVenueId).containsExactly(1L, 2L, 3L);
        assertThat(meterRegistry.counter("rec_stage_timeout_total", "stage", "selection").count()).isEqualTo(1.0);
    }

    @Test
    void saturatedRequestPoolDoesNotDropPersonalization() throws Exception {
        ExecutorService requestPool = Executors.newFixedThreadPool(2);
        CountDownLatch busy = new CountDownLatch(2);
        try {
            for (int i = 0; i < 2; i++) {
                requestPool.submit(() -> {
                    busy.countDown();
                    Thread.sleep(1500);
                    return null;
                });
            }
            assertThat(busy.await(1, TimeUnit.SECONDS)).isTrue();
            stubRetrieval(List.of(
                TestVenues.semantic(1, "Арбат", 0.9, "шумно"),
                TestVenues.semantic(2, "Тверской", 0.85, "кафе"),
                TestVenues.semantic(3, "Хамовники", 0.6, "музей")
            ));
            when(profileStore.findProfile(7L)).thenReturn(Optional.of(
                new UserProfile(7L, Set.of(), Set.of("шумно"), Set.of(), InteractionHistory.empty())
            ));

            TurnResult result = loop.run(new TurnCommand(SEMANTIC, 7L, 200, null, "trace-1", "req-1"));

            assertThat(result.getOutcome()).isEqualTo(TurnOutcome.RECOMMENDATIONS);
            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getVenues()).extracting(Candidate::getVenueId).containsExactly(2L, 3L, 1L);
            assertThat(meterRegistry.counter("rec_profile_unavailable_total").count()).isZero();
        } finally {
            requestPool.shutdownNow();
        }
    }

    private OrchestrationLoop newLoop(PersonalizationScorer scorer) {
        return newLoop(scorer, new SelectionPolicy(new SelectionProperties()));
    }

    private OrchestrationLoop newLoop(PersonalizationScorer scorer, SelectionPolicy selectionPolicy) {
        return new OrchestrationLoop(
            candidateRetriever,
            scorer,
            selectionPolicy,
            new ProfileLoader(profileStore, profileExecutor, meterRegistry),
            new RetrievalProperties(),
            new OrchestrationProperties(),
            meterRegistry
        );
    }

    private void stubRetrieval(List<Candidate> candidates) {
        when(candidateRetriever.retrieve(any(), anyInt(), any(), any(), any(), any()))
            .thenReturn(new RetrievalOutcome(candidates, List.of(), false));
    }

    private static List<Long> ids(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::getVenueId).toList();
    }
}
