package com.placeguide.recommend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.placeguide.recommend.TestVenues;
import com.placeguide.recommend.api.dto.TurnRequest;
import com.placeguide.recommend.api.dto.TurnResponse;
import com.placeguide.recommend.api.dto.VenueCard;
import com.placeguide.recommend.model.QueryMode;
import com.placeguide.recommend.orchestration.ActiveTurnRegistry;
import com.placeguide.recommend.orchestration.OrchestrationLoop;
import com.placeguide.recommend.orchestration.TurnCommand;
import com.placeguide.recommend.orchestration.TurnOutcome;
import com.placeguide.recommend.orchestration.TurnResult;
import com.placeguide.recommend.orchestration.TurnState;
import com.placeguide.recommend.query.InvalidTurnRequestException;
import com.placeguide.recommend.query.LandmarkGazetteer;
import com.placeguide.recommend.query.QueryResolver;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecommendationServiceTest {
    @Mock
    private OrchestrationLoop orchestrationLoop;

    private ActiveTurnRegistry registry;
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        registry = new ActiveTurnRegistry();
        service = new RecommendationService(new QueryResolver(new LandmarkGazetteer()), orchestrationLoop, registry);
    }

    @Test
    void debugTurnRendersRankedCardsAndStates() {
        TurnResult result = mock(TurnResult.class);
        when(result.getOutcome()).thenReturn(TurnOutcome.RECOMMENDATIONS);
        when(result.getVenues()).thenReturn(List.of(
            TestVenues.semantic(5, "Арбат", 0.9),
            TestVenues.semantic(8, "Тверской", 0.7)
        ));
        when(result.getWarnings()).thenReturn(List.of());
        when(result.getStates()).thenReturn(List.of(TurnState.AWAITING_QUERY, TurnState.RETRIEVING, TurnState.DONE));
        AtomicReference<TurnCommand> seen = new AtomicReference<>();
        when(orchestrationLoop.run(any())).thenAnswer(invocation -> {
            seen.set(invocation.getArgument(0));
            return result;
        });

        TurnRequest request = new TurnRequest();
        request.setUserId(7L);
        request.setText("бар");
        request.setTimeoutMs(1500);
        request.setDebug(true);
        TurnResponse response = service.recommend(request, "trace-1", "req-1");

        assertThat(seen.get().query().getMode()).isEqualTo(QueryMode.SEMANTIC);
        assertThat(seen.get().timeoutMs()).isEqualTo(1500);
        assertThat(seen.get().traceId()).isEqualTo("trace-1");
        assertThat(response.getResponseType()).isEqualTo("recommendation");
        assertThat(response.getOutcome()).isEqualTo("recommendations");
        assertThat(response.getVenues()).extracting(VenueCard::getId).containsExactly(5L, 8L);
        assertThat(response.getVenues()).extracting(VenueCard::getRank).containsExactly(1, 2);
        assertThat(response.getWarnings()).isNull();
        assertThat(response.getStates()).containsExactly("awaiting_query", "retrieving", "done");
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void clarificationIsQuestionWithoutStatesByDefault() {
        TurnResult result = mock(TurnResult.class);
        when(result.getOutcome()).thenReturn(TurnOutcome.CLARIFICATION);
        when(result.isQuestion()).thenReturn(true);
        when(result.getClarifyingQuestion()).thenReturn("Где вы сейчас?");
        when(result.getVenues()).thenReturn(List.of());
        when(result.getWarnings()).thenReturn(List.of());
        when(orchestrationLoop.run(any())).thenReturn(result);

        TurnResponse response = service.recommend(new TurnRequest(), "trace-1", "req-1");

        assertThat(response.getResponseType()).isEqualTo("question");
        assertThat(response.getClarifyingQuestion()).isEqualTo("Где вы сейчас?");
        assertThat(response.getVenues()).isEmpty();
        assertThat(response.getStates()).isNull();
    }

    @Test
    void turnIsReleasedWhenLoopFails() {
        when(orchestrationLoop.run(any())).thenThrow(new IllegalStateException("boom"));
        TurnRequest request = new TurnRequest();
        request.setUserId(7L);
        request.setText("бар");

        assertThatThrownBy(() -> service.recommend(request, "trace-1", "req-1"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void invalidRequestNeverReachesLoop() {
        TurnRequest request = new TurnRequest();
        request.setLon(37.62);

        assertThatThrownBy(() -> service.recommend(request, "trace-1", "req-1"))
            .isInstanceOf(InvalidTurnRequestException.class);
        verifyNoInteractions(orchestrationLoop);
    }
}
