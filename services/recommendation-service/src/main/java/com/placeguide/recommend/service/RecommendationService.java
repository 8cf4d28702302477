package com.placeguide.recommend.service;

import com.placeguide.recommend.api.dto.TurnRequest;
import com.placeguide.recommend.api.dto.TurnResponse;
import com.placeguide.recommend.api.dto.VenueCard;
import com.placeguide.recommend.execution.CancellationToken;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.orchestration.ActiveTurnRegistry;
import com.placeguide.recommend.orchestration.OrchestrationLoop;
import com.placeguide.recommend.orchestration.TurnCommand;
import com.placeguide.recommend.orchestration.TurnResult;
import com.placeguide.recommend.orchestration.TurnState;
import com.placeguide.recommend.query.QueryResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

@Service
public class RecommendationService {
    private final QueryResolver queryResolver;
    private final OrchestrationLoop orchestrationLoop;
    private final ActiveTurnRegistry activeTurnRegistry;

    public RecommendationService(
        QueryResolver queryResolver,
        OrchestrationLoop orchestrationLoop,
        ActiveTurnRegistry activeTurnRegistry
    ) {
        this.queryResolver = queryResolver;
        this.orchestrationLoop = orchestrationLoop;
        this.activeTurnRegistry = activeTurnRegistry;
    }

    public TurnResponse recommend(TurnRequest request, String traceId, String requestId) {
        long started = System.nanoTime();
        Query query = queryResolver.resolve(request);
        Long userId = request.getUserId();

        CancellationToken token = activeTurnRegistry.begin(userId);
        TurnResult result;
        try {
            result = orchestrationLoop.run(
                new TurnCommand(query, userId, request.getTimeoutMs(), token, traceId, requestId)
            );
        } finally {
            activeTurnRegistry.end(userId, token);
        }

        TurnResponse response = new TurnResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setResponseType(result.isQuestion() ? "question" : "recommendation");
        response.setOutcome(result.getOutcome().code());
        response.setClarifyingQuestion(result.getClarifyingQuestion());
        response.setMessage(result.getMessage());
        response.setVenues(toCards(result.getVenues()));
        response.setRelaxationLevel(result.getRelaxationLevel());
        response.setWarnings(result.getWarnings().isEmpty() ? null : result.getWarnings());
        if (Boolean.TRUE.equals(request.getDebug())) {
            List<String> states = new ArrayList<>();
            for (TurnState state : result.getStates()) {
                states.add(state.name().toLowerCase(Locale.ROOT));
            }
            response.setStates(states);
        }
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        return response;
    }

    private static List<VenueCard> toCards(List<Candidate> venues) {
        List<VenueCard> cards = new ArrayList<>(venues.size());
        for (int i = 0; i < venues.size(); i++) {
            cards.add(VenueCard.from(venues.get(i), i + 1));
        }
        return cards;
    }
}
