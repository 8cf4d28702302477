package com.placeguide.recommend.orchestration;

import com.placeguide.recommend.execution.CancellationToken;
import com.placeguide.recommend.execution.StageDeadline;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.model.QueryMode;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.retrieval.CandidateRetriever;
import com.placeguide.recommend.retrieval.RetrievalOutcome;
import com.placeguide.recommend.retrieval.RetrievalProperties;
import com.placeguide.recommend.retrieval.RetrievalTimeoutException;
import com.placeguide.recommend.retrieval.RetrievalUnavailableException;
import com.placeguide.recommend.scoring.PersonalizationScorer;
import com.placeguide.recommend.scoring.ScoringTimeoutException;
import com.placeguide.recommend.selection.SelectionPolicy;
import com.placeguide.recommend.selection.SelectionResult;
import com.placeguide.recommend.selection.SelectionTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OrchestrationLoop {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);

    private final CandidateRetriever candidateRetriever;
    private final PersonalizationScorer scorer;
    private final SelectionPolicy selectionPolicy;
    private final ProfileLoader profileLoader;
    private final RetrievalProperties retrievalProperties;
    private final OrchestrationProperties properties;
    private final MeterRegistry meterRegistry;

    public OrchestrationLoop(
        CandidateRetriever candidateRetriever,
        PersonalizationScorer scorer,
        SelectionPolicy selectionPolicy,
        ProfileLoader profileLoader,
        RetrievalProperties retrievalProperties,
        OrchestrationProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.candidateRetriever = candidateRetriever;
        this.scorer = scorer;
        this.selectionPolicy = selectionPolicy;
        this.profileLoader = profileLoader;
        this.retrievalProperties = retrievalProperties;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public TurnResult run(TurnCommand command) {
        Turn turn = new Turn(command);
        TurnResult result = execute(turn);
        meterRegistry.counter("rec_turn_total", "outcome", result.getOutcome().code()).increment();
        log.debug(
            "turn finished outcome={} venues={} states={} trace_id={}",
            result.getOutcome().code(),
            result.getVenues().size(),
            result.getStates(),
            command.traceId()
        );
        return result;
    }

    private TurnResult execute(Turn turn) {
        Query query = turn.command.query();
        if (query.getMode() == QueryMode.CLARIFY) {
            turn.enter(TurnState.CLARIFYING);
            return turn.finish(TurnOutcome.CLARIFICATION, List.of(), properties.getClarifyingQuestion(), null, 0);
        }
        if (turn.cancelled()) {
            return turn.cancel();
        }

        TurnBudget budget = TurnBudget.resolve(turn.command.timeoutMs(), properties);
        CompletableFuture<Optional<UserProfile>> profileFuture = profileLoader.start(turn.command.userId());

        turn.enter(TurnState.RETRIEVING);
        RetrievalOutcome retrieval;
        try {
            retrieval = candidateRetriever.retrieve(
                query,
                retrievalProperties.getMaxCandidates(),
                budget.retrievalMs(),
                turn.token,
                turn.command.traceId(),
                turn.command.requestId()
            );
        } catch (RetrievalTimeoutException e) {
            profileFuture.cancel(true);
            log.warn("retrieval timed out with no candidates trace_id={}: {}", turn.command.traceId(), e.getMessage());
            turn.warnings.add("retrieval_timeout");
            return turn.fail();
        } catch (RetrievalUnavailableException e) {
            profileFuture.cancel(true);
            log.warn("retrieval unavailable trace_id={}: {}", turn.command.traceId(), e.getMessage());
            turn.warnings.add("retrieval_unavailable");
            return turn.fail();
        }
        turn.warnings.addAll(retrieval.warnings());
        if (turn.cancelled()) {
            profileFuture.cancel(true);
            return turn.cancel();
        }

        List<Candidate> candidates = retrieval.candidates();
        Optional<UserProfile> profile = candidates.isEmpty()
            ? Optional.empty()
            : profileLoader.await(profileFuture, properties.getProfileWaitMs(), turn.command.traceId());
        if (candidates.isEmpty()) {
            profileFuture.cancel(true);
        }

        turn.enter(TurnState.SCORING);
        List<Candidate> scored;
        try {
            scored = scorer.score(candidates, profile, StageDeadline.after(budget.scoringMs()));
        } catch (ScoringTimeoutException e) {
            countStageTimeout("scoring");
            log.warn("{}, falling back to retrieval order trace_id={}", e.getMessage(), turn.command.traceId());
            turn.warnings.add("scoring_timeout");
            scored = scorer.score(candidates, Optional.empty());
        }
        if (turn.cancelled()) {
            return turn.cancel();
        }

        turn.enter(TurnState.SELECTING);
        SelectionResult selection;
        try {
            selection = selectionPolicy.select(scored, StageDeadline.after(budget.selectionMs()));
        } catch (SelectionTimeoutException e) {
            countStageTimeout("selection");
            log.warn("{}, returning top results without diversity trace_id={}", e.getMessage(), turn.command.traceId());
            turn.warnings.add("selection_timeout");
            List<Candidate> top = selectionPolicy.topWithoutDiversity(scored);
            selection = new SelectionResult(top, 0, false);
        }
        if (turn.cancelled()) {
            return turn.cancel();
        }

        turn.enter(TurnState.DONE);
        List<Candidate> venues = selection.selected();
        if (venues.isEmpty()) {
            return turn.finish(TurnOutcome.NO_MATCHES, venues, null, properties.getNoMatchesMessage(), 0);
        }
        TurnOutcome outcome = selection.insufficient() ? TurnOutcome.INSUFFICIENT_MATCHES : TurnOutcome.RECOMMENDATIONS;
        return turn.finish(outcome, venues, null, null, selection.relaxationLevel());
    }

    private void countStageTimeout(String stage) {
        meterRegistry.counter("rec_stage_timeout_total", "stage", stage).increment();
    }

    private final class Turn {
        private final TurnCommand command;
        private final CancellationToken token;
        private final List<TurnState> states = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Turn(TurnCommand command) {
            this.command = command;
            this.token = command.cancellationToken();
            states.add(TurnState.AWAITING_QUERY);
        }

        private void enter(TurnState state) {
            states.add(state);
        }

        private boolean cancelled() {
            return token.isCancelled();
        }

        private TurnResult cancel() {
            log.debug("turn cancelled ({}) trace_id={}", token.getReason(), command.traceId());
            enter(TurnState.CANCELLED);
            return finish(TurnOutcome.CANCELLED, List.of(), null, null, 0);
        }

        private TurnResult fail() {
            enter(TurnState.FAILED);
            return finish(TurnOutcome.UNAVAILABLE, List.of(), null, properties.getUnavailableMessage(), 0);
        }

        private TurnResult finish(
            TurnOutcome outcome,
            List<Candidate> venues,
            String question,
            String message,
            int relaxationLevel
        ) {
            return new TurnResult(outcome, venues, question, message, relaxationLevel, warnings, states);
        }
    }
}
