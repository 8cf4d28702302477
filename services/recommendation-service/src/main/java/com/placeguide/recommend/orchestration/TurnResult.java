package com.placeguide.recommend.orchestration;

import com.placeguide.recommend.model.Candidate;
import java.util.List;

public class TurnResult {
    private final TurnOutcome outcome;
    private final List<Candidate> venues;
    private final String clarifyingQuestion;
    private final String message;
    private final int relaxationLevel;
    private final List<String> warnings;
    private final List<TurnState> states;

    TurnResult(
        TurnOutcome outcome,
        List<Candidate> venues,
        String clarifyingQuestion,
        String message,
        int relaxationLevel,
        List<String> warnings,
        List<TurnState> states
    ) {
        this.outcome = outcome;
        this.venues = venues == null ? List.of() : List.copyOf(venues);
        this.clarifyingQuestion = clarifyingQuestion;
        this.message = message;
        this.relaxationLevel = relaxationLevel;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.states = states == null ? List.of() : List.copyOf(states);
    }

    public TurnOutcome getOutcome() {
        return outcome;
    }

    public List<Candidate> getVenues() {
        return venues;
    }

    public String getClarifyingQuestion() {
        return clarifyingQuestion;
    }

    public String getMessage() {
        return message;
    }

    public int getRelaxationLevel() {
        return relaxationLevel;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<TurnState> getStates() {
        return states;
    }

    public TurnState getFinalState() {
        return states.isEmpty() ? TurnState.AWAITING_QUERY : states.get(states.size() - 1);
    }

    public boolean isQuestion() {
        return outcome == TurnOutcome.CLARIFICATION;
    }
}
