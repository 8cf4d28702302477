package com.placeguide.recommend.orchestration;

public enum TurnState {
    AWAITING_QUERY,
    RETRIEVING,
    SCORING,
    SELECTING,
    DONE,
    CLARIFYING,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == CLARIFYING || this == FAILED || this == CANCELLED;
    }
}
