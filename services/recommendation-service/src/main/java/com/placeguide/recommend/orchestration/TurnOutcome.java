package com.placeguide.recommend.orchestration;

public enum TurnOutcome {
    RECOMMENDATIONS("recommendations"),
    INSUFFICIENT_MATCHES("insufficient_matches"),
    NO_MATCHES("no_matches"),
    CLARIFICATION("clarification"),
    UNAVAILABLE("unavailable"),
    CANCELLED("cancelled");

    private final String code;

    TurnOutcome(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
