package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.model.Candidate;
import java.util.List;

public class RetrievalStageResult {
    private final List<Candidate> candidates;
    private final boolean error;
    private final boolean unavailable;
    private final boolean timedOut;
    private final long tookMs;
    private final String errorMessage;

    private RetrievalStageResult(
        List<Candidate> candidates,
        boolean error,
        boolean unavailable,
        boolean timedOut,
        long tookMs,
        String errorMessage
    ) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.error = error;
        this.unavailable = unavailable;
        this.timedOut = timedOut;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static RetrievalStageResult success(List<Candidate> candidates, long tookMs) {
        return new RetrievalStageResult(candidates, false, false, false, tookMs, null);
    }

    public static RetrievalStageResult unavailable(String message) {
        return new RetrievalStageResult(List.of(), true, true, false, 0L, message);
    }

    public static RetrievalStageResult error(String message) {
        return new RetrievalStageResult(List.of(), true, false, false, 0L, message);
    }

    public static RetrievalStageResult timedOut(List<Candidate> partial) {
        return new RetrievalStageResult(partial, true, false, true, 0L, "timeout");
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public boolean isError() {
        return error;
    }

    public boolean isUnavailable() {
        return unavailable;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isUsable() {
        return !error || (timedOut && !candidates.isEmpty());
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
