package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.model.Candidate;
import java.util.List;

public record RetrievalOutcome(List<Candidate> candidates, List<String> warnings, boolean degraded) {
    public RetrievalOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RetrievalOutcome empty() {
        return new RetrievalOutcome(List.of(), List.of(), false);
    }
}
