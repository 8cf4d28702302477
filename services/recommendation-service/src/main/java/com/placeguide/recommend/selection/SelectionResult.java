package com.placeguide.recommend.selection;

import com.placeguide.recommend.model.Candidate;
import java.util.List;

public record SelectionResult(List<Candidate> selected, int relaxationLevel, boolean insufficient) {
    public SelectionResult {
        selected = selected == null ? List.of() : List.copyOf(selected);
    }
}
