package com.placeguide.recommend.model;

import java.util.Locale;

public enum QueryMode {
    SEMANTIC,
    GEO,
    HYBRID,
    CLARIFY;

    public static QueryMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return QueryMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
