package com.placeguide.recommend.model;

import java.util.Locale;

public final class Districts {
    private Districts() {
    }

    public static String key(String district) {
        if (district == null || district.isBlank()) {
            return null;
        }
        return district.trim().toLowerCase(Locale.ROOT);
    }
}
