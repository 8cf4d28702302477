package com.placeguide.recommend.model;

import java.util.Locale;

public enum InteractionType {
    LIKED("liked"),
    DISLIKED("disliked");

    private final String code;

    InteractionType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static InteractionType fromCode(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InteractionType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
