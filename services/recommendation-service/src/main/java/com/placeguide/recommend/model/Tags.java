package com.placeguide.recommend.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public final class Tags {
    private Tags() {
    }

    public static String normalize(String tag) {
        if (tag == null) {
            return null;
        }
        String value = tag.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return value.isEmpty() ? null : value;
    }

    public static Set<String> normalizeAll(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags == null) {
            return normalized;
        }
        for (String tag : tags) {
            String value = normalize(tag);
            if (value != null) {
                normalized.add(value);
            }
        }
        return normalized;
    }

    public static boolean anyMatch(Collection<String> venueTags, Set<String> wanted) {
        if (wanted == null || wanted.isEmpty() || venueTags == null) {
            return false;
        }
        for (String tag : venueTags) {
            String value = normalize(tag);
            if (value != null && wanted.contains(value)) {
                return true;
            }
        }
        return false;
    }

    public static int countMatches(Set<String> normalizedVenueTags, Set<String> normalizedWanted) {
        if (normalizedVenueTags.isEmpty() || normalizedWanted.isEmpty()) {
            return 0;
        }
        int matches = 0;
        for (String tag : normalizedVenueTags) {
            if (normalizedWanted.contains(tag)) {
                matches++;
            }
        }
        return matches;
    }
}
