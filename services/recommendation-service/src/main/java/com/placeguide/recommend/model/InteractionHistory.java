package com.placeguide.recommend.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public final class InteractionHistory {
    private static final InteractionHistory EMPTY = new InteractionHistory(Map.of(), Map.of());

    private final Map<Long, Integer> likedCounts;
    private final Map<Long, Integer> dislikedCounts;

    public InteractionHistory(Map<Long, Integer> likedCounts, Map<Long, Integer> dislikedCounts) {
        this.likedCounts = likedCounts == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(likedCounts));
        this.dislikedCounts = dislikedCounts == null
            ? Map.of()
            : Collections.unmodifiableMap(new HashMap<>(dislikedCounts));
    }

    public static InteractionHistory empty() {
        return EMPTY;
    }

    public int likedCount(long venueId) {
        return likedCounts.getOrDefault(venueId, 0);
    }

    public int dislikedCount(long venueId) {
        return dislikedCounts.getOrDefault(venueId, 0);
    }

    public boolean isDisliked(long venueId) {
        return dislikedCount(venueId) > likedCount(venueId);
    }

    public Map<Long, Integer> getLikedCounts() {
        return likedCounts;
    }

    public Map<Long, Integer> getDislikedCounts() {
        return dislikedCounts;
    }
}
