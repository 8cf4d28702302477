package com.placeguide.recommend.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

public final class UserProfile {
    private final long userId;
    private final Set<String> preferredTags;
    private final Set<String> avoidedTags;
    private final Set<String> favoriteDistricts;
    private final InteractionHistory history;

    public UserProfile(
        long userId,
        Collection<String> preferredTags,
        Collection<String> avoidedTags,
        Collection<String> favoriteDistricts,
        InteractionHistory history
    ) {
        this.userId = userId;
        this.preferredTags = Collections.unmodifiableSet(Tags.normalizeAll(preferredTags));
        this.avoidedTags = Collections.unmodifiableSet(Tags.normalizeAll(avoidedTags));
        this.favoriteDistricts = Collections.unmodifiableSet(districts(favoriteDistricts));
        this.history = history == null ? InteractionHistory.empty() : history;
    }

    public static UserProfile empty(long userId) {
        return new UserProfile(userId, Set.of(), Set.of(), Set.of(), InteractionHistory.empty());
    }

    public long getUserId() {
        return userId;
    }

    public Set<String> getPreferredTags() {
        return preferredTags;
    }

    public Set<String> getAvoidedTags() {
        return avoidedTags;
    }

    public Set<String> getFavoriteDistricts() {
        return favoriteDistricts;
    }

    public InteractionHistory getHistory() {
        return history;
    }

    public boolean isFavoriteDistrict(String district) {
        String key = Districts.key(district);
        if (key == null) {
            return false;
        }
        for (String favorite : favoriteDistricts) {
            if (key.equals(Districts.key(favorite))) {
                return true;
            }
        }
        return false;
    }

    public UserProfile withPreferences(
        Collection<String> preferredTags,
        Collection<String> avoidedTags,
        Collection<String> favoriteDistricts
    ) {
        return new UserProfile(userId, preferredTags, avoidedTags, favoriteDistricts, history);
    }

    private static Set<String> districts(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values == null) {
            return result;
        }
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            String key = Districts.key(value);
            if (key != null && seen.add(key)) {
                result.add(value.trim());
            }
        }
        return result;
    }
}
