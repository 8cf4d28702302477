package com.placeguide.recommend.profile;

import com.placeguide.recommend.model.InteractionType;
import com.placeguide.recommend.model.Tags;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.model.Venue;
import java.util.LinkedHashSet;
import java.util.Set;

public final class ProfileInference {
    private ProfileInference() {
    }

    public static UserProfile apply(UserProfile profile, Venue venue, InteractionType type) {
        Set<String> venueTags = Tags.normalizeAll(venue.getTags());
        Set<String> preferred = new LinkedHashSet<>(profile.getPreferredTags());
        Set<String> avoided = new LinkedHashSet<>(profile.getAvoidedTags());
        Set<String> districts = new LinkedHashSet<>(profile.getFavoriteDistricts());

        if (type == InteractionType.LIKED) {
            preferred.addAll(venueTags);
            avoided.removeAll(venueTags);
            if (venue.getDistrict() != null && !venue.getDistrict().isBlank()) {
                districts.add(venue.getDistrict().trim());
            }
        } else {
            avoided.addAll(venueTags);
            preferred.removeAll(venueTags);
        }
        return profile.withPreferences(preferred, avoided, districts);
    }
}
