package com.placeguide.recommend.store;

import com.placeguide.recommend.model.InteractionType;
import com.placeguide.recommend.model.UserProfile;
import java.util.Optional;

public interface ProfileStore {
    Optional<UserProfile> findProfile(long userId);

    void saveProfile(UserProfile profile);

    void appendInteraction(long userId, long venueId, InteractionType type);
}
