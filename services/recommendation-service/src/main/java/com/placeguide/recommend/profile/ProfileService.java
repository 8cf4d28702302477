package com.placeguide.recommend.profile;

import com.placeguide.recommend.model.InteractionType;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.model.Venue;
import com.placeguide.recommend.store.CandidateStore;
import com.placeguide.recommend.store.ProfileStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class ProfileService {
    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final ProfileStore profileStore;
    private final CandidateStore candidateStore;
    private final ExecutorService recommendExecutor;
    private final MeterRegistry meterRegistry;

    public ProfileService(
        ProfileStore profileStore,
        CandidateStore candidateStore,
        @Qualifier("recommendExecutor") ExecutorService recommendExecutor,
        MeterRegistry meterRegistry
    ) {
        this.profileStore = profileStore;
        this.candidateStore = candidateStore;
        this.recommendExecutor = recommendExecutor;
        this.meterRegistry = meterRegistry;
    }

    public UserProfile getProfile(long userId) {
        return profileStore.findProfile(userId).orElseGet(() -> UserProfile.empty(userId));
    }

    public UserProfile updateProfile(
        long userId,
        Collection<String> preferredTags,
        Collection<String> avoidedTags,
        Collection<String> favoriteDistricts
    ) {
        UserProfile current = getProfile(userId);
        UserProfile updated = current.withPreferences(
            preferredTags == null ? current.getPreferredTags() : preferredTags,
            avoidedTags == null ? current.getAvoidedTags() : avoidedTags,
            favoriteDistricts == null ? current.getFavoriteDistricts() : favoriteDistricts
        );
        profileStore.saveProfile(updated);
        return updated;
    }

    public CompletableFuture<Void> recordInteractionAsync(long userId, long venueId, InteractionType type) {
        return CompletableFuture
            .runAsync(() -> recordInteraction(userId, venueId, type), recommendExecutor)
            .handle((ignored, error) -> {
                if (error == null) {
                    meterRegistry.counter("rec_interaction_recorded_total").increment();
                } else {
                    meterRegistry.counter("rec_interaction_failed_total").increment();
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    log.warn("interaction {} of user {} on venue {} not recorded", type.code(), userId, venueId, cause);
                }
                return null;
            });
    }

    void recordInteraction(long userId, long venueId, InteractionType type) {
        profileStore.appendInteraction(userId, venueId, type);
        Optional<Venue> venue = candidateStore.findVenue(venueId);
        if (venue.isEmpty()) {
            log.debug("venue {} not found, profile of user {} left unchanged", venueId, userId);
            return;
        }
        UserProfile updated = ProfileInference.apply(getProfile(userId), venue.get(), type);
        profileStore.saveProfile(updated);
    }
}
