package com.placeguide.recommend.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.placeguide.recommend.TestVenues;
import com.placeguide.recommend.model.InteractionHistory;
import com.placeguide.recommend.model.InteractionType;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.store.CandidateStore;
import com.placeguide.recommend.store.ProfileStore;
import com.placeguide.recommend.store.StoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {
    @Mock
    private ProfileStore profileStore;

    @Mock
    private CandidateStore candidateStore;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private ProfileService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        meterRegistry = new SimpleMeterRegistry();
        service = new ProfileService(profileStore, candidateStore, executor, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void missingProfileReadsAsEmpty() {
        when(profileStore.findProfile(9L)).thenReturn(Optional.empty());

        UserProfile profile = service.getProfile(9L);

        assertThat(profile.getUserId()).isEqualTo(9L);
        assertThat(profile.getPreferredTags()).isEmpty();
        assertThat(profile.getHistory().getLikedCounts()).isEmpty();
    }

    @Test
    void updateKeepsFieldsThatWereNotSent() {
        when(profileStore.findProfile(9L)).thenReturn(Optional.of(
            new UserProfile(9L, List.of("кафе"), List.of("бар"), List.of("Арбат"), InteractionHistory.empty())
        ));

        UserProfile updated = service.updateProfile(9L, List.of("музей", "парк"), null, List.of());

        assertThat(updated.getPreferredTags()).containsExactly("музей", "парк");
        assertThat(updated.getAvoidedTags()).containsExactly("бар");
        assertThat(updated.getFavoriteDistricts()).isEmpty();
        verify(profileStore).saveProfile(updated);
    }

    @Test
    void likedInteractionIsLoggedAndFoldedIntoProfile() throws Exception {
        when(profileStore.findProfile(9L)).thenReturn(Optional.empty());
        when(candidateStore.findVenue(3L)).thenReturn(Optional.of(TestVenues.venue(3, "Хамовники", 4.6, "музей")));

        service.recordInteractionAsync(9L, 3L, InteractionType.LIKED).get(5, TimeUnit.SECONDS);

        verify(profileStore).appendInteraction(9L, 3L, InteractionType.LIKED);
        ArgumentCaptor<UserProfile> saved = ArgumentCaptor.forClass(UserProfile.class);
        verify(profileStore).saveProfile(saved.capture());
        assertThat(saved.getValue().getPreferredTags()).containsExactly("музей");
        assertThat(saved.getValue().getFavoriteDistricts()).containsExactly("Хамовники");
        assertThat(meterRegistry.counter("rec_interaction_recorded_total").count()).isEqualTo(1.0);
    }

    @Test
    void unknownVenueStillRecordsInteraction() throws Exception {
        when(candidateStore.findVenue(404L)).thenReturn(Optional.empty());

        service.recordInteractionAsync(9L, 404L, InteractionType.DISLIKED).get(5, TimeUnit.SECONDS);

        verify(profileStore).appendInteraction(9L, 404L, InteractionType.DISLIKED);
        verify(profileStore, never()).saveProfile(any());
    }

    @Test
    void storeFailureIsCountedNotPropagated() throws Exception {
        doThrow(new StoreUnavailableException("db down"))
            .when(profileStore).appendInteraction(9L, 3L, InteractionType.LIKED);

        service.recordInteractionAsync(9L, 3L, InteractionType.LIKED).get(5, TimeUnit.SECONDS);

        assertThat(meterRegistry.counter("rec_interaction_failed_total").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("rec_interaction_recorded_total").count()).isZero();
    }
}
