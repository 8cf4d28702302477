package com.placeguide.recommend.orchestration;

import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.store.ProfileStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    private final ProfileStore profileStore;
    private final ExecutorService profileExecutor;
    private final MeterRegistry meterRegistry;

    public ProfileLoader(
        ProfileStore profileStore,
        @Qualifier("profileExecutor") ExecutorService profileExecutor,
        MeterRegistry meterRegistry
    ) {
        this.profileStore = profileStore;
        this.profileExecutor = profileExecutor;
        this.meterRegistry = meterRegistry;
    }

    public CompletableFuture<Optional<UserProfile>> start(Long userId) {
        if (userId == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> load(userId), profileExecutor);
    }

    public Optional<UserProfile> await(CompletableFuture<Optional<UserProfile>> future, long waitMs, String traceId) {
        try {
            Optional<UserProfile> profile = waitMs > 0
                ? future.get(waitMs, TimeUnit.MILLISECONDS)
                : future.get();
            return profile == null ? Optional.empty() : profile;
        } catch (TimeoutException e) {
            future.cancel(true);
            degrade("profile load exceeded " + waitMs + "ms", null, traceId);
        } catch (ExecutionException e) {
            degrade("profile load failed", e.getCause(), traceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            degrade("profile load interrupted", null, traceId);
        }
        return Optional.empty();
    }

    private Optional<UserProfile> load(long userId) {
        try {
            return profileStore.findProfile(userId);
        } catch (RuntimeException e) {
            throw new ProfileUnavailableException("profile unavailable for user " + userId, e);
        }
    }

    private void degrade(String message, Throwable cause, String traceId) {
        meterRegistry.counter("rec_profile_unavailable_total").increment();
        if (cause != null) {
            log.warn("{}, scoring without personalization trace_id={}: {}", message, traceId, cause.getMessage());
            log.debug("profile load failure", cause);
        } else {
            log.warn("{}, scoring without personalization trace_id={}", message, traceId);
        }
    }
}
