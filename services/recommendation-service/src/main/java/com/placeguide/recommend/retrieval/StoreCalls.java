package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.store.StoreUnavailableException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class StoreCalls {
    private static final Logger log = LoggerFactory.getLogger(StoreCalls.class);

    private StoreCalls() {
    }

    static <T> T withSingleRetry(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (StoreUnavailableException first) {
            log.debug("{} unavailable, retrying once: {}", operation, first.getMessage());
            return call.get();
        }
    }
}
