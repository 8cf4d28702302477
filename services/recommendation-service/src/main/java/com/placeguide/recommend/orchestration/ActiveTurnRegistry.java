package com.placeguide.recommend.orchestration;

import com.placeguide.recommend.execution.CancellationToken;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ActiveTurnRegistry {
    private static final Logger log = LoggerFactory.getLogger(ActiveTurnRegistry.class);

    private final Map<Long, CancellationToken> active = new ConcurrentHashMap<>();

    public CancellationToken begin(Long userId) {
        CancellationToken token = CancellationToken.create();
        if (userId == null) {
            return token;
        }
        CancellationToken previous = active.put(userId, token);
        if (previous != null && previous.cancel("superseded")) {
            log.debug("superseded in-flight turn for user {}", userId);
        }
        return token;
    }

    public void end(Long userId, CancellationToken token) {
        if (userId != null && token != null) {
            active.remove(userId, token);
        }
    }

    public int activeCount() {
        return active.size();
    }
}
