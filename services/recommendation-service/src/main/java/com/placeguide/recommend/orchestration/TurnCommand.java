package com.placeguide.recommend.orchestration;

import com.placeguide.recommend.execution.CancellationToken;
import com.placeguide.recommend.model.Query;

public record TurnCommand(
    Query query,
    Long userId,
    Integer timeoutMs,
    CancellationToken cancellationToken,
    String traceId,
    String requestId
) {
    public TurnCommand {
        if (query == null) {
            throw new IllegalArgumentException("query is required");
        }
        if (cancellationToken == null) {
            cancellationToken = CancellationToken.create();
        }
    }

    public static TurnCommand of(Query query, Long userId) {
        return new TurnCommand(query, userId, null, null, null, null);
    }
}
