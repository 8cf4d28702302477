package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.execution.CancellationToken;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Query;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class RetrievalStageContext {
    private final Query query;
    private final int limit;
    private final Integer timeBudgetMs;
    private final CancellationToken cancellationToken;
    private final String traceId;
    private final String requestId;
    private final List<Candidate> gathered = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean abandoned = new AtomicBoolean(false);

    public RetrievalStageContext(
        Query query,
        int limit,
        Integer timeBudgetMs,
        CancellationToken cancellationToken,
        String traceId,
        String requestId
    ) {
        this.query = query;
        this.limit = limit;
        this.timeBudgetMs = timeBudgetMs;
        this.cancellationToken = cancellationToken == null ? CancellationToken.create() : cancellationToken;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public Query getQuery() {
        return query;
    }

    public int getLimit() {
        return limit;
    }

    public Integer getTimeBudgetMs() {
        return timeBudgetMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean shouldStop() {
        return abandoned.get() || cancellationToken.isCancelled();
    }

    public void abandon() {
        abandoned.set(true);
    }

    public boolean gather(Candidate candidate) {
        synchronized (gathered) {
            if (shouldStop() || gathered.size() >= limit) {
                return false;
            }
            gathered.add(candidate);
            return true;
        }
    }

    public boolean isFull() {
        return gathered.size() >= limit;
    }

    public List<Candidate> snapshot() {
        synchronized (gathered) {
            return List.copyOf(gathered);
        }
    }
}
