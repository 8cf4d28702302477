package com.placeguide.recommend.retrieval;

import com.placeguide.recommend.execution.CancellationToken;
import com.placeguide.recommend.merge.HybridMerge;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Query;
import com.placeguide.recommend.model.QueryMode;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
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
public class CandidateRetriever {
    private static final Logger log = LoggerFactory.getLogger(CandidateRetriever.class);

    private final GeoRetriever geoRetriever;
    private final SemanticRetriever semanticRetriever;
    private final RetrievalProperties properties;
    private final ExecutorService recommendExecutor;
    private final MeterRegistry meterRegistry;

    public CandidateRetriever(
        GeoRetriever geoRetriever,
        SemanticRetriever semanticRetriever,
        RetrievalProperties properties,
        @Qualifier("recommendExecutor") ExecutorService recommendExecutor,
        MeterRegistry meterRegistry
    ) {
        this.geoRetriever = geoRetriever;
        this.semanticRetriever = semanticRetriever;
        this.properties = properties;
        this.recommendExecutor = recommendExecutor;
        this.meterRegistry = meterRegistry;
    }

    public RetrievalOutcome retrieve(Query query, int limit) {
        return retrieve(query, limit, null, CancellationToken.create(), null, null);
    }

    public RetrievalOutcome retrieve(
        Query query,
        int limit,
        Integer timeBudgetMs,
        CancellationToken token,
        String traceId,
        String requestId
    ) {
        if (query == null || query.getMode() == QueryMode.CLARIFY) {
            return RetrievalOutcome.empty();
        }
        int bounded = properties.boundLimit(limit);
        long deadline = timeBudgetMs != null && timeBudgetMs > 0
            ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeBudgetMs)
            : 0L;

        if (query.getMode() == QueryMode.HYBRID) {
            return retrieveHybrid(query, bounded, timeBudgetMs, deadline, token, traceId, requestId);
        }
        Retriever retriever = query.getMode() == QueryMode.GEO ? geoRetriever : semanticRetriever;
        RetrievalStageContext context =
            new RetrievalStageContext(query, bounded, timeBudgetMs, token, traceId, requestId);
        RetrievalStageResult result = awaitStage(start(retriever, context), context, deadline);

        List<String> warnings = new ArrayList<>();
        if (result.isTimedOut()) {
            countTimeout();
            if (result.getCandidates().isEmpty()) {
                throw new RetrievalTimeoutException(retriever.name() + " retrieval exceeded " + timeBudgetMs + "ms");
            }
            log.warn("{} retrieval timed out with {} partial candidates trace_id={}",
                retriever.name(), result.getCandidates().size(), traceId);
            warnings.add(retriever.name() + "_timeout_partial");
            return new RetrievalOutcome(result.getCandidates(), warnings, true);
        }
        if (result.isError()) {
            throw new RetrievalUnavailableException(retriever.name() + " retrieval failed: " + result.getErrorMessage());
        }
        return new RetrievalOutcome(truncate(result.getCandidates(), bounded), warnings, false);
    }

    private RetrievalOutcome retrieveHybrid(
        Query query,
        int limit,
        Integer timeBudgetMs,
        long deadline,
        CancellationToken token,
        String traceId,
        String requestId
    ) {
        RetrievalStageContext semanticContext =
            new RetrievalStageContext(query, limit, timeBudgetMs, token, traceId, requestId);
        RetrievalStageContext geoContext =
            new RetrievalStageContext(query, limit, timeBudgetMs, token, traceId, requestId);

        CompletableFuture<RetrievalStageResult> semanticFuture = start(semanticRetriever, semanticContext);
        CompletableFuture<RetrievalStageResult> geoFuture = start(geoRetriever, geoContext);

        RetrievalStageResult semanticResult = awaitStage(semanticFuture, semanticContext, deadline);
        RetrievalStageResult geoResult = awaitStage(geoFuture, geoContext, deadline);

        boolean semanticUsable = semanticResult.isUsable();
        boolean geoUsable = geoResult.isUsable();
        if (!semanticUsable && !geoUsable) {
            if (semanticResult.isTimedOut() || geoResult.isTimedOut()) {
                countTimeout();
            }
            if (semanticResult.isTimedOut() && geoResult.isTimedOut()) {
                throw new RetrievalTimeoutException("hybrid retrieval exceeded " + timeBudgetMs + "ms");
            }
            throw new RetrievalUnavailableException(
                "hybrid retrieval failed: semantic=" + semanticResult.getErrorMessage()
                    + ", geo=" + geoResult.getErrorMessage()
            );
        }

        List<String> warnings = new ArrayList<>();
        collectWarnings(semanticRetriever.name(), semanticResult, warnings, traceId);
        collectWarnings(geoRetriever.name(), geoResult, warnings, traceId);
        boolean degraded = !warnings.isEmpty();
        if (degraded) {
            meterRegistry.counter("rec_retrieval_degraded_total").increment();
        }

        List<Candidate> merged = HybridMerge.merge(
            semanticUsable ? semanticResult.getCandidates() : List.of(),
            geoUsable ? geoResult.getCandidates() : List.of(),
            properties.getHybridRankConstant()
        );
        return new RetrievalOutcome(truncate(merged, limit), warnings, degraded);
    }

    private void collectWarnings(String name, RetrievalStageResult result, List<String> warnings, String traceId) {
        if (!result.isError()) {
            return;
        }
        if (result.isTimedOut()) {
            countTimeout();
            warnings.add(result.getCandidates().isEmpty() ? name + "_timeout" : name + "_timeout_partial");
        } else {
            warnings.add(name + "_unavailable");
        }
        log.warn("hybrid {} retrieval degraded: {} trace_id={}", name, result.getErrorMessage(), traceId);
    }

    private CompletableFuture<RetrievalStageResult> start(Retriever retriever, RetrievalStageContext context) {
        return CompletableFuture.supplyAsync(() -> retriever.retrieve(context), recommendExecutor);
    }

    private RetrievalStageResult awaitStage(
        CompletableFuture<RetrievalStageResult> future,
        RetrievalStageContext context,
        long deadline
    ) {
        try {
            if (deadline > 0L) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                return future.get(remaining, TimeUnit.NANOSECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            context.abandon();
            future.cancel(true);
            return RetrievalStageResult.timedOut(context.snapshot());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("retrieval stage failed", cause);
            return RetrievalStageResult.error(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.abandon();
            return RetrievalStageResult.error("interrupted");
        }
    }

    private void countTimeout() {
        meterRegistry.counter("rec_stage_timeout_total", "stage", "retrieval").increment();
    }

    private static List<Candidate> truncate(List<Candidate> candidates, int limit) {
        if (candidates.size() <= limit) {
            return candidates;
        }
        return List.copyOf(candidates.subList(0, limit));
    }
}
