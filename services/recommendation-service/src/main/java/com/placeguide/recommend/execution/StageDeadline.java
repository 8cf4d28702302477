package com.placeguide.recommend.execution;

import java.util.concurrent.TimeUnit;

public final class StageDeadline {
    private static final StageDeadline NONE = new StageDeadline(0L, 0L, false);

    private final long budgetMs;
    private final long deadlineNanos;
    private final boolean bounded;

    private StageDeadline(long budgetMs, long deadlineNanos, boolean bounded) {
        this.budgetMs = budgetMs;
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    public static StageDeadline after(long budgetMs) {
        long budget = Math.max(0L, budgetMs);
        return new StageDeadline(budget, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budget), true);
    }

    public static StageDeadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return bounded && System.nanoTime() - deadlineNanos >= 0;
    }

    public long getBudgetMs() {
        return budgetMs;
    }
}
