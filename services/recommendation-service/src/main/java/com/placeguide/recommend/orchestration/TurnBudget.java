package com.placeguide.recommend.orchestration;

public record TurnBudget(int totalMs, int retrievalMs, int scoringMs, int selectionMs) {

    public static TurnBudget resolve(Integer requestedMs, OrchestrationProperties properties) {
        int total = requestedMs == null || requestedMs <= 0 ? properties.getDefaultTimeoutMs() : requestedMs;
        total = Math.max(properties.getMinTimeoutMs(), Math.min(properties.getMaxTimeoutMs(), total));
        int floor = Math.max(1, properties.getMinStageMs());
        return new TurnBudget(
            total,
            share(total, properties.getRetrievalShare(), floor),
            share(total, properties.getScoringShare(), floor),
            share(total, properties.getSelectionShare(), floor)
        );
    }

    private static int share(int total, double fraction, int floor) {
        if (fraction <= 0.0) {
            return floor;
        }
        return Math.max(floor, (int) Math.round(total * fraction));
    }
}
