package com.dealhunt.aggregator.search.model;

public record PaginationState(
    boolean endOfResults,
    int consecutiveFailures,
    boolean retrySuggested,
    String failureReason
) {
    private static final PaginationState NEUTRAL = new PaginationState(false, 0, false, null);

    public static PaginationState neutral() {
        return NEUTRAL;
    }

    public static PaginationState exhausted(int consecutiveFailures, String failureReason) {
        return new PaginationState(true, consecutiveFailures, true, failureReason);
    }

    public static PaginationState failed(int consecutiveFailures, String failureReason) {
        return new PaginationState(false, consecutiveFailures, false, failureReason);
    }
}
