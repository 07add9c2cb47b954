package com.dealhunt.aggregator.search.model;

import java.time.Instant;

public record FailureRecord(
    SearchKey key,
    int consecutiveFailures,
    Instant firstFailureAt,
    Instant lastFailureAt,
    Instant lastSuccessAt,
    String lastFailureReason
) {
    public static FailureRecord firstFailure(SearchKey key, Instant now, String reason) {
        return new FailureRecord(key, 1, now, now, null, reason);
    }

    public FailureRecord nextFailure(Instant now, String reason) {
        return new FailureRecord(
            key,
            consecutiveFailures + 1,
            firstFailureAt == null ? now : firstFailureAt,
            now,
            lastSuccessAt,
            reason == null ? lastFailureReason : reason
        );
    }

    public FailureRecord success(Instant now) {
        return new FailureRecord(key, 0, null, lastFailureAt, now, lastFailureReason);
    }
}
