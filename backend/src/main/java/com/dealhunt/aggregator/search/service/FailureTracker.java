package com.dealhunt.aggregator.search.service;

import com.dealhunt.aggregator.search.model.FailureRecord;
import com.dealhunt.aggregator.search.model.SearchKey;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts consecutive empty or exhausted outcomes per search key. Once a key reaches
 * {@code maxFailures} callers should stop asking for further pages until a success resets it.
 * All updates go through {@link ConcurrentHashMap#compute} so racing failures on one key are
 * never lost.
 */
public class FailureTracker {
    private final Map<SearchKey, FailureRecord> records = new ConcurrentHashMap<>();
    private final int maxFailures;
    private final Clock clock;

    public FailureTracker(int maxFailures, Clock clock) {
        this.maxFailures = Math.max(1, maxFailures);
        this.clock = clock;
    }

    public int recordFailure(SearchKey key) {
        return recordFailure(key, null);
    }

    public int recordFailure(SearchKey key, String reason) {
        if (key == null) {
            return 0;
        }
        Instant now = clock.instant();
        AtomicInteger count = new AtomicInteger();
        records.compute(key, (ignored, existing) -> {
            FailureRecord next = existing == null
                ? FailureRecord.firstFailure(key, now, reason)
                : existing.nextFailure(now, reason);
            count.set(next.consecutiveFailures());
            return next;
        });
        return count.get();
    }

    public void recordSuccess(SearchKey key) {
        if (key == null) {
            return;
        }
        Instant now = clock.instant();
        // keys that never failed stay untracked
        records.computeIfPresent(key, (ignored, existing) -> existing.success(now));
    }

    public int getFailureCount(SearchKey key) {
        if (key == null) {
            return 0;
        }
        FailureRecord record = records.get(key);
        return record == null ? 0 : record.consecutiveFailures();
    }

    public boolean shouldStopPagination(SearchKey key) {
        return getFailureCount(key) >= maxFailures;
    }

    public Optional<String> lastFailureReason(SearchKey key) {
        return find(key).map(FailureRecord::lastFailureReason);
    }

    public Optional<FailureRecord> find(SearchKey key) {
        return key == null ? Optional.empty() : Optional.ofNullable(records.get(key));
    }

    public void reset(SearchKey key) {
        if (key != null) {
            records.remove(key);
        }
    }

    public void clear() {
        records.clear();
    }

    public int trackedKeys() {
        return records.size();
    }

    public int maxFailures() {
        return maxFailures;
    }
}
