package com.dealhunt.aggregator.search.service;

import com.dealhunt.aggregator.search.model.PriceRange;
import com.dealhunt.aggregator.search.model.SearchKey;
import com.dealhunt.aggregator.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class FailureTrackerTest {
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final FailureTracker tracker = new FailureTracker(3, clock);
    private final SearchKey key = SearchKey.of("xyz123nonexistent", 1, PriceRange.NONE, List.of("aliexpress", "ebay"));

    @Test
    void unseenKeyHasNoFailures() {
        assertThat(tracker.getFailureCount(key)).isZero();
        assertThat(tracker.shouldStopPagination(key)).isFalse();
        assertThat(tracker.find(key)).isEmpty();
    }

    @Test
    void stopsExactlyAtThreshold() {
        assertThat(tracker.recordFailure(key)).isEqualTo(1);
        assertThat(tracker.shouldStopPagination(key)).isFalse();
        assertThat(tracker.recordFailure(key)).isEqualTo(2);
        assertThat(tracker.shouldStopPagination(key)).isFalse();
        assertThat(tracker.recordFailure(key)).isEqualTo(3);
        assertThat(tracker.shouldStopPagination(key)).isTrue();
        assertThat(tracker.getFailureCount(key)).isEqualTo(3);
    }

    @Test
    void successResetsStreakAndTimestamps() {
        tracker.recordFailure(key, "No results found from product sources");
        clock.advance(Duration.ofSeconds(5));
        tracker.recordFailure(key);
        clock.advance(Duration.ofSeconds(5));
        tracker.recordSuccess(key);

        assertThat(tracker.getFailureCount(key)).isZero();
        assertThat(tracker.shouldStopPagination(key)).isFalse();
        assertThat(tracker.find(key)).hasValueSatisfying(record -> {
            assertThat(record.firstFailureAt()).isNull();
            assertThat(record.lastFailureAt()).isEqualTo(START.plusSeconds(5));
            assertThat(record.lastSuccessAt()).isEqualTo(START.plusSeconds(10));
        });

        assertThat(tracker.recordFailure(key)).isEqualTo(1);
        assertThat(tracker.find(key).orElseThrow().firstFailureAt()).isEqualTo(START.plusSeconds(10));
    }

    @Test
    void keepsFirstFailureTimeAndLatestReason() {
        tracker.recordFailure(key, "first");
        clock.advance(Duration.ofSeconds(30));
        tracker.recordFailure(key, "second");
        tracker.recordFailure(key);

        assertThat(tracker.find(key)).hasValueSatisfying(record -> {
            assertThat(record.firstFailureAt()).isEqualTo(START);
            assertThat(record.lastFailureAt()).isEqualTo(START.plusSeconds(30));
        });
        assertThat(tracker.lastFailureReason(key)).contains("second");
    }

    @Test
    void keysDifferingByPageOrFilterAreIndependent() {
        SearchKey nextPage = SearchKey.of("xyz123nonexistent", 2, PriceRange.NONE, List.of("aliexpress", "ebay"));
        SearchKey filtered = SearchKey.of("xyz123nonexistent", 1, PriceRange.of(null, java.math.BigDecimal.TEN),
            List.of("aliexpress", "ebay"));

        tracker.recordFailure(key);
        tracker.recordFailure(key);
        tracker.recordFailure(key);

        assertThat(tracker.shouldStopPagination(nextPage)).isFalse();
        assertThat(tracker.getFailureCount(filtered)).isZero();
    }

    @Test
    void resetForgetsKey() {
        tracker.recordFailure(key);
        tracker.reset(key);
        assertThat(tracker.getFailureCount(key)).isZero();
        assertThat(tracker.trackedKeys()).isZero();
    }

    @Test
    void concurrentFailuresAreNeverLost() throws Exception {
        FailureTracker highThreshold = new FailureTracker(10_000, clock);
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        highThreshold.recordFailure(key);
                    }
                }, executor));
            }
            start.countDown();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdownNow();
        }

        assertThat(highThreshold.getFailureCount(key)).isEqualTo(threads * perThread);
    }
}
