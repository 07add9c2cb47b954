package com.dealhunt.aggregator.search.service;

import com.dealhunt.aggregator.config.AggregatorProperties;
import com.dealhunt.aggregator.search.cache.TtlCache;
import com.dealhunt.aggregator.search.model.PaginationState;
import com.dealhunt.aggregator.search.model.PriceRange;
import com.dealhunt.aggregator.search.model.ProductResult;
import com.dealhunt.aggregator.search.model.SearchKey;
import com.dealhunt.aggregator.search.model.SearchRequest;
import com.dealhunt.aggregator.search.model.SearchResponse;
import com.dealhunt.aggregator.search.provider.ProviderAdapter;
import com.dealhunt.aggregator.search.provider.ProviderRegistry;
import com.dealhunt.aggregator.search.util.FailureReasons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one search out to the selected marketplaces, caches merged pages and keeps a
 * per-search failure streak that decides when further pages are no longer worth requesting.
 * Every call returns a well-formed {@link SearchResponse}; nothing thrown by a marketplace,
 * the cache or the tracker reaches the caller.
 */
@Service
public class SearchOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestratorService.class);

    private final ProviderRegistry registry;
    private final TtlCache<SearchKey, List<ProductResult>> cache;
    private final FailureTracker failureTracker;
    private final ExecutorService providerExecutor;
    private final AggregatorProperties properties;

    public SearchOrchestratorService(
        ProviderRegistry registry,
        TtlCache<SearchKey, List<ProductResult>> cache,
        FailureTracker failureTracker,
        @Qualifier("providerExecutor") ExecutorService providerExecutor,
        AggregatorProperties properties
    ) {
        this.registry = registry;
        this.cache = cache;
        this.failureTracker = failureTracker;
        this.providerExecutor = providerExecutor;
        this.properties = properties;
    }

    public SearchResponse search(SearchRequest request) {
        if (request == null || !request.hasQuery()) {
            return SearchResponse.empty();
        }
        List<ProviderAdapter> providers = registry.select(request.providerSelection());
        if (providers.isEmpty()) {
            log.debug("No registered marketplace matched selection {}", request.providerSelection());
            return SearchResponse.empty();
        }

        SearchKey key = SearchKey.of(
            request.query(),
            request.page(),
            request.priceRange(),
            providers.stream().map(ProviderAdapter::id).toList()
        );
        try {
            return searchWithKey(key, request.query().trim(), providers);
        } catch (Exception e) {
            log.warn("Search failed unexpectedly for {}", key, e);
            return SearchResponse.failed(new PaginationState(false, 0, true, FailureReasons.SEARCH_UNAVAILABLE));
        }
    }

    private SearchResponse searchWithKey(SearchKey key, String query, List<ProviderAdapter> providers) {
        AggregatorProperties.Search config = properties.getSearch();

        if (failureTracker.shouldStopPagination(key)) {
            int failures = failureTracker.getFailureCount(key);
            String reason = failureTracker.lastFailureReason(key)
                .orElseGet(() -> describeFailure(key, config));
            log.info("Pagination exhausted for {} after {} consecutive failures; skipping marketplaces", key, failures);
            return SearchResponse.failed(PaginationState.exhausted(failures, reason));
        }

        Optional<List<ProductResult>> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit for {} ({} results)", key, cached.get().size());
            failureTracker.recordSuccess(key);
            return SearchResponse.of(cached.get());
        }
        log.debug("Cache miss for {}; querying {}", key, key.providerIds());

        List<ProductResult> merged = dispatch(key, query, providers,
            Duration.ofSeconds(config.getDispatchDeadlineSeconds()));

        if (!isEffectiveFailure(key, merged, config)) {
            failureTracker.recordSuccess(key);
            cache.set(key, merged, Duration.ofSeconds(config.getCacheTtlSeconds()));
            return SearchResponse.of(merged);
        }

        String reason = describeFailure(key, config);
        int failures = failureTracker.recordFailure(key, reason);
        if (failures >= failureTracker.maxFailures()) {
            log.info("Search {} reached {} consecutive failures; marking end of results", key, failures);
            return SearchResponse.failed(PaginationState.exhausted(failures, reason));
        }
        log.debug("Search {} came back empty ({} consecutive failures): {}", key, failures, reason);
        return SearchResponse.failed(PaginationState.failed(failures, reason));
    }

    /**
     * Runs every provider on its own worker and concatenates results in completion order.
     * Providers still running or queued when the deadline passes are abandoned; whatever
     * finished in time is kept. {@code query} is the caller's trimmed text, the key only
     * identifies the search.
     */
    List<ProductResult> dispatch(SearchKey key, String query, List<ProviderAdapter> providers, Duration deadline) {
        Queue<List<ProductResult>> completed = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<List<ProductResult>>> calls = new ArrayList<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (ProviderAdapter provider : providers) {
            CompletableFuture<List<ProductResult>> call = CompletableFuture
                .supplyAsync(() -> callProvider(provider, query, key), providerExecutor);
            calls.add(call);
            futures.add(call.thenAccept(completed::add));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            long pending = futures.stream().filter(future -> !future.isDone()).count();
            log.warn("Dispatch deadline of {}s passed for {}; abandoning {} provider call(s)",
                deadline.toSeconds(), key, pending);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting on providers for {}", key);
        } catch (ExecutionException e) {
            log.warn("Provider dispatch failed for {}", key, e.getCause());
        } finally {
            // a cancelled supplier still waiting in the pool never runs
            calls.forEach(call -> call.cancel(true));
        }
        List<ProductResult> merged = new ArrayList<>();
        for (List<ProductResult> providerResults : completed) {
            merged.addAll(providerResults);
        }
        return List.copyOf(merged);
    }

    private List<ProductResult> callProvider(ProviderAdapter provider, String query, SearchKey key) {
        try {
            List<ProductResult> results = provider.search(query, key.page(), key.priceRange());
            if (results == null) {
                return List.of();
            }
            log.debug("Provider {} returned {} results for {}", provider.id(), results.size(), key);
            return results.stream().filter(Objects::nonNull).toList();
        } catch (Exception e) {
            log.warn("Provider {} failed for query='{}' page={}: {}", provider.id(), query, key.page(), e.toString());
            return List.of();
        }
    }

    private boolean isEffectiveFailure(SearchKey key, List<ProductResult> merged, AggregatorProperties.Search config) {
        if (merged.isEmpty()) {
            return true;
        }
        // deep pages under an active filter are treated as past the real result set
        return key.page() > config.getVeryHighPageThreshold() && key.priceRange().isActive();
    }

    private String describeFailure(SearchKey key, AggregatorProperties.Search config) {
        PriceRange priceRange = key.priceRange();
        return FailureReasons.describe(
            key.page(),
            priceRange,
            config.getEarlyPageThreshold(),
            config.getVeryHighPageThreshold()
        );
    }
}
