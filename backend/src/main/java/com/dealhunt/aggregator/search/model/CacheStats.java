package com.dealhunt.aggregator.search.model;

public record CacheStats(int totalEntries, int validEntries, int expiredEntries) {
}
