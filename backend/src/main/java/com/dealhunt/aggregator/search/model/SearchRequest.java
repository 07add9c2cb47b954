package com.dealhunt.aggregator.search.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Incoming search. A {@code null} provider selection means every registered marketplace;
 * an empty selection means none and yields an empty response.
 */
public record SearchRequest(
    String query,
    int page,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    List<String> providerSelection
) {
    public static SearchRequest of(String query, int page) {
        return new SearchRequest(query, page, null, null, null);
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public PriceRange priceRange() {
        return PriceRange.of(minPrice, maxPrice);
    }
}
