package com.dealhunt.aggregator.search.model;

import java.math.BigDecimal;

/**
 * One product offer returned by a marketplace. The search engine only counts and
 * concatenates these; the fields are filled in by the marketplace adapters.
 */
public record ProductResult(
    String id,
    String marketplace,
    String title,
    BigDecimal price,
    BigDecimal originalPrice,
    String currency,
    String imageUrl,
    String detailUrl,
    String affiliateUrl,
    Integer soldCount,
    Double rating
) {
    public static ProductResult of(String id, String marketplace, String title, BigDecimal price) {
        return new ProductResult(id, marketplace, title, price, price, null, null, null, null, null, null);
    }
}
