package com.dealhunt.aggregator.search.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one paginated search: normalized query, page, price filter and the sorted set
 * of marketplaces it was fanned out to. The result cache and the failure tracker are both
 * keyed by this type, so a cached page and its failure streak always refer to the same search.
 */
public record SearchKey(String query, int page, PriceRange priceRange, List<String> providerIds) {

    public SearchKey {
        query = normalizeQuery(query);
        page = Math.max(1, page);
        priceRange = priceRange == null ? PriceRange.NONE : priceRange;
        providerIds = normalizeProviders(providerIds);
    }

    public static SearchKey of(String query, int page, PriceRange priceRange, Collection<String> providerIds) {
        return new SearchKey(query, page, priceRange, providerIds == null ? List.of() : List.copyOf(providerIds));
    }

    public String canonical() {
        return "q=" + query
            + "|page=" + page
            + "|price=" + priceRange.descriptor()
            + "|providers=" + String.join(",", providerIds);
    }

    @Override
    public String toString() {
        return canonical();
    }

    public static String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }
        return query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static List<String> normalizeProviders(List<String> providerIds) {
        if (providerIds == null) {
            return List.of();
        }
        return providerIds.stream()
            .filter(Objects::nonNull)
            .map(id -> id.trim().toLowerCase(Locale.ROOT))
            .filter(id -> !id.isEmpty())
            .distinct()
            .sorted()
            .toList();
    }
}
