package com.dealhunt.aggregator.search.provider;

import com.dealhunt.aggregator.search.model.PriceRange;
import com.dealhunt.aggregator.search.model.ProductResult;

import java.util.List;

/**
 * Search and detail capability of one marketplace.
 */
public interface ProviderAdapter {

    /**
     * Registry id, e.g. {@code aliexpress}. Matched case-insensitively.
     */
    String id();

    /**
     * Whether the adapter has what it needs (credentials, endpoint) to serve requests.
     * Unavailable adapters are left out of the registry.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Fetches one page of results in the marketplace's own ordering.
     * <p>
     * Must not throw: transport, HTTP and parsing problems are logged by the adapter and
     * reported as an empty list so sibling marketplaces are unaffected.
     *
     * @param query      trimmed, non-blank search keywords
     * @param page       1-based page number
     * @param priceRange optional price bounds, {@link PriceRange#NONE} when unfiltered
     * @return the page's products, never {@code null}
     */
    List<ProductResult> search(String query, int page, PriceRange priceRange);

    /**
     * Looks up a single product.
     *
     * @throws ProductNotFoundException   if the marketplace does not know the id
     * @throws UpstreamProviderException  if the marketplace could not be reached or answered badly
     */
    ProductResult detail(String productId);
}
