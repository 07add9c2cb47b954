package com.dealhunt.aggregator.search.util;

import com.dealhunt.aggregator.search.model.PriceRange;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * User-facing explanations for a search page that came back empty (or was judged to be past
 * the real result set). Rules are checked in order; the first match wins.
 */
public final class FailureReasons {
    public static final String NO_RESULTS = "No results found from product sources";
    public static final String END_OF_RESULTS = "Reached end of available results";
    public static final String SEARCH_UNAVAILABLE = "Search service temporarily unavailable. Please try again later.";

    private FailureReasons() {}

    public static String describe(int page, PriceRange priceRange, int earlyPageThreshold, int veryHighPageThreshold) {
        PriceRange range = priceRange == null ? PriceRange.NONE : priceRange;
        boolean filtered = range.isActive();
        boolean early = page <= earlyPageThreshold;
        boolean veryHigh = page > veryHighPageThreshold;

        if (filtered && early) {
            return filterHint(range);
        }
        if (filtered && veryHigh) {
            return END_OF_RESULTS + " (page " + page + "); all matching products shown";
        }
        if (!early) {
            return filtered ? END_OF_RESULTS + " for the current price filters" : END_OF_RESULTS;
        }
        return NO_RESULTS;
    }

    private static String filterHint(PriceRange range) {
        if (range.hasMin() && range.hasMax()) {
            return "No products found between " + money(range.minPrice()) + " and " + money(range.maxPrice())
                + ". Try relaxing your price filters.";
        }
        if (range.hasMax()) {
            return "No products found under " + money(range.maxPrice())
                + ". Try increasing the maximum price.";
        }
        return "No products found above " + money(range.minPrice())
            + ". Try lowering the minimum price.";
    }

    private static String money(BigDecimal value) {
        return "$" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
