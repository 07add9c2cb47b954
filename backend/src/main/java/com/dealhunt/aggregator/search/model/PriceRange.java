package com.dealhunt.aggregator.search.model;

import java.math.BigDecimal;

public record PriceRange(BigDecimal minPrice, BigDecimal maxPrice) {
    public static final PriceRange NONE = new PriceRange(null, null);

    public PriceRange {
        minPrice = normalize(minPrice);
        maxPrice = normalize(maxPrice);
    }

    public static PriceRange of(BigDecimal minPrice, BigDecimal maxPrice) {
        if (minPrice == null && maxPrice == null) {
            return NONE;
        }
        return new PriceRange(minPrice, maxPrice);
    }

    public boolean hasMin() {
        return minPrice != null;
    }

    public boolean hasMax() {
        return maxPrice != null;
    }

    public boolean isActive() {
        return hasMin() || hasMax();
    }

    /**
     * Stable textual form used inside search keys, e.g. {@code any}, {@code 5-15},
     * {@code min=20} or {@code max=10}.
     */
    public String descriptor() {
        if (hasMin() && hasMax()) {
            return minPrice.toPlainString() + "-" + maxPrice.toPlainString();
        }
        if (hasMin()) {
            return "min=" + minPrice.toPlainString();
        }
        if (hasMax()) {
            return "max=" + maxPrice.toPlainString();
        }
        return "any";
    }

    private static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            return null;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
