package com.dealhunt.aggregator.search.provider;

public class ProductNotFoundException extends ProviderException {
    public ProductNotFoundException(String providerId, String productId) {
        super(providerId, "Product not found: " + providerId + "/" + productId);
    }
}
