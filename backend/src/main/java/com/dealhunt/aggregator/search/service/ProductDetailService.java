package com.dealhunt.aggregator.search.service;

import com.dealhunt.aggregator.search.model.ProductResult;
import com.dealhunt.aggregator.search.provider.ProductNotFoundException;
import com.dealhunt.aggregator.search.provider.ProviderAdapter;
import com.dealhunt.aggregator.search.provider.ProviderRegistry;
import com.dealhunt.aggregator.search.provider.UpstreamProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ProductDetailService {
    private static final Logger log = LoggerFactory.getLogger(ProductDetailService.class);

    private final ProviderRegistry registry;

    public ProductDetailService(ProviderRegistry registry) {
        this.registry = registry;
    }

    public ProductResult detail(String marketplace, String productId) {
        if (productId == null || productId.isBlank()) {
            throw new SearchValidationException("Product ID cannot be empty");
        }
        ProviderAdapter provider = registry.find(marketplace)
            .orElseThrow(() -> new SearchValidationException(
                "Invalid marketplace: " + marketplace + ". Valid options: " + String.join(", ", registry.providerIds())
            ));
        String id = productId.trim();
        ProductResult result;
        try {
            result = provider.detail(id);
        } catch (ProductNotFoundException | UpstreamProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Detail lookup failed for {}/{}", provider.id(), id, e);
            throw new UpstreamProviderException(provider.id(), "Product detail lookup failed", e);
        }
        if (result == null) {
            throw new ProductNotFoundException(provider.id(), id);
        }
        return result;
    }
}
