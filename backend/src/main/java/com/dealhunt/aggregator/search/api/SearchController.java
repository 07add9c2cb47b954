package com.dealhunt.aggregator.search.api;

import com.dealhunt.aggregator.config.AggregatorProperties;
import com.dealhunt.aggregator.search.cache.TtlCache;
import com.dealhunt.aggregator.search.model.CacheStats;
import com.dealhunt.aggregator.search.model.ProductResult;
import com.dealhunt.aggregator.search.model.SearchKey;
import com.dealhunt.aggregator.search.model.SearchRequest;
import com.dealhunt.aggregator.search.model.SearchResponse;
import com.dealhunt.aggregator.search.provider.ProviderRegistry;
import com.dealhunt.aggregator.search.service.ProductDetailService;
import com.dealhunt.aggregator.search.service.SearchOrchestratorService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/search")
public class SearchController {
    private final SearchOrchestratorService searchOrchestratorService;
    private final ProductDetailService productDetailService;
    private final ProviderRegistry providerRegistry;
    private final TtlCache<SearchKey, List<ProductResult>> searchResultCache;
    private final AggregatorProperties properties;

    public SearchController(
        SearchOrchestratorService searchOrchestratorService,
        ProductDetailService productDetailService,
        ProviderRegistry providerRegistry,
        TtlCache<SearchKey, List<ProductResult>> searchResultCache,
        AggregatorProperties properties
    ) {
        this.searchOrchestratorService = searchOrchestratorService;
        this.productDetailService = productDetailService;
        this.providerRegistry = providerRegistry;
        this.searchResultCache = searchResultCache;
        this.properties = properties;
    }

    @GetMapping
    public SearchResponse search(
        @RequestParam(name = "q", required = false) String query,
        @RequestParam(name = "page", required = false, defaultValue = "1") int page,
        @RequestParam(name = "minPrice", required = false) BigDecimal minPrice,
        @RequestParam(name = "maxPrice", required = false) BigDecimal maxPrice,
        @RequestParam(name = "marketplaces", required = false) List<String> marketplaces
    ) {
        if (page < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "page must be >= 1");
        }
        if (minPrice != null && minPrice.signum() < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "minPrice must be >= 0");
        }
        if (maxPrice != null && maxPrice.signum() < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "maxPrice must be >= 0");
        }
        if (minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0) {
            throw new ResponseStatusException(BAD_REQUEST, "minPrice must not exceed maxPrice");
        }
        String trimmed = query == null ? null : query.trim();
        int maxQueryLength = properties.getSearch().getMaxQueryLength();
        if (trimmed != null && trimmed.length() > maxQueryLength) {
            throw new ResponseStatusException(
                BAD_REQUEST,
                "Search query too long (max " + maxQueryLength + " characters)"
            );
        }
        List<String> selection = normalizeSelection(marketplaces);
        return searchOrchestratorService.search(new SearchRequest(trimmed, page, minPrice, maxPrice, selection));
    }

    @GetMapping("/detail/{marketplace}/{productId}")
    public ProductResult detail(@PathVariable String marketplace, @PathVariable String productId) {
        return productDetailService.detail(marketplace, productId);
    }

    @GetMapping("/providers")
    public Set<String> providers() {
        return providerRegistry.providerIds();
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return searchResultCache.stats();
    }

    @PostMapping("/cache/evict-expired")
    public Map<String, Integer> evictExpired() {
        return Map.of("removed", searchResultCache.clearExpired());
    }

    private List<String> normalizeSelection(List<String> marketplaces) {
        if (marketplaces == null) {
            return null;
        }
        List<String> selection = new ArrayList<>();
        for (String candidate : marketplaces) {
            String id = ProviderRegistry.normalizeId(candidate);
            if (id == null) {
                continue;
            }
            if (!providerRegistry.isRegistered(id)) {
                throw new ResponseStatusException(
                    BAD_REQUEST,
                    "Invalid marketplace: " + candidate + ". Valid options: " + String.join(", ", providerRegistry.providerIds())
                );
            }
            selection.add(id);
        }
        return selection;
    }
}
