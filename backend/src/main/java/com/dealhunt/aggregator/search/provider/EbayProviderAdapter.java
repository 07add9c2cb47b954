package com.dealhunt.aggregator.search.provider;

import com.dealhunt.aggregator.config.AggregatorProperties;
import com.dealhunt.aggregator.search.http.MarketplaceHttpClient;
import com.dealhunt.aggregator.search.model.HttpFetchResult;
import com.dealhunt.aggregator.search.model.PriceRange;
import com.dealhunt.aggregator.search.model.ProductResult;
import com.dealhunt.aggregator.search.util.JsonFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class EbayProviderAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(EbayProviderAdapter.class);

    public static final String ID = "ebay";
    private static final String BROWSE_PATH = "/buy/browse/v1";

    private final AggregatorProperties.Ebay config;
    private final MarketplaceHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public EbayProviderAdapter(
        AggregatorProperties properties,
        @Qualifier("ebayHttpClient") MarketplaceHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.config = properties.getEbay();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isAvailable() {
        return config.isConfigured();
    }

    @Override
    public List<ProductResult> search(String query, int page, PriceRange priceRange) {
        try {
            int limit = config.getPageSize();
            Map<String, String> params = new LinkedHashMap<>();
            params.put("q", query);
            params.put("limit", String.valueOf(limit));
            params.put("offset", String.valueOf((long) (Math.max(1, page) - 1) * limit));
            String filter = priceFilter(priceRange);
            if (filter != null) {
                params.put("filter", filter);
            }
            String url = browseUrl("/item_summary/search") + "?" + MarketplaceHttpClient.formEncode(params);

            HttpFetchResult fetch = httpClient.get(url, headers());
            if (!fetch.isSuccessful()) {
                log.warn("eBay search failed for query='{}' page={}: {}", query, page, fetch.describeFailure());
                return List.of();
            }
            JsonNode items = objectMapper.readTree(fetch.body()).path("itemSummaries");
            if (!items.isArray()) {
                return List.of();
            }
            List<ProductResult> out = new ArrayList<>();
            for (JsonNode item : items) {
                ProductResult parsed = toProduct(item);
                if (parsed != null) {
                    out.add(parsed);
                }
            }
            return out;
        } catch (Exception e) {
            log.warn("eBay search error for query='{}' page={}: {}", query, page, e.toString());
            return List.of();
        }
    }

    @Override
    public ProductResult detail(String productId) {
        String url = browseUrl("/item/" + URLEncoder.encode(productId, StandardCharsets.UTF_8));
        HttpFetchResult fetch = httpClient.get(url, headers());
        if (fetch.isNotFound()) {
            throw new ProductNotFoundException(ID, productId);
        }
        if (!fetch.isSuccessful()) {
            throw new UpstreamProviderException(ID, "eBay detail request failed: " + fetch.describeFailure());
        }
        ProductResult product;
        try {
            product = toProduct(objectMapper.readTree(fetch.body()));
        } catch (JsonProcessingException e) {
            throw new UpstreamProviderException(ID, "eBay detail response unreadable", e);
        }
        if (product == null) {
            throw new ProductNotFoundException(ID, productId);
        }
        return product;
    }

    String priceFilter(PriceRange priceRange) {
        if (priceRange == null || !priceRange.isActive()) {
            return null;
        }
        String min = priceRange.hasMin() ? priceRange.minPrice().toPlainString() : "";
        String max = priceRange.hasMax() ? priceRange.maxPrice().toPlainString() : "";
        return "price:[" + min + ".." + max + "],priceCurrency:" + config.getCurrency();
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + config.getToken());
        headers.put("X-EBAY-C-MARKETPLACE-ID", config.getMarketplaceId());
        if (config.getCampaignId() != null && !config.getCampaignId().isBlank()) {
            headers.put("X-EBAY-C-ENDUSERCTX", "affiliateCampaignId=" + config.getCampaignId());
        }
        return headers;
    }

    private String browseUrl(String path) {
        String base = config.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + BROWSE_PATH + path;
    }

    private ProductResult toProduct(JsonNode item) {
        String itemId = JsonFields.text(item, "itemId");
        if (itemId == null) {
            return null;
        }
        JsonNode price = item.path("price");
        BigDecimal value = JsonFields.decimal(price, "value");
        BigDecimal original = JsonFields.decimal(item.path("marketingPrice").path("originalPrice"), "value");
        String webUrl = JsonFields.text(item, "itemWebUrl");
        String affiliateUrl = JsonFields.text(item, "itemAffiliateWebUrl");
        String title = JsonFields.text(item, "title");
        return new ProductResult(
            itemId,
            ID,
            title == null ? "Unknown Product" : title,
            value,
            original == null ? value : original,
            JsonFields.text(price, "currency"),
            JsonFields.text(item.path("image"), "imageUrl"),
            webUrl,
            affiliateUrl == null ? webUrl : affiliateUrl,
            null,
            null
        );
    }
}
