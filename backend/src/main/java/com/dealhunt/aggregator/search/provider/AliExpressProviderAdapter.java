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
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AliExpressProviderAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(AliExpressProviderAdapter.class);

    public static final String ID = "aliexpress";
    static final String SEARCH_METHOD = "aliexpress.affiliate.product.query";
    static final String DETAIL_METHOD = "aliexpress.affiliate.productdetail.get";
    private static final String SEARCH_SORT = "LAST_VOLUME_DESC";
    private static final BigDecimal CENTS = BigDecimal.valueOf(100);

    private final AggregatorProperties.Aliexpress config;
    private final MarketplaceHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AliExpressProviderAdapter(
        AggregatorProperties properties,
        @Qualifier("aliexpressHttpClient") MarketplaceHttpClient httpClient,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.config = properties.getAliexpress();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
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
            Map<String, String> params = baseParams(SEARCH_METHOD);
            params.put("keywords", query);
            params.put("page_no", String.valueOf(Math.max(1, page)));
            params.put("page_size", String.valueOf(config.getPageSize()));
            params.put("sort", SEARCH_SORT);
            params.put("tracking_id", config.getTrackingId());
            if (priceRange != null && priceRange.hasMin()) {
                params.put("min_sale_price", toCents(priceRange.minPrice()));
            }
            if (priceRange != null && priceRange.hasMax()) {
                params.put("max_sale_price", toCents(priceRange.maxPrice()));
            }
            params.put("sign", AliExpressSigner.sign(params, config.getAppSecret(), config.getSignMethod()));

            HttpFetchResult fetch = httpClient.postForm(config.getBaseUrl(), params);
            if (!fetch.isSuccessful()) {
                log.warn("AliExpress search failed for query='{}' page={}: {}", query, page, fetch.describeFailure());
                return List.of();
            }
            JsonNode result = responseResult(fetch.body(), "aliexpress_affiliate_product_query_response");
            if (!isOk(result)) {
                log.warn("AliExpress search error for query='{}' page={}: code={} msg={}",
                    query, page, JsonFields.text(result, "resp_code"), JsonFields.text(result, "resp_msg"));
                return List.of();
            }
            return parseProducts(result);
        } catch (Exception e) {
            log.warn("AliExpress search error for query='{}' page={}: {}", query, page, e.toString());
            return List.of();
        }
    }

    @Override
    public ProductResult detail(String productId) {
        Map<String, String> params = baseParams(DETAIL_METHOD);
        params.put("product_ids", productId);
        params.put("tracking_id", config.getTrackingId());
        params.put("sign", AliExpressSigner.sign(params, config.getAppSecret(), config.getSignMethod()));

        HttpFetchResult fetch = httpClient.postForm(config.getBaseUrl(), params);
        if (!fetch.isSuccessful()) {
            throw new UpstreamProviderException(ID, "AliExpress detail request failed: " + fetch.describeFailure());
        }
        JsonNode result;
        try {
            result = responseResult(fetch.body(), "aliexpress_affiliate_productdetail_get_response");
        } catch (JsonProcessingException e) {
            throw new UpstreamProviderException(ID, "AliExpress detail response unreadable", e);
        }
        if (!isOk(result)) {
            throw new UpstreamProviderException(ID, "AliExpress detail error: " + JsonFields.text(result, "resp_msg"));
        }
        List<ProductResult> products = parseProducts(result);
        if (products.isEmpty()) {
            throw new ProductNotFoundException(ID, productId);
        }
        return products.get(0);
    }

    private Map<String, String> baseParams(String method) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("app_key", config.getAppKey());
        params.put("method", method);
        params.put("sign_method", config.getSignMethod());
        params.put("timestamp", AliExpressSigner.timestamp(clock.instant()));
        params.put("v", config.getApiVersion());
        params.put("format", "json");
        params.put("target_currency", config.getTargetCurrency());
        params.put("target_language", config.getTargetLanguage());
        return params;
    }

    private JsonNode responseResult(String body, String wrapper) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
        return root.path(wrapper).path("resp_result");
    }

    private boolean isOk(JsonNode result) {
        return result != null && result.path("resp_code").asInt(-1) == 200;
    }

    private List<ProductResult> parseProducts(JsonNode result) {
        JsonNode products = result.path("result").path("products").path("product");
        if (!products.isArray()) {
            return List.of();
        }
        List<ProductResult> out = new ArrayList<>();
        for (JsonNode product : products) {
            ProductResult parsed = toProduct(product);
            if (parsed != null) {
                out.add(parsed);
            }
        }
        return out;
    }

    private ProductResult toProduct(JsonNode product) {
        String productId = JsonFields.text(product, "product_id");
        if (productId == null) {
            return null;
        }
        BigDecimal originalPrice = JsonFields.firstDecimal(product, "target_original_price", "original_price");
        BigDecimal salePrice = JsonFields.firstDecimal(product, "target_sale_price", "sale_price");
        if (salePrice == null) {
            salePrice = originalPrice;
        }
        String currency = JsonFields.firstText(product, "target_sale_price_currency", "sale_price_currency");
        String detailUrl = JsonFields.text(product, "product_detail_url");
        String affiliateUrl = JsonFields.text(product, "promotion_link");
        Double evaluateRate = JsonFields.percent(product, "evaluate_rate");
        Double rating = evaluateRate == null
            ? null
            : BigDecimal.valueOf(evaluateRate / 100 * 5).setScale(1, RoundingMode.HALF_UP).doubleValue();
        String title = JsonFields.text(product, "product_title");
        return new ProductResult(
            productId,
            ID,
            title == null ? "Unknown Product" : title,
            salePrice,
            originalPrice == null ? salePrice : originalPrice,
            currency == null ? config.getTargetCurrency() : currency,
            JsonFields.text(product, "product_main_image_url"),
            detailUrl,
            affiliateUrl == null ? detailUrl : affiliateUrl,
            JsonFields.integer(product, "lastest_volume"),
            rating
        );
    }

    private String toCents(BigDecimal price) {
        return price.multiply(CENTS).setScale(0, RoundingMode.DOWN).toPlainString();
    }
}
