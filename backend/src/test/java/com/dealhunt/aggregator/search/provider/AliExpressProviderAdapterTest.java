package com.dealhunt.aggregator.search.provider;

import com.dealhunt.aggregator.config.AggregatorProperties;
import com.dealhunt.aggregator.search.http.MarketplaceHttpClient;
import com.dealhunt.aggregator.search.model.PriceRange;
import com.dealhunt.aggregator.search.model.ProductResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AliExpressProviderAdapterTest {
    private MockWebServer server;
    private AliExpressProviderAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        AggregatorProperties properties = new AggregatorProperties();
        AggregatorProperties.Aliexpress config = properties.getAliexpress();
        config.setBaseUrl(server.url("/sync").toString());
        config.setAppKey("12345");
        config.setAppSecret("secret");
        config.setTrackingId("dealhunt");
        MarketplaceHttpClient httpClient = new MarketplaceHttpClient(
            "deal-aggregator-test", Duration.ofSeconds(2), Duration.ofSeconds(2), null);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        adapter = new AliExpressProviderAdapter(properties, httpClient, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void parsesProductsAndSignsRequest() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody(Files.readString(Path.of("src/test/resources/fixtures/aliexpress-search.json"))));

        List<ProductResult> results = adapter.search(
            "laptop stand", 2, PriceRange.of(new BigDecimal("10"), new BigDecimal("15.5")));

        assertThat(results).hasSize(2);
        ProductResult first = results.get(0);
        assertThat(first.id()).isEqualTo("1005006123456789");
        assertThat(first.marketplace()).isEqualTo("aliexpress");
        assertThat(first.price()).isEqualByComparingTo("8.49");
        assertThat(first.originalPrice()).isEqualByComparingTo("16.98");
        assertThat(first.affiliateUrl()).isEqualTo("https://s.click.aliexpress.com/e/_stand");
        assertThat(first.soldCount()).isEqualTo(1520);
        assertThat(first.rating()).isEqualTo(4.8);
        ProductResult second = results.get(1);
        assertThat(second.price()).isEqualByComparingTo("2.10");
        assertThat(second.affiliateUrl()).isEqualTo(second.detailUrl());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        Map<String, String> form = parseForm(request.getBody().readUtf8());
        assertThat(form)
            .containsEntry("method", "aliexpress.affiliate.product.query")
            .containsEntry("keywords", "laptop stand")
            .containsEntry("page_no", "2")
            .containsEntry("min_sale_price", "1000")
            .containsEntry("max_sale_price", "1550")
            .containsEntry("timestamp", "2026-03-01 18:00:00")
            .containsEntry("tracking_id", "dealhunt");
        String sign = form.remove("sign");
        assertThat(sign).isEqualTo(AliExpressSigner.sign(form, "secret", "md5"));
    }

    @Test
    void unfilteredSearchOmitsPriceParams() throws Exception {
        server.enqueue(new MockResponse().setBody(
            Files.readString(Path.of("src/test/resources/fixtures/aliexpress-search.json"))));

        adapter.search("laptop stand", 1, PriceRange.NONE);

        Map<String, String> form = parseForm(server.takeRequest().getBody().readUtf8());
        assertThat(form).doesNotContainKeys("min_sale_price", "max_sale_price");
    }

    @Test
    void apiErrorCodeYieldsEmptyList() {
        server.enqueue(new MockResponse().setBody(
            "{\"aliexpress_affiliate_product_query_response\":{\"resp_result\":{\"resp_code\":405,\"resp_msg\":\"No results\"}}}"));

        assertThat(adapter.search("xyz123nonexistent", 1, PriceRange.NONE)).isEmpty();
    }

    @Test
    void httpFailureAndGarbageYieldEmptyList() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        server.enqueue(new MockResponse().setBody("<html>not json</html>"));

        assertThat(adapter.search("laptop", 1, PriceRange.NONE)).isEmpty();
        assertThat(adapter.search("laptop", 1, PriceRange.NONE)).isEmpty();
    }

    @Test
    void detailWithNoProductsIsNotFound() throws Exception {
        server.enqueue(new MockResponse().setBody(
            Files.readString(Path.of("src/test/resources/fixtures/aliexpress-detail-empty.json"))));

        assertThatThrownBy(() -> adapter.detail("1005000000000000"))
            .isInstanceOf(ProductNotFoundException.class);
        Map<String, String> form = parseForm(server.takeRequest().getBody().readUtf8());
        assertThat(form)
            .containsEntry("method", "aliexpress.affiliate.productdetail.get")
            .containsEntry("product_ids", "1005000000000000");
    }

    @Test
    void detailUpstreamErrorIsReported() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> adapter.detail("1005006123456789"))
            .isInstanceOf(UpstreamProviderException.class)
            .hasMessageContaining("http_500");
    }

    @Test
    void unavailableWithoutCredentials() {
        AggregatorProperties properties = new AggregatorProperties();
        AliExpressProviderAdapter unconfigured = new AliExpressProviderAdapter(
            properties, null, new ObjectMapper(), Clock.systemUTC());

        assertThat(unconfigured.isAvailable()).isFalse();
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> form = new LinkedHashMap<>();
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            form.put(
                URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8)
            );
        }
        return form;
    }
}
