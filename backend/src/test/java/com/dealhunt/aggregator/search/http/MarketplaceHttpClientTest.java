package com.dealhunt.aggregator.search.http;

import com.dealhunt.aggregator.search.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class MarketplaceHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private MarketplaceHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        client = new MarketplaceHttpClient("  ", Duration.ofSeconds(2), Duration.ofSeconds(1), executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void getSendsCallerHeadersAndSkipsBlankOnes() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"ok\":true}"));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer abc");
        headers.put("X-EBAY-C-ENDUSERCTX", "");

        HttpFetchResult result = client.get(server.url("/items?q=lamp").toString(), headers);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("{\"ok\":true}");
        assertThat(result.contentType()).startsWith("application/json");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer abc");
        assertThat(request.getHeader("X-EBAY-C-ENDUSERCTX")).isNull();
        assertThat(request.getHeader("User-Agent")).isEqualTo("deal-aggregator/0.1 (+contact)");
    }

    @Test
    void postFormEncodesBodyAndDropsNullValues() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));
        Map<String, String> form = new LinkedHashMap<>();
        form.put("keywords", "phone case & cover");
        form.put("page_no", "1");
        form.put("min_sale_price", null);

        HttpFetchResult result = client.postForm(server.url("/sync").toString(), form);

        assertThat(result.isSuccessful()).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Content-Type")).startsWith("application/x-www-form-urlencoded");
        assertThat(request.getBody().readUtf8()).isEqualTo("keywords=phone+case+%26+cover&page_no=1");
    }

    @Test
    void nonSuccessStatusIsReportedNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/missing").toString(), Map.of());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.isNotFound()).isTrue();
        assertThat(result.describeFailure()).isEqualTo("http_404");
    }

    @Test
    void malformedUrlAndStalledServerAreErrorCodes() {
        assertThat(client.get("not a url", Map.of()).errorCode()).isEqualTo("invalid_url");
        assertThat(client.get(null, Map.of()).errorCode()).isEqualTo("invalid_url");

        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        HttpFetchResult stalled = client.get(server.url("/slow").toString(), Map.of());

        assertThat(stalled.errorCode()).isIn("timeout", "io_error");
        assertThat(stalled.isSuccessful()).isFalse();
    }
}
