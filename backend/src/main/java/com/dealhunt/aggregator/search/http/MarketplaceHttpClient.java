package com.dealhunt.aggregator.search.http;

import com.dealhunt.aggregator.config.AggregatorProperties;
import com.dealhunt.aggregator.search.model.HttpFetchResult;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

/**
 * Thin JDK {@link HttpClient} wrapper used by the marketplace adapters. Transport problems
 * are reported through {@link HttpFetchResult#errorCode()} instead of being thrown.
 */
public class MarketplaceHttpClient {
    private final HttpClient client;
    private final String userAgent;
    private final Duration readTimeout;

    public MarketplaceHttpClient(
        String userAgent,
        Duration connectTimeout,
        Duration readTimeout,
        ExecutorService httpExecutor
    ) {
        this.userAgent = AggregatorProperties.normalizeUserAgent(userAgent);
        this.readTimeout = readTimeout;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1);
        if (httpExecutor != null) {
            builder.executor(httpExecutor);
        }
        this.client = builder.build();
    }

    public HttpFetchResult get(String url, Map<String, String> headers) {
        Instant startedAt = Instant.now();
        URI uri = uriFor(url);
        if (uri == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        HttpRequest.Builder builder = baseRequest(uri, headers);
        return execute(url, builder.GET().build(), startedAt);
    }

    public HttpFetchResult postForm(String url, Map<String, String> form) {
        Instant startedAt = Instant.now();
        URI uri = uriFor(url);
        if (uri == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        HttpRequest request = baseRequest(uri, Map.of())
            .header("Content-Type", "application/x-www-form-urlencoded;charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form), StandardCharsets.UTF_8))
            .build();
        return execute(url, request, startedAt);
    }

    public static String formEncode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        if (params == null) {
            return "";
        }
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    private HttpRequest.Builder baseRequest(URI uri, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(readTimeout)
            .header("User-Agent", userAgent)
            .header("Accept", "application/json")
            .header("Accept-Language", "en-US,en;q=0.8");
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    builder.setHeader(name, value);
                }
            });
        }
        return builder;
    }

    private HttpFetchResult execute(String url, HttpRequest request, Instant startedAt) {
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI uriFor(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
