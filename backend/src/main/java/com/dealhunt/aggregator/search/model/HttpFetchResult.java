package com.dealhunt.aggregator.search.model;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isNotFound() {
        return statusCode == 404 && errorCode == null;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        return "http_" + statusCode;
    }
}
