package com.bcnjobs.tracker.scrape.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult failure(String requestedUrl, Instant startedAt, String errorCode, String errorMessage) {
        Instant now = Instant.now();
        return new HttpFetchResult(requestedUrl, null, 0, null, null, now, Duration.between(startedAt, now), errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean hasBody() {
        return isSuccessful() && body != null && !body.isBlank();
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
