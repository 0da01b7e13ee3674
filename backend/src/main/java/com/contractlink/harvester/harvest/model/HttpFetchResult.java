package com.contractlink.harvester.harvest.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Duration retryAfter,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isRateLimited() {
        return errorCode == null && (statusCode == 429 || statusCode == 403);
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public HttpFetchResult withAttempts(int totalAttempts) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            retryAfter,
            fetchedAt,
            duration,
            totalAttempts,
            errorCode,
            errorMessage
        );
    }

    public HarvestErrorKind failureKind() {
        if (isSuccessful()) {
            return null;
        }
        return isRateLimited() ? HarvestErrorKind.RATE_LIMIT : HarvestErrorKind.NETWORK;
    }

    public String failureDetail() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage) + " (" + requestedUrl + ")";
        }
        return "http_" + statusCode + " (" + requestedUrl + ")";
    }
}
