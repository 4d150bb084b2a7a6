package com.metbull.sync.reconcile.model;

import java.time.Duration;

public record PageFetchResult(
    int page,
    String requestedUrl,
    int statusCode,
    String body,
    Duration duration,
    FetchFailure failure,
    String errorMessage
) {
    public static PageFetchResult success(int page, String url, int statusCode, String body, Duration duration) {
        return new PageFetchResult(page, url, statusCode, body, duration, null, null);
    }

    public static PageFetchResult failed(int page, String url, int statusCode, Duration duration, FetchFailure failure, String message) {
        return new PageFetchResult(page, url, statusCode, null, duration, failure, message);
    }

    public boolean isSuccessful() {
        return failure == null && statusCode >= 200 && statusCode < 300;
    }
}
