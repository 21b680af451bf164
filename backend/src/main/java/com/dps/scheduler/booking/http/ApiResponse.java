package com.dps.scheduler.booking.http;

import java.time.Duration;

public record ApiResponse(
    String path,
    int statusCode,
    String body,
    Duration duration,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode == 200 && errorMessage == null;
    }

    public String describeStatus() {
        return errorMessage == null ? String.valueOf(statusCode) : statusCode + " (" + errorMessage + ")";
    }

    public String bodyOrError() {
        if (body != null) {
            return body;
        }
        return errorMessage == null ? "" : errorMessage;
    }
}
