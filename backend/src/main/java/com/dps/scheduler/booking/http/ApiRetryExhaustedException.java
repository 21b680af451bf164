package com.dps.scheduler.booking.http;

import com.dps.scheduler.booking.service.FatalSchedulerException;

public class ApiRetryExhaustedException extends FatalSchedulerException {
    private final String path;
    private final int statusCode;
    private final int attempts;

    public ApiRetryExhaustedException(String path, int statusCode, int attempts) {
        super("Received status code " + statusCode + " from " + path + ". Retry failed after " + attempts + " attempts.", 1);
        this.path = path;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public String getPath() {
        return path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public int getAttempts() {
        return attempts;
    }
}
