package com.dps.scheduler.booking.http;

import com.dps.scheduler.booking.service.FatalSchedulerException;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * Sends JSON requests to the scheduling API with the fixed browser headers it expects.
 * A request that does not come back with status 200 is retried up to {@code max-retry}
 * more times; when the last attempt also fails the run is over and
 * {@link ApiRetryExhaustedException} is thrown.
 */
@Service
public class SchedulerApiClient {
    private static final Logger log = LoggerFactory.getLogger(SchedulerApiClient.class);
    private static final String CONTENT_TYPE = "application/json;charset=UTF-8";

    private final SchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public SchedulerApiClient(
        SchedulerProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getApp().getHeadersTimeoutMs()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public <T> T post(String path, Object body, Class<T> responseType) {
        ApiResponse response = request(path, "POST", body);
        return decode(path, response, objectMapper.getTypeFactory().constructType(responseType));
    }

    public <T> T post(String path, Object body, TypeReference<T> responseType) {
        ApiResponse response = request(path, "POST", body);
        return decode(path, response, objectMapper.getTypeFactory().constructType(responseType));
    }

    public ApiResponse request(String path, String method, Object body) {
        String payload = encode(body);
        int maxRetry = properties.getApp().getMaxRetry();
        ApiResponse lastResponse = null;
        for (int attempt = 0; attempt <= maxRetry; attempt++) {
            lastResponse = executeOnce(path, method, payload);
            if (lastResponse.isSuccessful()) {
                return lastResponse;
            }
            if (attempt < maxRetry) {
                log.warn("Received status code {}. Retrying...", lastResponse.describeStatus());
                log.error("{}", lastResponse.bodyOrError());
            }
        }
        log.error("Received status code {}. Retry failed.", lastResponse.describeStatus());
        throw new ApiRetryExhaustedException(path, lastResponse.statusCode(), maxRetry + 1);
    }

    private ApiResponse executeOnce(String path, String method, String payload) {
        Instant startedAt = Instant.now();
        URI uri = URI.create(properties.getApi().getBaseUrl() + path);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofMillis(properties.getApp().getHeadersTimeoutMs()))
            .header("Content-Type", CONTENT_TYPE)
            .header("Origin", properties.getApi().getOrigin())
            .header("Referer", properties.getApi().getReferer());
        HttpRequest request;
        if ("GET".equalsIgnoreCase(method)) {
            request = builder.GET().build();
        } else {
            request = builder
                .method(method.toUpperCase(Locale.ROOT), HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new ApiResponse(path, response.statusCode(), response.body(), Duration.between(startedAt, Instant.now()), null);
        } catch (HttpTimeoutException e) {
            return new ApiResponse(path, 0, null, Duration.between(startedAt, Instant.now()), "timeout: " + e.getMessage());
        } catch (IOException e) {
            return new ApiResponse(path, 0, null, Duration.between(startedAt, Instant.now()), "io_error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalSchedulerException("Interrupted while calling " + path, 1, e);
        }
    }

    private String encode(Object body) {
        if (body == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not encode request body for " + body.getClass().getSimpleName(), e);
        }
    }

    private <T> T decode(String path, ApiResponse response, JavaType type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not decode response from " + path, e);
        }
    }
}
