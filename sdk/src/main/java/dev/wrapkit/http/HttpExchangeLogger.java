// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs the request and response of every HTTP exchange at INFO. The fields selected by the log configs are put into
 * the MDC for the duration of the log call, so structured appenders can pick them up.
 */
public class HttpExchangeLogger {
    static final String MDC_REQUEST_NAME = "request.name";
    static final String MDC_REQUEST_TAG = "request.tag";
    static final String MDC_REQUEST_METHOD = "request.method";
    static final String MDC_REQUEST_URL = "request.url";
    static final String MDC_REQUEST_HEADERS = "request.headers";
    static final String MDC_RESPONSE_STATUS_CODE = "response.statusCode";
    static final String MDC_RESPONSE_HEADERS = "response.headers";
    static final String MDC_RESPONSE_BODY = "response.body";
    static final String MDC_RESPONSE_ELAPSED_TIME = "response.elapsedTime";

    private final Logger delegate;
    private final HttpRequestLogConfig requestLogConfig;
    private final HttpResponseLogConfig responseLogConfig;

    public HttpExchangeLogger(
            Logger delegate, HttpRequestLogConfig requestLogConfig, HttpResponseLogConfig responseLogConfig) {
        this.delegate = Objects.requireNonNull(delegate, "Logger cannot be null");
        this.requestLogConfig = Objects.requireNonNull(requestLogConfig, "HttpRequestLogConfig cannot be null");
        this.responseLogConfig = Objects.requireNonNull(responseLogConfig, "HttpResponseLogConfig cannot be null");
    }

    public void requestSent(HttpRequest request, RequestDetails details) {
        var fields = requestFields(request, details);
        log(fields, () -> delegate.info(
                "Sending HTTP request [{}]: {} {}", details.label(), request.method(), request.uri()));
    }

    public void responseReceived(
            HttpRequest request, HttpResponse<String> response, RequestDetails details, Duration elapsed) {
        var fields = responseFields(request, response, details, elapsed);
        log(fields, () -> delegate.info(
                "HTTP response received [{}]: {} {} -> {}",
                details.label(),
                request.method(),
                request.uri(),
                response.statusCode()));
    }

    Map<String, String> requestFields(HttpRequest request, RequestDetails details) {
        var fields = new LinkedHashMap<String, String>();
        if (requestLogConfig.name()) {
            putIfPresent(fields, MDC_REQUEST_NAME, details.name());
        }
        if (requestLogConfig.tag()) {
            putIfPresent(fields, MDC_REQUEST_TAG, details.tag());
        }
        if (requestLogConfig.method()) {
            fields.put(MDC_REQUEST_METHOD, request.method());
        }
        if (requestLogConfig.url()) {
            fields.put(MDC_REQUEST_URL, request.uri().toString());
        }
        if (requestLogConfig.headers()) {
            fields.put(MDC_REQUEST_HEADERS, format(request.headers()));
        }
        return fields;
    }

    Map<String, String> responseFields(
            HttpRequest request, HttpResponse<String> response, RequestDetails details, Duration elapsed) {
        var fields = new LinkedHashMap<String, String>();
        if (responseLogConfig.requestName()) {
            putIfPresent(fields, MDC_REQUEST_NAME, details.name());
        }
        if (responseLogConfig.requestTag()) {
            putIfPresent(fields, MDC_REQUEST_TAG, details.tag());
        }
        if (responseLogConfig.requestMethod()) {
            fields.put(MDC_REQUEST_METHOD, request.method());
        }
        if (responseLogConfig.requestUrl()) {
            fields.put(MDC_REQUEST_URL, request.uri().toString());
        }
        if (responseLogConfig.statusCode()) {
            fields.put(MDC_RESPONSE_STATUS_CODE, String.valueOf(response.statusCode()));
        }
        if (responseLogConfig.headers()) {
            fields.put(MDC_RESPONSE_HEADERS, format(response.headers()));
        }
        if (responseLogConfig.body()) {
            putIfPresent(fields, MDC_RESPONSE_BODY, response.body());
        }
        if (responseLogConfig.elapsedTime() && elapsed != null) {
            fields.put(MDC_RESPONSE_ELAPSED_TIME, String.valueOf(elapsed.toNanos() / 1_000_000_000.0));
        }
        return fields;
    }

    private static void putIfPresent(Map<String, String> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    private static String format(HttpHeaders headers) {
        return headers == null ? "{}" : headers.map().toString();
    }

    private static void log(Map<String, String> fields, Runnable logAction) {
        try {
            fields.forEach(MDC::put);
            logAction.run();
        } finally {
            fields.keySet().forEach(MDC::remove);
        }
    }
}
