// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.slf4j.Logger;
import org.slf4j.MDC;

class HttpExchangeLoggerTest {

    private static final HttpRequest REQUEST = HttpRequest.newBuilder(URI.create("https://api.example.com/orders"))
            .header("Accept", "application/json")
            .GET()
            .build();
    private static final RequestDetails DETAILS = RequestDetails.of("LIST_ORDERS", "eu");

    private Logger mockLogger;

    @BeforeEach
    void setUp() {
        mockLogger = mock(Logger.class);
    }

    private HttpExchangeLogger createLogger(HttpRequestLogConfig requestConfig, HttpResponseLogConfig responseConfig) {
        return new HttpExchangeLogger(mockLogger, requestConfig, responseConfig);
    }

    @Test
    void logsRequestLine() {
        var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

        logger.requestSent(REQUEST, DETAILS);

        verify(mockLogger)
                .info(
                        "Sending HTTP request [{}]: {} {}",
                        "LIST_ORDERS-eu",
                        "GET",
                        URI.create("https://api.example.com/orders"));
    }

    @Test
    void logsResponseLine() {
        var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

        logger.responseReceived(REQUEST, StubHttpResponse.of(REQUEST, 201, "{}"), DETAILS, Duration.ofMillis(20));

        verify(mockLogger)
                .info(
                        "HTTP response received [{}]: {} {} -> {}",
                        "LIST_ORDERS-eu",
                        "GET",
                        URI.create("https://api.example.com/orders"),
                        201);
    }

    @Test
    void defaultRequestFieldsLeaveOutHeaders() {
        var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

        var fields = logger.requestFields(REQUEST, DETAILS);

        assertEquals(
                Map.of(
                        HttpExchangeLogger.MDC_REQUEST_NAME, "LIST_ORDERS",
                        HttpExchangeLogger.MDC_REQUEST_TAG, "eu",
                        HttpExchangeLogger.MDC_REQUEST_METHOD, "GET",
                        HttpExchangeLogger.MDC_REQUEST_URL, "https://api.example.com/orders"),
                fields);
    }

    @Test
    void verboseRequestFieldsIncludeHeaders() {
        var logger = createLogger(HttpRequestLogConfig.verbose(), HttpResponseLogConfig.defaults());

        var fields = logger.requestFields(REQUEST, DETAILS);

        assertTrue(fields.get(HttpExchangeLogger.MDC_REQUEST_HEADERS).contains("application/json"));
    }

    @Test
    void missingNameAndTagAreLeftOut() {
        var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

        var fields = logger.requestFields(REQUEST, RequestDetails.unnamed());

        assertFalse(fields.containsKey(HttpExchangeLogger.MDC_REQUEST_NAME));
        assertFalse(fields.containsKey(HttpExchangeLogger.MDC_REQUEST_TAG));
    }

    @Test
    void defaultResponseFieldsIncludeStatusAndElapsedTime() {
        var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

        var fields = logger.responseFields(
                REQUEST, StubHttpResponse.of(REQUEST, 503, "unavailable"), DETAILS, Duration.ofMillis(1500));

        assertEquals("503", fields.get(HttpExchangeLogger.MDC_RESPONSE_STATUS_CODE));
        assertEquals("1.5", fields.get(HttpExchangeLogger.MDC_RESPONSE_ELAPSED_TIME));
        assertFalse(fields.containsKey(HttpExchangeLogger.MDC_RESPONSE_BODY));
        assertFalse(fields.containsKey(HttpExchangeLogger.MDC_RESPONSE_HEADERS));
    }

    @Test
    void verboseResponseFieldsIncludeBodyAndHeaders() {
        var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.verbose());
        var response = new StubHttpResponse(REQUEST, 200, Map.of("content-type", List.of("text/plain")), "done");

        var fields = logger.responseFields(REQUEST, response, DETAILS, Duration.ZERO);

        assertEquals("done", fields.get(HttpExchangeLogger.MDC_RESPONSE_BODY));
        assertTrue(fields.get(HttpExchangeLogger.MDC_RESPONSE_HEADERS).contains("text/plain"));
    }

    @Test
    void noFieldsWhenEverythingIsDisabled() {
        var logger = createLogger(HttpRequestLogConfig.none(), HttpResponseLogConfig.none());

        assertTrue(logger.requestFields(REQUEST, DETAILS).isEmpty());
        assertTrue(logger
                .responseFields(REQUEST, StubHttpResponse.of(REQUEST, 200, ""), DETAILS, Duration.ZERO)
                .isEmpty());
    }

    @Test
    void setsMdcDuringLogAndClearsAfter() {
        try (MockedStatic<MDC> mdcMock = mockStatic(MDC.class)) {
            var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

            logger.requestSent(REQUEST, DETAILS);

            mdcMock.verify(() -> MDC.put(HttpExchangeLogger.MDC_REQUEST_NAME, "LIST_ORDERS"));
            mdcMock.verify(() -> MDC.put(HttpExchangeLogger.MDC_REQUEST_TAG, "eu"));
            mdcMock.verify(() -> MDC.put(HttpExchangeLogger.MDC_REQUEST_METHOD, "GET"));
            mdcMock.verify(() -> MDC.put(HttpExchangeLogger.MDC_REQUEST_URL, "https://api.example.com/orders"));

            mdcMock.verify(() -> MDC.remove(HttpExchangeLogger.MDC_REQUEST_NAME));
            mdcMock.verify(() -> MDC.remove(HttpExchangeLogger.MDC_REQUEST_TAG));
            mdcMock.verify(() -> MDC.remove(HttpExchangeLogger.MDC_REQUEST_METHOD));
            mdcMock.verify(() -> MDC.remove(HttpExchangeLogger.MDC_REQUEST_URL));
            mdcMock.verify(() -> MDC.put(eq(HttpExchangeLogger.MDC_REQUEST_HEADERS), anyString()), never());
        }
    }

    @Test
    void clearsMdcWhenLoggingFails() {
        try (MockedStatic<MDC> mdcMock = mockStatic(MDC.class)) {
            doThrow(new IllegalStateException("appender failed"))
                    .when(mockLogger)
                    .info(anyString(), any(), any(), any());
            var logger = createLogger(HttpRequestLogConfig.defaults(), HttpResponseLogConfig.defaults());

            assertThrows(IllegalStateException.class, () -> logger.requestSent(REQUEST, DETAILS));

            mdcMock.verify(() -> MDC.remove(HttpExchangeLogger.MDC_REQUEST_URL));
        }
    }
}
