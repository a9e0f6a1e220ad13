// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import dev.wrapkit.exception.HttpClientException;
import dev.wrapkit.exception.RetryExhaustedException;
import dev.wrapkit.exception.SerDesException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;

class RetryingHttpClientTest {

    private static final URI BASE_URI = URI.create("https://api.example.com/v1/");

    record Order(String id, int quantity) {}

    private HttpTransport transport;
    private Logger clientLogger;
    private Logger strategyLogger;

    @BeforeEach
    void setUp() {
        transport = mock(HttpTransport.class);
        clientLogger = mock(Logger.class);
        strategyLogger = mock(Logger.class);
    }

    private HttpClientConfig.Builder config() {
        return HttpClientConfig.builder()
                .withBaseUri(BASE_URI)
                .withTransport(transport)
                .withClientLogger(clientLogger);
    }

    private HttpRetryStrategy.Builder strategy() {
        return HttpRetryStrategy.builder()
                .logger(strategyLogger)
                .sleeper(duration -> {})
                .asyncExecutor(Runnable::run);
    }

    private static HttpResponse<String> ok(String body) {
        return StubHttpResponse.of(null, 200, body);
    }

    @Test
    void sendsOnceWithoutStrategy() throws Exception {
        when(transport.send(any())).thenReturn(ok("{}"));
        var client = new RetryingHttpClient(config().build());

        var response = client.get("orders/42", "GET_ORDER", "eu");

        assertEquals(200, response.statusCode());
        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(transport).send(captor.capture());
        assertEquals(URI.create("https://api.example.com/v1/orders/42"), captor.getValue().uri());
        assertEquals("GET", captor.getValue().method());
        assertEquals(HttpClientConfig.DEFAULT_TIMEOUT, captor.getValue().timeout().orElseThrow());
    }

    @Test
    void logsRequestAndResponse() throws Exception {
        when(transport.send(any())).thenReturn(StubHttpResponse.of(null, 204, ""));
        var client = new RetryingHttpClient(config().build());

        client.delete("orders/42", "DELETE_ORDER", null);

        var url = URI.create("https://api.example.com/v1/orders/42");
        verify(clientLogger).info("Sending HTTP request [{}]: {} {}", "DELETE_ORDER", "DELETE", url);
        verify(clientLogger).info("HTTP response received [{}]: {} {} -> {}", "DELETE_ORDER", "DELETE", url, 204);
    }

    @Test
    void transportFailureWithoutStrategyIsWrapped() throws Exception {
        var error = new ConnectException("Connection refused");
        when(transport.send(any())).thenThrow(error);
        var client = new RetryingHttpClient(config().build());

        var exception = assertThrows(HttpClientException.class, () -> client.get("orders", "LIST_ORDERS", null));

        assertSame(error, exception.getCause());
        assertEquals(
                "HTTP request [LIST_ORDERS] failed: GET https://api.example.com/v1/orders", exception.getMessage());
        verify(transport, times(1)).send(any());
    }

    @Test
    void interruptedSendWithoutStrategyRestoresFlag() throws Exception {
        when(transport.send(any())).thenThrow(new InterruptedException("stop"));
        var client = new RetryingHttpClient(config().build());

        try {
            var exception = assertThrows(HttpClientException.class, () -> client.get("orders", null, null));

            assertInstanceOf(InterruptedException.class, exception.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void configuredStrategyRetriesConnectionErrors() throws Exception {
        when(transport.send(any()))
                .thenThrow(new ConnectException("Connection refused"))
                .thenThrow(new ConnectException("Connection refused"))
                .thenReturn(ok("{\"id\":\"o-1\",\"quantity\":2}"));
        var client = new RetryingHttpClient(
                config().withRetryStrategy(strategy().attempts(3).build()).build());

        var response = client.get("orders/o-1", "GET_ORDER", null);

        assertEquals(new Order("o-1", 2), client.readJson(response, Order.class));
        verify(transport, times(3)).send(any());
        verify(clientLogger, times(3)).info(eq("Sending HTTP request [{}]: {} {}"), any(), any(), any());
        verify(strategyLogger)
                .info(
                        "Retrying HTTP request [{}] ({}/{}): {}",
                        "GET_ORDER",
                        3,
                        3,
                        "GET https://api.example.com/v1/orders/o-1");
    }

    @Test
    void configuredStrategyRetriesServerErrorsUntilExhausted() throws Exception {
        when(transport.send(any())).thenReturn(StubHttpResponse.of(null, 503, "unavailable"));
        var client = new RetryingHttpClient(config()
                .withRetryStrategy(strategy().attempts(2).onStatuses(StatusGroup.SERVER_ERROR).build())
                .build());

        var exception = assertThrows(RetryExhaustedException.class, () -> client.get("orders", "LIST_ORDERS", "eu"));

        assertNull(exception.getCause());
        assertEquals(503, ((HttpResponse<?>) exception.getLastState().result()).statusCode());
        verify(transport, times(2)).send(any());
    }

    @Test
    void perCallStrategyOverridesConfiguredOne() throws Exception {
        when(transport.send(any())).thenThrow(new ConnectException("Connection refused"));
        var client = new RetryingHttpClient(
                config().withRetryStrategy(strategy().attempts(5).build()).build());
        var request = client.newRequest("orders").GET().build();

        var exception = assertThrows(
                RetryExhaustedException.class,
                () -> client.send(request, RequestDetails.named("LIST_ORDERS"), strategy().attempts(2).build()));

        assertInstanceOf(ConnectException.class, exception.getCause());
        verify(transport, times(2)).send(any());
    }

    @Test
    void nullPerCallStrategySendsOnce() throws Exception {
        when(transport.send(any())).thenThrow(new ConnectException("Connection refused"));
        var client = new RetryingHttpClient(
                config().withRetryStrategy(strategy().attempts(5).build()).build());
        var request = client.newRequest("orders").GET().build();

        assertThrows(HttpClientException.class, () -> client.send(request, null, null));
        verify(transport, times(1)).send(any());
    }

    @Test
    void appliesDefaultHeadersAndTimeout() throws Exception {
        when(transport.send(any())).thenReturn(ok(""));
        var client = new RetryingHttpClient(config()
                .withDefaultHeader("Accept", "application/json")
                .withTimeout(Duration.ofSeconds(2))
                .build());

        client.get("orders", null, null);

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(transport).send(captor.capture());
        assertEquals("application/json", captor.getValue().headers().firstValue("Accept").orElseThrow());
        assertEquals(Duration.ofSeconds(2), captor.getValue().timeout().orElseThrow());
    }

    @Test
    void postJsonSerializesBody() throws Exception {
        when(transport.send(any())).thenReturn(StubHttpResponse.of(null, 201, ""));
        var client = new RetryingHttpClient(config().build());

        client.postJson("orders", new Order("o-2", 5), "CREATE_ORDER", null);

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(transport).send(captor.capture());
        var request = captor.getValue();
        assertEquals("POST", request.method());
        assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());
        assertEquals("{\"id\":\"o-2\",\"quantity\":5}", bodyOf(request));
    }

    @Test
    void putAndPatchUseTheirMethods() throws Exception {
        when(transport.send(any())).thenReturn(ok(""));
        var client = new RetryingHttpClient(config().build());

        client.putJson("orders/o-2", new Order("o-2", 6), "REPLACE_ORDER", null);
        client.patchJson("orders/o-2", new Order("o-2", 7), "UPDATE_ORDER", null);

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(transport, times(2)).send(captor.capture());
        assertEquals(List.of("PUT", "PATCH"), captor.getAllValues().stream().map(HttpRequest::method).toList());
    }

    @Test
    void readJsonRejectsInvalidBody() throws Exception {
        when(transport.send(any())).thenReturn(ok("not json"));
        var client = new RetryingHttpClient(config().build());

        var response = client.get("orders/o-1", null, null);

        assertThrows(SerDesException.class, () -> client.readJson(response, Order.class));
    }

    @Test
    void absolutePathWithoutBaseUri() throws Exception {
        when(transport.send(any())).thenReturn(ok(""));
        var client = new RetryingHttpClient(
                HttpClientConfig.builder().withTransport(transport).withClientLogger(clientLogger).build());

        client.get("https://other.example.com/health", "HEALTH", null);

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(transport).send(captor.capture());
        assertEquals(URI.create("https://other.example.com/health"), captor.getValue().uri());
    }

    @Test
    void asyncSendRetriesWithoutBlocking() throws Exception {
        when(transport.sendAsync(any()))
                .thenReturn(CompletableFuture.failedFuture(new ConnectException("Connection refused")))
                .thenReturn(CompletableFuture.completedFuture(ok("done")));
        var client = new RetryingHttpClient(
                config().withRetryStrategy(strategy().attempts(3).build()).build());

        var response = client.getAsync("orders", "LIST_ORDERS", null).get(5, TimeUnit.SECONDS);

        assertEquals("done", response.body());
        verify(transport, times(2)).sendAsync(any());
        verify(clientLogger, times(1))
                .info(eq("HTTP response received [{}]: {} {} -> {}"), any(), any(), any(), any());
    }

    @Test
    void asyncFailureWithoutStrategyIsWrapped() {
        var error = new IOException("reset");
        when(transport.sendAsync(any())).thenReturn(CompletableFuture.failedFuture(error));
        var client = new RetryingHttpClient(config().build());

        var future = client.getAsync("orders", "LIST_ORDERS", null);

        var exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        var wrapped = assertInstanceOf(HttpClientException.class, exception.getCause());
        assertSame(error, wrapped.getCause());
    }

    @Test
    void asyncExhaustionCompletesExceptionally() {
        when(transport.sendAsync(any()))
                .thenReturn(CompletableFuture.completedFuture(StubHttpResponse.of(null, 500, "")));
        var client = new RetryingHttpClient(config()
                .withRetryStrategy(strategy().attempts(2).onStatuses(StatusGroup.SERVER_ERROR).build())
                .build());

        var future = client.getAsync("orders", "LIST_ORDERS", null);

        var exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RetryExhaustedException.class, exception.getCause());
        verify(strategyLogger).error(anyString(), any(), any(), any(), any());
    }

    private static String bodyOf(HttpRequest request) {
        var publisher = request.bodyPublisher().orElseThrow();
        var chunks = new ArrayList<ByteBuffer>();
        var done = new CompletableFuture<Void>();
        publisher.subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                chunks.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
                done.completeExceptionally(throwable);
            }

            @Override
            public void onComplete() {
                done.complete(null);
            }
        });
        done.join();
        var builder = new StringBuilder();
        chunks.forEach(chunk -> builder.append(StandardCharsets.UTF_8.decode(chunk)));
        return builder.toString();
    }
}
