// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import dev.wrapkit.exception.HttpClientException;
import dev.wrapkit.exception.RetryExhaustedException;
import dev.wrapkit.retry.RetryStrategy;
import dev.wrapkit.util.ExceptionHelper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client that sends every request through an optional {@link RetryStrategy} and logs each attempt.
 *
 * <p>Each attempt is logged twice at INFO, as {@code Sending HTTP request [label]: METHOD URL} before it is sent and
 * {@code HTTP response received [label]: METHOD URL -> STATUS} once the response arrives. The request and its {@link
 * RequestDetails} are the arguments of the retried operation, so {@link HttpRetryStrategy} hooks can name the request
 * they retry.
 *
 * <pre>{@code
 * var client = new RetryingHttpClient(HttpClientConfig.builder()
 *         .withBaseUri(URI.create("https://api.example.com/v1/"))
 *         .withRetryStrategy(HttpRetryStrategy.builder().attempts(3).onStatuses(StatusGroup.SERVER_ERROR).build())
 *         .build());
 *
 * var response = client.get("orders/42", "GET_ORDER", "eu");
 * var order = client.readJson(response, Order.class);
 * }</pre>
 */
public class RetryingHttpClient {
    private static final String CONTENT_TYPE = "Content-Type";

    private final HttpClientConfig config;
    private final HttpTransport transport;
    private final HttpExchangeLogger exchangeLogger;

    public RetryingHttpClient() {
        this(HttpClientConfig.defaultConfig());
    }

    public RetryingHttpClient(HttpClientConfig config) {
        this.config = Objects.requireNonNull(config, "HttpClientConfig cannot be null");
        this.transport = config.getTransport();
        this.exchangeLogger = new HttpExchangeLogger(
                config.getClientLogger(), config.getRequestLogConfig(), config.getResponseLogConfig());
    }

    public HttpClientConfig getConfig() {
        return config;
    }

    /**
     * Sends a request through the configured retry strategy, or once when none is configured.
     *
     * @param request the request to send
     * @param details the name and tag used in log lines, may be null
     * @return the accepted response
     * @throws RetryExhaustedException when the strategy gives up
     * @throws HttpClientException when no strategy is configured and the request fails in transport
     */
    public HttpResponse<String> send(HttpRequest request, RequestDetails details) {
        return send(request, details, config.getRetryStrategy().orElse(null));
    }

    /**
     * Sends a request through the given retry strategy instead of the configured one.
     *
     * @param request the request to send
     * @param details the name and tag used in log lines, may be null
     * @param strategy the strategy for this call; null sends the request once
     * @return the accepted response
     */
    public HttpResponse<String> send(HttpRequest request, RequestDetails details, RetryStrategy strategy) {
        Objects.requireNonNull(request, "request cannot be null");
        var effectiveDetails = details != null ? details : RequestDetails.unnamed();
        if (strategy != null) {
            return strategy.retry(this::sendOnce, request, effectiveDetails);
        }

        try {
            return sendOnce(request, effectiveDetails);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(failureMessage(request, effectiveDetails), e);
        } catch (IOException e) {
            throw new HttpClientException(failureMessage(request, effectiveDetails), e);
        }
    }

    /** Asynchronous counterpart of {@link #send(HttpRequest, RequestDetails)}; never blocks between attempts. */
    public CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest request, RequestDetails details) {
        return sendAsync(request, details, config.getRetryStrategy().orElse(null));
    }

    public CompletableFuture<HttpResponse<String>> sendAsync(
            HttpRequest request, RequestDetails details, RetryStrategy strategy) {
        Objects.requireNonNull(request, "request cannot be null");
        var effectiveDetails = details != null ? details : RequestDetails.unnamed();
        if (strategy != null) {
            return strategy.retryAsync(this::sendOnceAsync, request, effectiveDetails);
        }

        var result = new CompletableFuture<HttpResponse<String>>();
        CompletableFuture<HttpResponse<String>> attempt;
        try {
            attempt = sendOnceAsync(request, effectiveDetails);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        attempt.whenComplete((response, error) -> {
            if (error == null) {
                result.complete(response);
            } else {
                result.completeExceptionally(new HttpClientException(
                        failureMessage(request, effectiveDetails), ExceptionHelper.unwrapCompletableFuture(error)));
            }
        });
        return result;
    }

    public HttpResponse<String> get(String path, String name, String tag) {
        return send(newRequest(path).GET().build(), RequestDetails.of(name, tag));
    }

    public CompletableFuture<HttpResponse<String>> getAsync(String path, String name, String tag) {
        return sendAsync(newRequest(path).GET().build(), RequestDetails.of(name, tag));
    }

    public HttpResponse<String> delete(String path, String name, String tag) {
        return send(newRequest(path).DELETE().build(), RequestDetails.of(name, tag));
    }

    /**
     * Sends a POST with a body serialized by the configured {@link dev.wrapkit.serde.SerDes}, JSON by default.
     *
     * @param path the path, resolved against the base URI
     * @param body the value to serialize
     * @param name the request name, may be null
     * @param tag the request tag, may be null
     * @return the accepted response
     * @throws dev.wrapkit.exception.SerDesException if the body cannot be serialized
     */
    public HttpResponse<String> postJson(String path, Object body, String name, String tag) {
        return sendJson("POST", path, body, name, tag);
    }

    public HttpResponse<String> putJson(String path, Object body, String name, String tag) {
        return sendJson("PUT", path, body, name, tag);
    }

    public HttpResponse<String> patchJson(String path, Object body, String name, String tag) {
        return sendJson("PATCH", path, body, name, tag);
    }

    /**
     * Deserializes a JSON response body.
     *
     * @return the deserialized value, or null for an empty body
     * @throws dev.wrapkit.exception.SerDesException if the body is not valid JSON for the type
     */
    public <T> T readJson(HttpResponse<String> response, Class<T> type) {
        return config.getSerDes().deserialize(response.body(), type);
    }

    /**
     * Starts a request for a path resolved against the base URI, with the default headers and the request timeout
     * already applied.
     *
     * @param path a relative path, or an absolute URI
     * @return a request builder
     */
    public HttpRequest.Builder newRequest(String path) {
        var builder = HttpRequest.newBuilder(resolve(path)).timeout(config.getTimeout());
        config.getDefaultHeaders().forEach(builder::header);
        return builder;
    }

    private HttpResponse<String> sendJson(String method, String path, Object body, String name, String tag) {
        var json = config.getSerDes().serialize(body);
        var publisher = json == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(json);
        var request = newRequest(path)
                .header(CONTENT_TYPE, config.getSerDes().contentType())
                .method(method, publisher)
                .build();
        return send(request, RequestDetails.of(name, tag));
    }

    private URI resolve(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        return config.getBaseUri().map(base -> base.resolve(path)).orElseGet(() -> URI.create(path));
    }

    private HttpResponse<String> sendOnce(HttpRequest request, RequestDetails details)
            throws IOException, InterruptedException {
        exchangeLogger.requestSent(request, details);
        var start = System.nanoTime();
        var response = transport.send(request);
        exchangeLogger.responseReceived(request, response, details, Duration.ofNanos(System.nanoTime() - start));
        return response;
    }

    private CompletableFuture<HttpResponse<String>> sendOnceAsync(HttpRequest request, RequestDetails details) {
        exchangeLogger.requestSent(request, details);
        var start = System.nanoTime();
        return transport.sendAsync(request).thenApply(response -> {
            exchangeLogger.responseReceived(
                    request, response, details, Duration.ofNanos(System.nanoTime() - start));
            return response;
        });
    }

    private static String failureMessage(HttpRequest request, RequestDetails details) {
        return String.format("HTTP request [%s] failed: %s %s", details.label(), request.method(), request.uri());
    }
}
