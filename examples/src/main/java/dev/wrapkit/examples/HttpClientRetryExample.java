// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

import dev.wrapkit.exception.RetryExhaustedException;
import dev.wrapkit.http.HttpClientConfig;
import dev.wrapkit.http.HttpRetryStrategy;
import dev.wrapkit.http.HttpTransport;
import dev.wrapkit.http.RetryingHttpClient;
import dev.wrapkit.http.StatusGroup;
import dev.wrapkit.retry.Sleeper;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example demonstrating an API client built on {@link RetryingHttpClient}.
 *
 * <p>Connection failures are always retried; timeouts and 5xx responses are retried because the strategy enables
 * them. Each request is named so log lines and retry messages identify it, and tagged with the region it targets.
 */
public class HttpClientRetryExample {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientRetryExample.class);

    static final String GET_ORDER = "GET_ORDER";
    static final String CREATE_ORDER = "CREATE_ORDER";

    private final RetryingHttpClient client;
    private final String region;

    public HttpClientRetryExample(URI baseUri, String region) {
        this(baseUri, region, null, null);
    }

    /**
     * @param baseUri the orders API root
     * @param region tag added to every request log line
     * @param transport overrides the JDK transport, may be null
     * @param sleeper overrides how the client waits between attempts, may be null
     */
    public HttpClientRetryExample(URI baseUri, String region, HttpTransport transport, Sleeper sleeper) {
        var strategy = HttpRetryStrategy.builder()
                .attempts(3)
                .delay(Duration.ofMillis(500))
                .onTimeouts(true)
                .onStatuses(StatusGroup.SERVER_ERROR)
                .sleeper(sleeper)
                .build();

        var config = HttpClientConfig.builder()
                .withBaseUri(baseUri)
                .withDefaultHeader("Accept", "application/json")
                .withTimeout(Duration.ofSeconds(2))
                .withRetryStrategy(strategy);
        if (transport != null) {
            config.withTransport(transport);
        }

        this.client = new RetryingHttpClient(config.build());
        this.region = region;
    }

    /**
     * Looks up an order.
     *
     * @return the order, or empty if the API answers 404
     * @throws RetryExhaustedException if the API stays unreachable or keeps failing
     * @throws IllegalStateException on any other non-success status
     */
    public Optional<Order> getOrder(String orderId) {
        var response = client.get("orders/" + orderId, GET_ORDER, region);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (!StatusGroup.isSuccess(response.statusCode())) {
            throw new IllegalStateException("Unexpected status " + response.statusCode() + " for order " + orderId);
        }
        return Optional.ofNullable(client.readJson(response, Order.class));
    }

    public CompletableFuture<Order> getOrderAsync(String orderId) {
        return client.getAsync("orders/" + orderId, GET_ORDER, region)
                .thenApply(response -> client.readJson(response, Order.class));
    }

    public Order createOrder(Order order) {
        var response = client.postJson("orders", order, CREATE_ORDER, region);
        if (!StatusGroup.isSuccess(response.statusCode())) {
            throw new IllegalStateException("Order was not created, status " + response.statusCode());
        }
        var created = client.readJson(response, Order.class);
        logger.info("Created order {} for customer {}", created.id(), created.customerId());
        return created;
    }
}
