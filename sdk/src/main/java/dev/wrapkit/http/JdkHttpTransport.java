// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** {@link HttpTransport} backed by {@link java.net.http.HttpClient}. Bodies are read as UTF-8 strings. */
public class JdkHttpTransport implements HttpTransport {
    private final HttpClient client;

    public JdkHttpTransport(HttpClient client) {
        this.client = Objects.requireNonNull(client, "HttpClient cannot be null");
    }

    /**
     * Creates a transport over a new JDK client.
     *
     * @param connectTimeout how long to wait for a connection to be established
     * @param redirect the redirect policy
     * @return a new transport
     */
    public static JdkHttpTransport create(Duration connectTimeout, HttpClient.Redirect redirect) {
        return new JdkHttpTransport(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(redirect)
                .build());
    }

    @Override
    public HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest request) {
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    /** @return the underlying JDK client */
    public HttpClient getClient() {
        return client;
    }
}
