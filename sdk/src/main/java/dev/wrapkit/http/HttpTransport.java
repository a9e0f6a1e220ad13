// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a single HTTP request, without retries or logging. {@link RetryingHttpClient} sends every attempt through this
 * interface, so tests can replace the network with scripted responses.
 */
public interface HttpTransport {

    /**
     * Sends a request and waits for the response.
     *
     * @param request the request to send
     * @return the response with its body decoded as a string
     * @throws IOException if the request could not be sent or the response could not be read
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException;

    /**
     * Sends a request without blocking.
     *
     * @param request the request to send
     * @return a future of the response; transport failures complete it exceptionally
     */
    CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest request);
}
