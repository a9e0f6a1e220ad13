// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.net.ssl.SSLSession;

/** Minimal response for unit tests of the http package. */
record StubHttpResponse(HttpRequest request, int statusCode, Map<String, List<String>> headerMap, String body)
        implements HttpResponse<String> {

    static StubHttpResponse of(int statusCode) {
        return new StubHttpResponse(null, statusCode, Map.of(), "");
    }

    static StubHttpResponse of(HttpRequest request, int statusCode, String body) {
        return new StubHttpResponse(request, statusCode, Map.of(), body);
    }

    @Override
    public Optional<HttpResponse<String>> previousResponse() {
        return Optional.empty();
    }

    @Override
    public HttpHeaders headers() {
        return HttpHeaders.of(headerMap, (name, value) -> true);
    }

    @Override
    public Optional<SSLSession> sslSession() {
        return Optional.empty();
    }

    @Override
    public URI uri() {
        return request != null ? request.uri() : URI.create("http://localhost/");
    }

    @Override
    public HttpClient.Version version() {
        return HttpClient.Version.HTTP_1_1;
    }
}
