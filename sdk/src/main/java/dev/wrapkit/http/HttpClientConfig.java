// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import dev.wrapkit.retry.RetryStrategy;
import dev.wrapkit.serde.JacksonSerDes;
import dev.wrapkit.serde.SerDes;
import dev.wrapkit.validation.ParameterValidator;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for {@link RetryingHttpClient}. Built once and immutable afterwards.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * var config = HttpClientConfig.builder()
 *         .withBaseUri(URI.create("https://api.example.com/v1/"))
 *         .withDefaultHeader("Accept", "application/json")
 *         .withTimeout(Duration.ofSeconds(10))
 *         .withRetryStrategy(HttpRetryStrategy.builder()
 *                 .attempts(3)
 *                 .delay(Duration.ofMillis(500))
 *                 .onStatuses(StatusGroup.SERVER_ERROR)
 *                 .build())
 *         .build();
 * }</pre>
 */
public final class HttpClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(HttpClientConfig.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final URI baseUri;
    private final Map<String, String> defaultHeaders;
    private final Duration timeout;
    private final Duration connectTimeout;
    private final HttpClient.Redirect followRedirects;
    private final RetryStrategy retryStrategy;
    private final HttpRequestLogConfig requestLogConfig;
    private final HttpResponseLogConfig responseLogConfig;
    private final SerDes serDes;
    private final HttpTransport transport;
    private final Logger clientLogger;

    private HttpClientConfig(Builder builder) {
        this.baseUri = builder.baseUri;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.connectTimeout = builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.followRedirects = builder.followRedirects != null ? builder.followRedirects : HttpClient.Redirect.NEVER;
        this.retryStrategy = builder.retryStrategy;
        this.requestLogConfig =
                builder.requestLogConfig != null ? builder.requestLogConfig : HttpRequestLogConfig.defaults();
        this.responseLogConfig =
                builder.responseLogConfig != null ? builder.responseLogConfig : HttpResponseLogConfig.defaults();
        this.serDes = builder.serDes != null ? builder.serDes : new JacksonSerDes();
        this.transport = builder.transport != null ? builder.transport : createDefaultTransport();
        this.clientLogger = builder.clientLogger != null
                ? builder.clientLogger
                : LoggerFactory.getLogger(RetryingHttpClient.class);
    }

    /**
     * Creates a configuration with default settings: no base URI, no retries, 5 second timeouts, no redirects.
     *
     * @return HttpClientConfig with default configuration
     */
    public static HttpClientConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the base URI relative paths are resolved against, if any */
    public Optional<URI> getBaseUri() {
        return Optional.ofNullable(baseUri);
    }

    /** @return headers added to every request built by the client */
    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    /** @return the request timeout applied to requests built by the client */
    public Duration getTimeout() {
        return timeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public HttpClient.Redirect getFollowRedirects() {
        return followRedirects;
    }

    /** @return the strategy every request is sent through, if any */
    public Optional<RetryStrategy> getRetryStrategy() {
        return Optional.ofNullable(retryStrategy);
    }

    public HttpRequestLogConfig getRequestLogConfig() {
        return requestLogConfig;
    }

    public HttpResponseLogConfig getResponseLogConfig() {
        return responseLogConfig;
    }

    public SerDes getSerDes() {
        return serDes;
    }

    /** @return the transport every attempt is sent through (never null) */
    public HttpTransport getTransport() {
        return transport;
    }

    /** @return the logger request and response lines are written to */
    public Logger getClientLogger() {
        return clientLogger;
    }

    private HttpTransport createDefaultTransport() {
        logger.debug(
                "Creating default JDK HTTP transport (connectTimeout={}, redirects={})",
                connectTimeout,
                followRedirects);
        return JdkHttpTransport.create(connectTimeout, followRedirects);
    }

    /** Builder for HttpClientConfig. */
    public static final class Builder {
        private URI baseUri;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private Duration timeout;
        private Duration connectTimeout;
        private HttpClient.Redirect followRedirects;
        private RetryStrategy retryStrategy;
        private HttpRequestLogConfig requestLogConfig;
        private HttpResponseLogConfig responseLogConfig;
        private SerDes serDes;
        private HttpTransport transport;
        private Logger clientLogger;

        private Builder() {}

        /**
         * Sets the URI that paths passed to the request helpers are resolved against. A base URI with a path should end
         * with a slash, as required by {@link URI#resolve(String)}.
         *
         * @param baseUri the base URI
         * @return This builder
         */
        public Builder withBaseUri(URI baseUri) {
            this.baseUri = baseUri;
            return this;
        }

        public Builder withDefaultHeader(String name, String value) {
            Objects.requireNonNull(name, "header name cannot be null");
            Objects.requireNonNull(value, "header value cannot be null");
            this.defaultHeaders.put(name, value);
            return this;
        }

        public Builder withDefaultHeaders(Map<String, String> headers) {
            Objects.requireNonNull(headers, "headers cannot be null");
            headers.forEach(this::withDefaultHeader);
            return this;
        }

        /**
         * Sets the request timeout. If not set, defaults to 5 seconds.
         *
         * @param timeout the request timeout
         * @return This builder
         * @throws IllegalArgumentException if the timeout is zero or negative
         */
        public Builder withTimeout(Duration timeout) {
            ParameterValidator.validateOptionalPositiveDuration(timeout, "timeout");
            this.timeout = timeout;
            return this;
        }

        /** Sets the connect timeout of the default transport. Ignored when a transport is set. */
        public Builder withConnectTimeout(Duration connectTimeout) {
            ParameterValidator.validateOptionalPositiveDuration(connectTimeout, "connectTimeout");
            this.connectTimeout = connectTimeout;
            return this;
        }

        /** Sets the redirect policy of the default transport. Ignored when a transport is set. */
        public Builder withFollowRedirects(HttpClient.Redirect followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        /**
         * Sets the strategy every request is sent through. Without one, each request is sent once and transport
         * failures surface as {@link dev.wrapkit.exception.HttpClientException}.
         *
         * @param retryStrategy the retry strategy, or null for none
         * @return This builder
         */
        public Builder withRetryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Builder withRequestLogConfig(HttpRequestLogConfig requestLogConfig) {
            this.requestLogConfig = Objects.requireNonNull(requestLogConfig, "HttpRequestLogConfig cannot be null");
            return this;
        }

        public Builder withResponseLogConfig(HttpResponseLogConfig responseLogConfig) {
            this.responseLogConfig =
                    Objects.requireNonNull(responseLogConfig, "HttpResponseLogConfig cannot be null");
            return this;
        }

        /**
         * Sets a custom SerDes implementation for JSON bodies.
         *
         * @param serDes Custom SerDes instance
         * @return This builder
         * @throws NullPointerException if serDes is null
         */
        public Builder withSerDes(SerDes serDes) {
            this.serDes = Objects.requireNonNull(serDes, "SerDes cannot be null");
            return this;
        }

        /**
         * Sets a custom transport.
         *
         * <p><b>Note:</b> This method is primarily intended for testing with fake transports (e.g., {@code
         * FakeHttpTransport}). When set, the connect timeout and redirect settings are not used.
         *
         * @param transport Custom HttpTransport instance
         * @return This builder
         * @throws NullPointerException if transport is null
         */
        public Builder withTransport(HttpTransport transport) {
            this.transport = Objects.requireNonNull(transport, "HttpTransport cannot be null");
            return this;
        }

        /** Overrides the logger request and response lines are written to. */
        public Builder withClientLogger(Logger clientLogger) {
            this.clientLogger = Objects.requireNonNull(clientLogger, "Logger cannot be null");
            return this;
        }

        public HttpClientConfig build() {
            return new HttpClientConfig(this);
        }
    }
}
