// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import dev.wrapkit.retry.RetryOnException;
import dev.wrapkit.retry.RetryOnResult;
import dev.wrapkit.retry.RetryPolicy;
import dev.wrapkit.retry.RetryState;
import dev.wrapkit.retry.RetryStrategy;
import dev.wrapkit.retry.Sleeper;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.ProtocolException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry strategy for requests sent through the JDK HTTP client.
 *
 * <p>Connection failures are always retried. Timeouts, other network errors and protocol errors are retried only when
 * enabled. Exceptions are classified by the first matching type in their cause chain, since the JDK client wraps most
 * transport failures of a synchronous send in a plain {@link IOException}. Responses are retried only when their
 * status falls in one of the configured {@link StatusGroup}s; successful (2xx) responses never are.
 *
 * <p>The hooks log against the request being retried: the first {@link HttpRequest} and the first {@link
 * RequestDetails} among the operation arguments.
 *
 * <pre>{@code
 * var strategy = HttpRetryStrategy.builder()
 *         .attempts(3)
 *         .delay(Duration.ofSeconds(1))
 *         .onTimeouts(true)
 *         .onStatuses(StatusGroup.SERVER_ERROR)
 *         .build();
 * }</pre>
 */
public class HttpRetryStrategy extends RetryStrategy {
    static final List<Class<? extends Throwable>> CONNECTION_ERRORS = List.of(
            ConnectException.class,
            HttpConnectTimeoutException.class,
            UnknownHostException.class,
            NoRouteToHostException.class);
    static final List<Class<? extends Throwable>> TIMEOUT_ERRORS =
            List.of(HttpTimeoutException.class, SocketTimeoutException.class, TimeoutException.class);
    static final List<Class<? extends Throwable>> NETWORK_ERRORS =
            List.of(SocketException.class, ClosedChannelException.class);
    static final List<Class<? extends Throwable>> PROTOCOL_ERRORS =
            List.of(ProtocolException.class, EOFException.class, SSLProtocolException.class);

    private static final int MAX_CAUSE_DEPTH = 16;

    private final boolean onTimeouts;
    private final boolean onNetworkErrors;
    private final boolean onProtocolErrors;
    private final Set<StatusGroup> onStatuses;
    private final Logger logger;

    /** Creates a strategy that runs each request once and retries nothing but connection failures. */
    public HttpRetryStrategy() {
        this(builder());
    }

    protected HttpRetryStrategy(Builder builder) {
        super(RetryPolicy.of(builder.attempts, builder.delay), builder.sleeper, builder.asyncExecutor);
        this.onTimeouts = builder.onTimeouts;
        this.onNetworkErrors = builder.onNetworkErrors;
        this.onProtocolErrors = builder.onProtocolErrors;
        this.onStatuses = builder.onStatuses.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.onStatuses));
        this.logger = builder.logger != null ? builder.logger : LoggerFactory.getLogger(HttpRetryStrategy.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    @RetryOnException(IOException.class)
    public boolean retryOnConnectionError(IOException error) {
        return findCause(error, CONNECTION_ERRORS)
                .map(cause -> logReason("Marking HTTP request for retry due to connection error: {} - {}", cause))
                .orElse(false);
    }

    @RetryOnException({IOException.class, TimeoutException.class})
    public boolean retryOnTimeoutError(Exception error) {
        if (!onTimeouts) {
            return false;
        }
        return findCause(error, TIMEOUT_ERRORS)
                .map(cause -> logReason("Marking HTTP request for retry due to timeout error: {} - {}", cause))
                .orElse(false);
    }

    @RetryOnException(IOException.class)
    public boolean retryOnNetworkError(IOException error) {
        if (!onNetworkErrors) {
            return false;
        }
        return findCause(error, NETWORK_ERRORS)
                .or(() -> unclassified(error))
                .map(cause -> logReason("Marking HTTP request for retry due to network error: {} - {}", cause))
                .orElse(false);
    }

    @RetryOnException(IOException.class)
    public boolean retryOnProtocolError(IOException error) {
        if (!onProtocolErrors) {
            return false;
        }
        return findCause(error, PROTOCOL_ERRORS)
                .or(() -> unclassified(error))
                .map(cause -> logReason("Marking HTTP request for retry due to protocol error: {} - {}", cause))
                .orElse(false);
    }

    @RetryOnResult
    public boolean retryOnStatus(HttpResponse<?> response) {
        var statusCode = response.statusCode();
        if (StatusGroup.isSuccess(statusCode) || onStatuses.isEmpty()) {
            return false;
        }
        for (var group : onStatuses) {
            if (group.matches(statusCode)) {
                logger.info("Marking HTTP request for retry due to status code: {}", statusCode);
                return true;
            }
        }
        return false;
    }

    @Override
    public void before(RetryState state) {
        logger.info(
                "Retrying HTTP request [{}] ({}/{}): {}",
                label(state),
                state.attemptNumber() + 1,
                policy().effectiveAttempts(),
                target(state));
    }

    @Override
    public void errorCallback(RetryState state) {
        logger.error(
                "All retry attempts ({}/{}) failed for HTTP request [{}]: {}",
                state.attemptNumber(),
                policy().effectiveAttempts(),
                label(state),
                target(state));
        raiseRetryError(state);
    }

    private boolean logReason(String message, Throwable cause) {
        logger.info(message, cause.getClass().getSimpleName(), cause.getMessage());
        return true;
    }

    /**
     * Finds the first exception in the cause chain that is an instance of one of the given types. The JDK client
     * rethrows most transport failures of a synchronous send as a plain {@link IOException} around the original one.
     */
    static Optional<Throwable> findCause(Throwable error, List<Class<? extends Throwable>> types) {
        var current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (var type : types) {
                if (type.isInstance(current)) {
                    return Optional.of(current);
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * A plain {@link IOException} is how the JDK client reports a connection the server closed or reset mid-exchange,
     * e.g. "HTTP/1.1 header parser received no bytes" around an {@link EOFException} or a {@link SocketException}. The
     * client cannot tell a dropped connection from a truncated response, so either the network rule or the protocol
     * rule can retry it. Connection failures and timeouts keep their own rules.
     */
    private static Optional<Throwable> unclassified(IOException error) {
        if (error.getClass() != IOException.class
                || findCause(error, CONNECTION_ERRORS).isPresent()
                || findCause(error, TIMEOUT_ERRORS).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(error);
    }

    private static String label(RetryState state) {
        return state.findArgument(RequestDetails.class)
                .orElseGet(RequestDetails::unnamed)
                .label();
    }

    private static String target(RetryState state) {
        return state.findArgument(HttpRequest.class)
                .map(request -> request.method() + " " + request.uri())
                .orElse("<unknown request>");
    }

    public boolean isOnTimeouts() {
        return onTimeouts;
    }

    public boolean isOnNetworkErrors() {
        return onNetworkErrors;
    }

    public boolean isOnProtocolErrors() {
        return onProtocolErrors;
    }

    public Set<StatusGroup> getOnStatuses() {
        return onStatuses;
    }

    /** Builder for {@link HttpRetryStrategy} and its subclasses. */
    public static class Builder {
        private int attempts;
        private Duration delay = Duration.ZERO;
        private boolean onTimeouts;
        private boolean onNetworkErrors;
        private boolean onProtocolErrors;
        private final Set<StatusGroup> onStatuses = EnumSet.noneOf(StatusGroup.class);
        private Sleeper sleeper;
        private Executor asyncExecutor;
        private Logger logger;

        protected Builder() {}

        /**
         * @param attempts maximum number of attempts including the first one; zero means exactly one
         * @return this builder for method chaining
         */
        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        /**
         * @param delay fixed wait between attempts
         * @return this builder for method chaining
         */
        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        /** Retry on request, connect and socket timeouts. */
        public Builder onTimeouts(boolean onTimeouts) {
            this.onTimeouts = onTimeouts;
            return this;
        }

        /** Retry on socket-level errors such as resets and closed channels. */
        public Builder onNetworkErrors(boolean onNetworkErrors) {
            this.onNetworkErrors = onNetworkErrors;
            return this;
        }

        /** Retry on malformed or truncated responses. */
        public Builder onProtocolErrors(boolean onProtocolErrors) {
            this.onProtocolErrors = onProtocolErrors;
            return this;
        }

        /**
         * Sets the status groups whose responses are retried, replacing any previous set.
         *
         * @param groups the groups to retry on
         * @return this builder for method chaining
         */
        public Builder onStatuses(StatusGroup... groups) {
            return onStatuses(Arrays.asList(groups));
        }

        public Builder onStatuses(Iterable<StatusGroup> groups) {
            this.onStatuses.clear();
            if (groups != null) {
                groups.forEach(this.onStatuses::add);
            }
            return this;
        }

        /**
         * Sets the status groups from their lowercase names, e.g. {@code "server_error"}.
         *
         * @throws IllegalArgumentException if a name is not a known group
         */
        public Builder onStatusNames(String... names) {
            this.onStatuses.clear();
            for (var name : names) {
                this.onStatuses.add(StatusGroup.fromName(name));
            }
            return this;
        }

        /** Overrides how the synchronous loop waits between attempts. */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /** Overrides where the asynchronous loop schedules delayed attempts. */
        public Builder asyncExecutor(Executor asyncExecutor) {
            this.asyncExecutor = asyncExecutor;
            return this;
        }

        /** Overrides the logger retry reasons and hook messages are written to. */
        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public HttpRetryStrategy build() {
            return new HttpRetryStrategy(this);
        }
    }
}
