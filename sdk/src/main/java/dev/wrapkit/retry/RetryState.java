// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of one attempt of a retried operation.
 *
 * <p>Exactly one of {@link #hasResult()} and {@link #hasException()} is true. The arguments are the ones the operation
 * was invoked with; they are the same for every attempt of one call.
 */
public final class RetryState {
    private final int attemptNumber;
    private final List<Object> arguments;
    private final Object result;
    private final Throwable exception;

    private RetryState(int attemptNumber, List<Object> arguments, Object result, Throwable exception) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive, got: " + attemptNumber);
        }
        this.attemptNumber = attemptNumber;
        // arguments may legitimately contain nulls, so List.copyOf is not an option
        this.arguments = arguments == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
        this.result = result;
        this.exception = exception;
    }

    /**
     * Creates the state of an attempt that returned normally.
     *
     * @param attemptNumber the 1-based attempt number
     * @param arguments the arguments the operation was invoked with
     * @param result the returned value, may be null
     * @return a state whose outcome is {@code result}
     */
    public static RetryState ofResult(int attemptNumber, List<Object> arguments, Object result) {
        return new RetryState(attemptNumber, arguments, result, null);
    }

    /**
     * Creates the state of an attempt that threw.
     *
     * @param attemptNumber the 1-based attempt number
     * @param arguments the arguments the operation was invoked with
     * @param exception the captured exception
     * @return a state whose outcome is {@code exception}
     */
    public static RetryState ofException(int attemptNumber, List<Object> arguments, Throwable exception) {
        return new RetryState(attemptNumber, arguments, null, Objects.requireNonNull(exception, "exception"));
    }

    /** @return the 1-based number of this attempt */
    public int attemptNumber() {
        return attemptNumber;
    }

    /** @return the unmodifiable arguments passed to the operation */
    public List<Object> arguments() {
        return arguments;
    }

    /**
     * Finds the first argument that is an instance of the given type.
     *
     * @param type the argument type to look for
     * @return the first matching argument, or empty if there is none
     */
    public <A> Optional<A> findArgument(Class<A> type) {
        return arguments.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    public boolean hasException() {
        return exception != null;
    }

    public boolean hasResult() {
        return exception == null;
    }

    /**
     * @return the value returned by the attempt
     * @throws IllegalStateException if the attempt threw
     */
    public Object result() {
        if (hasException()) {
            throw new IllegalStateException("attempt " + attemptNumber + " threw an exception and has no result");
        }
        return result;
    }

    /**
     * @return the exception thrown by the attempt
     * @throws IllegalStateException if the attempt returned normally
     */
    public Throwable exception() {
        if (!hasException()) {
            throw new IllegalStateException("attempt " + attemptNumber + " returned normally and has no exception");
        }
        return exception;
    }

    @Override
    public String toString() {
        return hasException()
                ? String.format("RetryState{attempt=%d, exception=%s}", attemptNumber, exception)
                : String.format("RetryState{attempt=%d, result=%s}", attemptNumber, result);
    }
}
