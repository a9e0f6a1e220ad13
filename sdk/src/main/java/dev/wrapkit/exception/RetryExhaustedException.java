// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.exception;

import dev.wrapkit.retry.RetryState;

/**
 * Terminal failure of a retried operation: either the attempt bound was reached while the rules still asked for a
 * retry, or an attempt threw an exception that no rule considered retryable.
 *
 * <p>When the last attempt threw, that exception is the cause. When the last attempt returned a value that the rules
 * kept rejecting, there is no cause and the value is available through {@link #getLastState()}.
 */
public class RetryExhaustedException extends WrapkitException {
    private final transient RetryState lastState;

    public RetryExhaustedException(RetryState lastState) {
        super(buildMessage(lastState), lastState.hasException() ? lastState.exception() : null);
        this.lastState = lastState;
    }

    private static String buildMessage(RetryState state) {
        if (state.hasException()) {
            var exception = state.exception();
            return String.format(
                    "Retry attempts exhausted after attempt %d: %s: %s",
                    state.attemptNumber(), exception.getClass().getName(), exception.getMessage());
        }
        return String.format(
                "Retry attempts exhausted after attempt %d with result: %s", state.attemptNumber(), state.result());
    }

    public RetryState getLastState() {
        return lastState;
    }

    public int getAttemptNumber() {
        return lastState.attemptNumber();
    }
}
