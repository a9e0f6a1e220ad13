// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import dev.wrapkit.validation.ParameterValidator;
import java.time.Duration;

/**
 * Attempt bound and fixed delay of a retry loop.
 *
 * <p>{@code attempts} is the maximum number of attempts including the first one. Zero is accepted and behaves like
 * one: the operation runs exactly once and the loop never waits.
 *
 * @param attempts maximum number of attempts, zero or greater
 * @param delay fixed wait between attempts, zero or greater; null means zero
 */
public record RetryPolicy(int attempts, Duration delay) {

    public RetryPolicy {
        delay = delay != null ? delay : Duration.ZERO;
        ParameterValidator.validateNonNegativeInteger(attempts, "attempts");
        ParameterValidator.validateNonNegativeDuration(delay, "delay");
    }

    /** @return a policy with no retries and no delay */
    public static RetryPolicy defaults() {
        return new RetryPolicy(0, Duration.ZERO);
    }

    public static RetryPolicy of(int attempts, Duration delay) {
        return new RetryPolicy(attempts, delay);
    }

    /** @return the number of attempts the loop actually allows, never less than one */
    public int effectiveAttempts() {
        return Math.max(attempts, 1);
    }
}
