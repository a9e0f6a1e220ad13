// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a strategy method as a universal retry rule.
 *
 * <p>The method is consulted after every attempt, whether it threw or returned. It must be an instance method taking a
 * single {@link RetryState} and returning {@code boolean}:
 *
 * <pre>{@code
 * @Retry
 * public boolean retryWhileWarmingUp(RetryState state) {
 *     return state.attemptNumber() < 2;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Retry {}
