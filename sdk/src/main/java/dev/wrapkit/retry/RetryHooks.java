// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

/**
 * Lifecycle callbacks of the retry loop. Every hook defaults to doing nothing.
 *
 * <p>{@link #before} and {@link #after} bracket the wait between a retryable attempt and the next one. {@link
 * #errorCallback} runs once when the loop gives up; it may throw its own exception, otherwise the loop throws {@link
 * dev.wrapkit.exception.RetryExhaustedException}.
 */
public interface RetryHooks {

    /** Called with the state of an attempt that is about to be retried, before waiting. */
    default void before(RetryState state) {}

    /** Called with the state of an attempt that is about to be retried, after waiting. */
    default void after(RetryState state) {}

    /** Called with the final state when the loop gives up. */
    default void errorCallback(RetryState state) {}
}
