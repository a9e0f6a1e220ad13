// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

/** Answers whether the attempt described by a {@link RetryState} should be retried. */
@FunctionalInterface
public interface RetryPredicate {

    boolean test(RetryState state);

    /**
     * @param other the predicate to combine with
     * @return a predicate that is true when this or {@code other} is true, short-circuiting on this
     */
    default RetryPredicate or(RetryPredicate other) {
        return state -> test(state) || other.test(state);
    }
}
