// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

/** A two-argument operation that may throw a checked exception. */
@FunctionalInterface
public interface CheckedBiFunction<A, B, T> {
    T apply(A first, B second) throws Exception;
}
