// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

/** A one-argument operation that may throw a checked exception. */
@FunctionalInterface
public interface CheckedFunction<A, T> {
    T apply(A argument) throws Exception;
}
