// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a strategy method as a retry rule that is consulted only when an attempt returned normally.
 *
 * <p>The method must be an instance method taking a single reference-typed parameter and returning {@code boolean}. A
 * result that is not an instance of the parameter type does not reach the method and counts as "do not retry"; a
 * {@code null} result is passed through.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RetryOnResult {}
