// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a strategy method as a retry rule that is consulted only when an attempt threw.
 *
 * <p>The method must be an instance method taking a single {@link Throwable} (or subtype) and returning
 * {@code boolean}. It is never invoked for an attempt that returned normally.
 *
 * <p>{@link #value()} optionally restricts the exceptions the method sees: an exception that is not an instance of one
 * of the listed types does not reach the method and the rule counts as "do not retry" for that attempt. Without a list,
 * the declared parameter type is the filter. Every listed type must be assignable to the parameter type.
 *
 * <pre>{@code
 * @RetryOnException({ConnectException.class, HttpConnectTimeoutException.class})
 * public boolean retryOnConnectionError(IOException error) {
 *     return true;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RetryOnException {
    /** @return the exception types the rule applies to, empty for "the parameter type" */
    Class<? extends Throwable>[] value() default {};
}
