// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.exception;

/**
 * A retry strategy type is declared incorrectly, e.g. a method carries two rule tags or a tagged method has the wrong
 * signature. Raised when the rule registry of the type is built, before any operation runs.
 */
public class RetryConfigurationException extends WrapkitException {
    public RetryConfigurationException(String message) {
        super(message);
    }

    public RetryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
