// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.exception;

/** Root of the unchecked exceptions raised by the library. */
public class WrapkitException extends RuntimeException {
    public WrapkitException(String message, Throwable cause) {
        super(message, cause);
    }

    public WrapkitException(String message) {
        super(message);
    }
}
