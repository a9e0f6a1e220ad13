// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.exception;

/** Exception thrown when serialization or deserialization fails. */
public class SerDesException extends WrapkitException {
    public SerDesException(String message, Throwable cause) {
        super(message, cause);
    }

    public SerDesException(String message) {
        super(message);
    }
}
