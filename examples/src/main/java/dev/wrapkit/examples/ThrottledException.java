// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

/** Thrown by a backend that rejects a request because the caller exceeded its quota. */
public class ThrottledException extends RuntimeException {
    public ThrottledException(String message) {
        super(message);
    }
}
