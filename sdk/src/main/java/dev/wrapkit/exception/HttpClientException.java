// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.exception;

/** A request sent without a retry strategy failed in transport, or the sending thread was interrupted. */
public class HttpClientException extends WrapkitException {
    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
