// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

/**
 * Selects the fields attached to the "HTTP response received" log line.
 *
 * @param requestName the request name from {@link RequestDetails}
 * @param requestTag the request tag from {@link RequestDetails}
 * @param requestMethod the HTTP method
 * @param requestUrl the full request URL
 * @param statusCode the response status code
 * @param headers the response headers
 * @param body the response body
 * @param elapsedTime the time between sending the request and receiving the response, in seconds
 */
public record HttpResponseLogConfig(
        boolean requestName,
        boolean requestTag,
        boolean requestMethod,
        boolean requestUrl,
        boolean statusCode,
        boolean headers,
        boolean body,
        boolean elapsedTime) {

    /** Default configuration: everything but response headers and body. */
    public static HttpResponseLogConfig defaults() {
        return new HttpResponseLogConfig(true, true, true, true, true, false, false, true);
    }

    /** Configuration that attaches every field, including the response body. */
    public static HttpResponseLogConfig verbose() {
        return new HttpResponseLogConfig(true, true, true, true, true, true, true, true);
    }

    public static HttpResponseLogConfig none() {
        return new HttpResponseLogConfig(false, false, false, false, false, false, false, false);
    }
}
