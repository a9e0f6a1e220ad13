// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

/**
 * Selects the fields attached to the "Sending HTTP request" log line.
 *
 * @param name the request name from {@link RequestDetails}
 * @param tag the request tag from {@link RequestDetails}
 * @param method the HTTP method
 * @param url the full request URL
 * @param headers the request headers
 */
public record HttpRequestLogConfig(boolean name, boolean tag, boolean method, boolean url, boolean headers) {

    /** Default configuration: name, tag, method and URL, no headers. */
    public static HttpRequestLogConfig defaults() {
        return new HttpRequestLogConfig(true, true, true, true, false);
    }

    /** Configuration that attaches every field. */
    public static HttpRequestLogConfig verbose() {
        return new HttpRequestLogConfig(true, true, true, true, true);
    }

    /** Configuration that attaches no field; the message itself is still logged. */
    public static HttpRequestLogConfig none() {
        return new HttpRequestLogConfig(false, false, false, false, false);
    }
}
