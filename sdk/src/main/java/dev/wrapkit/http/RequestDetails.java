// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

/**
 * Identifies a request in log lines and retry messages.
 *
 * <p>The label is {@code NAME-TAG}, {@code NAME} when there is no tag, and {@code UNNAMED-TAG} or {@code UNNAMED}
 * when there is no name.
 *
 * @param name logical request name, e.g. {@code GET_ORDER}; may be null
 * @param tag free-form qualifier, e.g. a supplier code; may be null
 * @param label the display label; computed from name and tag when null
 */
public record RequestDetails(String name, String tag, String label) {
    static final String UNNAMED = "UNNAMED";

    public RequestDetails {
        if (label == null) {
            var prefix = name != null && !name.isEmpty() ? name : UNNAMED;
            label = tag != null && !tag.isEmpty() ? prefix + "-" + tag : prefix;
        }
    }

    public static RequestDetails of(String name, String tag) {
        return new RequestDetails(name, tag, null);
    }

    public static RequestDetails named(String name) {
        return new RequestDetails(name, null, null);
    }

    public static RequestDetails unnamed() {
        return new RequestDetails(null, null, null);
    }
}
