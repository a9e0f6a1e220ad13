// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.http;

import java.util.Locale;
import java.util.Optional;

/** Groups of HTTP response status codes that a {@link HttpRetryStrategy} can retry on. */
public enum StatusGroup {
    /** 1xx */
    INFO(100),
    /** 3xx */
    REDIRECT(300),
    /** 4xx */
    CLIENT_ERROR(400),
    /** 5xx */
    SERVER_ERROR(500);

    private final int lowerBound;

    StatusGroup(int lowerBound) {
        this.lowerBound = lowerBound;
    }

    /** @return true if the status code belongs to this group */
    public boolean matches(int statusCode) {
        return statusCode >= lowerBound && statusCode < lowerBound + 100;
    }

    /** @return true for 2xx status codes, which belong to no group */
    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * @param statusCode an HTTP status code
     * @return the group of the status code, or empty for 2xx and out-of-range codes
     */
    public static Optional<StatusGroup> of(int statusCode) {
        for (var group : values()) {
            if (group.matches(statusCode)) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a group from its lowercase name, e.g. {@code "client_error"}.
     *
     * @throws IllegalArgumentException if the name is not a known group
     */
    public static StatusGroup fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("status group name cannot be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown status group: " + name, e);
        }
    }
}
