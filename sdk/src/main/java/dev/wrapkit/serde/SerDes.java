// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.serde;

/** Converts request and response bodies to and from their string form. */
public interface SerDes {

    /** @return the serialized value, or null for a null value */
    String serialize(Object value);

    /** @return the deserialized value, or null for null or empty data */
    <T> T deserialize(String data, Class<T> type);

    /** @return the media type sent as {@code Content-Type} with serialized bodies */
    default String contentType() {
        return "application/json";
    }
}
