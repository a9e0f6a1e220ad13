// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

/** Thrown by a backend that cannot serve a request; transient outages are worth retrying. */
public class ServiceUnavailableException extends RuntimeException {
    private final String serviceName;
    private final boolean transientOutage;

    public ServiceUnavailableException(String serviceName, String message, boolean transientOutage) {
        super(message);
        this.serviceName = serviceName;
        this.transientOutage = transientOutage;
    }

    public String getServiceName() {
        return serviceName;
    }

    public boolean isTransientOutage() {
        return transientOutage;
    }
}
