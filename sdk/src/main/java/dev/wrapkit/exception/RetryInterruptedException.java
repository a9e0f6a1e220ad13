// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.exception;

import dev.wrapkit.retry.RetryState;

/**
 * The thread running a synchronous retry loop was interrupted, either while waiting between attempts or inside the
 * operation itself. The interrupt flag of the thread is restored before this is thrown.
 */
public class RetryInterruptedException extends WrapkitException {
    private final transient RetryState lastState;

    public RetryInterruptedException(RetryState lastState, InterruptedException cause) {
        super("Retry interrupted after attempt " + lastState.attemptNumber(), cause);
        this.lastState = lastState;
    }

    public RetryState getLastState() {
        return lastState;
    }
}
