// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.time.Duration;

/** {@link Sleeper} backed by {@link Thread#sleep(long)}; zero durations return immediately. */
public final class DefaultSleeper implements Sleeper {
    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    private DefaultSleeper() {}

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long millis = Math.max(0, duration.toMillis());
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
