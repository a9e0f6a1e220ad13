// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

import dev.wrapkit.exception.RetryExhaustedException;
import dev.wrapkit.retry.Retry;
import dev.wrapkit.retry.RetryOnException;
import dev.wrapkit.retry.RetryOnResult;
import dev.wrapkit.retry.RetryPolicy;
import dev.wrapkit.retry.RetryState;
import dev.wrapkit.retry.RetryStrategy;
import dev.wrapkit.retry.Sleeper;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example demonstrating a hierarchy of declarative retry strategies.
 *
 * <p>{@link BackendRetryStrategy} retries transient outages of any backend and logs from every hook. {@link
 * InventoryRetryStrategy} inherits that rule and adds two of its own:
 *
 * <ul>
 *   <li>a universal rule that retries throttled calls
 *   <li>a result rule that retries stale snapshots
 * </ul>
 *
 * <p>The rules are plain methods; the strategy collects them from the class hierarchy when it is first used.
 */
public class CustomRetryStrategyExample {

    private static final Logger logger = LoggerFactory.getLogger(CustomRetryStrategyExample.class);

    /** The inventory backend being called. */
    @FunctionalInterface
    public interface InventoryBackend {
        InventorySnapshot fetch(String warehouse) throws Exception;
    }

    /** Retries transient backend outages and logs each step of the retry loop. */
    public static class BackendRetryStrategy extends RetryStrategy {
        private static final Logger strategyLogger = LoggerFactory.getLogger(BackendRetryStrategy.class);

        public BackendRetryStrategy(int attempts, Duration delay) {
            super(attempts, delay);
        }

        protected BackendRetryStrategy(RetryPolicy policy, Sleeper sleeper, Executor asyncExecutor) {
            super(policy, sleeper, asyncExecutor);
        }

        @RetryOnException(ServiceUnavailableException.class)
        public boolean retryOnTransientOutage(ServiceUnavailableException error) {
            return error.isTransientOutage();
        }

        @Override
        public void before(RetryState state) {
            strategyLogger.info("Attempt {} failed, retrying in {}", state.attemptNumber(), delay());
        }

        @Override
        public void after(RetryState state) {
            strategyLogger.debug("Starting attempt {}", state.attemptNumber() + 1);
        }

        @Override
        public void errorCallback(RetryState state) {
            strategyLogger.warn("Giving up after attempt {}", state.attemptNumber());
        }
    }

    /** Adds throttling and stale-snapshot rules on top of {@link BackendRetryStrategy}. */
    public static class InventoryRetryStrategy extends BackendRetryStrategy {

        public InventoryRetryStrategy() {
            super(4, Duration.ofMillis(200));
        }

        public InventoryRetryStrategy(RetryPolicy policy, Sleeper sleeper) {
            super(policy, sleeper, null);
        }

        @Retry
        public boolean retryWhenThrottled(RetryState state) {
            return state.hasException() && state.exception() instanceof ThrottledException;
        }

        @RetryOnResult
        public boolean retryOnStaleSnapshot(InventorySnapshot snapshot) {
            return snapshot != null && snapshot.stale();
        }
    }

    private final InventoryBackend backend;
    private final RetryStrategy strategy;

    public CustomRetryStrategyExample(InventoryBackend backend) {
        this(backend, new InventoryRetryStrategy());
    }

    public CustomRetryStrategyExample(InventoryBackend backend, RetryStrategy strategy) {
        this.backend = backend;
        this.strategy = strategy;
    }

    /**
     * Fetches a fresh snapshot of a warehouse.
     *
     * @throws RetryExhaustedException if the backend keeps failing or keeps returning stale data
     */
    public InventorySnapshot fetchSnapshot(String warehouse) {
        var snapshot = strategy.retry(backend::fetch, warehouse);
        logger.info("Warehouse {} has {} items available", snapshot.warehouse(), snapshot.available());
        return snapshot;
    }

    /** Fetches a snapshot, falling back to an empty one when the backend cannot be reached. */
    public InventorySnapshot fetchSnapshotOrEmpty(String warehouse) {
        try {
            return fetchSnapshot(warehouse);
        } catch (RetryExhaustedException e) {
            logger.warn("Inventory unavailable for {}: {}", warehouse, e.getMessage());
            return new InventorySnapshot(warehouse, 0, true);
        }
    }

    public static void main(String[] args) {
        var calls = new int[1];
        var example = new CustomRetryStrategyExample(warehouse -> {
            calls[0]++;
            if (calls[0] == 1) {
                throw new ServiceUnavailableException("inventory", "warming up", true);
            }
            return new InventorySnapshot(warehouse, 42, calls[0] < 3);
        });
        example.fetchSnapshot(args.length > 0 ? args[0] : "warehouse-7");
    }
}
