// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.examples;

import static org.junit.jupiter.api.Assertions.*;

import dev.wrapkit.exception.RetryExhaustedException;
import dev.wrapkit.retry.RetryPolicy;
import dev.wrapkit.testing.RecordingSleeper;
import dev.wrapkit.testing.ScriptedOperation;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CustomRetryStrategyExampleTest {

    private RecordingSleeper sleeper;
    private CustomRetryStrategyExample.InventoryRetryStrategy strategy;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        strategy = new CustomRetryStrategyExample.InventoryRetryStrategy(
                RetryPolicy.of(4, Duration.ofMillis(200)), sleeper);
    }

    private CustomRetryStrategyExample example(ScriptedOperation<InventorySnapshot> backend) {
        return new CustomRetryStrategyExample(warehouse -> backend.call(), strategy);
    }

    @Test
    void inheritsParentRuleAndAddsItsOwn() {
        var registry = strategy.registry();

        assertEquals(1, registry.universalRules().size());
        assertTrue(registry.universalRules().containsKey("retryWhenThrottled"));
        assertTrue(registry.onExceptionRules().containsKey("retryOnTransientOutage"));
        assertTrue(registry.onResultRules().containsKey("retryOnStaleSnapshot"));
    }

    @Test
    void retriesTransientOutageThrottlingAndStaleData() {
        var backend = ScriptedOperation.<InventorySnapshot>create()
                .thenThrow(new ServiceUnavailableException("inventory", "warming up", true))
                .thenThrow(new ThrottledException("quota exceeded"))
                .thenReturn(new InventorySnapshot("w-7", 10, true))
                .thenReturn(new InventorySnapshot("w-7", 12, false));

        var snapshot = example(backend).fetchSnapshot("w-7");

        assertEquals(new InventorySnapshot("w-7", 12, false), snapshot);
        assertEquals(4, backend.getCallCount());
        assertEquals(3, sleeper.getSleepCount());
        assertEquals(Duration.ofMillis(600), sleeper.getTotalSleep());
    }

    @Test
    void permanentOutageIsNotRetried() {
        var backend = ScriptedOperation.<InventorySnapshot>alwaysThrowing(
                new ServiceUnavailableException("inventory", "decommissioned", false));

        var error = assertThrows(RetryExhaustedException.class, () -> example(backend).fetchSnapshot("w-1"));

        assertInstanceOf(ServiceUnavailableException.class, error.getCause());
        assertEquals(1, backend.getCallCount());
        assertEquals(0, sleeper.getSleepCount());
    }

    @Test
    void staleDataUntilTheBoundIsExhausted() {
        var backend = ScriptedOperation.alwaysReturning(new InventorySnapshot("w-2", 3, true));

        var error = assertThrows(RetryExhaustedException.class, () -> example(backend).fetchSnapshot("w-2"));

        assertNull(error.getCause());
        assertEquals(4, error.getAttemptNumber());
        assertEquals(new InventorySnapshot("w-2", 3, true), error.getLastState().result());
        assertEquals(4, backend.getCallCount());
    }

    @Test
    void fallsBackToEmptySnapshot() {
        var backend = ScriptedOperation.<InventorySnapshot>alwaysThrowing(new ThrottledException("quota exceeded"));

        var snapshot = example(backend).fetchSnapshotOrEmpty("w-3");

        assertEquals(new InventorySnapshot("w-3", 0, true), snapshot);
        assertEquals(4, backend.getCallCount());
    }
}
