// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import dev.wrapkit.exception.RetryExhaustedException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for declarative retry strategies.
 *
 * <p>Subclasses declare their retry rules as methods tagged with {@link Retry}, {@link RetryOnException} or {@link
 * RetryOnResult}. Rules are collected once per class, merged with the rules of every supertype, and compiled into a
 * single predicate on first use. A strategy without rules retries on any exception and never on a result.
 *
 * <p>Lifecycle hooks are the {@link RetryHooks} methods; override the ones you need.
 *
 * <pre>{@code
 * class InventoryRetryStrategy extends RetryStrategy {
 *     InventoryRetryStrategy() {
 *         super(3, Duration.ofSeconds(1));
 *     }
 *
 *     @RetryOnException(TimeoutException.class)
 *     public boolean retryOnTimeout(TimeoutException error) {
 *         return true;
 *     }
 *
 *     @RetryOnResult
 *     public boolean retryOnEmpty(List<?> items) {
 *         return items.isEmpty();
 *     }
 * }
 *
 * var items = new InventoryRetryStrategy().retry(inventory::fetch, "warehouse-7");
 * }</pre>
 *
 * <p>Instances hold no per-call state and may be shared between threads.
 */
public class RetryStrategy implements RetryHooks {
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Executor asyncExecutor;
    private final RuleRegistry registry;

    private volatile RetryExecutor executor;

    /** Creates a strategy that runs each operation exactly once. */
    public RetryStrategy() {
        this(RetryPolicy.defaults());
    }

    /**
     * @param attempts maximum number of attempts including the first one; zero means exactly one
     * @param delay fixed wait between attempts
     */
    public RetryStrategy(int attempts, Duration delay) {
        this(RetryPolicy.of(attempts, delay));
    }

    public RetryStrategy(RetryPolicy policy) {
        this(policy, DefaultSleeper.INSTANCE, ForkJoinPool.commonPool());
    }

    /**
     * @param policy attempt bound and delay
     * @param sleeper how the synchronous loop waits between attempts
     * @param asyncExecutor where the asynchronous loop schedules its delayed continuations
     * @throws dev.wrapkit.exception.RetryConfigurationException if the rules of this class are declared incorrectly
     */
    protected RetryStrategy(RetryPolicy policy, Sleeper sleeper, Executor asyncExecutor) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = sleeper != null ? sleeper : DefaultSleeper.INSTANCE;
        this.asyncExecutor = asyncExecutor != null ? asyncExecutor : ForkJoinPool.commonPool();
        this.registry = RuleRegistry.of(getClass());
    }

    public RetryPolicy policy() {
        return policy;
    }

    public int attempts() {
        return policy.attempts();
    }

    public Duration delay() {
        return policy.delay();
    }

    /** @return the merged rules of this strategy's class */
    public RuleRegistry registry() {
        return registry;
    }

    /** @return the rules of this strategy compiled into one predicate, computed on first use */
    public RetryPredicate predicate() {
        return executor().predicate();
    }

    private RetryExecutor executor() {
        var current = executor;
        if (current == null) {
            synchronized (this) {
                current = executor;
                if (current == null) {
                    current = new RetryExecutor(
                            policy, RetryPredicates.compile(registry, this), this, sleeper, asyncExecutor);
                    executor = current;
                }
            }
        }
        return current;
    }

    /**
     * Runs an operation until it succeeds or the strategy gives up.
     *
     * @param operation the operation to retry
     * @return the first accepted result
     * @throws RetryExhaustedException when the strategy gives up
     */
    public <T> T retry(Callable<T> operation) {
        return executor().execute(operation, List.of());
    }

    /**
     * Runs a one-argument operation until it succeeds or the strategy gives up. The same argument is passed to every
     * attempt and is visible to rules and hooks through {@link RetryState#arguments()}.
     */
    public <A, T> T retry(CheckedFunction<A, T> operation, A argument) {
        return executor().execute(() -> operation.apply(argument), arguments(argument));
    }

    /** Runs a two-argument operation until it succeeds or the strategy gives up. */
    public <A, B, T> T retry(CheckedBiFunction<A, B, T> operation, A first, B second) {
        return executor().execute(() -> operation.apply(first, second), arguments(first, second));
    }

    /**
     * Runs an asynchronous operation until it succeeds or the strategy gives up, without blocking between attempts.
     *
     * @param operation supplies a new stage for every attempt
     * @return a future of the first accepted result
     */
    public <T> CompletableFuture<T> retryAsync(Supplier<? extends CompletionStage<T>> operation) {
        return executor().executeAsync(operation, List.of());
    }

    public <A, T> CompletableFuture<T> retryAsync(
            Function<? super A, ? extends CompletionStage<T>> operation, A argument) {
        return executor().executeAsync(() -> operation.apply(argument), arguments(argument));
    }

    public <A, B, T> CompletableFuture<T> retryAsync(
            BiFunction<? super A, ? super B, ? extends CompletionStage<T>> operation, A first, B second) {
        return executor().executeAsync(() -> operation.apply(first, second), arguments(first, second));
    }

    /**
     * Throws the exhaustion error for a final state, keeping the original exception as the cause. Meant to be called
     * from {@link #errorCallback} by strategies that log before giving up.
     *
     * @param state the final state
     * @throws RetryExhaustedException always
     */
    protected void raiseRetryError(RetryState state) {
        throw new RetryExhaustedException(state);
    }

    private static List<Object> arguments(Object... values) {
        return Arrays.asList(values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{attempts=" + policy.attempts() + ", delay=" + policy.delay() + "}";
    }
}
