// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import dev.wrapkit.exception.RetryExhaustedException;
import dev.wrapkit.exception.RetryInterruptedException;
import dev.wrapkit.util.ExceptionHelper;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation under a {@link RetryPolicy} and a {@link RetryPredicate} until it succeeds or the loop gives up.
 *
 * <p>After each attempt the predicate decides:
 *
 * <ul>
 *   <li>no retry and the attempt returned: the result is returned
 *   <li>retry and the attempt bound is not reached: {@code before}, wait the fixed delay, {@code after}, next attempt
 *   <li>retry at the attempt bound, or no retry for an attempt that threw: {@code errorCallback}, then {@link
 *       RetryExhaustedException} unless the callback threw first
 * </ul>
 *
 * <p>The synchronous and asynchronous loops share that decision and differ only in how they wait: {@link #execute}
 * blocks the calling thread through a {@link Sleeper}, {@link #executeAsync} schedules the next attempt on a delayed
 * executor and never blocks. In both, an {@link Error} is never treated as an attempt outcome.
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    enum Decision {
        COMPLETE,
        RETRY,
        STOP
    }

    private final RetryPolicy policy;
    private final RetryPredicate predicate;
    private final RetryHooks hooks;
    private final Sleeper sleeper;
    private final Executor asyncExecutor;

    public RetryExecutor(
            RetryPolicy policy, RetryPredicate predicate, RetryHooks hooks, Sleeper sleeper, Executor asyncExecutor) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.hooks = hooks != null ? hooks : new RetryHooks() {};
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryPredicate predicate() {
        return predicate;
    }

    /**
     * Runs the operation on the calling thread until it succeeds or the loop gives up.
     *
     * @param operation the operation, invoked once per attempt
     * @param arguments the arguments the operation closes over, exposed to rules and hooks
     * @return the first result the predicate accepts
     * @throws RetryExhaustedException when the loop gives up and the error callback did not throw
     * @throws RetryInterruptedException when the thread is interrupted during an attempt or a wait
     */
    @SuppressWarnings("unchecked")
    public <T> T execute(Callable<T> operation, List<Object> arguments) {
        for (int attemptNumber = 1; ; attemptNumber++) {
            var state = attempt(operation, attemptNumber, arguments);
            switch (decide(state)) {
                case COMPLETE -> {
                    return (T) state.result();
                }
                case RETRY -> {
                    hooks.before(state);
                    sleep(state);
                    hooks.after(state);
                }
                case STOP -> throw exhaust(state);
            }
        }
    }

    /**
     * Runs an asynchronous operation until it succeeds or the loop gives up. No thread is blocked while waiting
     * between attempts.
     *
     * @param operation supplies the stage of one attempt; it is invoked again for every attempt
     * @param arguments the arguments the operation closes over, exposed to rules and hooks
     * @return a future completed with the first result the predicate accepts, or exceptionally with {@link
     *     RetryExhaustedException} or the exception thrown by the error callback
     */
    public <T> CompletableFuture<T> executeAsync(
            Supplier<? extends CompletionStage<T>> operation, List<Object> arguments) {
        return attemptAsync(operation, 1, arguments);
    }

    Decision decide(RetryState state) {
        var retry = predicate.test(state);
        if (!retry) {
            if (state.hasResult()) {
                logger.debug("Attempt {} succeeded", state.attemptNumber());
                return Decision.COMPLETE;
            }
            logger.debug(
                    "Attempt {} failed with non-retryable {}",
                    state.attemptNumber(),
                    state.exception().getClass().getName());
            return Decision.STOP;
        }
        if (state.attemptNumber() >= policy.effectiveAttempts()) {
            logger.debug("Attempt {} is retryable but the attempt bound is reached", state.attemptNumber());
            return Decision.STOP;
        }
        logger.debug(
                "Attempt {}/{} is retryable, next attempt in {}",
                state.attemptNumber(),
                policy.effectiveAttempts(),
                policy.delay());
        return Decision.RETRY;
    }

    private <T> RetryState attempt(Callable<T> operation, int attemptNumber, List<Object> arguments) {
        try {
            return RetryState.ofResult(attemptNumber, arguments, operation.call());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(RetryState.ofException(attemptNumber, arguments, e), e);
        } catch (Exception e) {
            return RetryState.ofException(attemptNumber, arguments, e);
        }
    }

    private void sleep(RetryState state) {
        try {
            sleeper.sleep(policy.delay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(state, e);
        }
    }

    private RetryExhaustedException exhaust(RetryState state) {
        hooks.errorCallback(state);
        return new RetryExhaustedException(state);
    }

    private <T> CompletableFuture<T> attemptAsync(
            Supplier<? extends CompletionStage<T>> operation, int attemptNumber, List<Object> arguments) {
        return invokeAsync(operation)
                .handle((result, error) -> {
                    if (error == null) {
                        return RetryState.ofResult(attemptNumber, arguments, result);
                    }
                    var cause = ExceptionHelper.unwrapCompletableFuture(error);
                    if (cause instanceof Error) {
                        // not an attempt outcome; fails the returned future without a decision
                        throw (Error) cause;
                    }
                    return RetryState.ofException(attemptNumber, arguments, cause);
                })
                .thenCompose(state -> next(operation, state));
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> next(Supplier<? extends CompletionStage<T>> operation, RetryState state) {
        return switch (decide(state)) {
            case COMPLETE -> CompletableFuture.completedFuture((T) state.result());
            case RETRY -> {
                hooks.before(state);
                var delayed = policy.delay().isZero()
                        ? asyncExecutor
                        : CompletableFuture.delayedExecutor(
                                policy.delay().toNanos(), TimeUnit.NANOSECONDS, asyncExecutor);
                yield CompletableFuture.runAsync(() -> hooks.after(state), delayed)
                        .thenCompose(ignored -> attemptAsync(operation, state.attemptNumber() + 1, state.arguments()));
            }
            case STOP -> {
                try {
                    yield CompletableFuture.failedFuture(exhaust(state));
                } catch (RuntimeException e) {
                    yield CompletableFuture.failedFuture(e);
                }
            }
        };
    }

    private static <T> CompletableFuture<T> invokeAsync(Supplier<? extends CompletionStage<T>> operation) {
        try {
            var stage = operation.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("operation returned a null stage"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
