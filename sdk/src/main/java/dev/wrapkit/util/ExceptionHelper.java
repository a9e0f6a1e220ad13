// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.util;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.CompletionException;

/** Utility class for handling exceptions */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * Throws any exception as if it were unchecked using type erasure. This preserves the original exception type and
     * stack trace.
     *
     * @param exception the exception to throw
     * @param <T> the exception type (erased at runtime)
     * @throws T the exception as an unchecked exception
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void sneakyThrow(Throwable exception) throws T {
        throw (T) exception;
    }

    /**
     * unwrap the exception that is wrapped by CompletionException
     *
     * @param throwable the throwable to unwrap
     * @return the original Throwable that is not a CompletionException
     */
    public static Throwable unwrapCompletableFuture(Throwable throwable) {
        while (throwable instanceof CompletionException && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }
        return throwable;
    }

    /**
     * unwrap the exception thrown by a reflectively invoked method
     *
     * @param exception the exception raised by {@link java.lang.reflect.Method#invoke}
     * @return the exception thrown by the method body itself
     */
    public static Throwable unwrapInvocation(InvocationTargetException exception) {
        return exception.getCause() != null ? exception.getCause() : exception;
    }
}
