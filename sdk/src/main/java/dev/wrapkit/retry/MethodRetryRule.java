// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import dev.wrapkit.exception.RetryConfigurationException;
import dev.wrapkit.util.ExceptionHelper;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** A retry rule backed by a tagged strategy method. */
final class MethodRetryRule implements RetryRule {
    private final Method method;
    private final RuleKind kind;
    private final Class<?> parameterType;
    private final List<Class<? extends Throwable>> exceptionTypes;

    private MethodRetryRule(Method method, RuleKind kind, List<Class<? extends Throwable>> exceptionTypes) {
        this.method = method;
        this.kind = kind;
        this.parameterType = method.getParameterTypes()[0];
        this.exceptionTypes = exceptionTypes;
    }

    /**
     * Reads the rule tag of a method.
     *
     * @param method a method declared by a strategy type
     * @return the rule, or empty if the method carries no tag
     * @throws RetryConfigurationException if the method carries more than one tag or has the wrong shape
     */
    static Optional<MethodRetryRule> from(Method method) {
        var kinds = new ArrayList<RuleKind>();
        for (var kind : RuleKind.values()) {
            if (method.isAnnotationPresent(kind.tag())) {
                kinds.add(kind);
            }
        }
        if (kinds.isEmpty()) {
            return Optional.empty();
        }
        if (kinds.size() > 1) {
            throw new RetryConfigurationException(String.format(
                    "method '%s' is already marked for %s and cannot also be marked for %s",
                    describe(method), kinds.get(0).description(), kinds.get(1).description()));
        }

        var kind = kinds.get(0);
        validateShape(method, kind);

        List<Class<? extends Throwable>> exceptionTypes = List.of();
        if (kind == RuleKind.ON_EXCEPTION) {
            exceptionTypes = exceptionTypes(method);
        }

        if (!method.trySetAccessible()) {
            throw new RetryConfigurationException("method '" + describe(method) + "' is not accessible");
        }
        return Optional.of(new MethodRetryRule(method, kind, exceptionTypes));
    }

    private static void validateShape(Method method, RuleKind kind) {
        if (Modifier.isStatic(method.getModifiers())) {
            throw invalid(method, kind, "must not be static");
        }
        var returnType = method.getReturnType();
        if (returnType != boolean.class && returnType != Boolean.class) {
            throw invalid(method, kind, "must return boolean, got " + returnType.getName());
        }
        if (method.getParameterCount() != 1) {
            throw invalid(method, kind, "must take exactly one parameter, got " + method.getParameterCount());
        }

        var parameterType = method.getParameterTypes()[0];
        switch (kind) {
            case UNIVERSAL -> {
                if (!parameterType.isAssignableFrom(RetryState.class)) {
                    throw invalid(method, kind, "must take a RetryState, got " + parameterType.getName());
                }
            }
            case ON_EXCEPTION -> {
                if (!Throwable.class.isAssignableFrom(parameterType)) {
                    throw invalid(method, kind, "must take a Throwable, got " + parameterType.getName());
                }
            }
            case ON_RESULT -> {
                if (parameterType.isPrimitive()) {
                    throw invalid(method, kind, "must take a reference type, got " + parameterType.getName());
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Class<? extends Throwable>> exceptionTypes(Method method) {
        var parameterType = method.getParameterTypes()[0];
        var declared = method.getAnnotation(RetryOnException.class).value();
        if (declared.length == 0) {
            return List.of((Class<? extends Throwable>) parameterType);
        }
        for (var type : declared) {
            if (!parameterType.isAssignableFrom(type)) {
                throw invalid(
                        method,
                        RuleKind.ON_EXCEPTION,
                        "filters on " + type.getName() + " which is not a " + parameterType.getName());
            }
        }
        return List.copyOf(Arrays.asList(declared));
    }

    private static RetryConfigurationException invalid(Method method, RuleKind kind, String reason) {
        return new RetryConfigurationException(
                String.format("method '%s' marked for %s %s", describe(method), kind.description(), reason));
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getName() + "." + method.getName();
    }

    @Override
    public String name() {
        return method.getName();
    }

    @Override
    public RuleKind kind() {
        return kind;
    }

    /** @return the class that declares the backing method */
    Class<?> declaringClass() {
        return method.getDeclaringClass();
    }

    @Override
    public RetryPredicate bind(Object target) {
        return switch (kind) {
            case UNIVERSAL -> state -> invoke(target, state);
            case ON_EXCEPTION -> state -> state.hasException()
                    && matchesException(state.exception())
                    && invoke(target, state.exception());
            case ON_RESULT -> state -> state.hasResult()
                    && (state.result() == null || parameterType.isInstance(state.result()))
                    && invoke(target, state.result());
        };
    }

    private boolean matchesException(Throwable exception) {
        for (var type : exceptionTypes) {
            if (type.isInstance(exception)) {
                return true;
            }
        }
        return false;
    }

    private boolean invoke(Object target, Object argument) {
        try {
            return Boolean.TRUE.equals(method.invoke(target, argument));
        } catch (InvocationTargetException e) {
            // a rule that throws aborts the retry loop with its own exception
            ExceptionHelper.sneakyThrow(ExceptionHelper.unwrapInvocation(e));
            return false;
        } catch (IllegalAccessException e) {
            throw new RetryConfigurationException("method '" + describe(method) + "' is not accessible", e);
        }
    }

    @Override
    public String toString() {
        return "MethodRetryRule{" + kind + " " + describe(method) + "}";
    }
}
