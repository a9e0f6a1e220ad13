// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.lang.annotation.Annotation;

/** The three kinds of retry rule a strategy method can be tagged with. */
public enum RuleKind {
    /** Consulted on every attempt with the full {@link RetryState}. See {@link Retry}. */
    UNIVERSAL(Retry.class, "retry"),

    /** Consulted only when the attempt threw, with the exception. See {@link RetryOnException}. */
    ON_EXCEPTION(RetryOnException.class, "retry on exception"),

    /** Consulted only when the attempt returned, with the result. See {@link RetryOnResult}. */
    ON_RESULT(RetryOnResult.class, "retry on result");

    private final Class<? extends Annotation> tag;
    private final String description;

    RuleKind(Class<? extends Annotation> tag, String description) {
        this.tag = tag;
        this.description = description;
    }

    /** @return the annotation that marks a method as a rule of this kind */
    public Class<? extends Annotation> tag() {
        return tag;
    }

    /** @return a human readable name, used in configuration error messages */
    public String description() {
        return description;
    }
}
