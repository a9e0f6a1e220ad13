// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

/**
 * A named predicate contributing to the retry decision of a strategy type.
 *
 * <p>Rules are held unbound in a {@link RuleRegistry}, one registry per strategy class, and bound to a strategy
 * instance when its predicate is compiled.
 */
public interface RetryRule {

    /** @return the rule name; a rule declared in a subtype replaces an inherited rule of the same name */
    String name();

    /** @return the kind of outcome this rule is consulted for */
    RuleKind kind();

    /**
     * Binds the rule to a strategy instance.
     *
     * @param target the strategy instance the rule is evaluated against
     * @return a predicate that answers "retry?" for one attempt; it returns false for outcomes outside its kind
     */
    RetryPredicate bind(Object target);
}
