// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import java.util.ArrayList;
import java.util.List;

/** Compiles rule registries into retry predicates, and holds the common presets. */
public final class RetryPredicates {

    /** Retries any attempt that threw and never an attempt that returned. Used when a registry has no rules. */
    public static final RetryPredicate ANY_EXCEPTION = RetryState::hasException;

    /** Never retries. */
    public static final RetryPredicate NEVER = state -> false;

    private RetryPredicates() {}

    /**
     * Compiles the rules of a registry, bound to one strategy instance, into a single predicate.
     *
     * <p>The predicate is the OR of every rule: universal rules first, then exception rules, then result rules, each
     * kind in registry order. Evaluation stops at the first rule that asks for a retry. An empty registry compiles to
     * {@link #ANY_EXCEPTION}.
     *
     * @param registry the merged rules of the strategy type
     * @param target the strategy instance the rules are bound to
     * @return the compiled predicate
     */
    public static RetryPredicate compile(RuleRegistry registry, Object target) {
        if (registry.isEmpty()) {
            return ANY_EXCEPTION;
        }

        var bound = new ArrayList<RetryPredicate>(registry.size());
        for (var kind : RuleKind.values()) {
            for (var rule : registry.rules(kind).values()) {
                bound.add(rule.bind(target));
            }
        }
        return new CompiledPredicate(List.copyOf(bound));
    }

    private record CompiledPredicate(List<RetryPredicate> predicates) implements RetryPredicate {
        @Override
        public boolean test(RetryState state) {
            for (var predicate : predicates) {
                if (predicate.test(state)) {
                    return true;
                }
            }
            return false;
        }
    }
}
