// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.retry;

import dev.wrapkit.exception.RetryConfigurationException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The retry rules of one strategy type, keyed by name within each {@link RuleKind}.
 *
 * <p>The registry of a type is the registry of its superclass, overlaid with the registries of the interfaces it
 * implements (in declaration order), overlaid with the rules the type declares itself. Overlaying a rule removes any
 * inherited rule of the same name, whatever its kind, so a subtype can replace a parent rule but never ends up with
 * two rules under one name. A subtype method that overrides a tagged method without repeating the tag keeps the
 * inherited rule; the override is what runs.
 *
 * <p>Registries are built once per class and cached; they are immutable.
 */
public final class RuleRegistry {
    private static final RuleRegistry EMPTY = new RuleRegistry(emptyMaps());

    private static final ClassValue<RuleRegistry> REGISTRIES = new ClassValue<>() {
        @Override
        protected RuleRegistry computeValue(Class<?> type) {
            return build(type);
        }
    };

    private final Map<RuleKind, Map<String, RetryRule>> rules;

    private RuleRegistry(Map<RuleKind, LinkedHashMap<String, RetryRule>> rules) {
        var copy = new EnumMap<RuleKind, Map<String, RetryRule>>(RuleKind.class);
        rules.forEach((kind, byName) -> copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
        this.rules = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the registry of a type, building it on first use.
     *
     * @param type the strategy type
     * @return the merged registry of the type
     * @throws RetryConfigurationException if the type or one of its supertypes declares an invalid rule
     */
    public static RuleRegistry of(Class<?> type) {
        return REGISTRIES.get(type);
    }

    /** @return a registry without rules */
    public static RuleRegistry empty() {
        return EMPTY;
    }

    /**
     * Merges inherited registries with a type's own rules.
     *
     * @param parents the registries to inherit from, in resolution order
     * @param own the rules declared by the type itself
     * @return the merged registry
     */
    public static RuleRegistry merge(List<RuleRegistry> parents, List<? extends RetryRule> own) {
        var merged = emptyMaps();
        for (var parent : parents) {
            for (var kind : RuleKind.values()) {
                parent.rules(kind).values().forEach(rule -> overlay(merged, rule));
            }
        }
        own.forEach(rule -> overlay(merged, rule));
        return new RuleRegistry(merged);
    }

    private static RuleRegistry build(Class<?> type) {
        if (type == Object.class) {
            return EMPTY;
        }

        var parents = new ArrayList<RuleRegistry>();
        if (type.getSuperclass() != null) {
            parents.add(of(type.getSuperclass()));
        }
        for (var implemented : type.getInterfaces()) {
            parents.add(of(implemented));
        }

        // declared methods come back in no particular order
        var methods = Arrays.stream(type.getDeclaredMethods())
                .filter(method -> !method.isBridge() && !method.isSynthetic())
                .sorted(Comparator.comparing(Method::getName))
                .toList();

        var own = new ArrayList<MethodRetryRule>();
        var names = new HashSet<String>();
        for (var method : methods) {
            Optional<MethodRetryRule> rule = MethodRetryRule.from(method);
            if (rule.isPresent()) {
                if (!names.add(rule.get().name())) {
                    throw new RetryConfigurationException(String.format(
                            "%s declares more than one retry rule named '%s'", type.getName(), rule.get().name()));
                }
                own.add(rule.get());
            }
        }

        if (parents.stream().allMatch(RuleRegistry::isEmpty) && own.isEmpty()) {
            return EMPTY;
        }
        return merge(parents, own);
    }

    private static void overlay(Map<RuleKind, LinkedHashMap<String, RetryRule>> maps, RetryRule rule) {
        maps.values().forEach(byName -> byName.remove(rule.name()));
        maps.get(rule.kind()).put(rule.name(), rule);
    }

    private static Map<RuleKind, LinkedHashMap<String, RetryRule>> emptyMaps() {
        var maps = new EnumMap<RuleKind, LinkedHashMap<String, RetryRule>>(RuleKind.class);
        for (var kind : RuleKind.values()) {
            maps.put(kind, new LinkedHashMap<>());
        }
        return maps;
    }

    /**
     * @param kind the rule kind
     * @return the rules of that kind by name, in merge order
     */
    public Map<String, RetryRule> rules(RuleKind kind) {
        return rules.get(kind);
    }

    public Map<String, RetryRule> universalRules() {
        return rules(RuleKind.UNIVERSAL);
    }

    public Map<String, RetryRule> onExceptionRules() {
        return rules(RuleKind.ON_EXCEPTION);
    }

    public Map<String, RetryRule> onResultRules() {
        return rules(RuleKind.ON_RESULT);
    }

    /** @return the names of every rule, across kinds */
    public Set<String> ruleNames() {
        var names = new HashSet<String>();
        rules.values().forEach(byName -> names.addAll(byName.keySet()));
        return Collections.unmodifiableSet(names);
    }

    public boolean isEmpty() {
        return rules.values().stream().allMatch(Map::isEmpty);
    }

    public int size() {
        return rules.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public String toString() {
        return "RuleRegistry{universal=" + universalRules().keySet()
                + ", onException=" + onExceptionRules().keySet()
                + ", onResult=" + onResultRules().keySet() + "}";
    }
}
