package com.simrelay.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup structure over the variable schema.
 * <p>
 * Group and variable names are matched case-insensitively with spaces treated as
 * underscores. The variable-to-group reverse index is built once at construction.
 */
public final class SchemaIndex {

    public static final String UNKNOWN = "Unknown";

    private final Map<String, SchemaGroup> groupsByKey;
    private final Map<String, String> groupByVariable;
    private final Map<String, List<EnumRule>> standaloneRules;

    /**
     * @param groups          declared groups; a variable may appear in at most one of them
     * @param standaloneRules translation rules for variables declared outside any group,
     *                        keyed by variable name
     * @throws SchemaLoadException if two groups normalize to the same name or share a variable
     */
    public SchemaIndex(List<SchemaGroup> groups, Map<String, List<EnumRule>> standaloneRules) {
        var byKey = new HashMap<String, SchemaGroup>();
        var reverse = new HashMap<String, String>();
        for (SchemaGroup group : groups) {
            if (byKey.putIfAbsent(normalize(group.name()), group) != null) {
                throw new SchemaLoadException("Duplicate schema group: " + group.name());
            }
            for (String variable : group.variables()) {
                String previous = reverse.putIfAbsent(normalize(variable), group.name());
                if (previous != null) {
                    throw new SchemaLoadException("Variable " + variable + " is declared in both "
                            + previous + " and " + group.name());
                }
            }
        }
        var rules = new HashMap<String, List<EnumRule>>();
        standaloneRules.forEach((variable, list) -> rules.put(normalize(variable), List.copyOf(list)));

        this.groupsByKey = Map.copyOf(byKey);
        this.groupByVariable = Map.copyOf(reverse);
        this.standaloneRules = Map.copyOf(rules);
    }

    public static SchemaIndex empty() {
        return new SchemaIndex(List.of(), Map.of());
    }

    /** Upper-cases and replaces spaces with underscores. */
    public static String normalize(String name) {
        return name.trim().replace(' ', '_').toUpperCase(Locale.ROOT);
    }

    public Optional<Set<String>> resolveGroup(String name) {
        return Optional.ofNullable(groupsByKey.get(normalize(name))).map(SchemaGroup::variables);
    }

    public Optional<String> groupOf(String variable) {
        return Optional.ofNullable(groupByVariable.get(normalize(variable)));
    }

    /** Declared group names, sorted. */
    public List<String> groupNames() {
        var names = new ArrayList<String>();
        groupsByKey.values().forEach(g -> names.add(g.name()));
        names.sort(String::compareTo);
        return names;
    }

    public int groupCount() {
        return groupsByKey.size();
    }

    /** True when no group and no standalone variable was declared. */
    public boolean isEmpty() {
        return groupsByKey.isEmpty() && standaloneRules.isEmpty();
    }

    /**
     * Translates a raw telemetry value to its display form.
     * <p>
     * Rules are taken from {@code group} when it declares the variable, then from the
     * group that owns the variable, then from the standalone variable declarations.
     * Without rules the raw value is returned unchanged.
     */
    public JsonNode translate(String group, String variable, JsonNode raw) {
        List<EnumRule> rules = rulesFor(group, variable);
        if (rules.isEmpty()) {
            return raw;
        }
        for (EnumRule rule : rules) {
            if (rule.matches(raw)) {
                return TextNode.valueOf(rule.description() != null ? rule.description() : UNKNOWN);
            }
        }
        for (EnumRule rule : rules) {
            if (rule.isTypeFallback()) {
                return TextNode.valueOf(rule.description() != null ? rule.description() : UNKNOWN);
            }
        }
        return TextNode.valueOf(UNKNOWN);
    }

    List<EnumRule> rulesFor(String group, String variable) {
        String variableKey = normalize(variable);
        if (group != null) {
            List<EnumRule> fromGroup = rulesInGroup(normalize(group), variableKey);
            if (!fromGroup.isEmpty()) {
                return fromGroup;
            }
        }
        String owner = groupByVariable.get(variableKey);
        if (owner != null) {
            List<EnumRule> fromOwner = rulesInGroup(normalize(owner), variableKey);
            if (!fromOwner.isEmpty()) {
                return fromOwner;
            }
        }
        return standaloneRules.getOrDefault(variableKey, List.of());
    }

    private List<EnumRule> rulesInGroup(String groupKey, String variableKey) {
        SchemaGroup group = groupsByKey.get(groupKey);
        if (group == null) {
            return List.of();
        }
        return group.rules().getOrDefault(variableKey, List.of());
    }
}
