package com.simrelay.core.schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A declared group of simulator variables.
 *
 * @param name      group name as declared
 * @param variables member variable names in declaration order
 * @param rules     translation rules keyed by normalized variable name; members without rules are absent
 */
public record SchemaGroup(String name, Set<String> variables, Map<String, List<EnumRule>> rules) {

    public SchemaGroup {
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        rules = Map.copyOf(rules);
    }
}
