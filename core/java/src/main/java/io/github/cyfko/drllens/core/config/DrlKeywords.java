package io.github.cyfko.drllens.core.config;

import java.util.List;
import java.util.Set;

/**
 * Keyword tables of the Drools Rule Language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class DrlKeywords {

    private DrlKeywords() {
    }

    /**
     * Rule attributes accepted by Drools, in documentation order.
     */
    public static final List<String> RULE_ATTRIBUTES = List.of(
            "salience", "no-loop", "agenda-group", "auto-focus", "activation-group",
            "ruleflow-group", "lock-on-active", "dialect", "date-effective", "date-expires",
            "duration", "timer", "calendars", "enabled");

    /**
     * Attributes whose optional value must be {@code true} or {@code false}.
     */
    public static final Set<String> BOOLEAN_ATTRIBUTES = Set.of("no-loop", "auto-focus", "lock-on-active", "enabled");

    public static final Set<String> DIALECTS = Set.of("java", "mvel");

    /**
     * Keywords that open a multi-line pattern region when followed by {@code (}.
     */
    public static final Set<String> CONSTRUCT_KEYWORDS = Set.of("exists", "not", "eval", "forall", "collect", "accumulate");

    /**
     * Working-memory calls that can re-trigger the rule that performs them.
     */
    public static final List<String> SIDE_EFFECT_CALLS = List.of("insert", "insertLogical", "update", "modify", "retract", "delete");
}
