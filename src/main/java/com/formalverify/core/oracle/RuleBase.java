package com.formalverify.core.oracle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable action/precondition/effect table plus the initial facts.
 * Shared by every {@link RuleBaseOracle}; per-run state lives in the oracle.
 */
public class RuleBase {

    private final Map<String, ActionRule> rules;
    private final List<String>            initialFacts;

    public RuleBase(List<ActionRule> rules, List<String> initialFacts) {
        Map<String, ActionRule> byName = new LinkedHashMap<>();
        for (ActionRule rule : rules) {
            if (byName.putIfAbsent(rule.getName(), rule) != null) {
                throw new RuleBaseException("Duplicate action in rule base: " + rule.getName());
            }
        }
        this.rules        = Collections.unmodifiableMap(byName);
        this.initialFacts = List.copyOf(initialFacts);
    }

    public boolean defines(String action) {
        return rules.containsKey(action);
    }

    /** Rule for the action, or null when the action is unknown. */
    public ActionRule ruleFor(String action) {
        return rules.get(action);
    }

    /** Action names in declaration order. */
    public List<String> actionNames() {
        return Collections.unmodifiableList(new ArrayList<>(rules.keySet()));
    }

    public List<String> getInitialFacts() {
        return initialFacts;
    }

    public int size() {
        return rules.size();
    }
}
