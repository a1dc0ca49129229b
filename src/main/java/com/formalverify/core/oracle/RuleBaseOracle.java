package com.formalverify.core.oracle;

import com.formalverify.core.action.ValidationResult;
import com.formalverify.core.state.WorldState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RuleBaseOracle - in-process oracle evaluating a {@link RuleBase}.
 *
 * Resolution mirrors the rule file's validate/2 clauses, first match wins:
 *   1. action not defined                     → INVALID_ACTION
 *   2. some precondition not in the world     → PRECONDITION_FAILED (no change)
 *   3. otherwise retract, then assert effects → VALID
 *
 * Each instance owns its own {@link WorldState}; a fresh instance per run
 * makes cross-run leakage impossible.
 */
public class RuleBaseOracle implements WorldStateOracle {

    private final RuleBase ruleBase;
    private WorldState     world;

    public RuleBaseOracle(RuleBase ruleBase) {
        this.ruleBase = ruleBase;
        this.world    = new WorldState(ruleBase.getInitialFacts());
    }

    @Override
    public void reset() {
        this.world = new WorldState(ruleBase.getInitialFacts());
    }

    @Override
    public boolean isKnownAction(String action) {
        return ruleBase.defines(action);
    }

    @Override
    public List<String> preconditionsOf(String action) {
        ActionRule rule = ruleBase.ruleFor(action);
        return rule != null ? rule.getPreconditions() : Collections.emptyList();
    }

    @Override
    public List<String> missingPreconditions(String action) {
        List<String> missing = new ArrayList<>();
        for (String condition : preconditionsOf(action)) {
            if (!world.holds(condition)) {
                missing.add(condition);
            }
        }
        return missing;
    }

    @Override
    public ValidationResult validate(String action) {
        ActionRule rule = ruleBase.ruleFor(action);
        if (rule == null) {
            return ValidationResult.INVALID_ACTION;
        }

        for (String condition : rule.getPreconditions()) {
            if (!world.holds(condition)) {
                return ValidationResult.PRECONDITION_FAILED;
            }
        }

        rule.getRetracts().forEach(world::retractFact);
        rule.getAsserts().forEach(world::assertFact);
        return ValidationResult.VALID;
    }

    @Override
    public List<String> currentFacts() {
        return world.snapshot();
    }
}
