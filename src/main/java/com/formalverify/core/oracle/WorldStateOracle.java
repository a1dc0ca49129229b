package com.formalverify.core.oracle;

import com.formalverify.core.action.ValidationResult;

import java.util.List;

/**
 * WorldStateOracle - the precondition/effect decision procedure consulted per step.
 *
 * The oracle owns the fact set. {@link #validate(String)} is the only
 * state transition: when it answers VALID it has already applied the
 * action's effects. Callers must treat every method as able to fail with
 * {@link OracleException}.
 *
 * An instance serves one verification run at a time.
 */
public interface WorldStateOracle {

    /**
     * Establish the canonical initial fact set.
     */
    void reset();

    boolean isKnownAction(String action);

    /**
     * Preconditions of the action in the oracle's declaration order.
     * Empty for unknown actions.
     */
    List<String> preconditionsOf(String action);

    /**
     * Subset of {@link #preconditionsOf(String)} that is currently false.
     */
    List<String> missingPreconditions(String action);

    /**
     * Decide the action against the current facts, applying its effects when
     * valid. Returns VALID, PRECONDITION_FAILED or INVALID_ACTION.
     */
    ValidationResult validate(String action);

    /**
     * Snapshot of the current fact set.
     */
    List<String> currentFacts();

    /**
     * True when the fact store behind this oracle is shared with other
     * instances, so runs must be serialized by the caller.
     */
    default boolean sharesState() {
        return false;
    }
}
