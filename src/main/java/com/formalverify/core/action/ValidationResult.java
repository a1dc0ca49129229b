package com.formalverify.core.action;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of verifying a single action step.
 *
 * Only VALID steps mutate the world state and drain the battery:
 * - VALID: known action, every precondition held, effects applied
 * - PRECONDITION_FAILED: known action, at least one precondition is false
 * - INVALID_ACTION: token is not defined in the rule base
 * - INVALID_FORMAT: token is not a string (or the request shape is wrong)
 * - ERROR_PROCESSING: the oracle failed while answering a query
 */
public enum ValidationResult {

    /**
     * All preconditions satisfied; the oracle applied the action's effects.
     */
    VALID("valid", "All preconditions satisfied."),

    /**
     * Action is known but the current facts do not satisfy it.
     * The explanation is replaced by the missing precondition list when available.
     */
    PRECONDITION_FAILED("precondition_failed", "One or more preconditions are not satisfied."),

    /**
     * Action name is not part of the rule base.
     */
    INVALID_ACTION("invalid_action", "Action is not defined in the rule base."),

    /**
     * Action value was not a string.
     */
    INVALID_FORMAT("invalid_format", "Action value must be a string."),

    /**
     * Oracle raised an unexpected failure while the step was being evaluated.
     */
    ERROR_PROCESSING("error_processing", "Internal error while querying the rule base.");

    private final String wireName;
    private final String defaultExplanation;

    ValidationResult(String wireName, String defaultExplanation) {
        this.wireName           = wireName;
        this.defaultExplanation = defaultExplanation;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDefaultExplanation() {
        return defaultExplanation;
    }

    public boolean isValid() {
        return this == VALID;
    }

    /**
     * Map an oracle's textual verdict to a result. Anything unrecognised is
     * treated as an unknown action, mirroring how an empty query answer reads.
     */
    public static ValidationResult fromWireName(String wireName) {
        if (wireName == null) {
            return INVALID_ACTION;
        }
        for (ValidationResult result : values()) {
            if (result.wireName.equalsIgnoreCase(wireName.trim())) {
                return result;
            }
        }
        return INVALID_ACTION;
    }
}
