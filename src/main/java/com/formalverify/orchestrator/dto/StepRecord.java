package com.formalverify.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.formalverify.core.action.ValidationResult;

import java.util.List;

/**
 * StepRecord - immutable outcome of one processed action.
 *
 * Always construct via {@link #builder(int, String, ValidationResult)}.
 * State snapshots are canonical (sorted) fact lists.
 */
@JsonPropertyOrder({"step", "action", "result", "precondition", "precondition_met",
        "missing_preconditions", "explanation", "from_state", "to_state", "battery"})
public class StepRecord {

    public static final String NO_PRECONDITIONS = "None";

    private final int              step;
    private final String           action;
    private final ValidationResult result;
    private final List<String>     preconditions;
    private final List<String>     missingPreconditions;
    private final String           explanation;
    private final List<String>     fromState;
    private final List<String>     toState;
    private final int              battery;

    private StepRecord(Builder b) {
        this.step                 = b.step;
        this.action               = b.action;
        this.result               = b.result;
        this.preconditions        = List.copyOf(b.preconditions);
        this.missingPreconditions = List.copyOf(b.missingPreconditions);
        this.explanation          = b.explanation != null ? b.explanation : b.result.getDefaultExplanation();
        this.fromState            = List.copyOf(b.fromState);
        this.toState              = List.copyOf(b.toState);
        this.battery              = b.battery;
    }

    public static Builder builder(int step, String action, ValidationResult result) {
        return new Builder(step, action, result);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    @JsonProperty("step")
    public int getStep() { return step; }

    @JsonProperty("action")
    public String getAction() { return action; }

    @JsonProperty("result")
    public ValidationResult getResult() { return result; }

    @JsonIgnore
    public List<String> getPreconditions() { return preconditions; }

    /** Ordered preconditions joined for display, "None" when there are none. */
    @JsonProperty("precondition")
    public String getPreconditionText() {
        return joinPreconditions(preconditions);
    }

    /** True only for a valid step; an unknown action has no missing list but is not met. */
    @JsonProperty("precondition_met")
    public boolean isPreconditionMet() {
        return result.isValid();
    }

    @JsonProperty("missing_preconditions")
    public List<String> getMissingPreconditions() { return missingPreconditions; }

    @JsonProperty("explanation")
    public String getExplanation() { return explanation; }

    @JsonProperty("from_state")
    public List<String> getFromState() { return fromState; }

    @JsonProperty("to_state")
    public List<String> getToState() { return toState; }

    @JsonProperty("battery")
    public int getBattery() { return battery; }

    @JsonIgnore
    public boolean isValid() { return result.isValid(); }

    public static String joinPreconditions(List<String> preconditions) {
        return preconditions.isEmpty() ? NO_PRECONDITIONS : String.join(", ", preconditions);
    }

    @Override
    public String toString() {
        return String.format("StepRecord{step=%d, action='%s', result=%s, battery=%d}",
                step, action, result, battery);
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final int              step;
        private final String           action;
        private final ValidationResult result;
        private List<String> preconditions        = List.of();
        private List<String> missingPreconditions = List.of();
        private String       explanation;
        private List<String> fromState            = List.of();
        private List<String> toState              = List.of();
        private int          battery;

        private Builder(int step, String action, ValidationResult result) {
            this.step   = step;
            this.action = action;
            this.result = result;
        }

        public Builder preconditions(List<String> v)        { this.preconditions = v;        return this; }
        public Builder missingPreconditions(List<String> v) { this.missingPreconditions = v; return this; }
        public Builder explanation(String v)                { this.explanation = v;          return this; }
        public Builder fromState(List<String> v)            { this.fromState = v;            return this; }
        public Builder toState(List<String> v)              { this.toState = v;              return this; }
        public Builder battery(int v)                       { this.battery = v;              return this; }

        public StepRecord build() {
            return new StepRecord(this);
        }
    }
}
