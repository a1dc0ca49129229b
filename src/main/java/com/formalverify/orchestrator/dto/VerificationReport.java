package com.formalverify.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.formalverify.core.graph.StateGraph;

import java.util.List;

@JsonPropertyOrder({"validation", "summary", "summary_details", "final_state",
        "final_battery", "battery_history", "expanded_actions", "fsm"})
public class VerificationReport {

    public static final String VALID_SEQUENCE   = "VALID SEQUENCE";
    public static final String INVALID_SEQUENCE = "INVALID SEQUENCE";

    private final List<StepRecord> validation;
    private final String           summary;
    private final String           summaryDetails;
    private final List<String>     finalState;
    private final int              finalBattery;
    private final List<Integer>    batteryHistory;
    private final List<String>     expandedActions;
    private final StateGraph       fsm;

    public VerificationReport(
            List<StepRecord> validation,
            String summary,
            String summaryDetails,
            List<String> finalState,
            int finalBattery,
            List<Integer> batteryHistory,
            List<String> expandedActions,
            StateGraph fsm
    ) {
        this.validation      = List.copyOf(validation);
        this.summary         = summary;
        this.summaryDetails  = summaryDetails;
        this.finalState      = List.copyOf(finalState);
        this.finalBattery    = finalBattery;
        this.batteryHistory  = List.copyOf(batteryHistory);
        this.expandedActions = List.copyOf(expandedActions);
        this.fsm             = fsm;
    }

    @JsonProperty("validation")
    public List<StepRecord> getValidation() { return validation; }

    @JsonProperty("summary")
    public String getSummary() { return summary; }

    @JsonProperty("summary_details")
    public String getSummaryDetails() { return summaryDetails; }

    @JsonProperty("final_state")
    public List<String> getFinalState() { return finalState; }

    @JsonProperty("final_battery")
    public int getFinalBattery() { return finalBattery; }

    @JsonProperty("battery_history")
    public List<Integer> getBatteryHistory() { return batteryHistory; }

    @JsonProperty("expanded_actions")
    public List<String> getExpandedActions() { return expandedActions; }

    @JsonProperty("fsm")
    public StateGraph getFsm() { return fsm; }

    @JsonIgnore
    public boolean isValidSequence() {
        return VALID_SEQUENCE.equals(summary);
    }
}
