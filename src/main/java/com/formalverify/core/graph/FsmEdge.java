package com.formalverify.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transition recorded for one processed step, valid or not.
 */
public class FsmEdge {

    private final int     from;
    private final int     to;
    private final String  action;
    private final int     step;
    private final boolean valid;
    private final String  precondition;

    public FsmEdge(int from, int to, String action, int step, boolean valid, String precondition) {
        this.from         = from;
        this.to           = to;
        this.action       = action;
        this.step         = step;
        this.valid        = valid;
        this.precondition = precondition;
    }

    @JsonProperty("from")
    public int getFrom() { return from; }

    @JsonProperty("to")
    public int getTo() { return to; }

    @JsonProperty("action")
    public String getAction() { return action; }

    @JsonProperty("step")
    public int getStep() { return step; }

    @JsonProperty("valid")
    public boolean isValid() { return valid; }

    @JsonProperty("precondition")
    public String getPrecondition() { return precondition; }

    @Override
    public String toString() {
        return String.format("FsmEdge{%d -[%s%s]-> %d}", from, action, valid ? "" : " ✗", to);
    }
}
