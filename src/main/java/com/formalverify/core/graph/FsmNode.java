package com.formalverify.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A distinct world state. Identity is the canonical fact list; the id only
 * records creation order (0 is the initial state).
 */
public class FsmNode {

    private final int          id;
    private final List<String> facts;
    private final String       label;
    private final int          step;
    private final NodeClass    nodeClass;

    public FsmNode(int id, List<String> facts, String label, int step, NodeClass nodeClass) {
        this.id        = id;
        this.facts     = List.copyOf(facts);
        this.label     = label;
        this.step      = step;
        this.nodeClass = nodeClass;
    }

    @JsonProperty("id")
    public int getId() { return id; }

    @JsonProperty("state")
    public List<String> getFacts() { return facts; }

    @JsonProperty("label")
    public String getLabel() { return label; }

    /** Step that first produced this state; 0 for the initial node. */
    @JsonProperty("step")
    public int getStep() { return step; }

    @JsonProperty("class")
    public NodeClass getNodeClass() { return nodeClass; }

    @Override
    public String toString() {
        return String.format("FsmNode{id=%d, label='%s', class=%s}", id, label, nodeClass);
    }
}
