package com.formalverify.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Finished state graph of one run: nodes in id order, edges in step order.
 */
public class StateGraph {

    private final List<FsmNode> nodes;
    private final List<FsmEdge> edges;

    public StateGraph(List<FsmNode> nodes, List<FsmEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    @JsonProperty("nodes")
    public List<FsmNode> getNodes() { return nodes; }

    @JsonProperty("edges")
    public List<FsmEdge> getEdges() { return edges; }
}
