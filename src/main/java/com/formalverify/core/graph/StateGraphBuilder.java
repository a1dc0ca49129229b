package com.formalverify.core.graph;

import com.formalverify.core.state.WorldState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * StateGraphBuilder - deduplicates world-state snapshots into FSM nodes.
 *
 * Nodes are keyed by the sorted, de-duplicated fact list, so a state reached
 * twice (in any fact order) resolves to the node created the first time.
 * Ids are handed out in creation order. One builder per run.
 */
public class StateGraphBuilder {

    public static final String EMPTY_LABEL = "Initial";

    private final Map<List<String>, Integer> idsByState = new HashMap<>();
    private final List<FsmNode>              nodes      = new ArrayList<>();
    private final List<FsmEdge>              edges      = new ArrayList<>();

    /**
     * Id of the node for {@code facts}, creating it with the given origin step and
     * class when this fact set has not been seen before.
     */
    public int getOrCreate(List<String> facts, int step, NodeClass nodeClass) {
        List<String> key = WorldState.canonical(facts);

        Integer existing = idsByState.get(key);
        if (existing != null) {
            return existing;
        }

        int id = nodes.size();
        nodes.add(new FsmNode(id, key, labelFor(key), step, nodeClass));
        idsByState.put(key, id);
        return id;
    }

    public void addEdge(int from, int to, String action, int step, boolean valid, String precondition) {
        if (from < 0 || from >= nodes.size() || to < 0 || to >= nodes.size()) {
            throw new IllegalArgumentException(
                    "Edge " + from + " -> " + to + " references an unknown node (" + nodes.size() + " nodes)");
        }
        edges.add(new FsmEdge(from, to, action, step, valid, precondition));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public StateGraph build() {
        return new StateGraph(nodes, edges);
    }

    static String labelFor(List<String> canonicalFacts) {
        return canonicalFacts.isEmpty() ? EMPTY_LABEL : String.join(", ", canonicalFacts);
    }
}
