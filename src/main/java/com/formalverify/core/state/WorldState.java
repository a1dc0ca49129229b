package com.formalverify.core.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * WorldState - the mutable set of fact atoms describing the world.
 *
 * Owned by exactly one oracle instance for the duration of one run. Equality
 * is set equality; iteration order is assertion order, which is the order
 * facts are reported back in {@link #snapshot()}.
 */
public class WorldState {

    private final Set<String> facts;

    public WorldState(Collection<String> initialFacts) {
        this.facts = new LinkedHashSet<>(initialFacts);
    }

    public boolean holds(String fact) {
        return facts.contains(fact);
    }

    public void assertFact(String fact) {
        facts.add(fact);
    }

    public void retractFact(String fact) {
        facts.remove(fact);
    }

    public int size() {
        return facts.size();
    }

    /** Copy of the facts in assertion order. */
    public List<String> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(facts));
    }

    /**
     * Sorted, de-duplicated view of a fact collection. Two collections with the
     * same members always produce the same list regardless of discovery order.
     */
    public static List<String> canonical(Collection<String> facts) {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(facts)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldState)) return false;
        return facts.equals(((WorldState) o).facts);
    }

    @Override
    public int hashCode() {
        return facts.hashCode();
    }

    @Override
    public String toString() {
        return "WorldState" + facts;
    }
}
