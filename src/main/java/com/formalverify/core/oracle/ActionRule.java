package com.formalverify.core.oracle;

import java.util.List;

/**
 * One action of the rule base: what must hold before it, and which facts it
 * retracts and then asserts when it runs.
 */
public class ActionRule {

    private final String       name;
    private final List<String> preconditions;
    private final List<String> retracts;
    private final List<String> asserts;

    public ActionRule(String name, List<String> preconditions, List<String> retracts, List<String> asserts) {
        this.name          = name;
        this.preconditions = List.copyOf(preconditions);
        this.retracts      = List.copyOf(retracts);
        this.asserts       = List.copyOf(asserts);
    }

    public String       getName()          { return name; }
    public List<String> getPreconditions() { return preconditions; }
    public List<String> getRetracts()      { return retracts; }
    public List<String> getAsserts()       { return asserts; }

    @Override
    public String toString() {
        return String.format("ActionRule{name='%s', pre=%s, -%s, +%s}",
                name, preconditions, retracts, asserts);
    }
}
