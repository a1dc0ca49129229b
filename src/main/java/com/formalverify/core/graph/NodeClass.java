package com.formalverify.core.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a state node was first reached.
 */
public enum NodeClass {
    INITIAL,
    VALID,
    INVALID;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
