package com.formalverify.core.action;

import java.util.Locale;

/**
 * ActionToken - one entry of a submitted action sequence.
 *
 * A token is either a symbolic action (trimmed, lower-cased) or a malformed
 * entry that was not a string in the request. Malformed tokens keep their raw
 * rendering so the step record can echo what the caller sent.
 */
public final class ActionToken {

    private final String  name;
    private final boolean wellFormed;

    private ActionToken(String name, boolean wellFormed) {
        this.name       = name;
        this.wellFormed = wellFormed;
    }

    public static ActionToken of(String raw) {
        if (raw == null) {
            return malformed("null");
        }
        return new ActionToken(normalize(raw), true);
    }

    public static ActionToken malformed(String rawRendering) {
        return new ActionToken(rawRendering != null ? rawRendering : "null", false);
    }

    public static String normalize(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public boolean isWellFormed() {
        return wellFormed;
    }

    public boolean is(String actionName) {
        return wellFormed && name.equals(actionName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionToken)) return false;
        ActionToken other = (ActionToken) o;
        return wellFormed == other.wellFormed && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + (wellFormed ? 1 : 0);
    }

    @Override
    public String toString() {
        return wellFormed ? name : "<malformed:" + name + ">";
    }
}
