package com.formalverify.core.action;

import java.util.Set;

/**
 * Action names the engine itself reasons about (battery drain, auto-expansion).
 * Whether an action is valid is decided by the oracle, not by this list.
 */
public final class RobotActions {

    public static final String SCAN_AREA      = "scanarea";
    public static final String MOVE_FORWARD   = "moveforward";
    public static final String MOVE_LEFT      = "moveleft";
    public static final String MOVE_RIGHT     = "moveright";
    public static final String TURN_LEFT      = "turnleft";
    public static final String TURN_RIGHT     = "turnright";
    public static final String PICK_OBJECT    = "pickobject";
    public static final String RELEASE_OBJECT = "releaseobject";

    public static final Set<String> MOVEMENT = Set.of(
            MOVE_FORWARD, MOVE_LEFT, MOVE_RIGHT, TURN_LEFT, TURN_RIGHT);

    public static final Set<String> MANIPULATION = Set.of(
            SCAN_AREA, PICK_OBJECT, RELEASE_OBJECT);

    private RobotActions() {
    }
}
