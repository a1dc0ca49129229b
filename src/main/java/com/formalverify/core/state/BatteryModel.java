package com.formalverify.core.state;

import com.formalverify.core.action.RobotActions;

/**
 * Battery drain table. Drain is only applied to steps the oracle accepted.
 *
 * MOVEMENT      20 - moveforward, moveleft, moveright, turnleft, turnright
 * MANIPULATION  10 - scanarea, pickobject, releaseobject
 * everything else 0 - poweron, poweroff, checkbattery, stop
 */
public final class BatteryModel {

    public static final int FULL = 100;
    public static final int EMPTY = 0;

    public static final int MOVEMENT_DRAIN     = 20;
    public static final int MANIPULATION_DRAIN = 10;

    private BatteryModel() {
    }

    public static int drainFor(String action) {
        if (RobotActions.MOVEMENT.contains(action)) {
            return MOVEMENT_DRAIN;
        }
        if (RobotActions.MANIPULATION.contains(action)) {
            return MANIPULATION_DRAIN;
        }
        return 0;
    }

    /** Level after running {@code action}, floored at {@link #EMPTY}. */
    public static int afterAction(int level, String action) {
        return Math.max(EMPTY, level - drainFor(action));
    }
}
