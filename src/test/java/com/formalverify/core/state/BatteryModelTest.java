package com.formalverify.core.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatteryModelTest {

    @Test
    void testMovementDrainsTwenty() {
        for (String action : new String[]{"moveforward", "moveleft", "moveright", "turnleft", "turnright"}) {
            assertEquals(80, BatteryModel.afterAction(100, action), action);
        }
    }

    @Test
    void testManipulationDrainsTen() {
        for (String action : new String[]{"scanarea", "pickobject", "releaseobject"}) {
            assertEquals(90, BatteryModel.afterAction(100, action), action);
        }
    }

    @Test
    void testControlActionsAreFree() {
        for (String action : new String[]{"poweron", "poweroff", "checkbattery", "stop"}) {
            assertEquals(100, BatteryModel.afterAction(100, action), action);
        }
    }

    @Test
    void testLevelIsFlooredAtZero() {
        assertEquals(0, BatteryModel.afterAction(10, "moveforward"));
        assertEquals(0, BatteryModel.afterAction(0, "scanarea"));
    }
}
