package com.formalverify.core.expander;

import com.formalverify.core.action.ActionToken;
import com.formalverify.core.action.RobotActions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SequenceExpander - inserts movement steps in front of pickobject.
 *
 * Dead reckoning from the origin: moveforward adds STEP to y, moveleft
 * subtracts STEP from x, moveright adds STEP to x. Turns do not move the
 * agent. There is no heading and no obstacle model.
 *
 * For every action that is directly followed by pickobject:
 *   1. claim the nearest manual target not claimed by an earlier pickup
 *   2. if |dx| > START_THRESHOLD, add up to MAX_STEPS lateral steps toward it,
 *      stopping once |dx| <= STOP_THRESHOLD
 *   3. then if dy > START_THRESHOLD, add up to MAX_STEPS moveforward steps,
 *      stopping once |dy| <= STOP_THRESHOLD
 *   4. with no target left, an action of scanarea gets two moveforward steps
 *
 * The per-axis cap bounds the output for targets that are out of reach.
 */
@Component
public class SequenceExpander {

    private static final Logger log = LoggerFactory.getLogger(SequenceExpander.class);

    public static final double DEFAULT_STEP_SIZE          = 1.5;
    public static final int    DEFAULT_MAX_STEPS_PER_AXIS = 5;
    public static final double DEFAULT_START_THRESHOLD    = 0.5;
    public static final double DEFAULT_STOP_THRESHOLD     = 1.0;

    // Legacy behaviour when no manual target is available after a scan
    private static final int SCAN_APPROACH_STEPS = 2;

    private final double stepSize;
    private final int    maxStepsPerAxis;
    private final double startThreshold;
    private final double stopThreshold;

    public SequenceExpander() {
        this(DEFAULT_STEP_SIZE, DEFAULT_MAX_STEPS_PER_AXIS, DEFAULT_START_THRESHOLD, DEFAULT_STOP_THRESHOLD);
    }

    @Autowired
    public SequenceExpander(
            @Value("${verifier.expander.step-size:1.5}") double stepSize,
            @Value("${verifier.expander.max-steps-per-axis:5}") int maxStepsPerAxis,
            @Value("${verifier.expander.start-threshold:0.5}") double startThreshold,
            @Value("${verifier.expander.stop-threshold:1.0}") double stopThreshold
    ) {
        if (stepSize <= 0 || maxStepsPerAxis < 0) {
            throw new IllegalArgumentException(
                    "Expander needs a positive step size and a non-negative step cap");
        }
        this.stepSize        = stepSize;
        this.maxStepsPerAxis = maxStepsPerAxis;
        this.startThreshold  = startThreshold;
        this.stopThreshold   = stopThreshold;
    }

    public List<ActionToken> expand(List<ActionToken> actions, List<TargetPoint> manualTargets) {
        List<TargetPoint> targets = manualTargets != null ? manualTargets : Collections.emptyList();
        Position          agent   = new Position();
        boolean[]         claimed = new boolean[targets.size()];
        List<ActionToken> out     = new ArrayList<>(actions.size());

        for (int i = 0; i < actions.size(); i++) {
            ActionToken action = actions.get(i);
            out.add(action);
            agent.apply(action);

            boolean pickupNext = i + 1 < actions.size()
                    && actions.get(i + 1).is(RobotActions.PICK_OBJECT);
            if (!pickupNext) {
                continue;
            }

            int targetIndex = nearestUnclaimed(targets, claimed, agent);
            if (targetIndex >= 0) {
                claimed[targetIndex] = true;
                approach(targets.get(targetIndex), agent, out);
            } else if (action.is(RobotActions.SCAN_AREA)) {
                for (int k = 0; k < SCAN_APPROACH_STEPS; k++) {
                    insert(RobotActions.MOVE_FORWARD, agent, out);
                }
                log.debug("[Expander] No target available, added {} forward steps after scan at index {}",
                        SCAN_APPROACH_STEPS, i);
            }
        }

        if (out.size() != actions.size()) {
            log.info("[Expander] Expanded {} actions to {}", actions.size(), out.size());
        }
        return out;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void approach(TargetPoint target, Position agent, List<ActionToken> out) {
        int lateral = 0;
        double dx = target.getX() - agent.x;
        if (Math.abs(dx) > startThreshold) {
            String direction = dx > 0 ? RobotActions.MOVE_RIGHT : RobotActions.MOVE_LEFT;
            while (lateral < maxStepsPerAxis) {
                insert(direction, agent, out);
                lateral++;
                if (Math.abs(target.getX() - agent.x) <= stopThreshold) {
                    break;
                }
            }
        }

        int forward = 0;
        double dy = target.getY() - agent.y;
        if (dy > startThreshold) {
            while (forward < maxStepsPerAxis) {
                insert(RobotActions.MOVE_FORWARD, agent, out);
                forward++;
                if (Math.abs(target.getY() - agent.y) <= stopThreshold) {
                    break;
                }
            }
        }

        log.debug("[Expander] Target {} → {} lateral, {} forward steps; agent now at ({}, {})",
                target, lateral, forward, agent.x, agent.y);
    }

    private void insert(String action, Position agent, List<ActionToken> out) {
        ActionToken token = ActionToken.of(action);
        out.add(token);
        agent.apply(token);
    }

    private int nearestUnclaimed(List<TargetPoint> targets, boolean[] claimed, Position agent) {
        int    best         = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int t = 0; t < targets.size(); t++) {
            if (claimed[t]) continue;
            double distance = targets.get(t).distanceTo(agent.x, agent.y);
            if (distance < bestDistance) {
                best         = t;
                bestDistance = distance;
            }
        }
        return best;
    }

    private final class Position {
        private double x = 0.0;
        private double y = 0.0;

        void apply(ActionToken action) {
            if (action.is(RobotActions.MOVE_FORWARD)) {
                y += stepSize;
            } else if (action.is(RobotActions.MOVE_LEFT)) {
                x -= stepSize;
            } else if (action.is(RobotActions.MOVE_RIGHT)) {
                x += stepSize;
            }
        }
    }
}
