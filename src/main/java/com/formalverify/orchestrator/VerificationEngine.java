package com.formalverify.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.formalverify.core.action.ActionToken;
import com.formalverify.core.action.InvalidRequestException;
import com.formalverify.core.action.ValidationResult;
import com.formalverify.core.expander.SequenceExpander;
import com.formalverify.core.expander.TargetPoint;
import com.formalverify.core.graph.NodeClass;
import com.formalverify.core.graph.StateGraphBuilder;
import com.formalverify.core.oracle.WorldStateOracle;
import com.formalverify.core.oracle.WorldStateOracleFactory;
import com.formalverify.core.state.BatteryModel;
import com.formalverify.core.state.WorldState;
import com.formalverify.orchestrator.dto.StepRecord;
import com.formalverify.orchestrator.dto.VerificationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * VerificationEngine - replays an action sequence against a fresh oracle.
 *
 * Run flow:  expand (optional) → reset → for each action:
 *            snapshot → known? → preconditions → validate → battery → graph → record
 *
 * Every action is processed; per-step failures are recorded, never thrown.
 * An oracle failure on any query is downgraded to ERROR_PROCESSING for that
 * step. Only a missing action list rejects the run before the first step.
 * An interrupted run (cancelled by the request timeout) stops before the
 * next step and throws {@link VerificationTimeoutException}.
 *
 * Oracles that share a fact store with other instances are used under
 * {@code sharedOracleLock} for the whole run.
 */
@Component
public class VerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private static final int INITIAL_STEP = 0;

    private final WorldStateOracleFactory oracleFactory;
    private final SequenceExpander        expander;
    private final ReportAssembler         assembler;

    private final ReentrantLock sharedOracleLock = new ReentrantLock(true);

    public VerificationEngine(
            WorldStateOracleFactory oracleFactory,
            SequenceExpander        expander,
            ReportAssembler         assembler
    ) {
        this.oracleFactory = oracleFactory;
        this.expander      = expander;
        this.assembler     = assembler;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public VerificationReport verify(List<ActionToken> actions, List<TargetPoint> manualTargets, boolean autoExpand) {
        if (actions == null) {
            throw new InvalidRequestException("Missing 'actions' in request");
        }

        List<ActionToken> sequence = autoExpand
                ? expander.expand(actions, manualTargets != null ? manualTargets : Collections.emptyList())
                : actions;

        WorldStateOracle oracle = oracleFactory.open();
        boolean locked = oracle.sharesState();
        if (locked) {
            try {
                sharedOracleLock.lockInterruptibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VerificationTimeoutException("Verification cancelled while waiting for the shared oracle", e);
            }
        }
        try {
            return run(oracle, sequence);
        } finally {
            if (locked) {
                sharedOracleLock.unlock();
            }
        }
    }

    // =========================================================================
    // RUN
    // =========================================================================

    private VerificationReport run(WorldStateOracle oracle, List<ActionToken> sequence) {
        log.info("[Engine] Run started: {} actions", sequence.size());

        List<String> facts = resetOracle(oracle);

        int               battery        = BatteryModel.FULL;
        List<Integer>     batteryHistory = new ArrayList<>();
        List<StepRecord>  steps          = new ArrayList<>();
        StateGraphBuilder graph          = new StateGraphBuilder();

        int currentNode = graph.getOrCreate(facts, INITIAL_STEP, NodeClass.INITIAL);

        for (int i = 0; i < sequence.size(); i++) {
            int         stepNumber = i + 1;
            ActionToken token      = sequence.get(i);

            abortIfCancelled(stepNumber);

            // facts only change inside validate(), so the last snapshot is current
            List<String> before  = facts;
            StepOutcome  outcome = evaluate(oracle, token);

            // an interrupted oracle call surfaces as an oracle failure
            abortIfCancelled(stepNumber);

            if (outcome.result.isValid()) {
                battery = BatteryModel.afterAction(battery, token.getName());
            }

            List<String> after = outcome.touchedOracle ? snapshot(oracle, before) : before;
            facts = after;

            int nextNode = graph.getOrCreate(after, stepNumber,
                    outcome.result.isValid() ? NodeClass.VALID : NodeClass.INVALID);
            graph.addEdge(currentNode, nextNode, token.getName(), stepNumber,
                    outcome.result.isValid(), StepRecord.joinPreconditions(outcome.preconditions));
            currentNode = nextNode;

            StepRecord record = StepRecord.builder(stepNumber, token.getName(), outcome.result)
                    .preconditions(outcome.preconditions)
                    .missingPreconditions(outcome.missing)
                    .explanation(outcome.explanation)
                    .fromState(WorldState.canonical(before))
                    .toState(WorldState.canonical(after))
                    .battery(battery)
                    .build();

            steps.add(record);
            batteryHistory.add(battery);

            log.debug("[Engine] Step {}: {} → {} (battery {}%)",
                    stepNumber, token, outcome.result, battery);
        }

        List<String> expanded = new ArrayList<>(sequence.size());
        sequence.forEach(token -> expanded.add(token.getName()));

        return assembler.assemble(expanded, steps, batteryHistory, battery, facts, graph.build());
    }

    /**
     * Evaluate one token. Does not touch the battery or the graph.
     */
    private StepOutcome evaluate(WorldStateOracle oracle, ActionToken token) {
        StepOutcome outcome = new StepOutcome();

        if (!token.isWellFormed()) {
            outcome.result = ValidationResult.INVALID_FORMAT;
            return outcome;
        }

        String action = token.getName();

        try {
            if (!oracle.isKnownAction(action)) {
                outcome.result = ValidationResult.INVALID_ACTION;
                return outcome;
            }

            outcome.preconditions = oracle.preconditionsOf(action);
            outcome.touchedOracle = true;
            outcome.result        = oracle.validate(action);

        } catch (RuntimeException e) {
            log.warn("[Engine] Oracle failed on '{}': {}", action, e.getMessage());
            outcome.result      = ValidationResult.ERROR_PROCESSING;
            outcome.explanation = null;
            return outcome;
        }

        if (outcome.result == ValidationResult.PRECONDITION_FAILED) {
            explainMissing(oracle, action, outcome);
        }

        return outcome;
    }

    /**
     * The verdict stands even if listing the missing preconditions fails;
     * the step then carries the default explanation.
     */
    private void explainMissing(WorldStateOracle oracle, String action, StepOutcome outcome) {
        try {
            outcome.missing = oracle.missingPreconditions(action);
        } catch (RuntimeException e) {
            log.warn("[Engine] Could not list missing preconditions of '{}': {}", action, e.getMessage());
            return;
        }
        if (!outcome.missing.isEmpty()) {
            outcome.explanation = "Missing preconditions: " + String.join(", ", outcome.missing);
        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private void abortIfCancelled(int stepNumber) {
        if (Thread.currentThread().isInterrupted()) {
            log.info("[Engine] Run cancelled at step {}", stepNumber);
            throw new VerificationTimeoutException("Verification cancelled at step " + stepNumber, null);
        }
    }

    private List<String> resetOracle(WorldStateOracle oracle) {
        try {
            oracle.reset();
            return oracle.currentFacts();
        } catch (RuntimeException e) {
            log.warn("[Engine] Oracle reset failed, starting from an empty fact set: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<String> snapshot(WorldStateOracle oracle, List<String> fallback) {
        try {
            return oracle.currentFacts();
        } catch (RuntimeException e) {
            log.warn("[Engine] Could not read current facts, keeping last known state: {}", e.getMessage());
            return fallback;
        }
    }

    private static final class StepOutcome {
        private ValidationResult result        = ValidationResult.ERROR_PROCESSING;
        private List<String>     preconditions = Collections.emptyList();
        private List<String>     missing       = Collections.emptyList();
        private String           explanation;
        private boolean          touchedOracle;
    }
}
