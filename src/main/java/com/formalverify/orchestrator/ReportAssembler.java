package com.formalverify.orchestrator;

import com.formalverify.core.graph.StateGraph;
import com.formalverify.orchestrator.dto.StepRecord;
import com.formalverify.orchestrator.dto.VerificationReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ReportAssembler {

    private static final Logger log =
            LoggerFactory.getLogger(ReportAssembler.class);

    public VerificationReport assemble(
            List<String> expandedActions,
            List<StepRecord> steps,
            List<Integer> batteryHistory,
            int finalBattery,
            List<String> finalState,
            StateGraph graph) {

        long invalidCount = steps.stream()
                .filter(step -> !step.isValid())
                .count();

        String summary = invalidCount == 0
                ? VerificationReport.VALID_SEQUENCE
                : VerificationReport.INVALID_SEQUENCE;

        String details = invalidCount == 0
                ? String.format("All %d actions are valid.", steps.size())
                : String.format("Found %d invalid action(s) out of %d.", invalidCount, steps.size());

        VerificationReport report = new VerificationReport(
                steps,
                summary,
                details,
                finalState,
                finalBattery,
                batteryHistory,
                expandedActions,
                graph
        );

        log.info("[Report] {} - {} ({} nodes, {} edges, battery {}%)",
                summary, details, graph.getNodes().size(), graph.getEdges().size(), finalBattery);

        return report;
    }
}
