package com.formalverify.core.stats;

import org.springframework.stereotype.Component;

import com.formalverify.communication.VerificationEventListener;
import com.formalverify.core.event.Event;
import com.formalverify.orchestrator.dto.VerificationReport;

@Component
public class RunStatisticsListener implements VerificationEventListener {  // keeps the run counters current

    private final RunStatistics statistics;

    public RunStatisticsListener(RunStatistics statistics) {
        this.statistics = statistics;
    }

    @Override
    public void onEvent(Event event) {
        switch (event.getType()) {
            case VERIFICATION_STARTED -> statistics.recordStarted();
            case VERIFICATION_REJECTED -> statistics.recordRejected();
            case VERIFICATION_COMPLETED -> {
                VerificationReport report = (VerificationReport) event.getPayload();
                if (report.isValidSequence()) {
                    statistics.recordValid();
                } else {
                    statistics.recordInvalid();
                }
            }
        }
    }
}
