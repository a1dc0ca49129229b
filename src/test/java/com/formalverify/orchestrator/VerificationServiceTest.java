package com.formalverify.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formalverify.communication.InMemoryEventBus;
import com.formalverify.core.action.ActionSequenceParser;
import com.formalverify.core.action.InvalidRequestException;
import com.formalverify.core.action.ValidationResult;
import com.formalverify.core.event.Event;
import com.formalverify.core.event.EventType;
import com.formalverify.core.expander.SequenceExpander;
import com.formalverify.core.oracle.OracleException;
import com.formalverify.core.oracle.RuleBase;
import com.formalverify.core.oracle.RuleBaseFixtures;
import com.formalverify.core.oracle.RuleBaseOracle;
import com.formalverify.core.oracle.WorldStateOracleFactory;
import com.formalverify.orchestrator.dto.VerificationReport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VerificationServiceTest {

    private final ObjectMapper      mapper   = new ObjectMapper();
    private final RuleBase          ruleBase = RuleBaseFixtures.robotRules();
    private final InMemoryEventBus  eventBus = new InMemoryEventBus();
    private final List<EventType>   seen     = new CopyOnWriteArrayList<>();

    private VerificationService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void testPublishesStartedAndCompleted() throws Exception {
        service = serviceWith(() -> new RuleBaseOracle(ruleBase), 5);

        VerificationReport report = service.verify(mapper.readTree(
                "{\"actions\": [\"poweron\", \"scanarea\"], \"auto_expand\": false}"));

        assertEquals(VerificationReport.VALID_SEQUENCE, report.getSummary());
        assertEquals(List.of(EventType.VERIFICATION_STARTED, EventType.VERIFICATION_COMPLETED), seen);
    }

    @Test
    void testMalformedRequestIsRejectedWithEvent() throws Exception {
        service = serviceWith(() -> new RuleBaseOracle(ruleBase), 5);

        assertThrows(InvalidRequestException.class,
                () -> service.verify(mapper.readTree("{\"actions\": {\"not\": \"a list\"}}")));
        assertEquals(List.of(EventType.VERIFICATION_REJECTED), seen);
    }

    @Test
    void testNonObjectBodyIsRejected() throws Exception {
        service = serviceWith(() -> new RuleBaseOracle(ruleBase), 5);

        assertThrows(InvalidRequestException.class, () -> service.verify(mapper.readTree("[\"poweron\"]")));
        assertThrows(InvalidRequestException.class, () -> service.verify(null));
    }

    @Test
    void testStalledOracleTimesOut() throws Exception {
        service = serviceWith(() -> new RuleBaseOracle(ruleBase) {
            @Override
            public ValidationResult validate(String action) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OracleException("interrupted", e);
                }
                return super.validate(action);
            }
        }, 1);

        assertThrows(VerificationTimeoutException.class,
                () -> service.verify(mapper.readTree("{\"actions\": [\"poweron\"]}")));
        assertFalse(seen.contains(EventType.VERIFICATION_COMPLETED));
    }

    @Test
    void testTimedOutRunStopsQueryingTheOracle() throws Exception {
        AtomicInteger validateCalls = new AtomicInteger();
        service = serviceWith(() -> new RuleBaseOracle(ruleBase) {
            @Override
            public ValidationResult validate(String action) {
                validateCalls.incrementAndGet();
                try {
                    Thread.sleep(1_500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OracleException("interrupted", e);
                }
                return super.validate(action);
            }
        }, 1);

        assertThrows(VerificationTimeoutException.class, () -> service.verify(mapper.readTree(
                "{\"actions\": [\"poweron\", \"scanarea\", \"moveforward\", \"turnleft\", \"stop\", \"poweroff\"],"
                        + " \"auto_expand\": false}")));

        // long enough for the remaining steps to start if the run were still going
        Thread.sleep(2_000);
        assertEquals(1, validateCalls.get());
    }

    private VerificationService serviceWith(WorldStateOracleFactory factory, long timeoutSeconds) {
        eventBus.subscribe((Event event) -> seen.add(event.getType()));
        VerificationEngine engine = new VerificationEngine(factory, new SequenceExpander(), new ReportAssembler());
        return new VerificationService(engine, new ActionSequenceParser(), eventBus, timeoutSeconds);
    }
}
