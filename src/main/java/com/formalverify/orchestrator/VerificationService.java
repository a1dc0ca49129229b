package com.formalverify.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.formalverify.communication.EventBus;
import com.formalverify.core.action.ActionSequenceParser;
import com.formalverify.core.action.ActionToken;
import com.formalverify.core.action.InvalidRequestException;
import com.formalverify.core.event.Event;
import com.formalverify.core.event.EventType;
import com.formalverify.core.expander.TargetPoint;
import com.formalverify.orchestrator.dto.VerificationReport;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * VerificationService - request boundary around {@link VerificationEngine}.
 *
 * Validates the request shape before any step runs, bounds the whole run by
 * {@code verifier.request.timeout-seconds}, and publishes lifecycle events.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private static final String SOURCE = "VerificationService";

    private final VerificationEngine   engine;
    private final ActionSequenceParser parser;
    private final EventBus             eventBus;
    private final long                 timeoutSeconds;

    private final ExecutorService runner;

    public VerificationService(
            VerificationEngine engine,
            ActionSequenceParser parser,
            EventBus eventBus,
            @Value("${verifier.request.timeout-seconds:30}") long timeoutSeconds
    ) {
        this.engine         = engine;
        this.parser         = parser;
        this.eventBus       = eventBus;
        this.timeoutSeconds = timeoutSeconds;

        AtomicInteger threadCount = new AtomicInteger();
        this.runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "verification-run-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parse and run one verification request.
     *
     * @throws InvalidRequestException      when the body is not a usable request
     * @throws VerificationTimeoutException when the run exceeds the timeout
     */
    public VerificationReport verify(JsonNode request) {
        List<ActionToken> actions;
        List<TargetPoint> targets;
        boolean           autoExpand;

        try {
            if (request == null || !request.isObject()) {
                throw new InvalidRequestException("Missing 'actions' in request");
            }
            actions    = parser.parseActions(request.get("actions"));
            targets    = parser.parseTargets(request.get("manual_targets"));
            autoExpand = parser.parseAutoExpand(request.get("auto_expand"));
        } catch (InvalidRequestException e) {
            log.warn("[Service] Rejected request: {}", e.getMessage());
            eventBus.publish(new Event(EventType.VERIFICATION_REJECTED, SOURCE, e.getMessage()));
            throw e;
        }

        eventBus.publish(new Event(EventType.VERIFICATION_STARTED, SOURCE, actions.size()));

        VerificationReport report = runBounded(actions, targets, autoExpand);

        eventBus.publish(new Event(EventType.VERIFICATION_COMPLETED, SOURCE, report));
        return report;
    }

    private VerificationReport runBounded(List<ActionToken> actions, List<TargetPoint> targets, boolean autoExpand) {
        Future<VerificationReport> future = runner.submit(() -> engine.verify(actions, targets, autoExpand));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[Service] Verification of {} actions timed out after {}s", actions.size(), timeoutSeconds);
            throw new VerificationTimeoutException(
                    "Verification did not finish within " + timeoutSeconds + " seconds", e);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new VerificationTimeoutException("Verification was interrupted", e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Verification failed: " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        runner.shutdownNow();
    }
}
