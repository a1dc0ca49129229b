package com.formalverify.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.formalverify.core.action.InvalidRequestException;
import com.formalverify.core.action.ValidationResult;
import com.formalverify.core.oracle.ConfiguredOracleFactory;
import com.formalverify.core.stats.RunStatistics;
import com.formalverify.orchestrator.VerificationService;
import com.formalverify.orchestrator.VerificationTimeoutException;
import com.formalverify.orchestrator.dto.VerificationReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@CrossOrigin
public class VerificationController {

    private static final Logger log = LoggerFactory.getLogger(VerificationController.class);

    private final VerificationService     verificationService;
    private final ConfiguredOracleFactory oracleFactory;
    private final RunStatistics           statistics;

    public VerificationController(
            VerificationService verificationService,
            ConfiguredOracleFactory oracleFactory,
            RunStatistics statistics) {
        this.verificationService = verificationService;
        this.oracleFactory       = oracleFactory;
        this.statistics          = statistics;
    }

    @GetMapping("/")
    public String home() {
        return "Formal Verification Server is running";
    }

    @PostMapping("/verify")
    public ResponseEntity<VerificationReport> verify(
            @RequestBody(required = false) JsonNode request
    ) {
        return ResponseEntity.ok(verificationService.verify(request));
    }

    @GetMapping("/actions")
    public Map<String, List<String>> actions() {
        return Map.of("actions", oracleFactory.knownActions());
    }

    @GetMapping("/verify/stats")
    public Map<String, Long> stats() {
        return statistics.snapshot();
    }

    // =========================================================================
    // Error mapping
    // =========================================================================

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidRequestException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error",  e.getMessage());
        body.put("result", ValidationResult.INVALID_FORMAT.getWireName());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(VerificationTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(VerificationTimeoutException e) {
        log.error("[Controller] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(Map.of("error", e.getMessage()));
    }
}
