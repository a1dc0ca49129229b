package com.formalverify.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formalverify.core.action.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * RemoteWorldStateOracle - oracle hosted out of process, reached over HTTP.
 *
 * Endpoints (all JSON):
 *   POST {base}/reset                          → ignored body
 *   GET  {base}/actions/{a}                    → {"known": bool}
 *   GET  {base}/actions/{a}/preconditions      → {"preconditions": [..]}
 *   GET  {base}/actions/{a}/missing            → {"missing": [..]}
 *   POST {base}/actions/{a}/validate           → {"result": "valid" | ...}
 *   GET  {base}/facts                          → {"facts": [..]}
 *   GET  {base}/actions                        → {"actions": [..]}
 *
 * The remote fact store is process-wide, so {@link #sharesState()} is true and
 * the engine serializes runs that use it. Transport and decoding failures are
 * rethrown as {@link OracleException}.
 */
public class RemoteWorldStateOracle implements WorldStateOracle {

    private static final Logger log = LoggerFactory.getLogger(RemoteWorldStateOracle.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String       baseUrl;

    public RemoteWorldStateOracle(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    // =========================================================================
    // WorldStateOracle contract
    // =========================================================================

    @Override
    public void reset() {
        post("/reset");
    }

    @Override
    public boolean isKnownAction(String action) {
        return get("/actions/{action}", action).path("known").asBoolean(false);
    }

    @Override
    public List<String> preconditionsOf(String action) {
        return atoms(get("/actions/{action}/preconditions", action), "preconditions");
    }

    @Override
    public List<String> missingPreconditions(String action) {
        return atoms(get("/actions/{action}/missing", action), "missing");
    }

    @Override
    public ValidationResult validate(String action) {
        JsonNode body = post("/actions/{action}/validate", action);
        if (!body.hasNonNull("result")) {
            throw new OracleException("Oracle validate response has no result for '" + action + "'");
        }
        return ValidationResult.fromWireName(body.get("result").asText());
    }

    @Override
    public List<String> currentFacts() {
        return atoms(get("/facts"), "facts");
    }

    @Override
    public boolean sharesState() {
        return true;
    }

    /** Action names the remote rule base defines. */
    public List<String> actionCatalog() {
        return atoms(get("/actions"), "actions");
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private JsonNode get(String path, Object... uriVariables) {
        try {
            ResponseEntity<String> response =
                    restTemplate.getForEntity(baseUrl + path, String.class, uriVariables);
            return readBody(response, path);
        } catch (RestClientException e) {
            log.warn("[Oracle] GET {} failed: {}", path, e.getMessage());
            throw new OracleException("Oracle query failed: GET " + path, e);
        }
    }

    private JsonNode post(String path, Object... uriVariables) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + path, new HttpEntity<>("{}", headers), String.class, uriVariables);
            return readBody(response, path);
        } catch (RestClientException e) {
            log.warn("[Oracle] POST {} failed: {}", path, e.getMessage());
            throw new OracleException("Oracle query failed: POST " + path, e);
        }
    }

    private JsonNode readBody(ResponseEntity<String> response, String path) {
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new OracleException("Oracle returned unreadable JSON for " + path, e);
        }
    }

    private List<String> atoms(JsonNode body, String field) {
        JsonNode list = body.path(field);
        if (!list.isArray()) {
            throw new OracleException("Oracle response is missing '" + field + "' list");
        }
        List<String> atoms = new ArrayList<>();
        for (JsonNode atom : list) {
            atoms.add(atom.asText());
        }
        return atoms;
    }
}
