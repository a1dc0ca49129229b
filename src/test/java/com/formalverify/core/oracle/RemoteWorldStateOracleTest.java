package com.formalverify.core.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formalverify.core.action.ValidationResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteWorldStateOracleTest {

    private static final String BASE = "http://oracle.local";

    private MockRestServiceServer  server;
    private RemoteWorldStateOracle oracle;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        oracle = new RemoteWorldStateOracle(restTemplate, new ObjectMapper(), BASE + "/");
    }

    @Test
    void testQueriesMapToEndpoints() {
        server.expect(requestTo(BASE + "/reset")).andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/actions/poweron")).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"known\": true}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/actions/poweron/preconditions"))
                .andRespond(withSuccess("{\"preconditions\": [\"powered_off\"]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/actions/poweron/validate")).andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"result\": \"valid\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/facts"))
                .andRespond(withSuccess("{\"facts\": [\"powered_on\"]}", MediaType.APPLICATION_JSON));

        oracle.reset();
        assertTrue(oracle.isKnownAction("poweron"));
        assertEquals(List.of("powered_off"), oracle.preconditionsOf("poweron"));
        assertEquals(ValidationResult.VALID, oracle.validate("poweron"));
        assertEquals(List.of("powered_on"), oracle.currentFacts());

        server.verify();
    }

    @Test
    void testPreconditionFailedVerdict() {
        server.expect(requestTo(BASE + "/actions/scanarea/validate"))
                .andRespond(withSuccess("{\"result\": \"precondition_failed\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/actions/scanarea/missing"))
                .andRespond(withSuccess("{\"missing\": [\"powered_on\"]}", MediaType.APPLICATION_JSON));

        assertEquals(ValidationResult.PRECONDITION_FAILED, oracle.validate("scanarea"));
        assertEquals(List.of("powered_on"), oracle.missingPreconditions("scanarea"));
    }

    @Test
    void testServerErrorBecomesOracleException() {
        server.expect(requestTo(BASE + "/actions/poweron/validate"))
                .andRespond(withServerError());

        assertThrows(OracleException.class, () -> oracle.validate("poweron"));
    }

    @Test
    void testMalformedPayloadBecomesOracleException() {
        server.expect(requestTo(BASE + "/facts"))
                .andRespond(withSuccess("{\"facts\": \"powered_on\"}", MediaType.APPLICATION_JSON));

        assertThrows(OracleException.class, () -> oracle.currentFacts());
    }

    @Test
    void testRemoteOracleSharesState() {
        assertTrue(oracle.sharesState());
    }
}
