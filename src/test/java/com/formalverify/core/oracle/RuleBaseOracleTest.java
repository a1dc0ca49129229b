package com.formalverify.core.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formalverify.core.action.ValidationResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class RuleBaseOracleTest {

    private RuleBase       ruleBase;
    private RuleBaseOracle oracle;

    @BeforeEach
    void setUp() {
        ruleBase = RuleBaseFixtures.robotRules();
        oracle   = new RuleBaseOracle(ruleBase);
        oracle.reset();
    }

    @Test
    void testResetEstablishesInitialFacts() {
        assertEquals(List.of("powered_off", "battery_full", "object_detected"), oracle.currentFacts());
    }

    @Test
    void testActionCatalogKeepsDeclarationOrder() {
        List<String> names = ruleBase.actionNames();

        assertEquals(12, names.size());
        assertEquals("poweron", names.get(0));
        assertTrue(names.contains("moveleft"));
        assertTrue(names.contains("moveright"));
    }

    @Test
    void testUnknownActionIsInvalidAndLeavesFactsAlone() {
        assertFalse(oracle.isKnownAction("flyaway"));
        assertEquals(ValidationResult.INVALID_ACTION, oracle.validate("flyaway"));
        assertTrue(oracle.preconditionsOf("flyaway").isEmpty());
        assertEquals(3, oracle.currentFacts().size());
    }

    @Test
    void testPreconditionsAreReportedInDeclarationOrder() {
        assertEquals(List.of("powered_on", "scanned", "object_detected"), oracle.preconditionsOf("pickobject"));
    }

    @Test
    void testFailedPreconditionDoesNotMutate() {
        List<String> before = oracle.currentFacts();

        assertEquals(ValidationResult.PRECONDITION_FAILED, oracle.validate("scanarea"));
        assertEquals(List.of("powered_on"), oracle.missingPreconditions("scanarea"));
        assertEquals(before, oracle.currentFacts());
    }

    @Test
    void testValidActionAppliesRetractThenAssert() {
        assertEquals(ValidationResult.VALID, oracle.validate("poweron"));

        List<String> facts = oracle.currentFacts();
        assertFalse(facts.contains("powered_off"));
        assertTrue(facts.contains("powered_on"));
    }

    @Test
    void testMoveForwardSwapsBatteryFacts() {
        oracle.validate("poweron");
        oracle.validate("scanarea");

        assertEquals(ValidationResult.VALID, oracle.validate("moveforward"));
        assertTrue(oracle.currentFacts().contains("battery_low"));
        assertFalse(oracle.currentFacts().contains("battery_full"));
    }

    @Test
    void testMissingPreconditionsListsOnlyFalseOnes() {
        oracle.validate("poweron");

        assertEquals(List.of("scanned"), oracle.missingPreconditions("pickobject"));
    }

    @Test
    void testReleaseRequiresHoldingObject() {
        oracle.validate("poweron");
        oracle.validate("scanarea");

        assertEquals(ValidationResult.PRECONDITION_FAILED, oracle.validate("releaseobject"));

        oracle.validate("pickobject");
        assertEquals(ValidationResult.VALID, oracle.validate("releaseobject"));
        assertFalse(oracle.currentFacts().contains("holding_object"));
    }

    @Test
    void testSeparateInstancesDoNotShareFacts() {
        oracle.validate("poweron");

        RuleBaseOracle other = new RuleBaseOracle(ruleBase);

        assertTrue(other.currentFacts().contains("powered_off"));
        assertFalse(other.currentFacts().contains("powered_on"));
    }

    @Test
    void testResetDiscardsPreviousRun() {
        oracle.validate("poweron");
        oracle.reset();

        assertEquals(ValidationResult.PRECONDITION_FAILED, oracle.validate("poweroff"));
    }

    @Test
    void testLoaderRejectsDuplicateActions() throws Exception {
        RuleBaseLoader loader = new RuleBaseLoader(new DefaultResourceLoader(), new ObjectMapper());
        String json = """
                {"actions": [{"name": "stop"}, {"name": "STOP"}]}
                """;

        assertThrows(RuleBaseException.class, () -> loader.parse(new ObjectMapper().readTree(json)));
    }

    @Test
    void testLoaderNormalizesIndependentlyOfDefaultLocale() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            RuleBaseLoader loader = new RuleBaseLoader(new DefaultResourceLoader(), new ObjectMapper());
            String json = """
                    {"initialFacts": ["POWERED_ON", "SCANNED", "OBJECT_DETECTED"],
                     "actions": [{"name": "PICKOBJECT",
                                  "preconditions": ["POWERED_ON", "SCANNED", "OBJECT_DETECTED"],
                                  "assert": ["HOLDING_OBJECT"]}]}
                    """;

            RuleBase parsed = loader.parse(new ObjectMapper().readTree(json));

            assertEquals(List.of("pickobject"), parsed.actionNames());
            assertEquals(List.of("powered_on", "scanned", "object_detected"), parsed.getInitialFacts());

            RuleBaseOracle tr = new RuleBaseOracle(parsed);
            tr.reset();
            assertEquals(ValidationResult.VALID, tr.validate("pickobject"));
            assertTrue(tr.currentFacts().contains("holding_object"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testLoaderRejectsMissingResource() {
        RuleBaseLoader loader = new RuleBaseLoader(new DefaultResourceLoader(), new ObjectMapper());

        assertThrows(RuleBaseException.class, () -> loader.load("classpath:rules/does-not-exist.json"));
    }
}
