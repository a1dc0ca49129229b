package com.formalverify.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formalverify.core.expander.TargetPoint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionSequenceParserTest {

    private final ObjectMapper         mapper = new ObjectMapper();
    private final ActionSequenceParser parser = new ActionSequenceParser();

    @Test
    void testArrayEntriesAreNormalized() throws Exception {
        List<ActionToken> tokens = parser.parseActions(json("[\" PowerOn \", \"SCANAREA\"]"));

        assertEquals(List.of(ActionToken.of("poweron"), ActionToken.of("scanarea")), tokens);
    }

    @Test
    void testNonStringEntryBecomesMalformedToken() throws Exception {
        List<ActionToken> tokens = parser.parseActions(json("[\"poweron\", 42]"));

        assertTrue(tokens.get(0).isWellFormed());
        assertFalse(tokens.get(1).isWellFormed());
        assertEquals("42", tokens.get(1).getName());
    }

    @Test
    void testBracketedStringIsSplit() throws Exception {
        List<ActionToken> tokens = parser.parseActions(json("\"[poweron, 'ScanArea', \\\"stop\\\" ,]\""));

        assertEquals(List.of(ActionToken.of("poweron"), ActionToken.of("scanarea"), ActionToken.of("stop")), tokens);
    }

    @Test
    void testMissingActionsIsRejected() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> parser.parseActions(null));
        assertEquals("Missing 'actions' in request", e.getMessage());
    }

    @Test
    void testNonListActionsIsRejected() throws Exception {
        JsonNode number = json("7");

        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> parser.parseActions(number));
        assertEquals("Actions must be a list", e.getMessage());
    }

    @Test
    void testTargetsAcceptPairsAndObjects() throws Exception {
        List<TargetPoint> targets = parser.parseTargets(json("[[5.0, 4], {\"x\": -1, \"y\": 2.5}]"));

        assertEquals(List.of(new TargetPoint(5.0, 4.0), new TargetPoint(-1.0, 2.5)), targets);
    }

    @Test
    void testMissingTargetsDefaultToEmpty() {
        assertTrue(parser.parseTargets(null).isEmpty());
    }

    @Test
    void testBadTargetIsRejected() throws Exception {
        JsonNode bad = json("[[1, \"two\"]]");

        assertThrows(InvalidRequestException.class, () -> parser.parseTargets(bad));
    }

    @Test
    void testAutoExpandDefaultsToTrue() throws Exception {
        assertTrue(parser.parseAutoExpand(null));
        assertFalse(parser.parseAutoExpand(json("false")));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
