package com.formalverify.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.formalverify.core.expander.TargetPoint;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ActionSequenceParser - turns the loosely-typed request body into engine input.
 *
 * {@code actions} is accepted as a JSON array or as a single bracketed,
 * comma-separated string ("[poweron, scanarea]"). Array entries that are not
 * strings become malformed tokens so the engine can report them step by step;
 * only a missing or wrongly-shaped {@code actions} field rejects the request.
 *
 * {@code manual_targets} is accepted as [[x, y], ...] or [{"x": .., "y": ..}, ...].
 */
@Component
public class ActionSequenceParser {

    public List<ActionToken> parseActions(JsonNode actionsNode) {
        if (actionsNode == null || actionsNode.isMissingNode() || actionsNode.isNull()) {
            throw new InvalidRequestException("Missing 'actions' in request");
        }

        if (actionsNode.isTextual()) {
            return parseBracketedList(actionsNode.asText());
        }

        if (!actionsNode.isArray()) {
            throw new InvalidRequestException("Actions must be a list");
        }

        List<ActionToken> tokens = new ArrayList<>();
        for (JsonNode entry : actionsNode) {
            if (entry.isTextual()) {
                tokens.add(ActionToken.of(entry.asText()));
            } else {
                tokens.add(ActionToken.malformed(entry.toString()));
            }
        }
        return tokens;
    }

    public List<TargetPoint> parseTargets(JsonNode targetsNode) {
        if (targetsNode == null || targetsNode.isMissingNode() || targetsNode.isNull()) {
            return Collections.emptyList();
        }
        if (!targetsNode.isArray()) {
            throw new InvalidRequestException("manual_targets must be a list of (x, y) pairs");
        }

        List<TargetPoint> targets = new ArrayList<>();
        for (JsonNode entry : targetsNode) {
            targets.add(parseTarget(entry));
        }
        return targets;
    }

    public boolean parseAutoExpand(JsonNode autoExpandNode) {
        if (autoExpandNode == null || autoExpandNode.isMissingNode() || autoExpandNode.isNull()) {
            return true;
        }
        if (!autoExpandNode.isBoolean()) {
            throw new InvalidRequestException("auto_expand must be a boolean");
        }
        return autoExpandNode.asBoolean();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<ActionToken> parseBracketedList(String text) {
        String body = text.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }

        List<ActionToken> tokens = new ArrayList<>();
        for (String part : body.split(",")) {
            String cleaned = stripQuotes(part.trim());
            if (!cleaned.isEmpty()) {
                tokens.add(ActionToken.of(cleaned));
            }
        }
        return tokens;
    }

    private String stripQuotes(String part) {
        if (part.length() >= 2) {
            char first = part.charAt(0);
            char last  = part.charAt(part.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return part.substring(1, part.length() - 1).trim();
            }
        }
        return part;
    }

    private TargetPoint parseTarget(JsonNode entry) {
        if (entry.isArray() && entry.size() == 2
                && entry.get(0).isNumber() && entry.get(1).isNumber()) {
            return new TargetPoint(entry.get(0).asDouble(), entry.get(1).asDouble());
        }
        if (entry.isObject() && entry.path("x").isNumber() && entry.path("y").isNumber()) {
            return new TargetPoint(entry.get("x").asDouble(), entry.get("y").asDouble());
        }
        throw new InvalidRequestException("Invalid manual target: " + entry);
    }
}
