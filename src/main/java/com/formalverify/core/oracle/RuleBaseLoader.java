package com.formalverify.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * RuleBaseLoader - reads the declarative rule file into a {@link RuleBase}.
 *
 * Expected shape:
 * <pre>
 * {
 *   "initialFacts": ["powered_off", ...],
 *   "actions": [
 *     {"name": "poweron", "preconditions": ["powered_off"],
 *      "retract": ["powered_off"], "assert": ["powered_on"]},
 *     ...
 *   ]
 * }
 * </pre>
 * Names are normalised to lower case. Missing effect lists mean "no change".
 */
@Component
public class RuleBaseLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleBaseLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper   objectMapper;

    public RuleBaseLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    public RuleBase load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleBaseException("Rule base not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            RuleBase ruleBase = parse(objectMapper.readTree(in));
            log.info("[RuleBase] Loaded {} actions from {} (initial facts: {})",
                    ruleBase.size(), location, ruleBase.getInitialFacts());
            return ruleBase;
        } catch (IOException e) {
            log.error("[RuleBase] Failed to read {}", location, e);
            throw new RuleBaseException("Cannot read rule base " + location + ": " + e.getMessage(), e);
        }
    }

    RuleBase parse(JsonNode root) {
        if (root == null || !root.path("actions").isArray()) {
            throw new RuleBaseException("Rule base must contain an 'actions' array");
        }

        List<ActionRule> rules = new ArrayList<>();
        for (JsonNode actionNode : root.get("actions")) {
            String name = actionNode.path("name").asText("").trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                throw new RuleBaseException("Action entry without a name: " + actionNode);
            }
            rules.add(new ActionRule(
                    name,
                    atoms(actionNode.path("preconditions")),
                    atoms(actionNode.path("retract")),
                    atoms(actionNode.path("assert"))
            ));
        }

        return new RuleBase(rules, atoms(root.path("initialFacts")));
    }

    private List<String> atoms(JsonNode node) {
        List<String> atoms = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return atoms;
        }
        if (!node.isArray()) {
            throw new RuleBaseException("Expected a list of atoms, got: " + node);
        }
        for (JsonNode atom : node) {
            if (!atom.isTextual() || atom.asText().isBlank()) {
                throw new RuleBaseException("Fact atoms must be non-empty strings, got: " + atom);
            }
            atoms.add(atom.asText().trim().toLowerCase(Locale.ROOT));
        }
        return atoms;
    }
}
