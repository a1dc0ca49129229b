package com.formalverify.core.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formalverify.config.OracleModeResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * ConfiguredOracleFactory - hands out one oracle per verification run, as
 * selected by {@code verifier.oracle.mode}.
 *
 * EMBEDDED: loads the rule base once at startup; every {@link #open()} builds a
 *           fresh {@link RuleBaseOracle} with its own world state.
 * REMOTE:   every {@link #open()} returns a client for the shared remote fact
 *           store; the engine serializes those runs.
 */
@Component
public class ConfiguredOracleFactory implements WorldStateOracleFactory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredOracleFactory.class);

    private final OracleModeResolver modeResolver;
    private final ObjectMapper       objectMapper;
    private final RuleBase           ruleBase;
    private final RestTemplate       restTemplate;
    private final String             remoteBaseUrl;

    public ConfiguredOracleFactory(
            OracleModeResolver modeResolver,
            RuleBaseLoader ruleBaseLoader,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper,
            @Value("${verifier.rules.location:classpath:rules/robot-rules.json}") String rulesLocation,
            @Value("${verifier.oracle.remote.base-url:http://localhost:5001}") String remoteBaseUrl,
            @Value("${verifier.oracle.remote.timeout-ms:5000}") long remoteTimeoutMs
    ) {
        this.modeResolver  = modeResolver;
        this.objectMapper  = objectMapper;
        this.remoteBaseUrl = remoteBaseUrl;

        if (modeResolver.isEmbedded()) {
            this.ruleBase     = ruleBaseLoader.load(rulesLocation);
            this.restTemplate = null;
        } else {
            this.ruleBase     = null;
            this.restTemplate = restTemplateBuilder
                    .setConnectTimeout(Duration.ofMillis(remoteTimeoutMs))
                    .setReadTimeout(Duration.ofMillis(remoteTimeoutMs))
                    .build();
        }

        log.info("[Oracle] Mode: {}{}", modeResolver.getMode(),
                modeResolver.isRemote() ? " (" + remoteBaseUrl + ")" : "");
    }

    @Override
    public WorldStateOracle open() {
        if (modeResolver.isEmbedded()) {
            return new RuleBaseOracle(ruleBase);
        }
        return new RemoteWorldStateOracle(restTemplate, objectMapper, remoteBaseUrl);
    }

    /**
     * Known action names, in rule-base declaration order.
     */
    public List<String> knownActions() {
        if (modeResolver.isEmbedded()) {
            return ruleBase.actionNames();
        }
        return new RemoteWorldStateOracle(restTemplate, objectMapper, remoteBaseUrl).actionCatalog();
    }
}
