package com.formalverify.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class OracleModeResolver {

    private final OracleMode mode;

    public OracleModeResolver(
        @Value("${verifier.oracle.mode:embedded}") String mode
    ) {
        this.mode = OracleMode.valueOf(mode.trim().toUpperCase());
    }

    public boolean isEmbedded() {
        return mode == OracleMode.EMBEDDED;
    }

    public boolean isRemote() {
        return mode == OracleMode.REMOTE;
    }

    public OracleMode getMode() {
        return mode;
    }
}
