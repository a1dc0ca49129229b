package com.formalverify.config;

public enum OracleMode {
    EMBEDDED,
    REMOTE
}
