package com.formalverify.core.oracle;

/**
 * Source of oracles. Every call returns an oracle for a new run; whether that
 * oracle owns its fact set is reported by {@link WorldStateOracle#sharesState()}.
 */
@FunctionalInterface
public interface WorldStateOracleFactory {

    WorldStateOracle open();
}
