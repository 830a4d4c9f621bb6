package com.agentcouncil.orchestrator.risk;

import java.util.Locale;

/** Positions argued in the risk debate, in speaking order. */
public enum RiskStance {
    AGGRESSIVE,
    NEUTRAL,
    CONSERVATIVE;

    public String role() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String stageName() {
        return role() + "-risk-debator";
    }
}
