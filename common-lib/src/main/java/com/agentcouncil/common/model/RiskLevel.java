package com.agentcouncil.common.model;

/**
 * Aggregate risk classification produced by the risk synthesizer, with the maximum decision
 * confidence tolerated at that level.
 */
public enum RiskLevel {
    LOW(0.90),
    MEDIUM(0.75),
    HIGH(0.60);

    private final double confidenceCeiling;

    RiskLevel(double confidenceCeiling) {
        this.confidenceCeiling = confidenceCeiling;
    }

    public double confidenceCeiling() {
        return confidenceCeiling;
    }
}
