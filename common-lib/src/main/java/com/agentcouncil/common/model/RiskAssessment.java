package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskAssessment(
    @JsonProperty("level") RiskLevel level,
    @JsonProperty("confidenceCeiling") double confidenceCeiling,
    @JsonProperty("summary") String summary
) {
    public static RiskAssessment of(RiskLevel level, String summary) {
        return new RiskAssessment(level, level.confidenceCeiling(), summary);
    }
}
