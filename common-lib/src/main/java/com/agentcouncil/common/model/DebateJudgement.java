package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DebateJudgement(
    @JsonProperty("winner") DebateSide winner,
    @JsonProperty("bullScore") double bullScore,
    @JsonProperty("bearScore") double bearScore,
    @JsonProperty("justification") String justification
) {}
