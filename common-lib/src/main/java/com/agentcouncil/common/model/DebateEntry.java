package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DebateEntry(
    @JsonProperty("role") String role,
    @JsonProperty("argument") String argument
) {}
