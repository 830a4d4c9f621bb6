package com.agentcouncil.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Body of a pipeline trigger: the instrument and the initial context seed. */
public record PipelineRequest(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("seed") Map<String, Object> seed
) {}
