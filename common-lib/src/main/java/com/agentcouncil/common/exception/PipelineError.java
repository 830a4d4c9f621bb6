package com.agentcouncil.common.exception;

import com.agentcouncil.common.model.StageError;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Structured, serializable form of a {@link PipelineException}. */
public record PipelineError(
    @JsonProperty("type") ErrorType type,
    @JsonProperty("message") String message,
    @JsonProperty("unit") String unit,
    @JsonProperty("failures") List<StageError> failures
) {}
