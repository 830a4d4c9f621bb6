package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StageError(
    @JsonProperty("stageName") String stageName,
    @JsonProperty("kind") FailureKind kind,
    @JsonProperty("message") String message
) {
    public static StageError of(String stageName, FailureKind kind, String message) {
        return new StageError(stageName, kind, message);
    }

    @Override
    public String toString() {
        return stageName + "[" + kind + "]: " + message;
    }
}
