package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one stage invocation: either a partial context update or a failure.
 *
 * <p>A failed result never carries updates, so a failing stage contributes nothing to the
 * merged context.
 */
public record StageResult(
    @JsonProperty("stageName") String stageName,
    @JsonProperty("updates") Map<String, Object> updates,
    @JsonProperty("error") StageError error
) {

    public StageResult {
        Objects.requireNonNull(stageName, "stageName");
        updates = error != null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(updates));
    }

    public static StageResult success(String stageName, Map<String, Object> updates) {
        return new StageResult(stageName, updates, null);
    }

    public static StageResult success(String stageName, String key, Object value) {
        return new StageResult(stageName, Map.of(key, value), null);
    }

    public static StageResult failure(String stageName, FailureKind kind, String message) {
        return new StageResult(stageName, Map.of(), StageError.of(stageName, kind, message));
    }

    @JsonIgnore
    public boolean succeeded() {
        return error == null;
    }
}
