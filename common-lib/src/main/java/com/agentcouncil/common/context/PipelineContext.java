package com.agentcouncil.common.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned view of the shared pipeline state.
 *
 * <p>Instances are produced only by {@link ContextStore}. A snapshot handed to a stage never
 * changes afterwards, even when the store merges newer values.
 */
public record PipelineContext(
    @JsonProperty("version") int version,
    @JsonProperty("fields") Map<String, Object> fields
) {

    public PipelineContext {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = fields.get(key);
        if (value == null) return Optional.empty();
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Context field '" + key + "' is "
                + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return Optional.of(type.cast(value));
    }

    /** Like {@link #get} but fails when the field is absent. */
    public <T> T require(String key, Class<T> type) {
        return get(key, type).orElseThrow(() ->
            new IllegalStateException("Context field '" + key + "' is missing at version " + version));
    }

    public String instrumentId() {
        return get(ContextKeys.INSTRUMENT_ID, String.class).orElse(null);
    }
}
