package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reasons of the last {@code REVISE} verdict, fed back to the re-executed decision stage.
 *
 * @param attempt the attempt whose output was rejected
 * @param reasons the gate's reasons, in the order the gate reported them
 */
public record PriorCritique(
    @JsonProperty("attempt") int attempt,
    @JsonProperty("reasons") List<String> reasons
) {

    public PriorCritique {
        reasons = List.copyOf(reasons);
    }

    /** True when any reason starts with the given prefix, e.g. a context key. */
    public boolean mentions(String prefix) {
        return reasons.stream().anyMatch(r -> r.startsWith(prefix));
    }
}
