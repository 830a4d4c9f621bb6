package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Binary outcome of a verdict gate plus its diagnostic reasons.
 *
 * <p>Construction does not reject a {@code REVISE} without reasons; the feedback controller
 * treats that as a contract violation of the gate that produced it.
 */
public record Verdict(
    @JsonProperty("outcome") VerdictOutcome outcome,
    @JsonProperty("reasons") List<String> reasons
) {

    public Verdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static Verdict accept() {
        return new Verdict(VerdictOutcome.ACCEPT, List.of());
    }

    public static Verdict revise(List<String> reasons) {
        return new Verdict(VerdictOutcome.REVISE, reasons);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return outcome == VerdictOutcome.ACCEPT;
    }
}
