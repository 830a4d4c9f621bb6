package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The pipeline's sole externally visible output.
 *
 * <p>Immutable; {@link #withVerification} returns a copy stamped with the feedback loop's
 * terminal status and the number of attempts it took.
 */
public record FinalDecision(
    @JsonProperty("instrumentId")  String instrumentId,
    @JsonProperty("action")        TradeAction action,
    @JsonProperty("rationale")     String rationale,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("evidence")      List<String> evidence,
    @JsonProperty("metadata")      Map<String, Object> metadata,
    @JsonProperty("verification")  VerificationStatus verification,
    @JsonProperty("attempts")      int attempts
) {

    public FinalDecision {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** A freshly produced decision that has not been through the verdict gate. */
    public static FinalDecision pending(String instrumentId, TradeAction action, String rationale,
                                        double confidence, List<String> evidence,
                                        Map<String, Object> metadata) {
        return new FinalDecision(instrumentId, action, rationale, confidence, evidence, metadata,
                                 VerificationStatus.PENDING, 0);
    }

    public FinalDecision withVerification(VerificationStatus status, int attempts) {
        return new FinalDecision(instrumentId, action, rationale, confidence, evidence, metadata,
                                 status, attempts);
    }

    @JsonIgnore
    public boolean isVerified() {
        return verification == VerificationStatus.VERIFIED;
    }
}
