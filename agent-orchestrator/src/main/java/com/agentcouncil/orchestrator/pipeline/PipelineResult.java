package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.orchestrator.feedback.FeedbackState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Successful outcome of one pipeline run. {@code state} is ACCEPTED when the decision passed the
 * verdict gate, EXHAUSTED when the retry budget ran out first.
 */
public record PipelineResult(
    @JsonProperty("traceId")        String traceId,
    @JsonProperty("instrumentId")   String instrumentId,
    @JsonProperty("decision")       FinalDecision decision,
    @JsonProperty("state")          FeedbackState state,
    @JsonProperty("attempts")       int attempts,
    @JsonProperty("verdicts")       List<Verdict> verdicts,
    @JsonProperty("contextVersion") int contextVersion,
    @JsonProperty("completedAt")    Instant completedAt
) {}
