package com.agentcouncil.orchestrator.feedback;

import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.Verdict;

import java.util.List;

/**
 * Terminal result of the feedback loop.
 *
 * @param state    ACCEPTED or EXHAUSTED
 * @param decision the last decision, stamped VERIFIED or UNVERIFIED
 * @param attempts number of decision attempts executed
 * @param verdicts one verdict per attempt, in order
 */
public record FeedbackOutcome(
    FeedbackState state,
    FinalDecision decision,
    int attempts,
    List<Verdict> verdicts
) {}
