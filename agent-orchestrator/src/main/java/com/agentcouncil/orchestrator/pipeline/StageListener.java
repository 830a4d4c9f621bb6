package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.model.StageError;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.orchestrator.feedback.FeedbackState;

import java.util.Set;

/**
 * Observability sink notified at stage boundaries. Implementations must not throw and must
 * not influence pipeline behavior; every method defaults to a no-op.
 */
public interface StageListener {

    StageListener NOOP = new StageListener() {};

    default void onStageStarted(String traceId, String stageName, int contextVersion) {}

    default void onStageSucceeded(String traceId, String stageName, Set<String> writtenKeys, long elapsedMs) {}

    default void onStageFailed(String traceId, StageError error) {}

    default void onStageCancelled(String traceId, String stageName) {}

    default void onVerdict(String traceId, int attempt, Verdict verdict) {}

    default void onRunCompleted(String traceId, String instrumentId, FeedbackState state, int attempts) {}

    default void onRunFailed(String traceId, String instrumentId, Throwable error) {}
}
