package com.agentcouncil.orchestrator.logger;

import com.agentcouncil.common.model.StageError;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.common.trace.TraceContextUtil;
import com.agentcouncil.orchestrator.feedback.FeedbackState;
import com.agentcouncil.orchestrator.pipeline.StageListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Observability component for stage boundaries inside a pipeline run.
 *
 * <p>Logs each event of a run without introducing any business logic or modifying pipeline
 * behavior. The traceId passed in comes from the Reactor Context; it is bridged to MDC only for
 * the duration of each log call.
 *
 * <p>Events:
 * <ol>
 *   <li>{@link #STAGE_STARTED}   — a stage was handed a snapshot</li>
 *   <li>{@link #STAGE_SUCCEEDED} — a stage returned its updates</li>
 *   <li>{@link #STAGE_FAILED}    — a stage errored or timed out</li>
 *   <li>{@link #STAGE_CANCELLED} — a running stage was cancelled after a sibling failed</li>
 *   <li>{@link #VERDICT}         — the verdict gate judged a decision attempt</li>
 *   <li>{@link #RUN_COMPLETED} / {@link #RUN_FAILED}</li>
 * </ol>
 */
@Component
public class StageFlowLogger implements StageListener {

    private static final Logger log = LoggerFactory.getLogger(StageFlowLogger.class);

    public static final String STAGE_STARTED   = "STAGE_STARTED";
    public static final String STAGE_SUCCEEDED = "STAGE_SUCCEEDED";
    public static final String STAGE_FAILED    = "STAGE_FAILED";
    public static final String STAGE_CANCELLED = "STAGE_CANCELLED";
    public static final String VERDICT         = "VERDICT";
    public static final String RUN_COMPLETED   = "RUN_COMPLETED";
    public static final String RUN_FAILED      = "RUN_FAILED";

    @Override
    public void onStageStarted(String traceId, String stageName, int contextVersion) {
        TraceContextUtil.withMdc(traceId, () ->
            log.debug("[StageFlow] event={} stage={} contextVersion={} traceId={}",
                STAGE_STARTED, stageName, contextVersion, traceId));
    }

    @Override
    public void onStageSucceeded(String traceId, String stageName, Set<String> writtenKeys, long elapsedMs) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[StageFlow] event={} stage={} wrote={} latencyMs={} traceId={}",
                STAGE_SUCCEEDED, stageName, writtenKeys, elapsedMs, traceId));
    }

    @Override
    public void onStageFailed(String traceId, StageError error) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[StageFlow] event={} stage={} kind={} message={} traceId={}",
                STAGE_FAILED, error.stageName(), error.kind(), error.message(), traceId));
    }

    @Override
    public void onStageCancelled(String traceId, String stageName) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[StageFlow] event={} stage={} traceId={}", STAGE_CANCELLED, stageName, traceId));
    }

    @Override
    public void onVerdict(String traceId, int attempt, Verdict verdict) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[StageFlow] event={} attempt={} outcome={} reasons={} traceId={}",
                VERDICT, attempt, verdict.outcome(), verdict.reasons(), traceId));
    }

    @Override
    public void onRunCompleted(String traceId, String instrumentId, FeedbackState state, int attempts) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[StageFlow] event={} instrumentId={} state={} attempts={} traceId={}",
                RUN_COMPLETED, instrumentId, state, attempts, traceId));
    }

    @Override
    public void onRunFailed(String traceId, String instrumentId, Throwable error) {
        TraceContextUtil.withMdc(traceId, () ->
            log.error("[StageFlow] event={} instrumentId={} error={} traceId={}",
                RUN_FAILED, instrumentId, error.getMessage(), traceId));
    }
}
