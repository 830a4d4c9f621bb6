package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.ContextStore;
import com.agentcouncil.common.exception.ContractViolationException;
import com.agentcouncil.common.trace.TraceContextUtil;
import com.agentcouncil.orchestrator.feedback.FeedbackController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point of the orchestration kernel.
 *
 * <h3>Execution order</h3>
 * <ol>
 *   <li>analyst fan-out group against the seed snapshot</li>
 *   <li>research chain: debate turns, judge, synthesis, risk debate, risk synthesis</li>
 *   <li>feedback loop: decision subsequence and verdict gate, at most {@code maxAttempts} times</li>
 * </ol>
 *
 * <p>The topology is validated once, at construction. The driver holds no per-run state; every
 * call to {@link #run} gets its own trace id, {@link ContextStore} and retry state, so concurrent
 * runs never share anything mutable.
 */
public class PipelineDriver {

    private static final Logger log = LoggerFactory.getLogger(PipelineDriver.class);

    static final String ANALYST_GROUP = "analyst-fan-out";
    static final String RESEARCH_CHAIN = "research-chain";
    static final String DECISION_SUBSEQUENCE = "decision-subsequence";
    static final String FEEDBACK_LOOP = "decision-feedback";

    private final PipelineTopology topology;
    private final StageListener listener;
    private final FanOutGroup analysts;
    private final StageChain research;
    private final FeedbackController feedback;

    public PipelineDriver(PipelineTopology topology, StageListener listener) {
        TopologyValidator.validate(topology);
        this.topology = topology;
        this.listener = listener != null ? listener : StageListener.NOOP;

        PipelineSettings settings = topology.settings();
        StageRunner runner = new StageRunner(settings.stageTimeout(), this.listener);
        this.analysts = new FanOutGroup(ANALYST_GROUP, topology.analysts(), runner, settings.cancelOnFailure());
        this.research = new StageChain(RESEARCH_CHAIN, topology.chain(), runner);
        this.feedback = new FeedbackController(FEEDBACK_LOOP,
            new StageChain(DECISION_SUBSEQUENCE, topology.revision(), runner),
            topology.gate(), runner, settings.maxAttempts(), this.listener);
    }

    public PipelineTopology topology() {
        return topology;
    }

    /**
     * Runs the whole pipeline for one instrument.
     *
     * @param instrumentId non-blank instrument identifier, stored under {@code instrument_id}
     * @param seed         initial context fields; may be {@code null} or empty, and may not
     *                     contain a field any stage or the feedback loop writes
     * @return the result, or an error signal carrying a
     *         {@link com.agentcouncil.common.exception.PipelineException}
     */
    public Mono<PipelineResult> run(String instrumentId, Map<String, Object> seed) {
        if (instrumentId == null || instrumentId.isBlank()) {
            return Mono.error(new IllegalArgumentException("instrumentId must not be blank"));
        }
        if (seed != null) {
            try {
                TopologyValidator.validateSeed(topology, seed.keySet());
            } catch (ContractViolationException e) {
                return Mono.error(e);
            }
        }
        String traceId = UUID.randomUUID().toString();

        Mono<PipelineResult> pipeline = Mono.defer(() -> {
            Map<String, Object> initial = new LinkedHashMap<>();
            if (seed != null) {
                initial.putAll(seed);
            }
            initial.put(ContextKeys.INSTRUMENT_ID, instrumentId);
            ContextStore store = new ContextStore(initial);

            TraceContextUtil.withMdc(traceId, () ->
                log.info("Pipeline run started. instrumentId={} seedKeys={} traceId={}",
                    instrumentId, initial.keySet(), traceId));

            return analysts.run(store)
                .then(Mono.defer(() -> research.run(store)))
                .then(Mono.defer(() -> feedback.run(store)))
                .map(outcome -> new PipelineResult(
                    traceId, instrumentId, outcome.decision(), outcome.state(),
                    outcome.attempts(), outcome.verdicts(), store.snapshot().version(), Instant.now()));
        })
        .doOnNext(result -> listener.onRunCompleted(traceId, instrumentId, result.state(), result.attempts()))
        .doOnError(e -> listener.onRunFailed(traceId, instrumentId, e));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
