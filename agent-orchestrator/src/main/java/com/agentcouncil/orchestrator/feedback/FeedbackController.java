package com.agentcouncil.orchestrator.feedback;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.ContextStore;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.ContractViolationException;
import com.agentcouncil.common.exception.PipelineConfigurationException;
import com.agentcouncil.common.exception.StageFailureException;
import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.PriorCritique;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.model.VerificationStatus;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.common.model.VerdictOutcome;
import com.agentcouncil.common.stage.Stage;
import com.agentcouncil.common.trace.TraceContextUtil;
import com.agentcouncil.orchestrator.pipeline.StageChain;
import com.agentcouncil.orchestrator.pipeline.StageListener;
import com.agentcouncil.orchestrator.pipeline.StageRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Bounded revision loop around the decision subsequence.
 *
 * <h3>Transitions</h3>
 * <ol>
 *   <li>RUNNING: increment attempt, run the subsequence, then the verdict gate</li>
 *   <li>accept → ACCEPTED; the decision is returned VERIFIED</li>
 *   <li>revise, attempt &lt; max → write {@code prior_critique} and go again</li>
 *   <li>revise, attempt == max → EXHAUSTED; the last decision is returned UNVERIFIED</li>
 * </ol>
 *
 * <p>Only a {@code REVISE} verdict causes re-execution. A failing stage or gate propagates as
 * {@link StageFailureException}; a malformed verdict as {@link ContractViolationException}.
 */
public class FeedbackController {

    private static final Logger log = LoggerFactory.getLogger(FeedbackController.class);

    private final String loopName;
    private final StageChain subsequence;
    private final Stage gate;
    private final StageRunner runner;
    private final int maxAttempts;
    private final StageListener listener;

    public FeedbackController(String loopName, StageChain subsequence, Stage gate,
                              StageRunner runner, int maxAttempts, StageListener listener) {
        if (maxAttempts <= 0) {
            throw new PipelineConfigurationException(loopName, "max attempts must be > 0, was " + maxAttempts);
        }
        this.loopName = loopName;
        this.subsequence = subsequence;
        this.gate = gate;
        this.runner = runner;
        this.maxAttempts = maxAttempts;
        this.listener = listener;
    }

    public Mono<FeedbackOutcome> run(ContextStore store) {
        return Mono.defer(() -> iterate(store, new RetryState(maxAttempts)));
    }

    private Mono<FeedbackOutcome> iterate(ContextStore store, RetryState retry) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            int attempt = retry.beginAttempt();
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Decision attempt {}/{} starting. loop={}", attempt, maxAttempts, loopName));

            return subsequence.run(store)
                .then(Mono.defer(() -> runner.run(gate, store.snapshot())))
                .flatMap(result -> {
                    Verdict verdict = extractVerdict(result);
                    store.merge(result.updates());
                    FeedbackState next = retry.record(verdict);
                    listener.onVerdict(traceId, attempt, verdict);

                    if (next == FeedbackState.RUNNING) {
                        TraceContextUtil.withMdc(traceId, () ->
                            log.info("Decision revised at attempt {}/{}. reasons={} loop={}",
                                attempt, maxAttempts, verdict.reasons(), loopName));
                        store.merge(Map.of(ContextKeys.PRIOR_CRITIQUE,
                            new PriorCritique(attempt, verdict.reasons())));
                        return iterate(store, retry);
                    }
                    return Mono.just(finish(store.snapshot(), retry, traceId));
                });
        });
    }

    private Verdict extractVerdict(StageResult result) {
        if (!result.succeeded()) {
            throw new StageFailureException(loopName, result.error());
        }
        Map<String, Object> updates = result.updates();
        if (updates.size() != 1 || !updates.containsKey(ContextKeys.VERDICT)) {
            throw new ContractViolationException(gate.stageName(),
                "gate must write exactly '" + ContextKeys.VERDICT + "', wrote " + updates.keySet());
        }
        if (!(updates.get(ContextKeys.VERDICT) instanceof Verdict verdict)) {
            throw new ContractViolationException(gate.stageName(),
                "'" + ContextKeys.VERDICT + "' is not a Verdict");
        }
        if (verdict.outcome() == null) {
            throw new ContractViolationException(gate.stageName(), "verdict has no outcome");
        }
        if (verdict.outcome() == VerdictOutcome.REVISE && verdict.reasons().isEmpty()) {
            throw new ContractViolationException(gate.stageName(), "REVISE verdict without reasons");
        }
        return verdict;
    }

    private FeedbackOutcome finish(PipelineContext context, RetryState retry, String traceId) {
        FinalDecision decision = context.get(ContextKeys.FINAL_DECISION, FinalDecision.class)
            .orElseThrow(() -> new ContractViolationException(subsequence.chainName(),
                "no '" + ContextKeys.FINAL_DECISION + "' after attempt " + retry.attempt()));

        VerificationStatus status = retry.state() == FeedbackState.ACCEPTED
            ? VerificationStatus.VERIFIED
            : VerificationStatus.UNVERIFIED;
        if (status == VerificationStatus.UNVERIFIED) {
            TraceContextUtil.withMdc(traceId, () ->
                log.warn("Retry budget exhausted after {} attempt(s); returning unverified decision. loop={}",
                    retry.attempt(), loopName));
        }
        return new FeedbackOutcome(retry.state(), decision.withVerification(status, retry.attempt()),
                                   retry.attempt(), retry.history());
    }
}
