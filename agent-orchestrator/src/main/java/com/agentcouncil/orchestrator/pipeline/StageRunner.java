package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.ContractViolationException;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.FailureKind;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.stage.Stage;
import com.agentcouncil.common.trace.TraceContextUtil;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;

/**
 * Invokes a single stage against a snapshot.
 *
 * <p>The stage body runs on {@code boundedElastic} under its time budget. Errors and timeouts
 * come back as a failed {@link StageResult} rather than an error signal, so callers decide how a
 * failure affects their unit. The one exception is a {@link ContractViolationException}, which
 * is never converted.
 */
public class StageRunner {

    private final Duration defaultTimeout;
    private final StageListener listener;

    public StageRunner(Duration defaultTimeout, StageListener listener) {
        this.defaultTimeout = defaultTimeout;
        this.listener = listener;
    }

    public Mono<StageResult> run(Stage stage, PipelineContext snapshot) {
        Duration timeout = stage.timeout() != null ? stage.timeout() : defaultTimeout;
        String name = stage.stageName();

        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            long startNanos = System.nanoTime();
            listener.onStageStarted(traceId, name, snapshot.version());

            return Mono.fromCallable(() -> TraceContextUtil.callWithMdc(traceId, () -> stage.execute(snapshot)))
                .subscribeOn(Schedulers.boundedElastic())
                .switchIfEmpty(Mono.fromSupplier(() ->
                    StageResult.failure(name, FailureKind.ERROR, "stage returned no result")))
                .timeout(timeout)
                .map(result -> checkContract(stage, result))
                .onErrorResume(e -> !(e instanceof ContractViolationException),
                               e -> Mono.just(toFailure(name, e, timeout)))
                .doOnNext(result -> {
                    if (result.succeeded()) {
                        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
                        listener.onStageSucceeded(traceId, name, result.updates().keySet(), elapsedMs);
                    } else {
                        listener.onStageFailed(traceId, result.error());
                    }
                })
                .doOnCancel(() -> listener.onStageCancelled(traceId, name));
        });
    }

    private static StageResult checkContract(Stage stage, StageResult result) {
        if (!stage.stageName().equals(result.stageName())) {
            throw new ContractViolationException(stage.stageName(),
                "result is labelled '" + result.stageName() + "'");
        }
        if (result.succeeded()) {
            Set<String> undeclared = new TreeSet<>(result.updates().keySet());
            undeclared.removeAll(stage.writes());
            if (!undeclared.isEmpty()) {
                throw new ContractViolationException(stage.stageName(),
                    "wrote undeclared field(s) " + undeclared + "; declared " + new TreeSet<>(stage.writes()));
            }
        }
        return result;
    }

    private static StageResult toFailure(String name, Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return StageResult.failure(name, FailureKind.TIMEOUT, "no result within " + timeout.toMillis() + "ms");
        }
        if (e instanceof StageException) {
            return StageResult.failure(name, FailureKind.ERROR, e.getMessage());
        }
        return StageResult.failure(name, FailureKind.ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
