package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.context.ContextStore;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageFailureException;
import com.agentcouncil.common.model.FailureKind;
import com.agentcouncil.common.model.StageError;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.stage.Stage;
import com.agentcouncil.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs independent stages concurrently against one snapshot and merges their outputs as a
 * single context version.
 *
 * <p>All-or-nothing: if any member fails the group fails with every member failure it saw, and
 * nothing from the successful members is merged. With {@code cancelOnFailure} the first failure
 * cancels members that are still running; those are reported as {@link FailureKind#CANCELLED}.
 * Results are merged in declaration order, never completion order.
 */
public class FanOutGroup {

    private static final Logger log = LoggerFactory.getLogger(FanOutGroup.class);

    private final String groupName;
    private final List<Stage> stages;
    private final StageRunner runner;
    private final boolean cancelOnFailure;

    public FanOutGroup(String groupName, List<Stage> stages, StageRunner runner, boolean cancelOnFailure) {
        this.groupName = groupName;
        this.stages = List.copyOf(stages);
        this.runner = runner;
        this.cancelOnFailure = cancelOnFailure;
    }

    public Mono<PipelineContext> run(ContextStore store) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            PipelineContext snapshot = store.snapshot();
            Map<String, StageResult> completed = new ConcurrentHashMap<>();
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Dispatching {} stages in parallel. group={} contextVersion={}",
                    stages.size(), groupName, snapshot.version()));

            Flux<StageResult> outcomes = Flux.fromIterable(stages)
                .flatMap(stage -> runner.run(stage, snapshot), stages.size());
            if (cancelOnFailure) {
                outcomes = outcomes.takeUntil(result -> !result.succeeded());
            }

            return outcomes
                .doOnNext(result -> completed.put(result.stageName(), result))
                .then(Mono.fromCallable(() -> fanIn(store, completed, traceId)));
        });
    }

    private PipelineContext fanIn(ContextStore store, Map<String, StageResult> completed, String traceId) {
        List<StageResult> ordered = new ArrayList<>(stages.size());
        List<StageError> failures = new ArrayList<>();
        boolean anyFailed = completed.values().stream().anyMatch(r -> !r.succeeded());

        for (Stage stage : stages) {
            StageResult result = completed.get(stage.stageName());
            if (result == null) {
                failures.add(StageError.of(stage.stageName(), FailureKind.CANCELLED,
                    "cancelled after a sibling failed"));
            } else if (!result.succeeded()) {
                failures.add(result.error());
            } else {
                ordered.add(result);
            }
        }

        if (anyFailed) {
            TraceContextUtil.withMdc(traceId, () ->
                log.warn("Group failed; discarding {} completed result(s). group={} failures={}",
                    ordered.size(), groupName, failures));
            throw new StageFailureException(groupName, failures);
        }
        return store.mergeGroup(groupName, ordered);
    }
}
