package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.context.ContextStore;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageFailureException;
import com.agentcouncil.common.stage.Stage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs stages one after another in declaration order. Each stage sees the context produced by
 * everything before it; the first failure aborts the chain and no later stage executes.
 */
public class StageChain {

    private final String chainName;
    private final List<Stage> stages;
    private final StageRunner runner;

    public StageChain(String chainName, List<Stage> stages, StageRunner runner) {
        this.chainName = chainName;
        this.stages = List.copyOf(stages);
        this.runner = runner;
    }

    public String chainName() {
        return chainName;
    }

    public Mono<PipelineContext> run(ContextStore store) {
        return Flux.fromIterable(stages)
            .concatMap(stage -> Mono.defer(() -> runner.run(stage, store.snapshot()))
                .flatMap(result -> result.succeeded()
                    ? Mono.just(store.merge(result.updates()))
                    : Mono.error(new StageFailureException(chainName, result.error()))))
            .then(Mono.fromCallable(store::snapshot));
    }
}
