package com.agentcouncil.orchestrator.gate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.common.stage.Stage;

import java.util.Set;

/**
 * A stage whose only output is a {@link Verdict} under {@code verdict}. How the verdict is
 * reached is up to the subclass; the feedback loop only consumes the outcome and reasons.
 */
public abstract class VerdictGate implements Stage {

    @Override
    public final Set<String> writes() {
        return Set.of(ContextKeys.VERDICT);
    }

    @Override
    public StageResult execute(PipelineContext context) {
        return StageResult.success(stageName(), ContextKeys.VERDICT, evaluate(context));
    }

    protected abstract Verdict evaluate(PipelineContext context);
}
