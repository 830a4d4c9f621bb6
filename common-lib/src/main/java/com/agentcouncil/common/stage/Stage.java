package com.agentcouncil.common.stage;

import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.StageResult;

import java.time.Duration;
import java.util.Set;

/**
 * A unit of work in the decision pipeline.
 *
 * <p>A stage declares, ahead of execution, which context fields it reads and which it writes.
 * The orchestrator checks those declarations when the pipeline is composed and again against
 * every successful result. Stages receive an immutable snapshot and must not depend on
 * siblings running in the same fan-out group.
 *
 * <p>Implementations either return {@link StageResult#failure} or throw; both end up as a
 * stage failure. Any external collaborator a stage needs (credentials, endpoints, thresholds)
 * is passed in through its constructor.
 */
public interface Stage {

    String stageName();

    Set<String> reads();

    Set<String> writes();

    StageResult execute(PipelineContext context);

    /** Per-stage time budget; {@code null} means the pipeline default applies. */
    default Duration timeout() {
        return null;
    }
}
