package com.agentcouncil.orchestrator.pipeline;

import java.time.Duration;

/**
 * Runtime knobs of the orchestration kernel.
 *
 * @param maxAttempts     upper bound on decision attempts inside the feedback loop
 * @param stageTimeout    default time budget of a stage without its own override
 * @param cancelOnFailure whether the first failure in a fan-out group cancels running siblings
 */
public record PipelineSettings(int maxAttempts, Duration stageTimeout, boolean cancelOnFailure) {

    public static PipelineSettings defaults() {
        return new PipelineSettings(3, Duration.ofSeconds(30), true);
    }
}
