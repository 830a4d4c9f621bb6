package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.stage.Stage;

import java.util.List;
import java.util.Set;

/**
 * The fixed shape of the pipeline: a parallel analyst group, a sequential research chain, and a
 * revision subsequence guarded by a verdict gate.
 *
 * @param analysts  stages of the fan-out group; write-sets must be pairwise disjoint
 * @param chain     stages run in order after the group
 * @param revision  stages re-executed on every decision attempt
 * @param gate      stage judging each attempt; writes only {@code verdict}
 * @param seedKeys  fields the caller provides in the initial context, besides {@code instrument_id}
 * @param settings  kernel settings
 */
public record PipelineTopology(
    List<Stage> analysts,
    List<Stage> chain,
    List<Stage> revision,
    Stage gate,
    Set<String> seedKeys,
    PipelineSettings settings
) {

    public PipelineTopology {
        analysts = analysts == null ? List.of() : List.copyOf(analysts);
        chain    = chain == null ? List.of() : List.copyOf(chain);
        revision = revision == null ? List.of() : List.copyOf(revision);
        seedKeys = seedKeys == null ? Set.of() : Set.copyOf(seedKeys);
    }
}
