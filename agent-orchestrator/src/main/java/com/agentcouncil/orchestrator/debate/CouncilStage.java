package com.agentcouncil.orchestrator.debate;

import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Base class of the stages that run after the analyst group: debaters, judge, synthesizers and
 * the trader. Subclasses return their updates; naming, declarations and logging live here.
 */
public abstract class CouncilStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(CouncilStage.class);

    private final String stageName;
    private final Set<String> reads;
    private final Set<String> writes;

    protected CouncilStage(String stageName, Set<String> reads, Set<String> writes) {
        this.stageName = stageName;
        this.reads = Set.copyOf(reads);
        this.writes = Set.copyOf(writes);
    }

    @Override
    public String stageName() { return stageName; }

    @Override
    public Set<String> reads() { return reads; }

    @Override
    public Set<String> writes() { return writes; }

    @Override
    public StageResult execute(PipelineContext context) {
        log.debug("[{}] running on contextVersion={} instrument={}",
            stageName, context.version(), context.instrumentId());
        Map<String, Object> updates = produce(context);
        log.info("[{}] complete. wrote={}", stageName, updates.keySet());
        return StageResult.success(stageName, updates);
    }

    protected abstract Map<String, Object> produce(PipelineContext context);
}
