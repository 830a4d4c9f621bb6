package com.agentcouncil.analysis.stage;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Base class for the analysts that run together in the fan-out group.
 *
 * <p>Each analyst reads the instrument id plus one seed field and writes exactly one
 * {@link AnalystReport} under its own key, so the analyst write-sets are disjoint by
 * construction.
 */
public abstract class AnalystStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(AnalystStage.class);

    private final String stageName;
    private final String inputKey;
    private final String outputKey;

    protected AnalystStage(String stageName, String inputKey, String outputKey) {
        this.stageName = stageName;
        this.inputKey  = inputKey;
        this.outputKey = outputKey;
    }

    @Override
    public String stageName() { return stageName; }

    @Override
    public Set<String> reads() {
        return Set.of(ContextKeys.INSTRUMENT_ID, inputKey);
    }

    @Override
    public Set<String> writes() {
        return Set.of(outputKey);
    }

    @Override
    public StageResult execute(PipelineContext context) {
        log.info("[{}] Analyzing instrument={}", stageName, context.instrumentId());
        AnalystReport report = analyze(context);
        log.info("[{}] complete. signal={} confidence={}", stageName, report.signal(),
                 String.format("%.2f", report.confidence()));
        return StageResult.success(stageName, outputKey, report);
    }

    protected abstract AnalystReport analyze(PipelineContext context);

    /** Reads a list-valued seed field; absent or wrongly typed input is a stage error. */
    protected List<?> requireList(PipelineContext context, String key) {
        Object value = context.fields().get(key);
        if (value == null) {
            throw new StageException(stageName, "No '" + key + "' in context for instrument="
                + context.instrumentId());
        }
        if (!(value instanceof List<?> list)) {
            throw new StageException(stageName, "'" + key + "' must be a list but was "
                + value.getClass().getSimpleName());
        }
        return list;
    }

    protected static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
