package com.agentcouncil.orchestrator.debate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.DebateJudgement;
import com.agentcouncil.common.model.DebateRecord;
import com.agentcouncil.common.model.ResearchSynthesis;
import com.agentcouncil.common.model.TradeAction;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Condenses the judged debate into a stance and a conviction in [0, 1]. */
public class ResearchSynthesizerStage extends CouncilStage {

    public static final String NAME = "research-synthesizer";

    public ResearchSynthesizerStage() {
        super(NAME,
            Set.of(ContextKeys.INSTRUMENT_ID, ContextKeys.DEBATE_RECORD, ContextKeys.DEBATE_JUDGEMENT),
            Set.of(ContextKeys.RESEARCH_SYNTHESIS));
    }

    @Override
    protected Map<String, Object> produce(PipelineContext context) {
        DebateJudgement judgement = context.require(ContextKeys.DEBATE_JUDGEMENT, DebateJudgement.class);
        DebateRecord record = context.require(ContextKeys.DEBATE_RECORD, DebateRecord.class);

        double total = judgement.bullScore() + judgement.bearScore();
        double conviction = total == 0.0 ? 0.0 : Math.abs(judgement.bullScore() - judgement.bearScore()) / total;
        TradeAction stance = judgement.winner().impliedAction();

        String summary = String.format(Locale.ROOT,
            "Research view on %s after %d debate turns: %s wins, stance %s with conviction %.2f. %s",
            context.instrumentId(), record.size(), judgement.winner(), stance, conviction,
            judgement.justification());
        return Map.of(ContextKeys.RESEARCH_SYNTHESIS, new ResearchSynthesis(stance, conviction, summary));
    }
}
