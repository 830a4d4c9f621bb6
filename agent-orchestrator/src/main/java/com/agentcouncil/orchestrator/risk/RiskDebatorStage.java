package com.agentcouncil.orchestrator.risk;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.DebateRecord;
import com.agentcouncil.common.model.ResearchSynthesis;
import com.agentcouncil.common.model.TradeAction;
import com.agentcouncil.orchestrator.debate.AnalystReports;
import com.agentcouncil.orchestrator.debate.CouncilStage;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One voice of the risk debate. Each stance reads the research synthesis against the analyst
 * reports and appends its argument to {@code risk_debate}.
 */
public class RiskDebatorStage extends CouncilStage {

    private final RiskStance stance;

    public RiskDebatorStage(RiskStance stance, boolean opening) {
        super(stance.stageName(), readsFor(opening), Set.of(ContextKeys.RISK_DEBATE));
        this.stance = stance;
    }

    private static Set<String> readsFor(boolean opening) {
        Set<String> reads = new HashSet<>(AnalystReports.KEYS);
        reads.add(ContextKeys.RESEARCH_SYNTHESIS);
        if (!opening) {
            reads.add(ContextKeys.RISK_DEBATE);
        }
        return reads;
    }

    @Override
    protected Map<String, Object> produce(PipelineContext context) {
        ResearchSynthesis synthesis = context.require(ContextKeys.RESEARCH_SYNTHESIS, ResearchSynthesis.class);
        DebateRecord debate = context.get(ContextKeys.RISK_DEBATE, DebateRecord.class).orElse(DebateRecord.empty());
        Map<String, AnalystReport> reports = AnalystReports.collect(context);

        long dissent = reports.values().stream().filter(r -> r.signal().contradicts(synthesis.stance())).count();
        double avgConfidence = AnalystReports.averageConfidence(reports);

        String argument = switch (stance) {
            case AGGRESSIVE -> String.format(Locale.ROOT,
                "Act on %s: conviction %.2f is an edge worth sizing into; %d dissenting report(s) are noise.",
                synthesis.stance(), synthesis.conviction(), dissent);
            case NEUTRAL -> String.format(Locale.ROOT,
                "Balance: stance %s, average analyst confidence %.2f, %d of %d report(s) dissent. Size moderately.",
                synthesis.stance(), avgConfidence, dissent, reports.size());
            case CONSERVATIVE -> conservativeArgument(synthesis, dissent, avgConfidence);
        };
        return Map.of(ContextKeys.RISK_DEBATE, debate.append(stance.role(), argument));
    }

    private static String conservativeArgument(ResearchSynthesis synthesis, long dissent, double avgConfidence) {
        if (synthesis.stance() == TradeAction.HOLD) {
            return "No directional edge; holding is already the capital-preserving choice.";
        }
        return String.format(Locale.ROOT,
            "Protect capital: %d report(s) contradict %s and average confidence is only %.2f; cap exposure.",
            dissent, synthesis.stance(), avgConfidence);
    }
}
