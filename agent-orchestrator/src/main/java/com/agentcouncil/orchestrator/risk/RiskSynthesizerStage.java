package com.agentcouncil.orchestrator.risk;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.DebateRecord;
import com.agentcouncil.common.model.ResearchSynthesis;
import com.agentcouncil.common.model.RiskAssessment;
import com.agentcouncil.common.model.RiskLevel;
import com.agentcouncil.orchestrator.debate.AnalystReports;
import com.agentcouncil.orchestrator.debate.CouncilStage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the risk debate into a risk level.
 *
 * <p>Risk flags: one per analyst report contradicting the research stance, one for a conviction
 * below {@value #LOW_CONVICTION}, one for an average analyst confidence below
 * {@value #LOW_CONFIDENCE}. No flags is LOW, one is MEDIUM, two or more HIGH.
 */
public class RiskSynthesizerStage extends CouncilStage {

    public static final String NAME = "risk-synthesizer";

    static final double LOW_CONVICTION = 0.2;
    static final double LOW_CONFIDENCE = 0.45;

    public RiskSynthesizerStage() {
        super(NAME, declaredReads(), Set.of(ContextKeys.RISK_ASSESSMENT));
    }

    private static Set<String> declaredReads() {
        Set<String> reads = new HashSet<>(AnalystReports.KEYS);
        reads.add(ContextKeys.RESEARCH_SYNTHESIS);
        reads.add(ContextKeys.RISK_DEBATE);
        return reads;
    }

    @Override
    protected Map<String, Object> produce(PipelineContext context) {
        ResearchSynthesis synthesis = context.require(ContextKeys.RESEARCH_SYNTHESIS, ResearchSynthesis.class);
        DebateRecord debate = context.get(ContextKeys.RISK_DEBATE, DebateRecord.class)
            .orElseThrow(() -> new StageException(NAME, "no risk debate to synthesize"));
        Map<String, AnalystReport> reports = AnalystReports.collect(context);

        List<String> flags = new ArrayList<>();
        reports.forEach((key, report) -> {
            if (report.signal().contradicts(synthesis.stance())) {
                flags.add(key + " contradicts " + synthesis.stance());
            }
        });
        if (synthesis.conviction() < LOW_CONVICTION) {
            flags.add(String.format(Locale.ROOT, "low conviction %.2f", synthesis.conviction()));
        }
        double avgConfidence = AnalystReports.averageConfidence(reports);
        if (avgConfidence < LOW_CONFIDENCE) {
            flags.add(String.format(Locale.ROOT, "low analyst confidence %.2f", avgConfidence));
        }

        RiskLevel level = flags.isEmpty() ? RiskLevel.LOW
            : flags.size() == 1 ? RiskLevel.MEDIUM
            : RiskLevel.HIGH;
        String summary = String.format(Locale.ROOT, "Risk %s after %d risk argument(s); flags=%s",
            level, debate.size(), flags);
        return Map.of(ContextKeys.RISK_ASSESSMENT, RiskAssessment.of(level, summary));
    }
}
