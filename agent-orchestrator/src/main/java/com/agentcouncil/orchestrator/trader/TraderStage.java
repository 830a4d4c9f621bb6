package com.agentcouncil.orchestrator.trader;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.PriorCritique;
import com.agentcouncil.common.model.ResearchSynthesis;
import com.agentcouncil.common.model.RiskAssessment;
import com.agentcouncil.common.model.RiskLevel;
import com.agentcouncil.common.model.TradeAction;
import com.agentcouncil.orchestrator.debate.AnalystReports;
import com.agentcouncil.orchestrator.debate.CouncilStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Produces the trading decision from the research stance and the risk assessment.
 *
 * <p>A first attempt cites every analyst report plus the synthesis and the risk assessment.
 * When a critique of the previous attempt is present, the previous decision is revised
 * instead: evidence the critique names is dropped, an excessive confidence is capped at the
 * risk ceiling, and an unsupported action falls back to HOLD.
 */
public class TraderStage extends CouncilStage {

    private static final Logger log = LoggerFactory.getLogger(TraderStage.class);

    public static final String NAME = "trader";

    static final double HIGH_RISK_MIN_CONVICTION = 0.35;
    static final double NEUTRAL_CONFIDENCE = 0.5;

    public TraderStage() {
        super(NAME, declaredReads(), Set.of(ContextKeys.FINAL_DECISION));
    }

    private static Set<String> declaredReads() {
        Set<String> reads = new HashSet<>(AnalystReports.KEYS);
        reads.add(ContextKeys.INSTRUMENT_ID);
        reads.add(ContextKeys.RESEARCH_SYNTHESIS);
        reads.add(ContextKeys.RISK_ASSESSMENT);
        reads.add(ContextKeys.PRIOR_CRITIQUE);
        reads.add(ContextKeys.FINAL_DECISION);
        return reads;
    }

    @Override
    protected Map<String, Object> produce(PipelineContext context) {
        ResearchSynthesis synthesis = context.require(ContextKeys.RESEARCH_SYNTHESIS, ResearchSynthesis.class);
        RiskAssessment risk = context.require(ContextKeys.RISK_ASSESSMENT, RiskAssessment.class);

        FinalDecision previous = context.get(ContextKeys.FINAL_DECISION, FinalDecision.class).orElse(null);
        PriorCritique critique = context.get(ContextKeys.PRIOR_CRITIQUE, PriorCritique.class).orElse(null);

        FinalDecision decision = critique != null && previous != null
            ? revise(previous, critique, risk)
            : decide(context, synthesis, risk);
        return Map.of(ContextKeys.FINAL_DECISION, decision);
    }

    private FinalDecision decide(PipelineContext context, ResearchSynthesis synthesis, RiskAssessment risk) {
        TradeAction action = synthesis.stance();
        if (risk.level() == RiskLevel.HIGH && synthesis.conviction() < HIGH_RISK_MIN_CONVICTION) {
            action = TradeAction.HOLD;
        }
        double confidence = action.isDirectional()
            ? NEUTRAL_CONFIDENCE + 0.5 * synthesis.conviction()
            : NEUTRAL_CONFIDENCE;

        List<String> evidence = new ArrayList<>(AnalystReports.collect(context).keySet());
        evidence.add(ContextKeys.RESEARCH_SYNTHESIS);
        evidence.add(ContextKeys.RISK_ASSESSMENT);

        String rationale = String.format(Locale.ROOT,
            "%s on research stance %s (conviction %.2f) under %s risk",
            action, synthesis.stance(), synthesis.conviction(), risk.level());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("stance", synthesis.stance().name());
        metadata.put("conviction", synthesis.conviction());
        metadata.put("riskLevel", risk.level().name());
        metadata.put("revision", 0);

        return FinalDecision.pending(context.instrumentId(), action, rationale, confidence, evidence, metadata);
    }

    private FinalDecision revise(FinalDecision previous, PriorCritique critique, RiskAssessment risk) {
        List<String> kept = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (String key : previous.evidence()) {
            if (critique.mentions(key + " ")) dropped.add(key);
            else kept.add(key);
        }

        TradeAction action = previous.action();
        double confidence = previous.confidence();
        if (critique.mentions("action:")) {
            action = TradeAction.HOLD;
            confidence = Math.min(confidence, NEUTRAL_CONFIDENCE);
        }
        if (critique.mentions("confidence:")) {
            confidence = Math.min(confidence, risk.confidenceCeiling());
        }

        int revision = ((Number) previous.metadata().getOrDefault("revision", 0)).intValue() + 1;
        log.info("[{}] revising attempt {} decision. dropped={} action={} confidence={}",
            NAME, critique.attempt(), dropped, action, String.format("%.2f", confidence));

        Map<String, Object> metadata = new HashMap<>(previous.metadata());
        metadata.put("revision", revision);
        metadata.put("droppedEvidence", List.copyOf(dropped));

        String rationale = String.format(Locale.ROOT, "%s (revision %d after %d critique point(s))",
            action == previous.action() ? previous.rationale() : action + " after the cited evidence failed review",
            revision, critique.reasons().size());

        return FinalDecision.pending(previous.instrumentId(), action, rationale, confidence, kept, metadata);
    }
}
