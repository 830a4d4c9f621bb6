package com.agentcouncil.orchestrator.gate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.RiskAssessment;
import com.agentcouncil.common.model.TradeAction;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.orchestrator.debate.AnalystReports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Grounding check of the trader's decision against the research record.
 *
 * <p>Asks for a revision when the decision cites a field that is not in the context, cites an
 * analyst report whose signal contradicts the action, claims more confidence than the risk
 * level allows, or takes a directional action that no cited report supports. Each reason starts
 * with the field it concerns ({@code <key> ...}, {@code confidence: ...}, {@code action: ...}).
 */
public class ReflectionGate extends VerdictGate {

    private static final Logger log = LoggerFactory.getLogger(ReflectionGate.class);

    public static final String NAME = "reflection-gate";

    private static final double EPSILON = 1e-9;

    @Override
    public String stageName() {
        return NAME;
    }

    @Override
    public Set<String> reads() {
        Set<String> reads = new HashSet<>(AnalystReports.KEYS);
        reads.add(ContextKeys.FINAL_DECISION);
        reads.add(ContextKeys.RISK_ASSESSMENT);
        reads.add(ContextKeys.RESEARCH_SYNTHESIS);
        return reads;
    }

    @Override
    protected Verdict evaluate(PipelineContext context) {
        FinalDecision decision = context.require(ContextKeys.FINAL_DECISION, FinalDecision.class);
        RiskAssessment risk = context.require(ContextKeys.RISK_ASSESSMENT, RiskAssessment.class);
        TradeAction action = decision.action();

        List<String> reasons = new ArrayList<>();
        boolean supported = false;
        for (String key : decision.evidence()) {
            Object cited = context.fields().get(key);
            if (cited == null) {
                reasons.add(key + " is cited but not present in the research record");
            } else if (cited instanceof AnalystReport report) {
                if (report.signal().contradicts(action)) {
                    reasons.add(key + " signals " + report.signal() + " and does not support " + action);
                }
                supported |= report.signal() == action;
            }
        }

        if (decision.confidence() > risk.confidenceCeiling() + EPSILON) {
            reasons.add(String.format(Locale.ROOT, "confidence: %.2f exceeds the %.2f ceiling for %s risk",
                decision.confidence(), risk.confidenceCeiling(), risk.level()));
        }
        if (action.isDirectional() && !supported) {
            reasons.add("action: " + action + " is not supported by any cited analyst report");
        }

        if (reasons.isEmpty()) {
            log.info("[{}] decision grounded. action={} evidence={}", NAME, action, decision.evidence());
            return Verdict.accept();
        }
        log.info("[{}] revision requested. reasons={}", NAME, reasons);
        return Verdict.revise(reasons);
    }
}
