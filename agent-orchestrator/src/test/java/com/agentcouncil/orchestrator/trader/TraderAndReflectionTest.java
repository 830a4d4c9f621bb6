package com.agentcouncil.orchestrator.trader;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.PriorCritique;
import com.agentcouncil.common.model.ResearchSynthesis;
import com.agentcouncil.common.model.RiskAssessment;
import com.agentcouncil.common.model.RiskLevel;
import com.agentcouncil.common.model.TradeAction;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.common.model.VerdictOutcome;
import com.agentcouncil.orchestrator.gate.ReflectionGate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TraderAndReflectionTest {

    private final TraderStage trader = new TraderStage();
    private final ReflectionGate gate = new ReflectionGate();

    private static Map<String, Object> council(TradeAction stance, double conviction, RiskLevel risk,
                                               TradeAction newsSignal) {
        Map<String, Object> fields = new HashMap<>();
        fields.put(ContextKeys.INSTRUMENT_ID, "NVDA");
        fields.put(ContextKeys.TECHNICAL_REPORT, AnalystReport.of("technical", "t", TradeAction.BUY, 0.7, Map.of()));
        fields.put(ContextKeys.SENTIMENT_REPORT, AnalystReport.of("sentiment", "s", TradeAction.BUY, 0.6, Map.of()));
        fields.put(ContextKeys.NEWS_REPORT, AnalystReport.of("news", "n", newsSignal, 0.6, Map.of()));
        fields.put(ContextKeys.FUNDAMENTALS_REPORT, AnalystReport.of("fundamentals", "f", TradeAction.HOLD, 0.5, Map.of()));
        fields.put(ContextKeys.RESEARCH_SYNTHESIS, new ResearchSynthesis(stance, conviction, "synthesis"));
        fields.put(ContextKeys.RISK_ASSESSMENT, RiskAssessment.of(risk, "risk"));
        return fields;
    }

    private FinalDecision decide(Map<String, Object> fields) {
        return (FinalDecision) trader.execute(new PipelineContext(0, fields)).updates().get(ContextKeys.FINAL_DECISION);
    }

    private Verdict judge(Map<String, Object> fields, FinalDecision decision) {
        Map<String, Object> withDecision = new HashMap<>(fields);
        withDecision.put(ContextKeys.FINAL_DECISION, decision);
        return (Verdict) gate.execute(new PipelineContext(1, withDecision)).updates().get(ContextKeys.VERDICT);
    }

    @Nested
    @DisplayName("trader")
    class TraderTests {

        @Test
        @DisplayName("first attempt follows the stance and cites every report")
        void firstAttempt() {
            FinalDecision decision = decide(council(TradeAction.BUY, 0.4, RiskLevel.LOW, TradeAction.BUY));

            assertEquals(TradeAction.BUY, decision.action());
            assertEquals(0.7, decision.confidence(), 1e-9);
            assertEquals(6, decision.evidence().size());
            assertTrue(decision.evidence().contains(ContextKeys.RISK_ASSESSMENT));
        }

        @Test
        @DisplayName("HIGH risk with weak conviction → HOLD")
        void highRiskHold() {
            FinalDecision decision = decide(council(TradeAction.BUY, 0.2, RiskLevel.HIGH, TradeAction.BUY));
            assertEquals(TradeAction.HOLD, decision.action());
            assertEquals(0.5, decision.confidence(), 1e-9);
        }

        @Test
        @DisplayName("critique drops named evidence and caps confidence")
        void revision() {
            Map<String, Object> fields = council(TradeAction.BUY, 0.8, RiskLevel.MEDIUM, TradeAction.SELL);
            FinalDecision first = decide(fields);
            fields.put(ContextKeys.FINAL_DECISION, first);
            fields.put(ContextKeys.PRIOR_CRITIQUE, new PriorCritique(1, List.of(
                "news_report signals SELL and does not support BUY",
                "confidence: 0.90 exceeds the 0.75 ceiling for MEDIUM risk")));

            FinalDecision second = decide(fields);

            assertEquals(TradeAction.BUY, second.action());
            assertEquals(0.75, second.confidence(), 1e-9);
            assertFalse(second.evidence().contains(ContextKeys.NEWS_REPORT));
            assertEquals(List.of(ContextKeys.NEWS_REPORT), second.metadata().get("droppedEvidence"));
            assertEquals(1, second.metadata().get("revision"));
        }

        @Test
        @DisplayName("unsupported action falls back to HOLD")
        void unsupportedAction() {
            Map<String, Object> fields = council(TradeAction.BUY, 0.4, RiskLevel.LOW, TradeAction.BUY);
            fields.put(ContextKeys.FINAL_DECISION, decide(fields));
            fields.put(ContextKeys.PRIOR_CRITIQUE, new PriorCritique(1,
                List.of("action: BUY is not supported by any cited analyst report")));

            assertEquals(TradeAction.HOLD, decide(fields).action());
        }
    }

    @Nested
    @DisplayName("reflection gate")
    class GateTests {

        @Test
        @DisplayName("grounded decision → accept")
        void grounded() {
            Map<String, Object> fields = council(TradeAction.BUY, 0.4, RiskLevel.LOW, TradeAction.BUY);
            assertEquals(VerdictOutcome.ACCEPT, judge(fields, decide(fields)).outcome());
        }

        @Test
        @DisplayName("contradicting citation and excess confidence → revise with both reasons")
        void contradictionAndConfidence() {
            Map<String, Object> fields = council(TradeAction.BUY, 0.8, RiskLevel.MEDIUM, TradeAction.SELL);
            Verdict verdict = judge(fields, decide(fields));

            assertEquals(VerdictOutcome.REVISE, verdict.outcome());
            assertEquals(List.of(
                "news_report signals SELL and does not support BUY",
                "confidence: 0.90 exceeds the 0.75 ceiling for MEDIUM risk"), verdict.reasons());
        }

        @Test
        @DisplayName("citing an absent field → revise")
        void phantomEvidence() {
            Map<String, Object> fields = council(TradeAction.BUY, 0.4, RiskLevel.LOW, TradeAction.BUY);
            FinalDecision decision = FinalDecision.pending("NVDA", TradeAction.BUY, "r", 0.6,
                List.of(ContextKeys.TECHNICAL_REPORT, "insider_tip"), Map.of());

            assertEquals(List.of("insider_tip is cited but not present in the research record"),
                judge(fields, decision).reasons());
        }

        @Test
        @DisplayName("directional action without a supporting report → revise")
        void unsupported() {
            Map<String, Object> fields = council(TradeAction.BUY, 0.4, RiskLevel.LOW, TradeAction.BUY);
            FinalDecision decision = FinalDecision.pending("NVDA", TradeAction.BUY, "r", 0.6,
                List.of(ContextKeys.FUNDAMENTALS_REPORT), Map.of());

            assertEquals(List.of("action: BUY is not supported by any cited analyst report"),
                judge(fields, decision).reasons());
        }

        @Test
        @DisplayName("the gate only ever writes the verdict")
        void writesVerdictOnly() {
            assertEquals(java.util.Set.of(ContextKeys.VERDICT), gate.writes());
        }
    }
}
