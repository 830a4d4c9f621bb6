package com.agentcouncil.orchestrator.debate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.DebateJudgement;
import com.agentcouncil.common.model.DebateRecord;
import com.agentcouncil.common.model.DebateSide;
import com.agentcouncil.common.model.ResearchSynthesis;
import com.agentcouncil.common.model.RiskAssessment;
import com.agentcouncil.common.model.RiskLevel;
import com.agentcouncil.common.model.TradeAction;
import com.agentcouncil.orchestrator.risk.RiskDebatorStage;
import com.agentcouncil.orchestrator.risk.RiskStance;
import com.agentcouncil.orchestrator.risk.RiskSynthesizerStage;
import com.agentcouncil.orchestrator.trader.TraderStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Debate, judgement and risk stages over hand-built analyst reports.
 */
class CouncilStagesTest {

    private static AnalystReport report(String analyst, TradeAction signal, double confidence) {
        return AnalystReport.of(analyst, analyst + " says " + signal, signal, confidence, Map.of());
    }

    private static Map<String, Object> reports(TradeAction technical, TradeAction sentiment,
                                               TradeAction news, TradeAction fundamentals) {
        Map<String, Object> fields = new HashMap<>();
        fields.put(ContextKeys.INSTRUMENT_ID, "NVDA");
        fields.put(ContextKeys.TECHNICAL_REPORT, report("technical", technical, 0.7));
        fields.put(ContextKeys.SENTIMENT_REPORT, report("sentiment", sentiment, 0.6));
        fields.put(ContextKeys.NEWS_REPORT, report("news", news, 0.6));
        fields.put(ContextKeys.FUNDAMENTALS_REPORT, report("fundamentals", fundamentals, 0.8));
        return fields;
    }

    private static PipelineContext ctx(Map<String, Object> fields) {
        return new PipelineContext(0, fields);
    }

    @SuppressWarnings("unchecked")
    private static <T> T output(Map<String, Object> fields, com.agentcouncil.common.stage.Stage stage, String key) {
        return (T) stage.execute(ctx(fields)).updates().get(key);
    }

    @Nested
    @DisplayName("research debate")
    class DebateTests {

        @Test
        @DisplayName("researchers append turns without touching earlier records")
        void appendOnly() {
            Map<String, Object> fields = reports(TradeAction.BUY, TradeAction.BUY, TradeAction.SELL, TradeAction.HOLD);
            DebateRecord afterBull = output(fields, new ResearcherStage(DebateSide.BULL, 1, true), ContextKeys.DEBATE_RECORD);
            fields.put(ContextKeys.DEBATE_RECORD, afterBull);
            DebateRecord afterBear = output(fields, new ResearcherStage(DebateSide.BEAR, 1, false), ContextKeys.DEBATE_RECORD);

            assertEquals(1, afterBull.size());
            assertEquals(2, afterBear.size());
            assertEquals("bull", afterBear.entries().get(0).role());
            assertTrue(afterBear.entries().get(1).argument().contains("Rebutting the bull"));
        }

        @Test
        @DisplayName("opening researcher does not declare the debate record as input")
        void openingReads() {
            assertFalse(new ResearcherStage(DebateSide.BULL, 1, true).reads().contains(ContextKeys.DEBATE_RECORD));
            assertTrue(new ResearcherStage(DebateSide.BEAR, 1, false).reads().contains(ContextKeys.DEBATE_RECORD));
            assertEquals("bear-researcher-2", new ResearcherStage(DebateSide.BEAR, 2, false).stageName());
        }

        @Test
        @DisplayName("judge, risk synthesizer and trader expose their input fields through reads()")
        void declaredInputs() {
            Set<String> judge = new DebateJudgeStage().reads();
            assertTrue(judge.containsAll(AnalystReports.KEYS));
            assertTrue(judge.contains(ContextKeys.DEBATE_RECORD));

            Set<String> risk = new RiskSynthesizerStage().reads();
            assertTrue(risk.containsAll(Set.of(ContextKeys.RESEARCH_SYNTHESIS, ContextKeys.RISK_DEBATE)));

            Set<String> trader = new TraderStage().reads();
            assertTrue(trader.containsAll(Set.of(ContextKeys.PRIOR_CRITIQUE, ContextKeys.FINAL_DECISION,
                ContextKeys.RISK_ASSESSMENT, ContextKeys.RESEARCH_SYNTHESIS)));
        }

        @Test
        @DisplayName("judge credits summed confidence per side")
        void judgeScores() {
            Map<String, Object> fields = reports(TradeAction.BUY, TradeAction.BUY, TradeAction.SELL, TradeAction.HOLD);
            fields.put(ContextKeys.DEBATE_RECORD, DebateRecord.empty().append("bull", "b").append("bear", "s"));

            DebateJudgement judgement = output(fields, new DebateJudgeStage(), ContextKeys.DEBATE_JUDGEMENT);

            assertEquals(DebateSide.BULL, judgement.winner());
            assertEquals(1.3, judgement.bullScore(), 1e-9);
            assertEquals(0.6, judgement.bearScore(), 1e-9);
        }

        @Test
        @DisplayName("balanced reports → TIE")
        void judgeTie() {
            Map<String, Object> fields = reports(TradeAction.HOLD, TradeAction.BUY, TradeAction.SELL, TradeAction.HOLD);
            fields.put(ContextKeys.DEBATE_RECORD, DebateRecord.empty().append("bull", "b").append("bear", "s"));

            DebateJudgement judgement = output(fields, new DebateJudgeStage(), ContextKeys.DEBATE_JUDGEMENT);
            assertEquals(DebateSide.TIE, judgement.winner());
        }

        @Test
        @DisplayName("one-sided record cannot be judged")
        void judgeNeedsBothSides() {
            Map<String, Object> fields = reports(TradeAction.BUY, TradeAction.BUY, TradeAction.SELL, TradeAction.HOLD);
            fields.put(ContextKeys.DEBATE_RECORD, DebateRecord.empty().append("bull", "b"));
            assertThrows(StageException.class, () -> new DebateJudgeStage().execute(ctx(fields)));
        }

        @Test
        @DisplayName("synthesizer turns the margin into conviction")
        void synthesis() {
            Map<String, Object> fields = new HashMap<>();
            fields.put(ContextKeys.INSTRUMENT_ID, "NVDA");
            fields.put(ContextKeys.DEBATE_RECORD, DebateRecord.empty().append("bull", "b").append("bear", "s"));
            fields.put(ContextKeys.DEBATE_JUDGEMENT, new DebateJudgement(DebateSide.BEAR, 0.5, 1.5, "bear wins"));

            ResearchSynthesis synthesis = output(fields, new ResearchSynthesizerStage(), ContextKeys.RESEARCH_SYNTHESIS);

            assertEquals(TradeAction.SELL, synthesis.stance());
            assertEquals(0.5, synthesis.conviction(), 1e-9);
        }
    }

    @Nested
    @DisplayName("risk debate")
    class RiskTests {

        private Map<String, Object> withSynthesis(Map<String, Object> fields, TradeAction stance, double conviction) {
            fields.put(ContextKeys.RESEARCH_SYNTHESIS, new ResearchSynthesis(stance, conviction, "s"));
            return fields;
        }

        private RiskAssessment assess(Map<String, Object> fields) {
            Map<String, Object> working = new HashMap<>(fields);
            for (RiskStance stance : RiskStance.values()) {
                DebateRecord next = output(working, new RiskDebatorStage(stance, stance == RiskStance.AGGRESSIVE),
                    ContextKeys.RISK_DEBATE);
                working.put(ContextKeys.RISK_DEBATE, next);
            }
            assertEquals(3, ((DebateRecord) working.get(ContextKeys.RISK_DEBATE)).size());
            return output(working, new RiskSynthesizerStage(), ContextKeys.RISK_ASSESSMENT);
        }

        @Test
        @DisplayName("no flags → LOW")
        void low() {
            RiskAssessment risk = assess(withSynthesis(
                reports(TradeAction.BUY, TradeAction.BUY, TradeAction.HOLD, TradeAction.BUY), TradeAction.BUY, 1.0));
            assertEquals(RiskLevel.LOW, risk.level());
            assertEquals(0.90, risk.confidenceCeiling(), 1e-9);
        }

        @Test
        @DisplayName("one contradicting report → MEDIUM")
        void medium() {
            RiskAssessment risk = assess(withSynthesis(
                reports(TradeAction.BUY, TradeAction.BUY, TradeAction.SELL, TradeAction.BUY), TradeAction.BUY, 0.5));
            assertEquals(RiskLevel.MEDIUM, risk.level());
        }

        @Test
        @DisplayName("contradiction plus low conviction → HIGH")
        void high() {
            RiskAssessment risk = assess(withSynthesis(
                reports(TradeAction.BUY, TradeAction.SELL, TradeAction.HOLD, TradeAction.BUY), TradeAction.BUY, 0.1));
            assertEquals(RiskLevel.HIGH, risk.level());
        }
    }
}
