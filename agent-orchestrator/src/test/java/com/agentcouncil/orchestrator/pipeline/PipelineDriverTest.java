package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.ContractViolationException;
import com.agentcouncil.common.exception.PipelineException;
import com.agentcouncil.common.exception.StageFailureException;
import com.agentcouncil.common.model.FailureKind;
import com.agentcouncil.common.model.FinalDecision;
import com.agentcouncil.common.model.PriorCritique;
import com.agentcouncil.common.model.StageResult;
import com.agentcouncil.common.model.TradeAction;
import com.agentcouncil.common.model.Verdict;
import com.agentcouncil.common.model.VerdictOutcome;
import com.agentcouncil.common.model.VerificationStatus;
import com.agentcouncil.common.stage.Stage;
import com.agentcouncil.orchestrator.CouncilSeeds;
import com.agentcouncil.orchestrator.config.OrchestratorConfig;
import com.agentcouncil.orchestrator.feedback.FeedbackState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDriverTest {

    private static final Duration WAIT = Duration.ofSeconds(20);

    private static final List<String> REPORTS = List.of("report_a", "report_b", "report_c", "report_d");

    private static List<Stage> fourAnalysts() {
        List<Stage> analysts = new ArrayList<>();
        for (int i = 0; i < REPORTS.size(); i++) {
            analysts.add(StubStage.writing("analyst-" + i, REPORTS.get(i), i));
        }
        return analysts;
    }

    private static StubStage synthesis() {
        return StubStage.of("synthesis", Set.copyOf(REPORTS), Set.of("summary"), ctx -> {
            for (String key : REPORTS) {
                if (!ctx.has(key)) {
                    return StageResult.failure("synthesis", FailureKind.ERROR, "missing " + key);
                }
            }
            return StageResult.success("synthesis", "summary", "all reports present");
        });
    }

    private static Stage trader() {
        return StubStage.of("trader", Set.of("summary"), Set.of(ContextKeys.FINAL_DECISION),
            ctx -> StageResult.success("trader", ContextKeys.FINAL_DECISION,
                FinalDecision.pending(ctx.instrumentId(), TradeAction.BUY, "ok", 0.6, List.of("summary"), Map.of())));
    }

    private static Stage acceptingGate() {
        return StubStage.writing("gate", ContextKeys.VERDICT, Verdict.accept());
    }

    @Nested
    @DisplayName("kernel scenarios")
    class KernelTests {

        @Test
        @DisplayName("4 analysts merge, chain proceeds, accepted on first attempt")
        void happyPath() {
            StubStage synthesis = synthesis();
            PipelineTopology topology = new PipelineTopology(fourAnalysts(), List.of(synthesis), List.of(trader()),
                acceptingGate(), Set.of(), PipelineSettings.defaults());

            PipelineResult result = new PipelineDriver(topology, StageListener.NOOP).run("NVDA", Map.of()).block(WAIT);

            assertNotNull(result);
            PipelineContext seenByChain = synthesis.seen().get(0);
            assertTrue(seenByChain.fields().keySet().containsAll(REPORTS));
            assertEquals(1, seenByChain.version());
            assertEquals(FeedbackState.ACCEPTED, result.state());
            assertEquals(1, result.attempts());
            assertEquals(VerificationStatus.VERIFIED, result.decision().verification());
            assertEquals("NVDA", result.decision().instrumentId());
            // seed 0, group 1, chain 2, decision 3, verdict 4
            assertEquals(4, result.contextVersion());
        }

        @Test
        @DisplayName("analyst timeout → group error, no chain stage runs")
        void analystTimeout() {
            List<Stage> analysts = new ArrayList<>(fourAnalysts());
            analysts.set(2, StubStage.writing("analyst-2", "report_c", 2)
                .delayed(Duration.ofSeconds(3)).withTimeout(Duration.ofMillis(100)));
            StubStage synthesis = synthesis();
            PipelineTopology topology = new PipelineTopology(analysts, List.of(synthesis), List.of(trader()),
                acceptingGate(), Set.of(), PipelineSettings.defaults());

            StageFailureException e = assertThrows(StageFailureException.class,
                () -> new PipelineDriver(topology, StageListener.NOOP).run("NVDA", Map.of()).block(WAIT));

            assertEquals(PipelineDriver.ANALYST_GROUP, e.getUnitName());
            assertEquals("analyst-2", e.getFailures().get(0).stageName());
            assertEquals(FailureKind.TIMEOUT, e.getFailures().get(0).kind());
            assertEquals(0, synthesis.executions());
        }

        @Test
        @DisplayName("seed providing a stage-owned field is rejected before any stage runs")
        void seedOverlapsStageWrites() {
            List<Stage> analysts = fourAnalysts();
            StubStage synthesis = synthesis();
            PipelineTopology topology = new PipelineTopology(analysts, List.of(synthesis), List.of(trader()),
                acceptingGate(), Set.of(), PipelineSettings.defaults());

            ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> new PipelineDriver(topology, StageListener.NOOP)
                    .run("NVDA", Map.of("report_b", 99, "summary", "forged")).block(WAIT));

            assertEquals(TopologyValidator.SEED_UNIT, e.getUnitName());
            assertTrue(e.getMessage().contains("report_b"));
            assertTrue(e.getMessage().contains("summary"));
            for (Stage analyst : analysts) {
                assertEquals(0, ((StubStage) analyst).executions());
            }
            assertEquals(0, synthesis.executions());
        }

        @Test
        @DisplayName("blank instrument id is rejected")
        void blankInstrument() {
            PipelineTopology topology = new PipelineTopology(fourAnalysts(), List.of(), List.of(trader()),
                acceptingGate(), Set.of("summary"), PipelineSettings.defaults());
            PipelineDriver driver = new PipelineDriver(topology, StageListener.NOOP);

            assertThrows(IllegalArgumentException.class, () -> driver.run(" ", Map.of()).block(WAIT));
        }

        @Test
        @DisplayName("each run gets its own trace id and store")
        void runsAreIsolated() {
            List<String> traces = Collections.synchronizedList(new ArrayList<>());
            StageListener listener = new StageListener() {
                @Override
                public void onRunCompleted(String traceId, String instrumentId, FeedbackState state, int attempts) {
                    traces.add(traceId);
                }
            };
            PipelineTopology topology = new PipelineTopology(fourAnalysts(), List.of(synthesis()), List.of(trader()),
                acceptingGate(), Set.of(), PipelineSettings.defaults());
            PipelineDriver driver = new PipelineDriver(topology, listener);

            PipelineResult first = driver.run("NVDA", Map.of()).block(WAIT);
            PipelineResult second = driver.run("AMD", Map.of()).block(WAIT);

            assertNotEquals(first.traceId(), second.traceId());
            assertEquals(List.of(first.traceId(), second.traceId()), traces);
            assertEquals(first.contextVersion(), second.contextVersion());
            assertEquals("AMD", second.decision().instrumentId());
        }

        @Test
        @DisplayName("stage events carry the run's trace id")
        void listenerEvents() {
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            StageListener listener = new StageListener() {
                @Override
                public void onStageSucceeded(String traceId, String stageName, Set<String> keys, long elapsedMs) {
                    events.add(traceId + ":" + stageName);
                }
            };
            PipelineTopology topology = new PipelineTopology(fourAnalysts(), List.of(synthesis()), List.of(trader()),
                acceptingGate(), Set.of(), PipelineSettings.defaults());

            PipelineResult result = new PipelineDriver(topology, listener).run("NVDA", Map.of()).block(WAIT);

            assertEquals(7, events.size());
            assertTrue(events.stream().allMatch(e -> e.startsWith(result.traceId() + ":")));
        }
    }

    @Nested
    @DisplayName("trading council end to end")
    class CouncilTests {

        private PipelineDriver council() {
            return new PipelineDriver(OrchestratorConfig.councilTopology(PipelineSettings.defaults(), 2),
                StageListener.NOOP);
        }

        @Test
        @DisplayName("unanimous BUY: over-confident first attempt is capped and accepted")
        void unanimousBuy() {
            PipelineResult result = council().run("NVDA", CouncilSeeds.bullish()).block(WAIT);

            assertEquals(FeedbackState.ACCEPTED, result.state());
            assertEquals(2, result.attempts());
            assertEquals(TradeAction.BUY, result.decision().action());
            assertEquals(0.90, result.decision().confidence(), 1e-9);
            assertTrue(result.decision().isVerified());
            assertEquals(VerdictOutcome.REVISE, result.verdicts().get(0).outcome());
            assertTrue(result.verdicts().get(0).reasons().get(0).startsWith("confidence:"));
            assertEquals(VerdictOutcome.ACCEPT, result.verdicts().get(1).outcome());
        }

        @Test
        @DisplayName("contradicting news report is dropped from the evidence on revision")
        void contradictingEvidenceDropped() {
            PipelineResult result = council().run("NVDA", CouncilSeeds.bullishWithBadNews()).block(WAIT);

            assertEquals(FeedbackState.ACCEPTED, result.state());
            assertEquals(2, result.attempts());
            assertEquals(TradeAction.BUY, result.decision().action());
            assertFalse(result.decision().evidence().contains(ContextKeys.NEWS_REPORT));
            assertTrue(result.decision().evidence().contains(ContextKeys.TECHNICAL_REPORT));
            assertEquals(List.of("news_report signals SELL and does not support BUY"),
                result.verdicts().get(0).reasons());
        }

        @Test
        @DisplayName("identical inputs → identical decision and verdict history")
        void idempotent() {
            PipelineDriver driver = council();
            PipelineResult first = driver.run("NVDA", CouncilSeeds.bullishWithBadNews()).block(WAIT);
            PipelineResult second = driver.run("NVDA", CouncilSeeds.bullishWithBadNews()).block(WAIT);

            assertEquals(first.decision(), second.decision());
            assertEquals(first.verdicts(), second.verdicts());
            assertEquals(first.contextVersion(), second.contextVersion());
        }

        @Test
        @DisplayName("seeded decision and critique cannot short-circuit the feedback loop")
        void seededLoopFieldsRejected() {
            Map<String, Object> seed = CouncilSeeds.bullish();
            seed.put(ContextKeys.FINAL_DECISION,
                FinalDecision.pending("OTHER", TradeAction.HOLD, "injected", 0.5, List.of(), Map.of()));
            seed.put(ContextKeys.PRIOR_CRITIQUE, new PriorCritique(1, List.of("confidence: too high")));

            ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> council().run("NVDA", seed).block(WAIT));

            assertEquals(TopologyValidator.SEED_UNIT, e.getUnitName());
            assertTrue(e.getMessage().contains(ContextKeys.FINAL_DECISION));
            assertTrue(e.getMessage().contains(ContextKeys.PRIOR_CRITIQUE));
        }

        @Test
        @DisplayName("seeded debate record is rejected instead of failing a researcher")
        void seededDebateRecordRejected() {
            Map<String, Object> seed = CouncilSeeds.bullish();
            seed.put(ContextKeys.DEBATE_RECORD, "junk");

            ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> council().run("NVDA", seed).block(WAIT));

            assertEquals(TopologyValidator.SEED_UNIT, e.getUnitName());
        }

        @Test
        @DisplayName("missing seed field fails the analyst group")
        void missingSeed() {
            Map<String, Object> seed = CouncilSeeds.bullish();
            seed.remove(ContextKeys.PRICES);

            PipelineException e = assertThrows(PipelineException.class,
                () -> council().run("NVDA", seed).block(WAIT));

            assertEquals(PipelineDriver.ANALYST_GROUP, e.getUnitName());
            assertTrue(e.getMessage().contains("technical-analyst"));
        }
    }
}
