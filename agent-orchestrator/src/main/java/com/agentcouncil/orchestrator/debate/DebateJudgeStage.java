package com.agentcouncil.orchestrator.debate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.DebateJudgement;
import com.agentcouncil.common.model.DebateRecord;
import com.agentcouncil.common.model.DebateSide;
import com.agentcouncil.common.model.TradeAction;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores the research debate. Each side is credited with the summed confidence of the reports
 * it argued from; a margin below {@code tieMargin} of the total is a tie.
 */
public class DebateJudgeStage extends CouncilStage {

    public static final String NAME = "debate-judge";

    private final double tieMargin;

    public DebateJudgeStage() {
        this(0.15);
    }

    public DebateJudgeStage(double tieMargin) {
        super(NAME, declaredReads(), Set.of(ContextKeys.DEBATE_JUDGEMENT));
        this.tieMargin = tieMargin;
    }

    private static Set<String> declaredReads() {
        Set<String> reads = new HashSet<>(AnalystReports.KEYS);
        reads.add(ContextKeys.DEBATE_RECORD);
        return reads;
    }

    @Override
    protected Map<String, Object> produce(PipelineContext context) {
        DebateRecord record = context.get(ContextKeys.DEBATE_RECORD, DebateRecord.class)
            .orElseThrow(() -> new StageException(NAME, "no debate record to judge"));
        String bullRole = ResearcherStage.role(DebateSide.BULL);
        String bearRole = ResearcherStage.role(DebateSide.BEAR);
        if (record.byRole(bullRole).isEmpty() || record.byRole(bearRole).isEmpty()) {
            throw new StageException(NAME, "debate record needs both sides, has " + record.size() + " turn(s)");
        }

        Map<String, AnalystReport> reports = AnalystReports.collect(context);
        double bull = AnalystReports.weight(reports, TradeAction.BUY);
        double bear = AnalystReports.weight(reports, TradeAction.SELL);
        double total = bull + bear;

        DebateSide winner;
        if (total == 0.0 || Math.abs(bull - bear) / total < tieMargin) {
            winner = DebateSide.TIE;
        } else {
            winner = bull > bear ? DebateSide.BULL : DebateSide.BEAR;
        }

        String justification = String.format(Locale.ROOT,
            "%d turns judged; bull weight %.2f vs bear weight %.2f (tie margin %.2f) → %s",
            record.size(), bull, bear, tieMargin, winner);
        return Map.of(ContextKeys.DEBATE_JUDGEMENT, new DebateJudgement(winner, bull, bear, justification));
    }
}
