package com.agentcouncil.orchestrator.debate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.DebateEntry;
import com.agentcouncil.common.model.DebateRecord;
import com.agentcouncil.common.model.DebateSide;
import com.agentcouncil.common.model.TradeAction;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One turn of the bull/bear research debate. The researcher argues from the analyst reports
 * that support its side, answers the opponent's last argument, and appends its turn to
 * {@code debate_record}.
 *
 * <p>The opening turn starts a new record and therefore does not read one.
 */
public class ResearcherStage extends CouncilStage {

    private final DebateSide side;
    private final int turn;

    public ResearcherStage(DebateSide side, int turn, boolean opening) {
        super(stageName(side, turn), readsFor(opening), Set.of(ContextKeys.DEBATE_RECORD));
        if (side == DebateSide.TIE) {
            throw new IllegalArgumentException("a researcher argues for BULL or BEAR");
        }
        this.side = side;
        this.turn = turn;
    }

    public static String stageName(DebateSide side, int turn) {
        return side.name().toLowerCase(Locale.ROOT) + "-researcher-" + turn;
    }

    public static String role(DebateSide side) {
        return side.name().toLowerCase(Locale.ROOT);
    }

    private static Set<String> readsFor(boolean opening) {
        Set<String> reads = new HashSet<>(AnalystReports.KEYS);
        reads.add(ContextKeys.INSTRUMENT_ID);
        if (!opening) {
            reads.add(ContextKeys.DEBATE_RECORD);
        }
        return reads;
    }

    @Override
    protected Map<String, Object> produce(PipelineContext context) {
        DebateRecord record = context.get(ContextKeys.DEBATE_RECORD, DebateRecord.class)
            .orElse(DebateRecord.empty());
        Map<String, AnalystReport> reports = AnalystReports.collect(context);
        TradeAction wanted = side.impliedAction();
        TradeAction opposed = side == DebateSide.BULL ? TradeAction.SELL : TradeAction.BUY;

        StringBuilder argument = new StringBuilder();
        argument.append(String.format(Locale.ROOT, "%s case for %s (turn %d): ",
            side, context.instrumentId(), turn));

        List<AnalystReport> support = reports.values().stream().filter(r -> r.signal() == wanted).toList();
        if (support.isEmpty()) {
            argument.append("no analyst signals ").append(wanted).append(" outright");
        } else {
            argument.append(support.size()).append(" report(s) signal ").append(wanted).append(": ");
            for (AnalystReport r : support) {
                argument.append(String.format(Locale.ROOT, "%s (%.2f); ", r.analyst(), r.confidence()));
            }
        }

        long against = reports.values().stream().filter(r -> r.signal() == opposed).count();
        List<DebateEntry> rebuttals = record.byRole(role(opposingSide()));
        if (!rebuttals.isEmpty()) {
            argument.append(String.format(Locale.ROOT,
                " Rebutting the %s: only %d report(s) back %s, total weight %.2f vs %.2f.",
                opposingSide().name().toLowerCase(Locale.ROOT), against, opposed,
                AnalystReports.weight(reports, opposed), AnalystReports.weight(reports, wanted)));
        }

        return Map.of(ContextKeys.DEBATE_RECORD, record.append(role(side), argument.toString().trim()));
    }

    private DebateSide opposingSide() {
        return side == DebateSide.BULL ? DebateSide.BEAR : DebateSide.BULL;
    }
}
