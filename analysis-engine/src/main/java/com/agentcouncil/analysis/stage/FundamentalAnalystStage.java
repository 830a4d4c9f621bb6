package com.agentcouncil.analysis.stage;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.TradeAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Votes on valuation and balance-sheet ratios. Each available metric casts +1, 0 or -1;
 * missing metrics abstain.
 *
 * <ol>
 *   <li>revenueGrowth : &gt; 15% → +1, &lt; 0 → −1</li>
 *   <li>profitMargin  : &gt; 15% → +1, &lt; 0 → −1</li>
 *   <li>debtToEquity  : &lt; 1.0 → +1, &gt; 2.0 → −1</li>
 *   <li>peRatio       : 0–25 → +1, &gt; 40 or ≤ 0 → −1</li>
 *   <li>freeCashFlow  : positive → +1, negative → −1</li>
 * </ol>
 */
public class FundamentalAnalystStage extends AnalystStage {

    public static final String NAME = "fundamentals-analyst";

    public FundamentalAnalystStage() {
        super(NAME, ContextKeys.FUNDAMENTALS, ContextKeys.FUNDAMENTALS_REPORT);
    }

    @Override
    protected AnalystReport analyze(PipelineContext context) {
        Object raw = context.fields().get(ContextKeys.FUNDAMENTALS);
        if (!(raw instanceof Map<?, ?> fundamentals)) {
            throw new StageException(stageName(), "No fundamentals map in context for instrument="
                + context.instrumentId());
        }

        Map<String, Integer> votes = new LinkedHashMap<>();
        vote(votes, fundamentals, "revenueGrowth", v -> v > 0.15 ? 1 : v < 0 ? -1 : 0);
        vote(votes, fundamentals, "profitMargin",  v -> v > 0.15 ? 1 : v < 0 ? -1 : 0);
        vote(votes, fundamentals, "debtToEquity",  v -> v < 1.0 ? 1 : v > 2.0 ? -1 : 0);
        vote(votes, fundamentals, "peRatio",       v -> v > 0 && v <= 25 ? 1 : v > 40 || v <= 0 ? -1 : 0);
        vote(votes, fundamentals, "freeCashFlow",  v -> v > 0 ? 1 : v < 0 ? -1 : 0);

        if (votes.isEmpty()) {
            throw new StageException(stageName(), "None of the known ratios present for instrument="
                + context.instrumentId());
        }

        int score = votes.values().stream().mapToInt(Integer::intValue).sum();
        TradeAction signal = score >= 2 ? TradeAction.BUY
            : score <= -2 ? TradeAction.SELL
            : TradeAction.HOLD;
        double confidence = clamp(Math.min(0.4 + 0.1 * Math.abs(score), 0.9));

        List<String> parts = new ArrayList<>();
        votes.forEach((metric, v) -> parts.add(metric + (v > 0 ? "+" : v < 0 ? "-" : "=")));
        String summary = String.format("Fundamentals score %d from %s → Signal: %s",
            score, String.join(", ", parts), signal);

        Map<String, Object> metadata = new LinkedHashMap<>(votes);
        metadata.put("score", score);
        return AnalystReport.of(stageName(), summary, signal, confidence, metadata);
    }

    private interface Rule {
        int apply(double value);
    }

    private static void vote(Map<String, Integer> votes, Map<?, ?> fundamentals, String metric, Rule rule) {
        Object value = fundamentals.get(metric);
        if (value instanceof Number n) {
            votes.put(metric, rule.apply(n.doubleValue()));
        }
    }
}
