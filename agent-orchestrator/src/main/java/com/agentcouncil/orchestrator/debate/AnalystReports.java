package com.agentcouncil.orchestrator.debate;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.TradeAction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Read helpers over the four analyst reports produced by the fan-out group. */
public final class AnalystReports {

    public static final List<String> KEYS = List.of(
        ContextKeys.TECHNICAL_REPORT,
        ContextKeys.SENTIMENT_REPORT,
        ContextKeys.NEWS_REPORT,
        ContextKeys.FUNDAMENTALS_REPORT
    );

    private AnalystReports() {}

    /** Reports present in {@code context}, keyed by context field, in {@link #KEYS} order. */
    public static Map<String, AnalystReport> collect(PipelineContext context) {
        Map<String, AnalystReport> reports = new LinkedHashMap<>();
        for (String key : KEYS) {
            context.get(key, AnalystReport.class).ifPresent(r -> reports.put(key, r));
        }
        return reports;
    }

    /** Sum of the confidences of reports signalling {@code action}. */
    public static double weight(Map<String, AnalystReport> reports, TradeAction action) {
        return reports.values().stream()
            .filter(r -> r.signal() == action)
            .mapToDouble(AnalystReport::confidence)
            .sum();
    }

    public static double averageConfidence(Map<String, AnalystReport> reports) {
        return reports.values().stream().mapToDouble(AnalystReport::confidence).average().orElse(0.0);
    }
}
