package com.agentcouncil.analysis.stage;

import com.agentcouncil.analysis.indicator.PriceSeries;
import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.exception.StageException;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.TradeAction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Trend-following read of the price history: SMA20/SMA50 trend, MACD confirmation and an RSI
 * exhaustion filter.
 */
public class TechnicalAnalystStage extends AnalystStage {

    public static final String NAME = "technical-analyst";

    private final double overbought;
    private final double oversold;

    public TechnicalAnalystStage() {
        this(70.0, 30.0);
    }

    public TechnicalAnalystStage(double overbought, double oversold) {
        super(NAME, ContextKeys.PRICES, ContextKeys.TECHNICAL_REPORT);
        this.overbought = overbought;
        this.oversold = oversold;
    }

    @Override
    protected AnalystReport analyze(PipelineContext context) {
        List<?> raw = requireList(context, ContextKeys.PRICES);
        if (raw.size() < 2) {
            throw new StageException(stageName(), "Need at least 2 prices, got " + raw.size()
                + " for instrument=" + context.instrumentId());
        }
        PriceSeries prices;
        try {
            prices = PriceSeries.newestFirst(raw.stream().map(v -> (Number) v).toList());
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new StageException(stageName(), "Unusable price series: " + e.getMessage(), e);
        }

        String trend  = prices.trend();
        double macd   = prices.macd();
        double rsi    = prices.rsi(14);
        double sma20  = prices.sma(20);
        double stdDev = prices.stdDev(20);

        TradeAction signal = switch (trend) {
            case "UPTREND"   -> !Double.isNaN(macd) && macd > 0 ? TradeAction.BUY  : TradeAction.HOLD;
            case "DOWNTREND" -> !Double.isNaN(macd) && macd < 0 ? TradeAction.SELL : TradeAction.HOLD;
            default          -> TradeAction.HOLD;
        };
        if (signal == TradeAction.BUY && rsi > overbought)  signal = TradeAction.HOLD;
        if (signal == TradeAction.SELL && rsi < oversold)   signal = TradeAction.HOLD;

        double confidence = computeConfidence(trend, macd, stdDev, sma20);

        String summary = String.format(
            "Trend: %s | Price=%.2f | SMA20=%.2f | MACD=%.4f | RSI=%.1f | StdDev=%.2f → Signal: %s",
            trend, prices.latest(), orZero(sma20), orZero(macd), orZero(rsi), orZero(stdDev), signal);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("trend",        trend);
        metadata.put("currentPrice", prices.latest());
        metadata.put("sma20",        Double.isNaN(sma20) ? "N/A" : sma20);
        metadata.put("macd",         Double.isNaN(macd) ? "N/A" : macd);
        metadata.put("rsi",          Double.isNaN(rsi) ? "N/A" : rsi);
        metadata.put("momentum5",    Double.isNaN(prices.momentum(5)) ? "N/A" : prices.momentum(5));

        return AnalystReport.of(stageName(), summary, signal, confidence, metadata);
    }

    private double computeConfidence(String trend, double macd, double stdDev, double sma20) {
        if ("SIDEWAYS".equals(trend) || "INSUFFICIENT_DATA".equals(trend)) return 0.3;
        double base = 0.5;
        // MACD agreeing with the trend
        if (!Double.isNaN(macd) && (("UPTREND".equals(trend) && macd > 0)
            || ("DOWNTREND".equals(trend) && macd < 0))) base += 0.2;
        if (!Double.isNaN(stdDev) && !Double.isNaN(sma20) && sma20 > 0) {
            double cv = stdDev / sma20; // coefficient of variation
            if (cv < 0.01) base += 0.15;
            else if (cv > 0.03) base -= 0.1;
        }
        return clamp(base);
    }

    private static double orZero(double v) { return Double.isNaN(v) ? 0 : v; }
}
