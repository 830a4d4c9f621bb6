package com.agentcouncil.analysis.indicator;

import java.util.List;

/**
 * Closing prices of one instrument with the indicator math the technical analyst needs.
 *
 * <p>Prices are newest-first (index 0 = most recent close), the layout the run seed uses.
 * Every indicator returns {@code NaN} when the series is too short for its period.
 */
public final class PriceSeries {

    private final double[] newestFirst;

    private PriceSeries(double[] newestFirst) {
        this.newestFirst = newestFirst;
    }

    public static PriceSeries newestFirst(List<? extends Number> prices) {
        double[] values = new double[prices.size()];
        for (int i = 0; i < values.length; i++) {
            Number price = prices.get(i);
            if (price == null) {
                throw new IllegalArgumentException("null price at index " + i);
            }
            values[i] = price.doubleValue();
        }
        return new PriceSeries(values);
    }

    public int size() {
        return newestFirst.length;
    }

    public double latest() {
        return newestFirst.length == 0 ? Double.NaN : newestFirst[0];
    }

    public double sma(int period) {
        if (newestFirst.length < period) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += newestFirst[i];
        return sum / period;
    }

    /** Most recent EMA, seeded with the oldest close and walked forward in time. */
    public double ema(int period) {
        if (newestFirst.length < period) return Double.NaN;
        double k = 2.0 / (period + 1);
        double ema = newestFirst[newestFirst.length - 1];
        for (int i = newestFirst.length - 2; i >= 0; i--) {
            ema = newestFirst[i] * k + ema * (1 - k);
        }
        return ema;
    }

    /** MACD line = EMA(12) - EMA(26). */
    public double macd() {
        double ema12 = ema(12);
        double ema26 = ema(26);
        if (Double.isNaN(ema12) || Double.isNaN(ema26)) return Double.NaN;
        return ema12 - ema26;
    }

    /** RSI with Wilder's smoothing; 100 when there were no losing periods. */
    public double rsi(int period) {
        if (newestFirst.length < period + 1) return Double.NaN;

        int oldest = newestFirst.length - 1;
        double avgGain = 0;
        double avgLoss = 0;
        for (int step = 1; step <= period; step++) {
            double change = newestFirst[oldest - step] - newestFirst[oldest - step + 1];
            if (change > 0) avgGain += change;
            else avgLoss -= change;
        }
        avgGain /= period;
        avgLoss /= period;

        for (int step = period + 1; step <= oldest; step++) {
            double change = newestFirst[oldest - step] - newestFirst[oldest - step + 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return 100.0;
        return 100.0 - (100.0 / (1.0 + avgGain / avgLoss));
    }

    public double stdDev(int period) {
        if (newestFirst.length < period) return Double.NaN;
        double mean = sma(period);
        double variance = 0;
        for (int i = 0; i < period; i++) {
            double diff = newestFirst[i] - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /** Fractional change between the latest close and the close {@code lookback} periods ago. */
    public double momentum(int lookback) {
        if (newestFirst.length <= lookback || newestFirst[lookback] == 0) return Double.NaN;
        return (newestFirst[0] - newestFirst[lookback]) / newestFirst[lookback];
    }

    /** UPTREND, DOWNTREND, SIDEWAYS or INSUFFICIENT_DATA from price vs SMA20 vs SMA50. */
    public String trend() {
        double sma20 = sma(20);
        double sma50 = sma(50);
        if (Double.isNaN(sma20) || Double.isNaN(sma50)) return "INSUFFICIENT_DATA";
        double price = latest();
        if (price > sma20 && sma20 > sma50) return "UPTREND";
        if (price < sma20 && sma20 < sma50) return "DOWNTREND";
        return "SIDEWAYS";
    }
}
