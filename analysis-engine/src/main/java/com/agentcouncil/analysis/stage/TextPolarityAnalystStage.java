package com.agentcouncil.analysis.stage;

import com.agentcouncil.analysis.lexicon.SentimentLexicon;
import com.agentcouncil.common.context.PipelineContext;
import com.agentcouncil.common.model.AnalystReport;
import com.agentcouncil.common.model.TradeAction;

import java.util.List;
import java.util.Map;

/**
 * Shared logic of the analysts that classify a list of texts as positive, negative or neutral
 * and turn the net balance into a signal.
 */
public abstract class TextPolarityAnalystStage extends AnalystStage {

    private final String inputKey;
    private final SentimentLexicon lexicon;
    private final double signalThreshold;

    protected TextPolarityAnalystStage(String stageName, String inputKey, String outputKey,
                                       SentimentLexicon lexicon, double signalThreshold) {
        super(stageName, inputKey, outputKey);
        this.inputKey = inputKey;
        this.lexicon = lexicon;
        this.signalThreshold = signalThreshold;
    }

    /** Label used in the summary, e.g. "Social sentiment". */
    protected abstract String label();

    @Override
    protected AnalystReport analyze(PipelineContext context) {
        List<?> texts = requireList(context, inputKey);
        if (texts.isEmpty()) {
            return AnalystReport.of(stageName(), label() + ": no items available → Signal: HOLD",
                TradeAction.HOLD, 0.2, Map.of("items", 0));
        }

        int positive = 0;
        int negative = 0;
        for (Object text : texts) {
            int score = lexicon.score(String.valueOf(text));
            if (score > 0) positive++;
            else if (score < 0) negative++;
        }
        double net = (positive - negative) / (double) texts.size();

        TradeAction signal = net >= signalThreshold ? TradeAction.BUY
            : net <= -signalThreshold ? TradeAction.SELL
            : TradeAction.HOLD;
        double confidence = clamp(0.4 + Math.abs(net) * 0.5);

        String summary = String.format("%s: %d positive / %d negative of %d (net %.2f) → Signal: %s",
            label(), positive, negative, texts.size(), net, signal);

        return AnalystReport.of(stageName(), summary, signal, confidence, Map.of(
            "items", texts.size(),
            "positive", positive,
            "negative", negative,
            "net", net));
    }
}
