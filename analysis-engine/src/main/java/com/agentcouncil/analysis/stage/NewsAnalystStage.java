package com.agentcouncil.analysis.stage;

import com.agentcouncil.analysis.lexicon.SentimentLexicon;
import com.agentcouncil.common.context.ContextKeys;

/** Tone of recent headlines. Uses a higher threshold than social sentiment. */
public class NewsAnalystStage extends TextPolarityAnalystStage {

    public static final String NAME = "news-analyst";

    public NewsAnalystStage() {
        this(SentimentLexicon.market(), 0.3);
    }

    public NewsAnalystStage(SentimentLexicon lexicon, double signalThreshold) {
        super(NAME, ContextKeys.HEADLINES, ContextKeys.NEWS_REPORT, lexicon, signalThreshold);
    }

    @Override
    protected String label() {
        return "News flow";
    }
}
