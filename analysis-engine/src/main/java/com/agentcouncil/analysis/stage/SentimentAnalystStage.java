package com.agentcouncil.analysis.stage;

import com.agentcouncil.analysis.lexicon.SentimentLexicon;
import com.agentcouncil.common.context.ContextKeys;

/** Crowd mood from social posts about the instrument. */
public class SentimentAnalystStage extends TextPolarityAnalystStage {

    public static final String NAME = "sentiment-analyst";

    public SentimentAnalystStage() {
        this(SentimentLexicon.market(), 0.2);
    }

    public SentimentAnalystStage(SentimentLexicon lexicon, double signalThreshold) {
        super(NAME, ContextKeys.SOCIAL_POSTS, ContextKeys.SENTIMENT_REPORT, lexicon, signalThreshold);
    }

    @Override
    protected String label() {
        return "Social sentiment";
    }
}
