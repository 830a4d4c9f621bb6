package com.agentcouncil.analysis.lexicon;

import java.util.Locale;
import java.util.Set;

/**
 * Word-list polarity scoring shared by the sentiment and news analysts.
 */
public final class SentimentLexicon {

    private final Set<String> positive;
    private final Set<String> negative;

    public SentimentLexicon(Set<String> positive, Set<String> negative) {
        this.positive = Set.copyOf(positive);
        this.negative = Set.copyOf(negative);
    }

    public static SentimentLexicon market() {
        return new SentimentLexicon(
            Set.of("bullish", "buy", "beat", "beats", "growth", "strong", "upgrade", "upgraded",
                   "record", "surge", "surges", "rally", "positive", "outperform", "partnership",
                   "expands", "profit", "raises", "breakthrough", "love"),
            Set.of("bearish", "sell", "miss", "misses", "weak", "downgrade", "downgraded",
                   "lawsuit", "decline", "declines", "drop", "drops", "crash", "negative", "fraud",
                   "recall", "underperform", "concern", "concerns", "probe", "layoffs", "loss"));
    }

    /** Net polarity of one text: positive hits minus negative hits. */
    public int score(String text) {
        if (text == null || text.isBlank()) return 0;
        int score = 0;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (positive.contains(token)) score++;
            else if (negative.contains(token)) score--;
        }
        return score;
    }
}
