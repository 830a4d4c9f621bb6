package com.agentcouncil.common.context;

/**
 * Names of the fields carried in a {@link PipelineContext}.
 *
 * <p>Seed fields arrive with the run request; every other field is written by exactly one
 * stage category.
 */
public final class ContextKeys {

    // ── seed ─────────────────────────────────────────────────────────────────
    public static final String INSTRUMENT_ID = "instrument_id";
    public static final String PRICES        = "prices";
    public static final String HEADLINES     = "headlines";
    public static final String SOCIAL_POSTS  = "social_posts";
    public static final String FUNDAMENTALS  = "fundamentals";

    // ── analyst fan-out ──────────────────────────────────────────────────────
    public static final String TECHNICAL_REPORT    = "technical_report";
    public static final String SENTIMENT_REPORT    = "sentiment_report";
    public static final String NEWS_REPORT         = "news_report";
    public static final String FUNDAMENTALS_REPORT = "fundamentals_report";

    // ── debate / synthesis chain ─────────────────────────────────────────────
    public static final String DEBATE_RECORD      = "debate_record";
    public static final String DEBATE_JUDGEMENT   = "debate_judgement";
    public static final String RESEARCH_SYNTHESIS = "research_synthesis";
    public static final String RISK_DEBATE        = "risk_debate";
    public static final String RISK_ASSESSMENT    = "risk_assessment";

    // ── gated decision loop ──────────────────────────────────────────────────
    public static final String FINAL_DECISION = "final_decision";
    public static final String VERDICT        = "verdict";
    public static final String PRIOR_CRITIQUE = "prior_critique";

    private ContextKeys() {}
}
