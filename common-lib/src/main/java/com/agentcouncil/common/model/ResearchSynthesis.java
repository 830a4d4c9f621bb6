package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Condensed view of the research debate handed to the risk debate and the trader.
 *
 * @param stance     the action the debate outcome argues for
 * @param conviction margin of the winning side, in [0.0, 1.0]
 * @param summary    human-readable synthesis
 */
public record ResearchSynthesis(
    @JsonProperty("stance") TradeAction stance,
    @JsonProperty("conviction") double conviction,
    @JsonProperty("summary") String summary
) {}
