package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record AnalystReport(
    @JsonProperty("analyst") String analyst,
    @JsonProperty("summary") String summary,
    @JsonProperty("signal") TradeAction signal,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static AnalystReport of(String analyst, String summary,
                                   TradeAction signal, double confidence,
                                   Map<String, Object> metadata) {
        return new AnalystReport(analyst, summary, signal, confidence,
                                 metadata == null ? Map.of() : Map.copyOf(metadata));
    }
}
