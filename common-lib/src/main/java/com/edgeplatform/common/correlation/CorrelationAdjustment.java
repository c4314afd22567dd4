package com.edgeplatform.common.correlation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CorrelationAdjustment(
    @JsonProperty("edgeMultiplier")       double edgeMultiplier,
    @JsonProperty("confidenceMultiplier") double confidenceMultiplier,
    @JsonProperty("reason")               String reason
) {
    public static CorrelationAdjustment neutral(String reason) {
        return new CorrelationAdjustment(1.0, 1.0, reason);
    }
}
