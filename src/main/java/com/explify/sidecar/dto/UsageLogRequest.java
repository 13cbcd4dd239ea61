package com.explify.sidecar.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /admin/usage/log}, in the analysis client's snake_case field names.
 * Missing numeric fields count as zero.
 */
public record UsageLogRequest(
        @JsonProperty("model_used") String modelUsed,
        @JsonProperty("input_tokens") Integer inputTokens,
        @JsonProperty("output_tokens") Integer outputTokens,
        @JsonProperty("request_type") String requestType,
        @JsonProperty("deep_analysis") Boolean deepAnalysis) {
}
