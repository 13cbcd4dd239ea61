package com.explify.sidecar.dto;

import java.time.Instant;

/**
 * Per-user usage totals for the admin dashboard.
 */
public record UsageSummary(
        String userId,
        String email,
        long totalQueries,
        long totalInputTokens,
        long totalOutputTokens,
        long sonnetQueries,
        long opusQueries,
        long deepAnalysisCount,
        Instant lastActive) {
}
