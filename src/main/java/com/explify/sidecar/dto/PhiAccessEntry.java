package com.explify.sidecar.dto;

import java.time.Instant;

public record PhiAccessEntry(
        String id,
        String userId,
        String email,
        String action,
        String resourceType,
        String resourceId,
        String ipAddress,
        String userAgent,
        Instant createdAt) {
}
