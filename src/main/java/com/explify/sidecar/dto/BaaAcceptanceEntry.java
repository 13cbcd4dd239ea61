package com.explify.sidecar.dto;

import java.time.Instant;

public record BaaAcceptanceEntry(
        String id,
        String userId,
        String email,
        String baaVersion,
        Instant acceptedAt,
        String ipAddress,
        String userAgent) {
}
