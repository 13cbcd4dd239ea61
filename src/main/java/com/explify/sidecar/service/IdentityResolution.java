package com.explify.sidecar.service;

/**
 * Outcome of identity resolution: either an identity or the reason none could be established.
 */
public final class IdentityResolution {
    private final String identity;
    private final String reason;

    private IdentityResolution(String identity, String reason) {
        this.identity = identity;
        this.reason = reason;
    }

    public static IdentityResolution resolved(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        return new IdentityResolution(identity, null);
    }

    public static IdentityResolution unauthenticated(String reason) {
        return new IdentityResolution(null, reason);
    }

    public boolean isResolved() {
        return this.identity != null;
    }

    public String getIdentity() {
        return this.identity;
    }

    public String getReason() {
        return this.reason;
    }
}
