package com.explify.sidecar.model;

/**
 * Deployment mode of the sidecar.
 *
 * NETWORKED is the multi-tenant web deployment: callers authenticate with a bearer token and the
 * compliance machinery (admin, consent, PHI access logging, request audit, rate limiting) is live.
 * LOCAL is the single-tenant desktop deployment: a fixed local identity is assumed and the
 * compliance machinery is inert.
 */
public enum OperatingMode {
    NETWORKED,
    LOCAL;

    public static OperatingMode fromRequireAuth(String flag) {
        if (flag != null && "true".equalsIgnoreCase(flag.trim())) {
            return NETWORKED;
        }
        return LOCAL;
    }
}
