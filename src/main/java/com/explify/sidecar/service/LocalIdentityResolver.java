package com.explify.sidecar.service;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Single-tenant desktop mode: every request belongs to the one local user and no identity provider
 * is consulted.
 */
public class LocalIdentityResolver implements IdentityResolver {
    private final IdentityResolution localUser;

    public LocalIdentityResolver(String localUserId) {
        this.localUser = IdentityResolution.resolved(localUserId);
    }

    @Override
    public IdentityResolution resolve(HttpServletRequest request) {
        return this.localUser;
    }
}
