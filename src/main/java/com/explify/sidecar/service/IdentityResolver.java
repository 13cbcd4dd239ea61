package com.explify.sidecar.service;

import jakarta.servlet.http.HttpServletRequest;

public interface IdentityResolver {

    /**
     * Establishes who is calling. Implementations never throw for bad credentials; they return an
     * unauthenticated result carrying a client-safe reason.
     */
    IdentityResolution resolve(HttpServletRequest request);
}
