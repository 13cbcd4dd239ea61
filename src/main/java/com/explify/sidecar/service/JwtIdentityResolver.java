package com.explify.sidecar.service;

import com.explify.sidecar.security.JwtValidator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/**
 * Resolves the caller from an {@code Authorization: Bearer} access token.
 */
public class JwtIdentityResolver implements IdentityResolver {
    static final String MISSING_HEADER = "Missing authorization header";
    static final String TOKEN_EXPIRED = "Token expired";
    static final String INVALID_TOKEN = "Invalid token";
    static final String MISSING_SUBJECT = "Invalid token: missing sub";

    private static final String BEARER_PREFIX = "Bearer ";
    private final JwtValidator jwtValidator;

    public JwtIdentityResolver(JwtValidator jwtValidator) {
        this.jwtValidator = jwtValidator;
    }

    @Override
    public IdentityResolution resolve(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return IdentityResolution.unauthenticated(MISSING_HEADER);
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        JwtValidator.ValidationResult result = this.jwtValidator.validate(token);
        if (result.isValid()) {
            return IdentityResolution.resolved(result.getSubject());
        }
        switch (result.getFailure()) {
            case EXPIRED:
                return IdentityResolution.unauthenticated(TOKEN_EXPIRED);
            case MISSING_SUBJECT:
                return IdentityResolution.unauthenticated(MISSING_SUBJECT);
            default:
                return IdentityResolution.unauthenticated(INVALID_TOKEN);
        }
    }
}
