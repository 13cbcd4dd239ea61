package com.explify.sidecar.filter;

import com.explify.sidecar.service.IdentityResolution;
import com.explify.sidecar.service.IdentityResolver;
import com.explify.sidecar.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Attaches the caller's identity to the request before any handler runs, or rejects the request
 * with 401. Health checks and CORS pre-flight requests pass without identity.
 */
@Component
public class IdentityFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(IdentityFilter.class);
    private static final List<String> PUBLIC_PATHS = List.of("/health");

    private final IdentityResolver identityResolver;

    public IdentityFilter(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod()) || PUBLIC_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws IOException, ServletException {
        IdentityResolution resolution = this.identityResolver.resolve(request);
        if (!resolution.isResolved()) {
            log.warn("Authentication failed for {} {}: {}", request.getMethod(),
                    LogSanitizer.sanitize(request.getRequestURI()), resolution.getReason());
            JsonErrorResponses.write(response, HttpServletResponse.SC_UNAUTHORIZED, resolution.getReason());
            return;
        }
        String identity = resolution.getIdentity();
        SecurityContext.setCurrentIdentity(identity);
        request.setAttribute(SecurityContext.IDENTITY_ATTRIBUTE, identity);
        this.setSpringSecurityContext(identity);
        try {
            chain.doFilter(request, response);
        } finally {
            SecurityContext.clear();
            SecurityContextHolder.clearContext();
        }
    }

    private void setSpringSecurityContext(String identity) {
        org.springframework.security.core.context.SecurityContext context = SecurityContextHolder.getContext();
        if (context.getAuthentication() != null && context.getAuthentication().isAuthenticated()) {
            return;
        }
        context.setAuthentication(new UsernamePasswordAuthenticationToken(identity, null,
                List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    }
}
