package com.explify.sidecar.filter;

import com.explify.sidecar.security.ClientIpResolver;
import com.explify.sidecar.service.RateLimitDecision;
import com.explify.sidecar.service.RateLimitService;
import com.explify.sidecar.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    private final RateLimitService rateLimitService;
    private final ClientIpResolver clientIpResolver;

    public RateLimitFilter(RateLimitService rateLimitService, ClientIpResolver clientIpResolver) {
        this.rateLimitService = rateLimitService;
        this.clientIpResolver = clientIpResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws IOException, ServletException {
        RateLimitService.RouteClass routeClass = this.rateLimitService.classify(request.getRequestURI());
        if (routeClass == RateLimitService.RouteClass.UNLIMITED) {
            chain.doFilter(request, response);
            return;
        }
        String key = this.rateLimitKey(request);
        RateLimitDecision decision = this.rateLimitService.check(key, routeClass);
        if (decision.isLimited()) {
            response.setHeader("X-RateLimit-Limit", String.valueOf(decision.getLimit()));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()));
        }
        if (decision.isAllowed()) {
            chain.doFilter(request, response);
            return;
        }
        log.warn("Rate limit exceeded for {} on {}", LogSanitizer.sanitize(key), LogSanitizer.sanitize(request.getRequestURI()));
        response.setHeader("Retry-After", String.valueOf(decision.getRetryAfterSeconds()));
        JsonErrorResponses.write(response, 429, "Rate limit exceeded. Please try again later.",
                Map.of("retryAfter", decision.getRetryAfterSeconds()));
    }

    private String rateLimitKey(HttpServletRequest request) {
        String identity = SecurityContext.getCurrentIdentity();
        if (identity != null) {
            return "user:" + identity;
        }
        return "ip:" + this.clientIpResolver.resolveClientIp(request);
    }
}
