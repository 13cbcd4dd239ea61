package com.explify.sidecar.filter;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.service.RequestAuditService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Records every request that got past identity resolution, after the handler has finished and
 * whether or not it succeeded. Networked mode only.
 */
@Component
public class RequestAuditFilter extends OncePerRequestFilter {
    private final RequestAuditService requestAuditService;
    private final ModeConfig modeConfig;

    public RequestAuditFilter(RequestAuditService requestAuditService, ModeConfig modeConfig) {
        this.requestAuditService = requestAuditService;
        this.modeConfig = modeConfig;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return this.modeConfig.isLocal();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws ServletException, IOException {
        long start = System.nanoTime();
        boolean failed = true;
        try {
            chain.doFilter(request, response);
            failed = false;
        } finally {
            double durationMs = (System.nanoTime() - start) / 1_000_000.0;
            int status = failed ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR : response.getStatus();
            this.requestAuditService.recordRequestAudit(SecurityContext.getCurrentIdentity(), request.getMethod(),
                    request.getRequestURI(), status, durationMs, CorrelationIdFilter.requestId(request));
        }
    }
}
