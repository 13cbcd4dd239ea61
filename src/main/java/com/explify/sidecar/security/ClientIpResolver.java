package com.explify.sidecar.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller address. With no trusted proxies configured the service is assumed to sit
 * behind a load balancer and the first X-Forwarded-For hop wins; otherwise the header is honoured
 * only when the direct peer is a trusted proxy.
 */
@Component
public class ClientIpResolver {
    private static final Logger log = LoggerFactory.getLogger(ClientIpResolver.class);
    private final Set<String> trustedProxies;

    public ClientIpResolver(@Value(value="${app.security.trusted-proxies:}") String trustedProxyList) {
        if (trustedProxyList == null || trustedProxyList.isBlank()) {
            this.trustedProxies = Set.of();
            return;
        }
        this.trustedProxies = Arrays.stream(trustedProxyList.split(","))
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        log.info("Trusted proxies configured: {}", this.trustedProxies);
    }

    /**
     * @return the caller address, or null when the request carries none
     */
    public String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        String remoteAddr = request.getRemoteAddr();
        if (this.trustedProxies.isEmpty() || remoteAddr != null && this.trustedProxies.contains(remoteAddr)) {
            String forwarded = firstHop(request.getHeader("X-Forwarded-For"));
            if (forwarded != null) {
                return forwarded;
            }
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
        } else if (request.getHeader("X-Forwarded-For") != null) {
            log.debug("Ignoring X-Forwarded-For from untrusted proxy: {}", remoteAddr);
        }
        return remoteAddr != null && !remoteAddr.isBlank() ? remoteAddr : null;
    }

    private static String firstHop(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String candidate = header.split(",")[0].trim();
        return candidate.isEmpty() ? null : candidate;
    }
}
