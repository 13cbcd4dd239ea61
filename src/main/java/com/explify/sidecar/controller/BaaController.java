package com.explify.sidecar.controller;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.exception.NotAvailableException;
import com.explify.sidecar.filter.SecurityContext;
import com.explify.sidecar.security.ClientIpResolver;
import com.explify.sidecar.service.ConsentService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/baa"})
public class BaaController {
    private final ConsentService consentService;
    private final ClientIpResolver clientIpResolver;
    private final ModeConfig modeConfig;

    public BaaController(ConsentService consentService, ClientIpResolver clientIpResolver, ModeConfig modeConfig) {
        this.consentService = consentService;
        this.clientIpResolver = clientIpResolver;
        this.modeConfig = modeConfig;
    }

    @GetMapping(value={"/status"})
    public Map<String, Object> status() {
        this.requireNetworked();
        String version = this.consentService.getCurrentVersion();
        boolean accepted = this.consentService.status(SecurityContext.getCurrentIdentity(), version);
        return Map.of("accepted", accepted, "version", version);
    }

    @PostMapping(value={"/accept"})
    public Map<String, Object> accept(HttpServletRequest request) {
        this.requireNetworked();
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        this.consentService.accept(SecurityContext.getCurrentIdentity(), this.consentService.getCurrentVersion(),
                this.clientIpResolver.resolveClientIp(request), userAgent != null ? userAgent : "");
        return Map.of("accepted", true);
    }

    private void requireNetworked() {
        if (this.modeConfig.isLocal()) {
            throw new NotAvailableException();
        }
    }
}
