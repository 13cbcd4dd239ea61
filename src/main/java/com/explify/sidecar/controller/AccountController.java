package com.explify.sidecar.controller;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.exception.NotAvailableException;
import com.explify.sidecar.exception.UnauthenticatedException;
import com.explify.sidecar.filter.SecurityContext;
import com.explify.sidecar.service.AdminReportService;
import com.explify.sidecar.service.PhiAccessAuditService;
import com.explify.sidecar.service.UsageLogService;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Self-service export of the compliance records held about the caller.
 */
@RestController
@RequestMapping(value={"/account"})
public class AccountController {
    private final ModeConfig modeConfig;
    private final AdminReportService adminReportService;
    private final UsageLogService usageLogService;
    private final PhiAccessAuditService phiAccessAuditService;

    public AccountController(ModeConfig modeConfig, AdminReportService adminReportService, UsageLogService usageLogService,
                             PhiAccessAuditService phiAccessAuditService) {
        this.modeConfig = modeConfig;
        this.adminReportService = adminReportService;
        this.usageLogService = usageLogService;
        this.phiAccessAuditService = phiAccessAuditService;
    }

    @GetMapping(value={"/export"})
    public ResponseEntity<Map<String, Object>> export(HttpServletRequest request) {
        if (this.modeConfig.isLocal()) {
            throw new NotAvailableException();
        }
        String identity = SecurityContext.getCurrentIdentity();
        if (identity == null) {
            throw new UnauthenticatedException();
        }
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("exportedAt", Instant.now().toString());
        export.put("userId", identity);
        export.put("baaAcceptances", this.adminReportService.baaAcceptances(null, identity));
        export.put("usage", this.usageLogService.listForUser(identity));
        export.put("phiAccess", this.adminReportService.phiAccessLog(null, identity, null, 0, 0, true).items());
        this.phiAccessAuditService.recordPhiAccess(request, "export_account", "account", null);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"explify-data-export.json\"")
                .body(export);
    }
}
