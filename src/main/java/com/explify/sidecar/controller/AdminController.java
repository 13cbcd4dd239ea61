package com.explify.sidecar.controller;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.dto.AdminUserView;
import com.explify.sidecar.dto.BaaAcceptanceEntry;
import com.explify.sidecar.dto.PhiAccessPage;
import com.explify.sidecar.dto.UsageLogRequest;
import com.explify.sidecar.dto.UsageSummary;
import com.explify.sidecar.exception.NotAvailableException;
import com.explify.sidecar.filter.SecurityContext;
import com.explify.sidecar.service.AdminAuthorizer;
import com.explify.sidecar.service.AdminReportService;
import com.explify.sidecar.service.PhiAccessAuditService;
import com.explify.sidecar.service.UsageLogService;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Compliance reporting for administrators. Every operation except usage logging passes
 * {@link AdminAuthorizer#requireAdmin} first; none exist in local mode.
 */
@RestController
@RequestMapping(value={"/admin"})
public class AdminController {
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ModeConfig modeConfig;
    private final AdminAuthorizer adminAuthorizer;
    private final AdminReportService adminReportService;
    private final UsageLogService usageLogService;
    private final PhiAccessAuditService phiAccessAuditService;

    public AdminController(ModeConfig modeConfig, AdminAuthorizer adminAuthorizer, AdminReportService adminReportService,
                           UsageLogService usageLogService, PhiAccessAuditService phiAccessAuditService) {
        this.modeConfig = modeConfig;
        this.adminAuthorizer = adminAuthorizer;
        this.adminReportService = adminReportService;
        this.usageLogService = usageLogService;
        this.phiAccessAuditService = phiAccessAuditService;
    }

    @GetMapping(value={"/users"})
    public List<AdminUserView> listUsers() {
        this.requireAdmin();
        return this.adminReportService.listUsers();
    }

    @GetMapping(value={"/usage"})
    public List<UsageSummary> usage(@RequestParam(value="since") String since) {
        this.requireAdmin();
        return this.usageLogService.summarizeSince(RequestParams.parseSince(since));
    }

    @GetMapping(value={"/audit-log"})
    public ResponseEntity<?> auditLog(@RequestParam(value="format", defaultValue="json") String format,
                                      @RequestParam(value="since", required=false) String since,
                                      @RequestParam(value="user_id", required=false) String userId,
                                      @RequestParam(value="action", required=false) String action,
                                      @RequestParam(value="limit", defaultValue="100") int limit,
                                      @RequestParam(value="offset", defaultValue="0") int offset,
                                      HttpServletRequest request) {
        this.requireAdmin();
        Instant sinceInstant = RequestParams.parseSince(since);
        if ("csv".equalsIgnoreCase(format)) {
            PhiAccessPage all = this.adminReportService.phiAccessLog(sinceInstant, userId, action, limit, offset, true);
            this.phiAccessAuditService.recordPhiAccess(request, "export_phi_access_log", "phi_access_log", null);
            return csvAttachment("phi-access-log.csv", this.adminReportService.phiAccessCsv(all.items()));
        }
        return ResponseEntity.ok(this.adminReportService.phiAccessLog(sinceInstant, userId, action, limit, offset, false));
    }

    @GetMapping(value={"/baa-acceptances"})
    public ResponseEntity<?> baaAcceptances(@RequestParam(value="format", defaultValue="json") String format,
                                            @RequestParam(value="since", required=false) String since,
                                            @RequestParam(value="user_id", required=false) String userId) {
        this.requireAdmin();
        List<BaaAcceptanceEntry> entries = this.adminReportService.baaAcceptances(RequestParams.parseSince(since), userId);
        if ("csv".equalsIgnoreCase(format)) {
            return csvAttachment("baa-acceptances.csv", this.adminReportService.baaAcceptanceCsv(entries));
        }
        return ResponseEntity.ok(Map.of("items", entries));
    }

    /**
     * Usage accounting from the analysis pipeline. Any authenticated caller may report its own usage;
     * local mode and unreadable bodies are accepted and ignored.
     */
    @PostMapping(value={"/usage/log"})
    public Map<String, Object> logUsage(@RequestBody(required=false) UsageLogRequest body) {
        this.usageLogService.recordUsage(SecurityContext.getCurrentIdentity(), body);
        return Map.of("ok", true);
    }

    private void requireAdmin() {
        if (this.modeConfig.isLocal()) {
            throw new NotAvailableException();
        }
        this.adminAuthorizer.requireAdmin(SecurityContext.getCurrentIdentity());
    }

    private static ResponseEntity<String> csvAttachment(String filename, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(body);
    }
}
