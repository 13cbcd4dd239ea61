package com.explify.sidecar.service;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.model.RequestAuditRecord;
import com.explify.sidecar.util.LogSanitizer;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

/**
 * General request audit trail: one line on the {@code audit} logger and one persisted record per
 * completed request. Networked mode only.
 */
@Service
public class RequestAuditService {
    private static final Logger log = LoggerFactory.getLogger(RequestAuditService.class);
    private static final Logger auditLog = LoggerFactory.getLogger("audit");
    private final MongoTemplate mongoTemplate;
    private final AuditWriter auditWriter;
    private final ModeConfig modeConfig;

    public RequestAuditService(MongoTemplate mongoTemplate, AuditWriter auditWriter, ModeConfig modeConfig) {
        this.mongoTemplate = mongoTemplate;
        this.auditWriter = auditWriter;
        this.modeConfig = modeConfig;
    }

    public void recordRequestAudit(String identity, String method, String path, int statusCode, double durationMs) {
        this.recordRequestAudit(identity, method, path, statusCode, durationMs, null);
    }

    public void recordRequestAudit(String identity, String method, String path, int statusCode, double durationMs, String requestId) {
        if (this.modeConfig.isLocal()) {
            return;
        }
        try {
            RequestAuditRecord record = RequestAuditRecord.create(identity, method, LogSanitizer.sanitize(path), statusCode, durationMs)
                    .withRequestId(requestId);
            if (auditLog.isInfoEnabled()) {
                auditLog.info(String.format(Locale.ROOT, "user=%s method=%s path=%s status=%d duration_ms=%.1f request_id=%s",
                        LogSanitizer.sanitize(record.getUserId()), record.getMethod(), record.getPath(), statusCode, durationMs,
                        LogSanitizer.sanitize(requestId)));
            }
            this.auditWriter.submit("request_audit", () -> this.mongoTemplate.insert(record));
        } catch (RuntimeException e) {
            log.error("Failed to record request audit: {}", e.getMessage());
        }
    }
}
