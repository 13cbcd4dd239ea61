package com.explify.sidecar.service;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.filter.CorrelationIdFilter;
import com.explify.sidecar.filter.SecurityContext;
import com.explify.sidecar.model.PhiAccessRecord;
import com.explify.sidecar.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

/**
 * PHI access trail. Handlers that read, write, export or delete patient data call
 * {@link #recordPhiAccess}; the write happens on the audit worker and nothing it does can fail the
 * calling handler.
 */
@Service
public class PhiAccessAuditService {
    private static final Logger log = LoggerFactory.getLogger(PhiAccessAuditService.class);
    private final MongoTemplate mongoTemplate;
    private final AuditWriter auditWriter;
    private final ClientIpResolver clientIpResolver;
    private final ModeConfig modeConfig;

    public PhiAccessAuditService(MongoTemplate mongoTemplate, AuditWriter auditWriter, ClientIpResolver clientIpResolver, ModeConfig modeConfig) {
        this.mongoTemplate = mongoTemplate;
        this.auditWriter = auditWriter;
        this.clientIpResolver = clientIpResolver;
        this.modeConfig = modeConfig;
    }

    /**
     * @param action e.g. {@code view_report}, {@code delete_report}, {@code export_account}
     * @param resourceId optional
     */
    public void recordPhiAccess(HttpServletRequest request, String action, String resourceType, String resourceId) {
        try {
            if (this.modeConfig.isLocal()) {
                return;
            }
            String identity = resolveIdentity(request);
            if (identity == null) {
                log.debug("PHI access '{}' not recorded: no identity", action);
                return;
            }
            PhiAccessRecord record = PhiAccessRecord.create(identity, action, resourceType, resourceId)
                    .withClient(this.clientIpResolver.resolveClientIp(request),
                            request != null ? request.getHeader(HttpHeaders.USER_AGENT) : null)
                    .withRequestId(CorrelationIdFilter.requestId(request));
            this.auditWriter.submit("phi_access:" + action, () -> this.mongoTemplate.insert(record));
        } catch (RuntimeException e) {
            log.error("Failed to record PHI access '{}': {}", action, e.getMessage());
        }
    }

    private static String resolveIdentity(HttpServletRequest request) {
        String identity = SecurityContext.getCurrentIdentity();
        if (identity == null && request != null) {
            Object attribute = request.getAttribute(SecurityContext.IDENTITY_ATTRIBUTE);
            identity = attribute instanceof String ? (String)attribute : null;
        }
        return identity != null && !identity.isBlank() ? identity : null;
    }
}
