package com.explify.sidecar.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="request_audit_log")
public class RequestAuditRecord {
    public static final String ANONYMOUS = "anonymous";

    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private String userId;
    private String method;
    private String path;
    private int statusCode;
    private double durationMs;
    @Indexed
    private String requestId;

    public RequestAuditRecord() {
        this.timestamp = Instant.now();
    }

    public static RequestAuditRecord create(String userId, String method, String path, int statusCode, double durationMs) {
        RequestAuditRecord record = new RequestAuditRecord();
        record.userId = userId != null && !userId.isBlank() ? userId : ANONYMOUS;
        record.method = method;
        record.path = path;
        record.statusCode = statusCode;
        record.durationMs = durationMs;
        return record;
    }

    public RequestAuditRecord withRequestId(String requestId) {
        this.requestId = requestId;
        return this;
    }

    public String getId() {
        return this.id;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getMethod() {
        return this.method;
    }

    public String getPath() {
        return this.path;
    }

    public int getStatusCode() {
        return this.statusCode;
    }

    public double getDurationMs() {
        return this.durationMs;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
