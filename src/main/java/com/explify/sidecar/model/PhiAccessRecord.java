package com.explify.sidecar.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One access to protected health information. Records are inserted and never updated.
 */
@Document(collection="phi_access_log")
public class PhiAccessRecord {
    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private String userId;
    @Indexed
    private String action;
    private String resourceType;
    private String resourceId;
    private String ipAddress;
    private String userAgent;
    private String requestId;

    public PhiAccessRecord() {
        this.timestamp = Instant.now();
    }

    public static PhiAccessRecord create(String userId, String action, String resourceType, String resourceId) {
        PhiAccessRecord record = new PhiAccessRecord();
        record.userId = userId;
        record.action = action;
        record.resourceType = resourceType;
        record.resourceId = resourceId;
        return record;
    }

    public PhiAccessRecord withClient(String ipAddress, String userAgent) {
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        return this;
    }

    public PhiAccessRecord withRequestId(String requestId) {
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

    public String getAction() {
        return this.action;
    }

    public String getResourceType() {
        return this.resourceType;
    }

    public String getResourceId() {
        return this.resourceId;
    }

    public String getIpAddress() {
        return this.ipAddress;
    }

    public String getUserAgent() {
        return this.userAgent;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
