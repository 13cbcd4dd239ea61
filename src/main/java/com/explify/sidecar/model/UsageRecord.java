package com.explify.sidecar.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="usage_log")
public class UsageRecord {
    @Id
    private String id;
    @Indexed
    private String userId;
    @Indexed
    private Instant createdAt;
    private String modelUsed;
    private int inputTokens;
    private int outputTokens;
    private String requestType;
    private boolean deepAnalysis;

    public UsageRecord() {
        this.createdAt = Instant.now();
    }

    public static UsageRecord create(String userId, String modelUsed, int inputTokens, int outputTokens, String requestType, boolean deepAnalysis) {
        UsageRecord record = new UsageRecord();
        record.userId = userId;
        record.modelUsed = modelUsed != null ? modelUsed : "";
        record.inputTokens = inputTokens;
        record.outputTokens = outputTokens;
        record.requestType = requestType != null && !requestType.isBlank() ? requestType : "explain";
        record.deepAnalysis = deepAnalysis;
        return record;
    }

    public String getId() {
        return this.id;
    }

    public String getUserId() {
        return this.userId;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getModelUsed() {
        return this.modelUsed;
    }

    public int getInputTokens() {
        return this.inputTokens;
    }

    public int getOutputTokens() {
        return this.outputTokens;
    }

    public String getRequestType() {
        return this.requestType;
    }

    public boolean isDeepAnalysis() {
        return this.deepAnalysis;
    }
}
