package com.explify.sidecar.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Acceptance of a Business Associate Agreement version. Re-acceptance inserts a new row,
 * so the collection is the full consent history.
 */
@Document(collection="baa_acceptances")
@CompoundIndex(name="user_version_idx", def="{'userId': 1, 'baaVersion': 1}")
public class BaaAcceptance {
    @Id
    private String id;
    private String userId;
    private String baaVersion;
    private Instant acceptedAt;
    private String ipAddress;
    private String userAgent;

    public BaaAcceptance() {
        this.acceptedAt = Instant.now();
    }

    public static BaaAcceptance create(String userId, String baaVersion, String ipAddress, String userAgent) {
        BaaAcceptance acceptance = new BaaAcceptance();
        acceptance.userId = userId;
        acceptance.baaVersion = baaVersion;
        acceptance.ipAddress = ipAddress;
        acceptance.userAgent = userAgent;
        return acceptance;
    }

    public String getId() {
        return this.id;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getBaaVersion() {
        return this.baaVersion;
    }

    public Instant getAcceptedAt() {
        return this.acceptedAt;
    }

    public String getIpAddress() {
        return this.ipAddress;
    }

    public String getUserAgent() {
        return this.userAgent;
    }
}
