package com.explify.sidecar.service;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.exception.UnauthenticatedException;
import com.explify.sidecar.model.BaaAcceptance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Business Associate Agreement acceptance. Acceptances are inserted, never updated, so repeated
 * acceptance of the same version leaves one row per acceptance.
 */
@Service
public class ConsentService {
    private static final Logger log = LoggerFactory.getLogger(ConsentService.class);
    private final MongoTemplate mongoTemplate;
    private final ModeConfig modeConfig;
    private final String currentVersion;

    public ConsentService(MongoTemplate mongoTemplate, ModeConfig modeConfig, @Value("${app.baa.version:1.0}") String currentVersion) {
        this.mongoTemplate = mongoTemplate;
        this.modeConfig = modeConfig;
        this.currentVersion = currentVersion;
    }

    public String getCurrentVersion() {
        return this.currentVersion;
    }

    public boolean status(String identity, String version) {
        requireIdentity(identity);
        if (this.modeConfig.isLocal()) {
            return false;
        }
        Query query = new Query(Criteria.where("userId").is(identity).and("baaVersion").is(version));
        return this.mongoTemplate.exists(query, BaaAcceptance.class);
    }

    public void accept(String identity, String version, String ipAddress, String userAgent) {
        requireIdentity(identity);
        if (this.modeConfig.isLocal()) {
            return;
        }
        this.mongoTemplate.insert(BaaAcceptance.create(identity, version, ipAddress, userAgent));
        log.info("BAA version {} accepted", version);
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new UnauthenticatedException();
        }
    }
}
