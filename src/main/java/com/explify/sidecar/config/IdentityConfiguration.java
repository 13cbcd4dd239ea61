package com.explify.sidecar.config;

import com.explify.sidecar.security.JwksKeyProvider;
import com.explify.sidecar.security.JwtValidator;
import com.explify.sidecar.service.IdentityResolver;
import com.explify.sidecar.service.JwtIdentityResolver;
import com.explify.sidecar.service.LocalIdentityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IdentityConfiguration {
    private static final Logger log = LoggerFactory.getLogger(IdentityConfiguration.class);

    @Value(value="${app.auth.local-user-id:local-user}")
    private String localUserId;
    @Value(value="${app.oidc.issuer:}")
    private String issuer;
    @Value(value="${app.oidc.region:}")
    private String region;
    @Value(value="${app.oidc.user-pool-id:}")
    private String userPoolId;
    @Value(value="${app.oidc.client-id:}")
    private String clientId;
    @Value(value="${app.oidc.jwks-uri:}")
    private String jwksUri;
    @Value(value="${app.oidc.local-jwks-path:}")
    private String localJwksPath;
    @Value(value="${app.oidc.jwks-cache-ttl:3600}")
    private long jwksCacheTtlSeconds;
    @Value(value="${app.oidc.clock-skew-seconds:0}")
    private long clockSkewSeconds;

    @Bean
    public IdentityResolver identityResolver(ModeConfig modeConfig) {
        if (modeConfig.isLocal()) {
            log.info("Identity: local mode, all requests attributed to '{}'", this.localUserId);
            return new LocalIdentityResolver(this.localUserId);
        }
        String effectiveIssuer = resolveIssuer(this.issuer, this.region, this.userPoolId);
        JwksKeyProvider keyProvider = new JwksKeyProvider(this.jwksUri, this.localJwksPath, effectiveIssuer, this.jwksCacheTtlSeconds);
        log.info("Identity: bearer tokens from issuer {}", effectiveIssuer.isEmpty() ? "(unset)" : effectiveIssuer);
        return new JwtIdentityResolver(new JwtValidator(keyProvider, effectiveIssuer, this.clientId, this.clockSkewSeconds));
    }

    public static String resolveIssuer(String issuer, String region, String userPoolId) {
        if (issuer != null && !issuer.isBlank()) {
            return issuer.trim();
        }
        if (region != null && !region.isBlank() && userPoolId != null && !userPoolId.isBlank()) {
            return "https://cognito-idp." + region.trim() + ".amazonaws.com/" + userPoolId.trim();
        }
        return "";
    }
}
