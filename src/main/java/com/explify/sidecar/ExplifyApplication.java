package com.explify.sidecar;

import com.explify.sidecar.config.IdentityConfiguration;
import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.security.AdminAllowlist;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class ExplifyApplication {
    private static final Logger log = LoggerFactory.getLogger(ExplifyApplication.class);
    private final Environment environment;
    private final ModeConfig modeConfig;
    private final AdminAllowlist adminAllowlist;

    public ExplifyApplication(Environment environment, ModeConfig modeConfig, AdminAllowlist adminAllowlist) {
        this.environment = environment;
        this.modeConfig = modeConfig;
        this.adminAllowlist = adminAllowlist;
    }

    public static void main(String[] args) {
        SpringApplication.run(ExplifyApplication.class, args);
    }

    @PostConstruct
    public void validateSecurityConfiguration() {
        if (this.modeConfig.isLocal()) {
            log.warn("=================================================================");
            log.warn("  DESKTOP MODE: authentication disabled");
            log.warn("=================================================================");
            log.warn("  All requests are attributed to the local user.");
            log.warn("  Admin, BAA and account endpoints are not available.");
            log.warn("  Set REQUIRE_AUTH=true for a multi-tenant deployment.");
            log.warn("=================================================================");
            return;
        }
        String issuer = IdentityConfiguration.resolveIssuer(
                this.environment.getProperty("app.oidc.issuer", ""),
                this.environment.getProperty("app.oidc.region", ""),
                this.environment.getProperty("app.oidc.user-pool-id", ""));
        String clientId = this.environment.getProperty("app.oidc.client-id", "");
        if (issuer.isEmpty() || clientId.isBlank()) {
            log.error("=================================================================");
            log.error("  SECURITY CONFIGURATION ERROR: identity provider incomplete");
            log.error("=================================================================");
            log.error("  Issuer: {}", issuer.isEmpty() ? "(unset)" : issuer);
            log.error("  Client id: {}", clientId.isBlank() ? "(unset)" : "(set)");
            log.error("");
            log.error("  Issuer and audience checks are skipped until both are set:");
            log.error("    - COGNITO_REGION and COGNITO_USER_POOL_ID (or OIDC_ISSUER)");
            log.error("    - COGNITO_CLIENT_ID");
            log.error("=================================================================");
        }
        if (this.adminAllowlist.isEmpty()) {
            log.warn("No admin users configured (ADMIN_EMAILS is empty); every admin request will be refused");
        }
        log.info("Security configuration validated:");
        log.info("  Mode: {}", this.modeConfig.getMode());
        log.info("  Issuer: {}", issuer);
        log.info("  Admins configured: {}", this.adminAllowlist.size());
    }
}
