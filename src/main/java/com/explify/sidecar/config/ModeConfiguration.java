package com.explify.sidecar.config;

import com.explify.sidecar.model.OperatingMode;
import com.explify.sidecar.security.AdminAllowlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ModeConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ModeConfiguration.class);

    @Bean
    public ModeConfig modeConfig(@Value("${app.require-auth:false}") String requireAuth) {
        ModeConfig modeConfig = ModeConfig.of(OperatingMode.fromRequireAuth(requireAuth));
        log.info("Operating mode: {}", modeConfig.getMode());
        return modeConfig;
    }

    @Bean
    public AdminAllowlist adminAllowlist(@Value("${app.admin.emails:}") String adminEmails) {
        AdminAllowlist allowlist = AdminAllowlist.parse(adminEmails);
        log.info("Admin allow-list loaded: {} address(es)", allowlist.size());
        return allowlist;
    }
}
