package com.explify.sidecar.config;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the desktop shell and the web front end.
 *
 * app.cors.allowed-origins: comma-separated list. A wildcard is tolerated in desktop mode, where the
 * API only listens on loopback, and flagged in networked mode.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final ModeConfig modeConfig;
    @Value("${app.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebConfig(ModeConfig modeConfig) {
        this.modeConfig = modeConfig;
    }

    @PostConstruct
    public void validateCorsConfiguration() {
        boolean hasWildcard = Arrays.asList(this.allowedOrigins).contains("*");
        if (hasWildcard && this.modeConfig.isNetworked()) {
            log.error("=================================================================");
            log.error("  SECURITY WARNING: CORS wildcard (*) in networked mode!");
            log.error("=================================================================");
            log.error("  Allowed Origins: {}", Arrays.toString(this.allowedOrigins));
            log.error("  Set ALLOWED_ORIGINS to the front-end origin(s).");
            log.error("=================================================================");
        }
        log.info("CORS allowed origins: {}", Arrays.toString(this.allowedOrigins));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(this.allowedOrigins)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "Accept", "Origin", "X-Requested-With", "X-Request-Id")
                .exposedHeaders("X-Request-Id", "X-RateLimit-Limit", "X-RateLimit-Remaining", "Retry-After", "Content-Disposition")
                .maxAge(3600);
    }
}
