package com.explify.sidecar.config;

import com.explify.sidecar.filter.CorrelationIdFilter;
import com.explify.sidecar.filter.IdentityFilter;
import com.explify.sidecar.filter.NetworkedRouteFilter;
import com.explify.sidecar.filter.RateLimitFilter;
import com.explify.sidecar.filter.RequestAuditFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

/**
 * Request pipeline: request id, local-mode route gate, identity, request audit, rate limit, then
 * the handler. The custom filters run only inside the security chain; their servlet registrations
 * are disabled so they do not run twice.
 */
@Configuration
public class SecurityConfig {
    private final CorrelationIdFilter correlationIdFilter;
    private final NetworkedRouteFilter networkedRouteFilter;
    private final IdentityFilter identityFilter;
    private final RequestAuditFilter requestAuditFilter;
    private final RateLimitFilter rateLimitFilter;

    public SecurityConfig(CorrelationIdFilter correlationIdFilter, NetworkedRouteFilter networkedRouteFilter, IdentityFilter identityFilter,
                          RequestAuditFilter requestAuditFilter, RateLimitFilter rateLimitFilter) {
        this.correlationIdFilter = correlationIdFilter;
        this.networkedRouteFilter = networkedRouteFilter;
        this.identityFilter = identityFilter;
        this.requestAuditFilter = requestAuditFilter;
        this.rateLimitFilter = rateLimitFilter;
    }

    @Bean
    public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilterRegistration(CorrelationIdFilter filter) {
        return disabled(filter);
    }

    @Bean
    public FilterRegistrationBean<NetworkedRouteFilter> networkedRouteFilterRegistration(NetworkedRouteFilter filter) {
        return disabled(filter);
    }

    @Bean
    public FilterRegistrationBean<IdentityFilter> identityFilterRegistration(IdentityFilter filter) {
        return disabled(filter);
    }

    @Bean
    public FilterRegistrationBean<RequestAuditFilter> requestAuditFilterRegistration(RequestAuditFilter filter) {
        return disabled(filter);
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter filter) {
        return disabled(filter);
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http.addFilterBefore(this.correlationIdFilter, SecurityContextHolderFilter.class)
                .addFilterBefore(this.networkedRouteFilter, SecurityContextHolderFilter.class)
                .addFilterBefore(this.identityFilter, AnonymousAuthenticationFilter.class)
                .addFilterBefore(this.requestAuditFilter, AuthorizationFilter.class)
                .addFilterBefore(this.rateLimitFilter, AuthorizationFilter.class)
                .cors(Customizer.withDefaults())
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .headers(headers -> headers.frameOptions(HeadersConfigurer.FrameOptionsConfig::deny)
                        .contentTypeOptions(contentType -> {})
                        .referrerPolicy(referrer -> referrer.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER)))
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(HttpMethod.OPTIONS, "/**").permitAll();
                    auth.requestMatchers("/health").permitAll();
                    auth.anyRequest().authenticated();
                })
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable);
        return http.build();
    }

    private static <T extends jakarta.servlet.Filter> FilterRegistrationBean<T> disabled(T filter) {
        FilterRegistrationBean<T> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
