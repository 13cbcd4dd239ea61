package com.explify.sidecar.config;

import com.explify.sidecar.secrets.CredentialBackend;
import com.explify.sidecar.secrets.KeyringCredentialBackend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecretStoreConfiguration {

    @Bean
    public CredentialBackend credentialBackend(@Value("${app.secrets.service-name:explify}") String serviceName) {
        return new KeyringCredentialBackend(serviceName);
    }
}
