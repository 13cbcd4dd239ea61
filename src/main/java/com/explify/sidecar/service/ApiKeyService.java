package com.explify.sidecar.service;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.secrets.SecretStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Provider credentials for the analysis pipeline. Local installs keep user-supplied keys in the
 * {@link SecretStore}; networked deployments take them from the environment and use the instance
 * IAM role for Bedrock.
 */
@Service
public class ApiKeyService {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

    public static final String CLAUDE_API_KEY = "claude_api_key";
    public static final String OPENAI_API_KEY = "openai_api_key";
    public static final String AWS_ACCESS_KEY_ID = "aws_access_key_id";
    public static final String AWS_SECRET_ACCESS_KEY = "aws_secret_access_key";
    public static final List<String> KEY_NAMES = List.of(CLAUDE_API_KEY, OPENAI_API_KEY, AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY);
    static final String IAM_ROLE_MARKER = "iam_role";

    public enum Provider {
        CLAUDE,
        OPENAI,
        BEDROCK;

        public static Provider parse(String value) {
            if (value != null) {
                for (Provider provider : values()) {
                    if (provider.name().equalsIgnoreCase(value.trim())) {
                        return provider;
                    }
                }
            }
            throw new IllegalArgumentException("Unknown provider: " + value);
        }
    }

    private final SecretStore secretStore;
    private final ModeConfig modeConfig;
    private final String anthropicApiKey;
    private final String openaiApiKey;
    private final String awsRegion;

    public ApiKeyService(SecretStore secretStore, ModeConfig modeConfig,
                         @Value("${app.providers.anthropic-api-key:}") String anthropicApiKey,
                         @Value("${app.providers.openai-api-key:}") String openaiApiKey,
                         @Value("${app.providers.aws-region:us-east-1}") String awsRegion) {
        this.secretStore = secretStore;
        this.modeConfig = modeConfig;
        this.anthropicApiKey = anthropicApiKey;
        this.openaiApiKey = openaiApiKey;
        this.awsRegion = awsRegion;
    }

    /**
     * Credentials for a provider. Claude and OpenAI yield {@code api_key}; Bedrock yields
     * {@code access_key}, {@code secret_key} and {@code region}.
     *
     * @return empty when the provider is not configured
     */
    public Optional<Map<String, String>> getApiKey(Provider provider) {
        if (this.modeConfig.isNetworked()) {
            return this.fromEnvironment(provider);
        }
        switch (provider) {
            case CLAUDE:
                return this.secretStore.get(CLAUDE_API_KEY).map(key -> Map.of("api_key", key));
            case OPENAI:
                return this.secretStore.get(OPENAI_API_KEY).map(key -> Map.of("api_key", key));
            default:
                Optional<String> accessKey = this.secretStore.get(AWS_ACCESS_KEY_ID);
                Optional<String> secretKey = this.secretStore.get(AWS_SECRET_ACCESS_KEY);
                if (accessKey.isEmpty() || secretKey.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(Map.of("access_key", accessKey.get(), "secret_key", secretKey.get(), "region", this.awsRegion));
        }
    }

    /**
     * Which named keys hold a value. Values are never returned.
     */
    public Map<String, Boolean> keyStatus() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        if (this.modeConfig.isNetworked()) {
            status.put(CLAUDE_API_KEY, hasText(this.anthropicApiKey));
            status.put(OPENAI_API_KEY, hasText(this.openaiApiKey));
            status.put(AWS_ACCESS_KEY_ID, true);
            status.put(AWS_SECRET_ACCESS_KEY, true);
            return status;
        }
        for (String name : KEY_NAMES) {
            status.put(name, this.secretStore.get(name).isPresent());
        }
        return status;
    }

    /**
     * Stores a key. In networked mode keys come from the environment and writes are ignored.
     *
     * @return true when the value was stored
     */
    public boolean storeKey(String name, String value) {
        requireKnownName(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Key value must not be empty");
        }
        if (this.modeConfig.isNetworked()) {
            log.warn("Ignoring write of {} in networked mode", name);
            return false;
        }
        this.secretStore.set(name, value.trim());
        log.info("Stored credential {}", name);
        return true;
    }

    public boolean deleteKey(String name) {
        requireKnownName(name);
        if (this.modeConfig.isNetworked()) {
            log.warn("Ignoring delete of {} in networked mode", name);
            return false;
        }
        this.secretStore.delete(name);
        log.info("Deleted credential {}", name);
        return true;
    }

    private Optional<Map<String, String>> fromEnvironment(Provider provider) {
        switch (provider) {
            case CLAUDE:
                return hasText(this.anthropicApiKey) ? Optional.of(Map.of("api_key", this.anthropicApiKey)) : Optional.empty();
            case OPENAI:
                return hasText(this.openaiApiKey) ? Optional.of(Map.of("api_key", this.openaiApiKey)) : Optional.empty();
            default:
                return Optional.of(Map.of("access_key", IAM_ROLE_MARKER, "secret_key", "", "region", this.awsRegion));
        }
    }

    private static void requireKnownName(String name) {
        if (!KEY_NAMES.contains(name)) {
            throw new IllegalArgumentException("Unknown key name: " + name);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
