package com.explify.sidecar.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.secrets.SecretStore;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ApiKeyServiceTest {

    private final SecretStore secretStore = mock(SecretStore.class);

    private ApiKeyService local() {
        return new ApiKeyService(this.secretStore, ModeConfig.local(), "", "", "eu-west-1");
    }

    private ApiKeyService networked(String anthropicKey) {
        return new ApiKeyService(this.secretStore, ModeConfig.networked(), anthropicKey, "", "us-east-1");
    }

    @Test
    void localModeReadsFromSecretStore() {
        when(this.secretStore.get(ApiKeyService.CLAUDE_API_KEY)).thenReturn(Optional.of("sk-ant"));
        when(this.secretStore.get(ApiKeyService.AWS_ACCESS_KEY_ID)).thenReturn(Optional.of("AKIA"));
        when(this.secretStore.get(ApiKeyService.AWS_SECRET_ACCESS_KEY)).thenReturn(Optional.empty());
        when(this.secretStore.get(ApiKeyService.OPENAI_API_KEY)).thenReturn(Optional.empty());

        assertEquals(Optional.of(Map.of("api_key", "sk-ant")), this.local().getApiKey(ApiKeyService.Provider.CLAUDE));
        assertEquals(Optional.empty(), this.local().getApiKey(ApiKeyService.Provider.BEDROCK));
        assertEquals(Optional.empty(), this.local().getApiKey(ApiKeyService.Provider.OPENAI));
    }

    @Test
    void localBedrockNeedsBothHalves() {
        when(this.secretStore.get(ApiKeyService.AWS_ACCESS_KEY_ID)).thenReturn(Optional.of("AKIA"));
        when(this.secretStore.get(ApiKeyService.AWS_SECRET_ACCESS_KEY)).thenReturn(Optional.of("secret"));

        Map<String, String> creds = this.local().getApiKey(ApiKeyService.Provider.BEDROCK).orElseThrow();

        assertEquals("AKIA", creds.get("access_key"));
        assertEquals("secret", creds.get("secret_key"));
        assertEquals("eu-west-1", creds.get("region"));
    }

    @Test
    void networkedModeUsesEnvironmentAndIamRole() {
        ApiKeyService service = this.networked("sk-env");

        assertEquals(Optional.of(Map.of("api_key", "sk-env")), service.getApiKey(ApiKeyService.Provider.CLAUDE));
        assertEquals(Optional.empty(), service.getApiKey(ApiKeyService.Provider.OPENAI));
        assertEquals(ApiKeyService.IAM_ROLE_MARKER, service.getApiKey(ApiKeyService.Provider.BEDROCK).orElseThrow().get("access_key"));
        verifyNoInteractions(this.secretStore);
    }

    @Test
    void networkedModeIgnoresWrites() {
        ApiKeyService service = this.networked("");

        assertFalse(service.storeKey(ApiKeyService.CLAUDE_API_KEY, "sk"));
        assertFalse(service.deleteKey(ApiKeyService.CLAUDE_API_KEY));
        assertFalse(service.keyStatus().get(ApiKeyService.CLAUDE_API_KEY));
        verifyNoInteractions(this.secretStore);
    }

    @Test
    void storesTrimmedValueLocally() {
        assertTrue(this.local().storeKey(ApiKeyService.OPENAI_API_KEY, "  sk-open  "));

        verify(this.secretStore).set(ApiKeyService.OPENAI_API_KEY, "sk-open");
    }

    @Test
    void rejectsUnknownNamesAndBlankValues() {
        assertThrows(IllegalArgumentException.class, () -> this.local().storeKey("github_token", "x"));
        assertThrows(IllegalArgumentException.class, () -> this.local().storeKey(ApiKeyService.CLAUDE_API_KEY, " "));
        assertThrows(IllegalArgumentException.class, () -> this.local().deleteKey("github_token"));
        assertThrows(IllegalArgumentException.class, () -> ApiKeyService.Provider.parse("gemini"));
        assertEquals(ApiKeyService.Provider.BEDROCK, ApiKeyService.Provider.parse(" Bedrock "));
    }

    @Test
    void keyStatusReportsPresenceOnly() {
        when(this.secretStore.get(anyString())).thenReturn(Optional.empty());
        when(this.secretStore.get(ApiKeyService.CLAUDE_API_KEY)).thenReturn(Optional.of("sk"));

        Map<String, Boolean> status = this.local().keyStatus();

        assertEquals(ApiKeyService.KEY_NAMES.size(), status.size());
        assertTrue(status.get(ApiKeyService.CLAUDE_API_KEY));
        assertFalse(status.get(ApiKeyService.OPENAI_API_KEY));
    }
}
