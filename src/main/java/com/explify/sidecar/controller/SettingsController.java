package com.explify.sidecar.controller;

import com.explify.sidecar.service.ApiKeyService;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Provider API keys. Values are write-only: reads report presence, never the secret.
 */
@RestController
@RequestMapping(value={"/settings/keys"})
public class SettingsController {
    private final ApiKeyService apiKeyService;

    public SettingsController(ApiKeyService apiKeyService) {
        this.apiKeyService = apiKeyService;
    }

    @GetMapping
    public Map<String, Boolean> keyStatus() {
        return this.apiKeyService.keyStatus();
    }

    @PutMapping(value={"/{name}"})
    public Map<String, Object> storeKey(@PathVariable(value="name") String name, @RequestBody Map<String, String> body) {
        boolean stored = this.apiKeyService.storeKey(name, body != null ? body.get("value") : null);
        return Map.of("name", name, "stored", stored);
    }

    @DeleteMapping(value={"/{name}"})
    public Map<String, Object> deleteKey(@PathVariable(value="name") String name) {
        boolean deleted = this.apiKeyService.deleteKey(name);
        return Map.of("name", name, "deleted", deleted);
    }
}
