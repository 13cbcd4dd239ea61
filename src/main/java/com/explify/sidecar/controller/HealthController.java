package com.explify.sidecar.controller;

import com.explify.sidecar.config.ModeConfig;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final ModeConfig modeConfig;

    public HealthController(ModeConfig modeConfig) {
        this.modeConfig = modeConfig;
    }

    @GetMapping(value={"/health"})
    public Map<String, String> health() {
        return Map.of("status", "ok", "mode", this.modeConfig.getMode().name());
    }
}
