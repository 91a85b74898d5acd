package com.example.dutyroster.common;

import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.config.RotationRulesSettings;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final RotationRulesSettings settings;

    public HealthController(RotationRulesSettings settings) {
        this.settings = settings;
    }

    // Reports the rule defaults a request without overrides will run with
    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        RotationRules rules = settings.toRules();
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of("status", "UP", "rules", rules)));
    }
}
