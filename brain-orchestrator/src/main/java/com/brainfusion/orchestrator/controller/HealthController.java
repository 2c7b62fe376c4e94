package com.brainfusion.orchestrator.controller;

import com.brainfusion.orchestrator.oracle.BrainRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @Value("${spring.application.version:1.0.0}")
    private String version;

    private final BrainRegistry brainRegistry;

    public HealthController(BrainRegistry brainRegistry) {
        this.brainRegistry = brainRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "OK",
            "version", version,
            "smeDomains", brainRegistry.smeDomains()));
    }
}
