package com.copas.services.ordercrm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Plain liveness probe for the load balancer. Actuator health covers the database.
 */
@RestController
@Tag(name = "Health")
public class HealthController {

    @Value("${spring.application.name:order-crm-service}")
    private String serviceName;

    @GetMapping("/health")
    @Operation(summary = "Liveness probe")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "service", serviceName));
    }
}
