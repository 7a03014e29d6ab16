package com.phillippitts.meetingrouter.presentation.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server info and a lightweight liveness probe for hosting platforms.
 */
@RestController
class ServerInfoController {

    static final String SERVICE_NAME = "Meeting Router Webhook Server";
    static final String VERSION = "1.0.0";

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("availableEndpoints", List.of(
                endpoint("/health", "GET", "Health check"),
                endpoint("/fathom", "POST", "Fathom AI meeting webhook")));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        return ResponseEntity.ok(body);
    }

    private static Map<String, String> endpoint(String path, String method, String description) {
        Map<String, String> endpoint = new LinkedHashMap<>();
        endpoint.put("path", path);
        endpoint.put("method", method);
        endpoint.put("description", description);
        return endpoint;
    }
}
