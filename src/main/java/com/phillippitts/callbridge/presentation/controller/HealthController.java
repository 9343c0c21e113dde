package com.phillippitts.callbridge.presentation.controller;

import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.SessionStreamManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic snapshot of the broker: status plus live call and stream counts.
 */
@RestController
class HealthController {

    private final CallRegistry registry;
    private final SessionStreamManager streams;

    HealthController(CallRegistry registry, SessionStreamManager streams) {
        this.registry = registry;
        this.streams = streams;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now().toString());
        body.put("activeCalls", registry.size());
        body.put("greetedCalls", registry.greetedCount());
        body.put("activeFunctionStreams", streams.activeFunctionStreamCount());
        return ResponseEntity.ok(body);
    }
}
