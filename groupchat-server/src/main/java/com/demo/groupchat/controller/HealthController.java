package com.demo.groupchat.controller;

import com.demo.groupchat.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final DocumentStore documentStore;

    public HealthController(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");

        try {
            response.put("store", documentStore.ping() ? "connected" : "disconnected");
        } catch (RuntimeException e) {
            log.warn("Store ping failed: {}", e.getMessage());
            response.put("store", "disconnected");
        }

        return response;
    }
}
