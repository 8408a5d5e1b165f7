package com.example.anchortargets.controller;

import com.example.anchortargets.model.AnchorGrid;
import com.example.anchortargets.rpn.util.ImageRecordCache;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Liveness endpoints, without Spring Actuator
 */
@RestController
public class HealthController {

    @Autowired
    private AnchorGrid anchorGrid;

    @Autowired
    private ImageRecordCache imageRecordCache;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", System.currentTimeMillis());
        response.put("service", "anchor-target-service");
        response.put("totalAnchors", anchorGrid.size());
        response.put("cachedRecords", imageRecordCache.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        Map<String, String> response = new HashMap<>();
        response.put("service", "Anchor Target Service");
        response.put("status", "Running");
        response.put("version", "1.0.0");
        return ResponseEntity.ok(response);
    }
}
