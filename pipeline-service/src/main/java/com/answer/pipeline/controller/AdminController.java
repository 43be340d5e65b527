package com.answer.pipeline.controller;

import com.answer.pipeline.service.PipelineStats;
import com.answer.pipeline.service.SearchPipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class AdminController {

    private final SearchPipelineService pipelineService;

    public AdminController(SearchPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping("/stats")
    public PipelineStats stats() {
        return pipelineService.stats();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> report = pipelineService.health();
        HttpStatus status = "unhealthy".equals(report.get("overall")) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        pipelineService.clearCache();
        return Map.of("cleared", true);
    }

    @DeleteMapping("/cache/{key}")
    public Map<String, Object> invalidate(@PathVariable("key") String key) {
        pipelineService.invalidate(key);
        return Map.of("key", key, "invalidated", true);
    }
}
