package com.answer.caching.controller;

import com.answer.caching.service.CacheService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/cache")
public class CacheController {

    private final CacheService cacheService;

    public CacheController(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @PostMapping(value = "/put", consumes = {MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<Map<String, Object>> put(
            @RequestParam("key") String key,
            @RequestBody String value,
            @RequestParam("ttl") long ttl
    ) {
        cacheService.put(key, value, ttl);
        return ResponseEntity.ok(Map.of("key", key, "stored", true));
    }

    @GetMapping("/get")
    public ResponseEntity<String> get(@RequestParam("key") String key) {
        String value = cacheService.get(key);
        if (value == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(value);
    }

    @DeleteMapping("/evict")
    public ResponseEntity<Map<String, Object>> evict(@RequestParam("key") String key) {
        return ResponseEntity.ok(Map.of("key", key, "evicted", cacheService.evict(key)));
    }

    @DeleteMapping("/clear")
    public ResponseEntity<Map<String, Object>> clear(@RequestParam(value = "pattern", required = false) String pattern) {
        return ResponseEntity.ok(Map.of("removed", cacheService.clear(pattern)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", ex.getMessage()));
    }
}
