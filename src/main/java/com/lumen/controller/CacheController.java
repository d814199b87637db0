package com.lumen.controller;

import com.lumen.model.dto.CacheStatistics;
import com.lumen.service.cache.ResponseCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCacheStore cacheStore;

    public CacheController(ResponseCacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cacheStore.stats());
    }

    /**
     * Remove entries whose key, model or prompt matches a glob pattern.
     */
    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(@RequestBody Map<String, String> body) {
        String pattern = body.get("pattern");
        log.info("Cache invalidation requested: pattern={}", pattern);
        int removed = cacheStore.invalidate(pattern);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "pattern", pattern,
                "removed", removed
        ));
    }

    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        cacheStore.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared"
        ));
    }
}
