package com.metricscache.api;

import com.metricscache.domain.keyspace.CacheKeys;
import com.metricscache.domain.keyspace.KeyScheme;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.service.CacheAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Key-space maintenance.
 *
 * Endpoints:
 * - GET /api/v1/cache/keys?pattern=xxx - Scan keys (or metricId/tenantId/scheme instead of a pattern)
 * - DELETE /api/v1/cache/keys?pattern=xxx - Delete matching keys
 * - GET /api/v1/cache/ttl?key=xxx - Remaining TTL
 * - GET /api/v1/cache/pages?pattern=xxx - Scan and fetch pages
 * - POST /api/v1/cache/archive?pattern=xxx - Copy matching pages to the archive table
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheAdminService adminService;

    @GetMapping("/keys")
    public ResponseEntity<List<String>> scan(
            @RequestParam(required = false) String pattern,
            @RequestParam(required = false) String metricId,
            @RequestParam(required = false) String tenantId,
            @RequestParam(defaultValue = "SHORTENED") KeyScheme scheme) {

        String match = pattern != null ? pattern : CacheKeys.scanPattern(scheme, metricId, tenantId);
        log.info("Scan keys: pattern={}", match);

        return ResponseEntity.ok(adminService.scan(match));
    }

    @DeleteMapping("/keys")
    public ResponseEntity<Map<String, Long>> deleteByPattern(@RequestParam String pattern) {
        log.info("Delete keys: pattern={}", pattern);

        return ResponseEntity.ok(Map.of("deleted", adminService.deleteByPattern(pattern)));
    }

    @GetMapping("/ttl")
    public ResponseEntity<Map<String, Long>> ttl(@RequestParam String key) {
        return ResponseEntity.ok(Map.of("ttl", adminService.ttl(key)));
    }

    @GetMapping("/pages")
    public ResponseEntity<Map<String, DatasetPage>> scanAndGet(@RequestParam String pattern) {
        log.info("Scan and get: pattern={}", pattern);

        return ResponseEntity.ok(adminService.scanAndGet(pattern));
    }

    @PostMapping("/archive")
    public ResponseEntity<Map<String, Integer>> archive(@RequestParam String pattern) {
        log.info("Archive pages: pattern={}", pattern);

        return ResponseEntity.ok(Map.of("archived", adminService.archive(pattern)));
    }
}
