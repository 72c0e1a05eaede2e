package com.sonarlink.controller;

import com.sonarlink.model.dto.CacheInfo;
import com.sonarlink.model.dto.CacheStatistics;
import com.sonarlink.service.SonarQubeGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics, configuration and invalidation for the SonarQube response cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final SonarQubeGateway gateway;

    public CacheController(SonarQubeGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Statistics plus configuration: TTL per resource type, max entries, in-flight fetches.
     */
    @GetMapping("/info")
    public ResponseEntity<CacheInfo> getInfo() {
        return ResponseEntity.ok(gateway.cacheInfo());
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(gateway.cacheInfo().getStatistics());
    }

    @PostMapping("/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        log.info("Cache clear requested");

        return gateway.clearAll()
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed,
                        "message", "Cache cleared"
                )));
    }

    @PostMapping("/clear/{type}")
    public Mono<ResponseEntity<Map<String, Object>>> clearType(@PathVariable("type") String type) {
        log.info("Cache clear requested for resource type {}", type);

        return gateway.clearType(type)
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed,
                        "message", "Cache cleared for " + type
                )));
    }

    /**
     * Drop every cached entry for a project, e.g. after an external write.
     */
    @PostMapping("/projects/{projectKey}/invalidate")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateProject(@PathVariable("projectKey") String projectKey) {
        return gateway.invalidateProject(projectKey)
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed,
                        "project", projectKey
                )));
    }
}
