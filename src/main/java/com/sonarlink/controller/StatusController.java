package com.sonarlink.controller;

import com.sonarlink.model.dto.RateLimitStatus;
import com.sonarlink.model.dto.UpstreamHealth;
import com.sonarlink.service.SonarQubeGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/v1/status")
public class StatusController {

    private final SonarQubeGateway gateway;

    public StatusController(SonarQubeGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/rate-limit")
    public ResponseEntity<RateLimitStatus> getRateLimit() {
        return ResponseEntity.ok(gateway.rateLimitStatus());
    }

    /**
     * Live connection and authentication check against SonarQube; never served from cache.
     */
    @GetMapping("/upstream")
    public Mono<ResponseEntity<UpstreamHealth>> getUpstream() {
        return gateway.upstreamHealth().map(ResponseEntity::ok);
    }
}
