package com.sonarlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarlink.model.ResourceEndpoint;
import com.sonarlink.service.ResourceCatalog;
import com.sonarlink.service.SonarQubeGateway;
import com.sonarlink.service.cache.CacheCoordinator;
import com.sonarlink.service.cache.CacheStore;
import com.sonarlink.service.cache.SharedCacheTier;
import com.sonarlink.service.cache.TtlPolicy;
import com.sonarlink.service.ratelimit.TokenBucketRateLimiter;
import com.sonarlink.service.retry.RetryOrchestrator;
import com.sonarlink.service.retry.RetryPolicy;
import com.sonarlink.transport.SonarQubeTransport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the data-access components from {@link SonarLinkProperties}.
 *
 * <p>Each component is an explicit bean rather than a static singleton; the cache
 * receives a {@link Clock} and the limiter/backoff a Reactor {@link Scheduler}.</p>
 */
@Configuration
public class DataAccessConfiguration {

    private final SonarLinkProperties properties;

    public DataAccessConfiguration(SonarLinkProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock sonarLinkClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler sonarLinkScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public TtlPolicy ttlPolicy() {
        Map<String, Duration> ttlByType = new LinkedHashMap<>();
        properties.getResources().forEach((type, resource) -> ttlByType.put(type, resource.getTtl()));
        return new TtlPolicy(ttlByType);
    }

    @Bean
    public ResourceCatalog resourceCatalog() {
        List<ResourceEndpoint> endpoints = properties.getResources().entrySet().stream()
                .map(entry -> ResourceEndpoint.builder()
                        .resourceType(entry.getKey())
                        .path(entry.getValue().getPath())
                        .listPath(entry.getValue().getListPath())
                        .idParam(entry.getValue().getIdParam())
                        .build())
                .toList();
        return new ResourceCatalog(endpoints);
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(Scheduler sonarLinkScheduler) {
        SonarLinkProperties.RateLimitConfig config = properties.getRateLimit();
        return new TokenBucketRateLimiter(
                config.getCapacity(),
                config.getRefillPerSecond(),
                config.getDefaultRetryAfter(),
                sonarLinkScheduler);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        SonarLinkProperties.RetryConfig config = properties.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(config.getMaxAttempts())
                .baseDelay(config.getBaseDelay())
                .maxDelay(config.getMaxDelay())
                .jitterFraction(config.getJitterFraction())
                .retryableStatusCodes(Set.copyOf(config.getRetryableStatusCodes()))
                .acquireTimeout(properties.getRateLimit().getAcquireTimeout())
                .build();
    }

    @Bean
    public RetryOrchestrator retryOrchestrator(
            RetryPolicy retryPolicy,
            TokenBucketRateLimiter tokenBucketRateLimiter,
            Scheduler sonarLinkScheduler) {
        return new RetryOrchestrator(retryPolicy, tokenBucketRateLimiter, sonarLinkScheduler);
    }

    @Bean
    public CacheStore cacheStore(TtlPolicy ttlPolicy, Clock sonarLinkClock) {
        return new CacheStore(ttlPolicy, properties.getCache().getMaxEntries(), sonarLinkClock);
    }

    @Bean
    public CacheCoordinator cacheCoordinator(
            CacheStore cacheStore,
            RetryOrchestrator retryOrchestrator,
            Scheduler sonarLinkScheduler,
            ObjectProvider<SharedCacheTier> sharedCacheTier) {
        return new CacheCoordinator(
                cacheStore,
                retryOrchestrator,
                properties.getCache().getWaitTimeout(),
                sonarLinkScheduler,
                sharedCacheTier.getIfAvailable(SharedCacheTier::none));
    }

    @Bean
    public SonarQubeGateway sonarQubeGateway(
            SonarQubeTransport sonarQubeTransport,
            TokenBucketRateLimiter tokenBucketRateLimiter,
            RetryOrchestrator retryOrchestrator,
            CacheStore cacheStore,
            CacheCoordinator cacheCoordinator,
            ResourceCatalog resourceCatalog,
            ObjectMapper objectMapper) {
        return new SonarQubeGateway(
                sonarQubeTransport,
                tokenBucketRateLimiter,
                retryOrchestrator,
                cacheStore,
                cacheCoordinator,
                resourceCatalog,
                objectMapper);
    }
}
