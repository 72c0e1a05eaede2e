package com.sonarlink.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sonarlink.exception.AuthenticationException;
import com.sonarlink.exception.ValidationException;
import com.sonarlink.model.CacheKey;
import com.sonarlink.model.RawResponse;
import com.sonarlink.model.ResourceEndpoint;
import com.sonarlink.model.dto.CacheInfo;
import com.sonarlink.model.dto.RateLimitStatus;
import com.sonarlink.model.dto.UpstreamHealth;
import com.sonarlink.service.cache.CacheCoordinator;
import com.sonarlink.service.cache.CacheStore;
import com.sonarlink.service.cache.SharedCacheTier;
import com.sonarlink.service.cache.TtlPolicy;
import com.sonarlink.service.ratelimit.TokenBucketRateLimiter;
import com.sonarlink.service.retry.RetryOrchestrator;
import com.sonarlink.service.retry.RetryResult;
import com.sonarlink.transport.SonarQubeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Entry point for MCP tool handlers.
 *
 * <p>Tool handlers translate their arguments into {@code (resourceType, resourceId, params)}
 * and call {@link #get}; after a successful write they call {@link #invalidateProject}.
 * This class holds no business logic of its own and only wires the cache, the
 * coordinator, the retry orchestrator, the rate limiter and the transport.</p>
 */
@Slf4j
public class SonarQubeGateway {

    private static final Pattern PROJECT_KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-.:]+$");
    private static final int MAX_PROJECT_KEY_LENGTH = 400;
    private static final String PROJECTS_TYPE = "projects";

    private final SonarQubeTransport transport;
    private final TokenBucketRateLimiter rateLimiter;
    private final RetryOrchestrator retryOrchestrator;
    private final CacheStore cacheStore;
    private final CacheCoordinator coordinator;
    private final ResourceCatalog catalog;
    private final ObjectMapper objectMapper;

    public SonarQubeGateway(
            SonarQubeTransport transport,
            TokenBucketRateLimiter rateLimiter,
            RetryOrchestrator retryOrchestrator,
            CacheStore cacheStore,
            CacheCoordinator coordinator,
            ResourceCatalog catalog,
            ObjectMapper objectMapper) {
        TtlPolicy ttlPolicy = cacheStore.getTtlPolicy();
        for (String type : catalog.resourceTypes()) {
            if (!ttlPolicy.contains(type)) {
                throw new IllegalStateException("Resource type '" + type + "' has no TTL policy");
            }
        }
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.retryOrchestrator = retryOrchestrator;
        this.cacheStore = cacheStore;
        this.coordinator = coordinator;
        this.catalog = catalog;
        this.objectMapper = objectMapper;

        log.info("Initialized SonarQubeGateway with resource types: {}", catalog.resourceTypes());
    }

    /**
     * Fetch a resource, from cache when fresh, otherwise through a single shared upstream call.
     *
     * @param resourceType configured resource type, e.g. {@code metrics}
     * @param resourceId   resource id (usually a project key); empty for collection resources
     * @param params       additional query parameters
     */
    public Mono<JsonNode> get(String resourceType, String resourceId, Map<String, ?> params) {
        return Mono.defer(() -> {
            ResourceEndpoint endpoint = catalog.resolve(resourceType);
            CacheKey key = CacheKey.of(resourceType, resourceId, params);
            return coordinator.getOrFetch(key, () -> fetch(endpoint, key));
        });
    }

    public Mono<JsonNode> get(String resourceType, String resourceId) {
        return get(resourceType, resourceId, Map.of());
    }

    /**
     * Drop everything cached for a project across all resource types, plus the cached project lists,
     * in the local store and the shared tier. Fetches already running for the project are not stored.
     *
     * @return number of entries removed from both tiers
     */
    public Mono<Integer> invalidateProject(String projectKey) {
        return Mono.defer(() -> {
            String key = validateProjectKey(projectKey);
            int local = invalidateLocally(key);
            SharedCacheTier sharedTier = coordinator.getSharedTier();
            return Mono.zip(sharedTier.invalidate(null, key), sharedTier.invalidate(PROJECTS_TYPE, ""))
                    .map(remote -> {
                        // drop anything refilled from the shared tier while it was being cleared
                        int refilled = invalidateLocally(key);
                        int removed = local + refilled + (int) (remote.getT1() + remote.getT2());
                        log.info("Invalidated {} cache entries for project {}", removed, key);
                        return removed;
                    });
        });
    }

    public Mono<Integer> clearType(String resourceType) {
        return Mono.defer(() -> {
            catalog.resolve(resourceType);
            int local = cacheStore.clearType(resourceType);
            return coordinator.getSharedTier().clearType(resourceType)
                    .map(remote -> local + remote.intValue());
        });
    }

    public Mono<Integer> clearAll() {
        return Mono.defer(() -> {
            int local = cacheStore.clearAll();
            return coordinator.getSharedTier().clearAll()
                    .map(remote -> local + remote.intValue());
        });
    }

    public CacheInfo cacheInfo() {
        Map<String, Long> ttlByType = new LinkedHashMap<>();
        cacheStore.getTtlPolicy().asMap().forEach((type, ttl) -> ttlByType.put(type, ttl.getSeconds()));

        return CacheInfo.builder()
                .statistics(cacheStore.stats())
                .ttlByType(ttlByType)
                .maxEntries(cacheStore.getMaxEntries())
                .inFlightRequests(coordinator.inFlightCount())
                .sharedCache(coordinator.getSharedTier().name())
                .build();
    }

    public RateLimitStatus rateLimitStatus() {
        return rateLimiter.status();
    }

    /**
     * Uncached call, typically a write. Goes through the rate limiter and retry policy;
     * on success the given project, if any, is invalidated. The project key is validated
     * before anything is sent.
     */
    public Mono<JsonNode> send(HttpMethod method, String path, Map<String, String> params, Object body, String projectKey) {
        return Mono.defer(() -> {
            String key = projectKey == null || projectKey.isBlank() ? null : validateProjectKey(projectKey);
            Mono<JsonNode> write = execute(method, path, params, body);
            return key == null ? write : write.flatMap(result -> invalidateProject(key).thenReturn(result));
        });
    }

    /**
     * {@code /system/status} reports {@code UP}.
     */
    public Mono<Boolean> checkConnection() {
        return execute(HttpMethod.GET, "/system/status", Map.of(), null)
                .map(status -> "UP".equals(status.path("status").asText()))
                .onErrorResume(error -> {
                    log.error("Connection validation failed: {}", error.getMessage());
                    return Mono.just(false);
                });
    }

    public Mono<Boolean> validateAuthentication() {
        return execute(HttpMethod.GET, "/authentication/validate", Map.of(), null)
                .map(body -> body.path("valid").asBoolean(true))
                .onErrorResume(AuthenticationException.class, error -> Mono.just(false))
                .onErrorResume(error -> {
                    log.error("Authentication validation failed: {}", error.getMessage());
                    return Mono.just(false);
                });
    }

    public Mono<UpstreamHealth> upstreamHealth() {
        return Mono.zip(checkConnection(), validateAuthentication())
                .map(checks -> UpstreamHealth.builder()
                        .reachable(checks.getT1())
                        .authenticated(checks.getT2())
                        .baseUrl(transport.getBaseUrl())
                        .build());
    }

    private int invalidateLocally(String projectKey) {
        return cacheStore.invalidatePrefix(null, projectKey) + cacheStore.invalidatePrefix(PROJECTS_TYPE, "");
    }

    private Mono<JsonNode> fetch(ResourceEndpoint endpoint, CacheKey key) {
        return transport.call(HttpMethod.GET, endpoint.pathFor(key), endpoint.queryFor(key), null)
                .map(this::toPayload);
    }

    private Mono<JsonNode> execute(HttpMethod method, String path, Map<String, String> params, Object body) {
        return retryOrchestrator.execute(() -> transport.call(method, path, params, body).map(this::toPayload))
                .flatMap(SonarQubeGateway::unwrap);
    }

    private static Mono<JsonNode> unwrap(RetryResult<JsonNode> result) {
        return result.isSuccess() ? Mono.just(result.getValue()) : Mono.error(result.getError());
    }

    /**
     * JSON bodies are parsed; anything else is wrapped as {@code {"content":..,"status_code":..}}.
     */
    JsonNode toPayload(RawResponse response) {
        if (response.isJson() && response.getBody() != null && !response.getBody().isBlank()) {
            try {
                return objectMapper.readTree(response.getBody());
            } catch (Exception e) {
                log.error("Failed to parse response: {}", e.getMessage());
            }
        }
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.put("content", response.getBody());
        wrapped.put("status_code", response.getStatusCode());
        return wrapped;
    }

    static String validateProjectKey(String projectKey) {
        if (projectKey == null || projectKey.isBlank()) {
            throw new ValidationException("Project key must be a non-empty string");
        }
        String key = projectKey.trim();
        if (key.length() > MAX_PROJECT_KEY_LENGTH) {
            throw new ValidationException("Project key must be " + MAX_PROJECT_KEY_LENGTH + " characters or less");
        }
        if (!PROJECT_KEY_PATTERN.matcher(key).matches()) {
            throw new ValidationException(
                    "Project key can only contain letters, numbers, hyphens, underscores, dots, and colons");
        }
        return key;
    }
}
