package com.sonarlink.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for SonarLink.
 *
 * <p>Every recognized option is enumerated here and validated once at startup;
 * a missing token or a non-positive limit stops the application instead of
 * falling back silently.</p>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "sonarlink")
public class SonarLinkProperties {

    @Valid
    private SonarQubeConfig sonarqube = new SonarQubeConfig();

    @Valid
    private RateLimitConfig rateLimit = new RateLimitConfig();

    @Valid
    private RetryConfig retry = new RetryConfig();

    @Valid
    private CacheConfig cache = new CacheConfig();

    @Valid
    @NotEmpty
    private Map<String, ResourceConfig> resources = new LinkedHashMap<>();

    @Data
    public static class SonarQubeConfig {
        @NotBlank
        private String baseUrl;
        @NotBlank
        private String token;
        private String organization;
        private boolean verifySsl = true;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int maxConnections = 50;
        @NotNull
        private Duration maxIdleTime = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimitConfig {
        @Min(1)
        private long capacity = 100;
        @DecimalMin(value = "0.0", inclusive = false)
        private double refillPerSecond = 100.0 / 60.0;
        @NotNull
        private Duration acquireTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration defaultRetryAfter = Duration.ofSeconds(5);
    }

    @Data
    public static class RetryConfig {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFraction = 0.1;
        @NotEmpty
        private Set<Integer> retryableStatusCodes = new LinkedHashSet<>(Set.of(429, 500, 502, 503, 504));
    }

    @Data
    public static class CacheConfig {
        @Min(1)
        private int maxEntries = 10000;
        @NotNull
        private Duration waitTimeout = Duration.ofSeconds(60);
        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(5);
        @NotNull
        private Duration statsLogInterval = Duration.ofMinutes(10);

        /**
         * Redis URL of the shared tier, e.g. {@code redis://localhost:6379/0}. Unset keeps the cache in-process.
         */
        private String redisUrl;
        @NotBlank
        private String redisKeyPrefix = "sonarlink:";
        @NotNull
        private Duration redisCommandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ResourceConfig {
        @NotBlank
        private String path;
        private String listPath;
        @NotBlank
        private String idParam;
        @NotNull
        private Duration ttl;
    }
}
