package com.sonarlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarlink.service.cache.RedisSharedCacheTier;
import com.sonarlink.service.cache.SharedCacheTier;
import com.sonarlink.service.cache.TtlPolicy;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Duration;

/**
 * Redis shared tier behind the in-process cache.
 * Only active when {@code sonarlink.cache.redis-url} is set.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "sonarlink.cache", name = "redis-url")
public class SharedCacheConfiguration {

    private final SonarLinkProperties.CacheConfig config;

    public SharedCacheConfiguration(SonarLinkProperties properties) {
        this.config = properties.getCache();
    }

    @Bean
    public LettuceConnectionFactory sharedCacheConnectionFactory() {
        RedisURI uri = RedisURI.create(config.getRedisUrl());

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        server.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            server.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            server.setPassword(RedisPassword.of(uri.getPassword()));
        }

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(10))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(config.getRedisCommandTimeout()))
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(config.getRedisCommandTimeout());
        if (uri.isSsl()) {
            client.useSsl();
        }

        log.info("Configured shared cache tier at {}:{} (database {})", uri.getHost(), uri.getPort(), uri.getDatabase());
        return new LettuceConnectionFactory(server, client.build());
    }

    @Bean
    public ReactiveStringRedisTemplate sharedCacheRedisTemplate(LettuceConnectionFactory sharedCacheConnectionFactory) {
        return new ReactiveStringRedisTemplate(sharedCacheConnectionFactory);
    }

    @Bean
    public SharedCacheTier redisSharedCacheTier(
            ReactiveStringRedisTemplate sharedCacheRedisTemplate,
            ObjectMapper objectMapper,
            TtlPolicy ttlPolicy) {
        return new RedisSharedCacheTier(sharedCacheRedisTemplate, objectMapper, ttlPolicy, config.getRedisKeyPrefix());
    }
}
