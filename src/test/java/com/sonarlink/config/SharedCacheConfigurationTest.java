package com.sonarlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarlink.service.cache.RedisSharedCacheTier;
import com.sonarlink.service.cache.SharedCacheTier;
import com.sonarlink.service.cache.TtlPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SharedCacheConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(SharedCacheConfiguration.class)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(TtlPolicy.class, () -> new TtlPolicy(Map.of("metrics", Duration.ofSeconds(300))));

    @Test
    void testNoSharedTierWithoutRedisUrl() {
        runner.withBean(SonarLinkProperties.class, SonarLinkProperties::new).run(context -> {
            assertNull(context.getStartupFailure());
            assertTrue(context.getBeansOfType(SharedCacheTier.class).isEmpty());
            assertTrue(context.getBeansOfType(LettuceConnectionFactory.class).isEmpty());
        });
    }

    @Test
    void testRedisTierBuiltFromUrl() {
        runner.withBean(SonarLinkProperties.class, () -> {
                    SonarLinkProperties properties = new SonarLinkProperties();
                    properties.getCache().setRedisUrl("redis://:secret@cache.internal:6380/2");
                    return properties;
                })
                .withPropertyValues("sonarlink.cache.redis-url=redis://:secret@cache.internal:6380/2")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertInstanceOf(RedisSharedCacheTier.class, context.getBean(SharedCacheTier.class));

                    LettuceConnectionFactory factory = context.getBean(LettuceConnectionFactory.class);
                    assertEquals("cache.internal", factory.getHostName());
                    assertEquals(6380, factory.getPort());
                    assertEquals(2, factory.getDatabase());
                    assertEquals("secret", factory.getPassword());
                    assertEquals(Duration.ofSeconds(5), factory.getClientConfiguration().getCommandTimeout());
                });
    }
}
