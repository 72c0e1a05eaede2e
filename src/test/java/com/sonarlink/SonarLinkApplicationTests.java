package com.sonarlink;

import com.sonarlink.config.SonarLinkProperties;
import com.sonarlink.model.dto.CacheInfo;
import com.sonarlink.service.SonarQubeGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "sonarlink.sonarqube.base-url=sonar.example.com",
        "sonarlink.sonarqube.token=test-token-0000"
})
class SonarLinkApplicationTests {

    @Autowired
    private SonarQubeGateway gateway;

    @Autowired
    private SonarLinkProperties properties;

    @Test
    void testDefaultResourceCatalogLoaded() {
        CacheInfo info = gateway.cacheInfo();

        assertEquals(10, info.getTtlByType().size());
        assertEquals(60L, info.getTtlByType().get("issues"));
        assertEquals(1800L, info.getTtlByType().get("permissions"));
        assertEquals(600L, info.getTtlByType().get("quality_gates"));
        assertTrue(info.getTtlByType().containsKey("metrics_history"));
        assertTrue(info.getTtlByType().containsKey("security_hotspots"));
        assertEquals(10000, info.getMaxEntries());
        assertEquals("none", info.getSharedCache());
    }

    @Test
    void testPropertiesBound() {
        assertEquals(100, properties.getRateLimit().getCapacity());
        assertEquals(3, properties.getRetry().getMaxAttempts());
        assertEquals(Duration.ofSeconds(60), properties.getCache().getWaitTimeout());
        assertEquals("/projects/search", properties.getResources().get("projects").getListPath());
        assertNull(properties.getCache().getRedisUrl());
        assertEquals("sonarlink:", properties.getCache().getRedisKeyPrefix());
    }
}
