package com.sonarlink.config;

import org.junit.jupiter.api.Test;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigurationTest {

    @Test
    void testNormalizeBaseUrl() {
        assertEquals("https://sonar.example.com/api", WebClientConfiguration.normalizeBaseUrl("sonar.example.com"));
        assertEquals("http://localhost:9000/api", WebClientConfiguration.normalizeBaseUrl("http://localhost:9000/"));
        assertEquals("https://sonarcloud.io/api", WebClientConfiguration.normalizeBaseUrl("https://sonarcloud.io/api"));
        assertEquals("https://host/sonar/api", WebClientConfiguration.normalizeBaseUrl(" https://host/sonar "));
    }

    @Test
    void testInvalidBaseUrlRejected() {
        assertThrows(IllegalStateException.class, () -> WebClientConfiguration.normalizeBaseUrl(""));
        assertThrows(IllegalStateException.class, () -> WebClientConfiguration.normalizeBaseUrl(null));
        assertThrows(IllegalStateException.class, () -> WebClientConfiguration.normalizeBaseUrl("https://"));
    }

    @Test
    void testHttpClientDoesNotResendOnItsOwn() {
        SonarLinkProperties.SonarQubeConfig config = new SonarLinkProperties.SonarQubeConfig();
        config.setRequestTimeout(Duration.ofSeconds(7));
        ConnectionProvider provider = ConnectionProvider.create("test", 1);
        try {
            HttpClient client = WebClientConfiguration.sonarQubeHttpClient(provider, config);

            assertTrue(client.configuration().isRetryDisabled());
            assertEquals(Duration.ofSeconds(7), client.configuration().responseTimeout());
        } finally {
            provider.dispose();
        }
    }
}
