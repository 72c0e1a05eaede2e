package com.sonarlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarlink.transport.SonarQubeTransport;
import com.sonarlink.transport.WebClientSonarQubeTransport;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import javax.net.ssl.SSLException;
import java.net.URI;

/**
 * WebClient configuration for HTTP requests to SonarQube.
 */
@Slf4j
@Configuration
public class WebClientConfiguration {

    private static final String USER_AGENT = "SonarLink/1.0";

    private final SonarLinkProperties properties;

    public WebClientConfiguration(SonarLinkProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider sonarQubeConnectionProvider() {
        SonarLinkProperties.SonarQubeConfig config = properties.getSonarqube();
        return ConnectionProvider.builder("sonarqube")
                .maxConnections(config.getMaxConnections())
                .maxIdleTime(config.getMaxIdleTime())
                .build();
    }

    @Bean
    public WebClient sonarQubeWebClient(ConnectionProvider sonarQubeConnectionProvider) {
        SonarLinkProperties.SonarQubeConfig config = properties.getSonarqube();
        HttpClient httpClient = sonarQubeHttpClient(sonarQubeConnectionProvider, config);

        return WebClient.builder()
                .baseUrl(normalizeBaseUrl(config.getBaseUrl()))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .build();
    }

    @Bean
    public SonarQubeTransport sonarQubeTransport(WebClient sonarQubeWebClient, ObjectMapper objectMapper) {
        SonarLinkProperties.SonarQubeConfig config = properties.getSonarqube();
        String baseUrl = normalizeBaseUrl(config.getBaseUrl());
        log.info("Initialized SonarQube transport for {}", baseUrl);
        return new WebClientSonarQubeTransport(
                sonarQubeWebClient, objectMapper, baseUrl, config.getToken(), config.getOrganization());
    }

    /**
     * Reactor-netty client for SonarQube. Its built-in reconnect-and-resend is off so every
     * request on the wire has taken a rate-limit permit and counts as a retry attempt.
     */
    static HttpClient sonarQubeHttpClient(ConnectionProvider connectionProvider, SonarLinkProperties.SonarQubeConfig config) {
        HttpClient httpClient = HttpClient.create(connectionProvider)
                .keepAlive(true)
                .disableRetry(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .responseTimeout(config.getRequestTimeout());

        if (!config.isVerifySsl()) {
            log.warn("TLS certificate verification is DISABLED for SonarQube connections");
            SslContext insecure = insecureSslContext();
            httpClient = httpClient.secure(ssl -> ssl.sslContext(insecure));
        }
        return httpClient;
    }

    /**
     * Adds {@code https://} when no scheme is given and makes sure the path ends with {@code /api}.
     */
    public static String normalizeBaseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("SonarQube base URL cannot be empty");
        }

        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }

        URI parsed;
        try {
            parsed = URI.create(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid SonarQube base URL: " + url, e);
        }
        if (parsed.getHost() == null) {
            throw new IllegalStateException("Invalid SonarQube base URL: " + url);
        }

        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (!normalized.endsWith("/api")) {
            normalized = normalized + "/api";
        }
        return normalized;
    }

    private static SslContext insecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to build TLS context for SonarQube", e);
        }
    }
}
