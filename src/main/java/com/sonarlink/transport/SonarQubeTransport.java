package com.sonarlink.transport;

import com.sonarlink.model.RawResponse;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A single HTTP exchange with the SonarQube Web API.
 * Implementations handle authentication, connection pooling and failure
 * classification, and never retry.
 */
public interface SonarQubeTransport {

    /**
     * Perform one request.
     *
     * @param method HTTP method
     * @param path   API path relative to the {@code /api} base (e.g. {@code /measures/component})
     * @param params query parameters, may be empty
     * @param body   JSON body, or null
     * @return the response for statuses below 400; otherwise an error signal carrying
     *         the matching {@link com.sonarlink.exception.SonarQubeException} subtype
     */
    Mono<RawResponse> call(HttpMethod method, String path, Map<String, String> params, Object body);

    /**
     * Base URL requests are sent to, for diagnostics.
     */
    String getBaseUrl();
}
