package com.sonarlink.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarlink.exception.NetworkException;
import com.sonarlink.exception.SonarQubeErrors;
import com.sonarlink.exception.SonarQubeException;
import com.sonarlink.exception.UpstreamTimeoutException;
import com.sonarlink.model.RawResponse;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * WebClient-backed transport to SonarQube.
 *
 * <p>The WebClient carries the pooled reactor-netty connector, the base URL and
 * the bearer token header (see {@link com.sonarlink.config.WebClientConfiguration}).
 * Each call emits one log line with the token redacted.</p>
 */
@Slf4j
public class WebClientSonarQubeTransport implements SonarQubeTransport {

    private static final Set<String> SENSITIVE_PARAMS = Set.of("token", "password", "secret", "login_token");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String organization;
    private final String redactedAuth;

    public WebClientSonarQubeTransport(
            WebClient webClient,
            ObjectMapper objectMapper,
            String baseUrl,
            String token,
            String organization) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.organization = organization;
        this.redactedAuth = redactToken(token);
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public Mono<RawResponse> call(HttpMethod method, String path, Map<String, String> params, Object body) {
        Map<String, String> query = withOrganization(params);

        return Mono.defer(() -> {
            long startNanos = System.nanoTime();

            WebClient.RequestBodySpec request = webClient.method(method)
                    .uri(builder -> buildUri(builder, path, query));

            WebClient.RequestHeadersSpec<?> spec = body == null
                    ? request
                    : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

            return spec.exchangeToMono(this::toRawResponse)
                    .onErrorMap(error -> !(error instanceof SonarQubeException), this::classifyTransportFailure)
                    .doOnSuccess(response -> log.info(
                            "SonarQube {} {} params={} -> {} in {}ms (auth={})",
                            method, path, redactParams(query), response.getStatusCode(),
                            elapsedMillis(startNanos), redactedAuth))
                    .doOnError(error -> log.warn(
                            "SonarQube {} {} params={} failed after {}ms (auth={}): {}",
                            method, path, redactParams(query),
                            elapsedMillis(startNanos), redactedAuth, error.getMessage()));
        });
    }

    private URI buildUri(UriBuilder builder, String path, Map<String, String> query) {
        builder.path(path);
        // Values go through URI variables so braces and commas are encoded, not expanded
        Map<String, String> variables = new HashMap<>();
        int i = 0;
        for (Map.Entry<String, String> entry : query.entrySet()) {
            String variable = "p" + i++;
            builder.queryParam(entry.getKey(), "{" + variable + "}");
            variables.put(variable, entry.getValue());
        }
        return builder.build(variables);
    }

    private Mono<RawResponse> toRawResponse(ClientResponse response) {
        int status = response.statusCode().value();
        HttpHeaders headers = response.headers().asHttpHeaders();

        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> {
                    if (status < 400) {
                        return Mono.just(RawResponse.builder()
                                .statusCode(status)
                                .headers(headers)
                                .body(text)
                                .build());
                    }
                    return Mono.error(SonarQubeErrors.fromStatus(
                            status, extractErrorMessage(status, text), parseRetryAfter(headers)));
                });
    }

    /**
     * SonarQube error bodies look like {@code {"errors":[{"msg":"..."}]}}.
     */
    String extractErrorMessage(int status, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode root = objectMapper.readTree(body);
                JsonNode errors = root.path("errors");
                if (errors.isArray() && !errors.isEmpty()) {
                    StringJoiner joiner = new StringJoiner("; ");
                    errors.forEach(e -> joiner.add(e.has("msg") ? e.get("msg").asText() : e.asText()));
                    return joiner.toString();
                }
                if (root.hasNonNull("message")) {
                    return root.get("message").asText();
                }
            } catch (Exception e) {
                log.debug("Error body is not JSON: {}", e.getMessage());
            }
        }
        return "HTTP " + status + ": " + (body == null ? "" : body);
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", value);
            return null;
        }
    }

    private SonarQubeException classifyTransportFailure(Throwable error) {
        if (isTimeout(error)) {
            return new UpstreamTimeoutException("Request to SonarQube timed out: " + rootMessage(error), error);
        }
        return new NetworkException("Network error talking to SonarQube: " + rootMessage(error), error);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof ConnectTimeoutException
                    || t instanceof java.util.concurrent.TimeoutException
                    || t instanceof java.net.SocketTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private Map<String, String> withOrganization(Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>(params == null ? Map.of() : params);
        if (organization != null && !organization.isBlank()) {
            query.putIfAbsent("organization", organization);
        }
        return query;
    }

    static Map<String, String> redactParams(Map<String, String> params) {
        Map<String, String> redacted = new LinkedHashMap<>();
        params.forEach((name, value) -> redacted.put(name,
                SENSITIVE_PARAMS.contains(name.toLowerCase(Locale.ROOT)) ? "****" : value));
        return redacted;
    }

    static String redactToken(String token) {
        if (token == null || token.length() < 8) {
            return "Bearer ****";
        }
        return "Bearer ****" + token.substring(token.length() - 4);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
