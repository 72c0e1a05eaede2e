package com.sonarlink.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Identity of a cached SonarQube resource.
 *
 * <p>Composed of the resource type, the resource id (usually a project key; empty
 * for collection resources) and the normalized query parameters. Two requests
 * that differ only in parameter order or in blank/null parameters map to the
 * same key.</p>
 *
 * <p>String form: {@code metrics:my-project?metricKeys=coverage,bugs}</p>
 */
@Getter
@EqualsAndHashCode
public final class CacheKey {

    private final String resourceType;
    private final String resourceId;
    private final SortedMap<String, String> params;

    private CacheKey(String resourceType, String resourceId, SortedMap<String, String> params) {
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.params = Collections.unmodifiableSortedMap(params);
    }

    public static CacheKey of(String resourceType, String resourceId) {
        return of(resourceType, resourceId, Map.of());
    }

    public static CacheKey of(String resourceType, String resourceId, Map<String, ?> params) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("Resource type must be a non-empty string");
        }
        return new CacheKey(
                resourceType.trim(),
                resourceId == null ? "" : resourceId.trim(),
                normalize(params));
    }

    /**
     * Whether this key belongs to the given resource, across all types when
     * {@code type} is null.
     */
    public boolean matches(String type, String id) {
        return (type == null || resourceType.equals(type)) && resourceId.equals(id);
    }

    public boolean isCollection() {
        return resourceId.isEmpty();
    }

    private static SortedMap<String, String> normalize(Map<String, ?> params) {
        SortedMap<String, String> normalized = new TreeMap<>();
        if (params == null) {
            return normalized;
        }

        for (Map.Entry<String, ?> entry : params.entrySet()) {
            String name = entry.getKey() == null ? "" : entry.getKey().trim();
            Object value = entry.getValue();
            if (name.isEmpty() || value == null) {
                continue;
            }
            normalized.put(name, render(value));
        }
        return normalized;
    }

    private static String render(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .map(String::trim)
                    .collect(Collectors.joining(","));
        }
        return String.valueOf(value).trim();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(resourceType).append(':').append(resourceId);
        if (!params.isEmpty()) {
            sb.append('?').append(params.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining("&")));
        }
        return sb.toString();
    }
}
