package com.sonarlink.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a resource type lives in the SonarQube Web API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceEndpoint {

    private String resourceType;

    /**
     * Path relative to the {@code /api} base, used when a resource id is given.
     */
    private String path;

    /**
     * Path used for collection requests (empty resource id). Falls back to {@link #path}.
     */
    private String listPath;

    /**
     * Query parameter that carries the resource id.
     */
    private String idParam;

    public String pathFor(CacheKey key) {
        if (key.isCollection() && listPath != null && !listPath.isBlank()) {
            return listPath;
        }
        return path;
    }

    /**
     * Query parameters for the upstream call: the key's normalized params plus the id.
     */
    public Map<String, String> queryFor(CacheKey key) {
        Map<String, String> query = new LinkedHashMap<>(key.getParams());
        if (!key.isCollection()) {
            query.put(idParam, key.getResourceId());
        }
        return query;
    }
}
