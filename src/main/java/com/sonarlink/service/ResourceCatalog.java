package com.sonarlink.service;

import com.sonarlink.exception.UnknownResourceTypeException;
import com.sonarlink.model.ResourceEndpoint;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Endpoint lookup by resource type.
 */
public final class ResourceCatalog {

    private final Map<String, ResourceEndpoint> endpoints;

    public ResourceCatalog(Collection<ResourceEndpoint> endpoints) {
        Map<String, ResourceEndpoint> byType = new LinkedHashMap<>();
        for (ResourceEndpoint endpoint : endpoints) {
            if (endpoint.getPath() == null || endpoint.getPath().isBlank()
                    || endpoint.getIdParam() == null || endpoint.getIdParam().isBlank()) {
                throw new IllegalArgumentException(
                        "Resource '" + endpoint.getResourceType() + "' needs both a path and an id parameter");
            }
            byType.put(endpoint.getResourceType(), endpoint);
        }
        this.endpoints = Collections.unmodifiableMap(byType);
    }

    public ResourceEndpoint resolve(String resourceType) {
        ResourceEndpoint endpoint = endpoints.get(resourceType);
        if (endpoint == null) {
            throw new UnknownResourceTypeException(resourceType);
        }
        return endpoint;
    }

    public Set<String> resourceTypes() {
        return endpoints.keySet();
    }
}
