package com.sonarlink.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheKey normalization and matching.
 */
class CacheKeyTest {

    @Test
    void testParameterOrderDoesNotMatter() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("metricKeys", "coverage");
        first.put("branch", "main");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("branch", "main");
        second.put("metricKeys", "coverage");

        CacheKey a = CacheKey.of("metrics", "proj", first);
        CacheKey b = CacheKey.of("metrics", "proj", second);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("metrics:proj?branch=main&metricKeys=coverage", a.toString());
    }

    @Test
    void testNullValuesAndBlankNamesAreDropped() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("severities", null);
        params.put("  ", "ignored");
        params.put(" ps ", " 100 ");

        CacheKey key = CacheKey.of("issues", "proj", params);

        assertEquals(Map.of("ps", "100"), key.getParams());
        assertEquals(CacheKey.of("issues", "proj", Map.of("ps", 100)), key);
    }

    @Test
    void testCollectionValuesAreJoined() {
        CacheKey key = CacheKey.of("metrics", "proj", Map.of("metricKeys", List.of("bugs", "coverage")));

        assertEquals("bugs,coverage", key.getParams().get("metricKeys"));
    }

    @Test
    void testMissingIdIsCollection() {
        CacheKey key = CacheKey.of("projects", null);

        assertEquals("", key.getResourceId());
        assertTrue(key.isCollection());
        assertFalse(CacheKey.of("projects", "proj").isCollection());
    }

    @Test
    void testMatches() {
        CacheKey key = CacheKey.of("issues", "proj", Map.of("ps", "50"));

        assertTrue(key.matches("issues", "proj"));
        assertTrue(key.matches(null, "proj"));
        assertFalse(key.matches("metrics", "proj"));
        assertFalse(key.matches(null, "proj-2"));
    }

    @Test
    void testBlankTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> CacheKey.of(" ", "proj"));
        assertThrows(IllegalArgumentException.class, () -> CacheKey.of(null, "proj"));
    }
}
