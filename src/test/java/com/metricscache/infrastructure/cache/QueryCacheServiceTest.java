package com.metricscache.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.domain.model.MetricsQueryResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryCacheServiceTest {

    private InMemoryCacheClient cacheClient;
    private QueryCacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheClient = new InMemoryCacheClient();
        cacheService = new QueryCacheService(cacheClient, new ObjectMapper());
    }

    @Test
    void testGenerateCacheKey_SameShapeSameKey() {
        String first = cacheService.generateCacheKey("metrics", List.of("m1", "m2"), null, "SHORTENED");
        String second = cacheService.generateCacheKey("metrics", List.of("m1", "m2"), null, "SHORTENED");

        assertEquals(first, second);
        assertTrue(first.startsWith("query:metrics:"));
    }

    @Test
    void testGenerateCacheKey_DifferentOrderDifferentKey() {
        String first = cacheService.generateCacheKey("metrics", List.of("m1", "m2"));
        String second = cacheService.generateCacheKey("metrics", List.of("m2", "m1"));

        assertNotEquals(first, second);
    }

    @Test
    void testSetThenGet_ExpiresWithTtl() {
        // Given
        MetricsQueryResponse response = MetricsQueryResponse.builder()
                .groups(List.of(Map.of("region", "A", "sales", 15.0)))
                .keysRequested(1)
                .keysFound(1)
                .build();

        // When
        cacheService.set("query:metrics:abc", response, 60);

        // Then
        Optional<MetricsQueryResponse> cached = cacheService.get("query:metrics:abc", MetricsQueryResponse.class);
        assertTrue(cached.isPresent());
        assertEquals(15.0, cached.get().getGroups().get(0).get("sales"));

        cacheClient.advanceSeconds(61);
        assertTrue(cacheService.get("query:metrics:abc", MetricsQueryResponse.class).isEmpty());
    }

    @Test
    void testGet_UnreadableValueIsMiss() {
        cacheClient.put("query:metrics:bad", "not json");

        assertTrue(cacheService.get("query:metrics:bad", MetricsQueryResponse.class).isEmpty());
    }
}
