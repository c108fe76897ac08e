package com.company.apimonitoring.service;

import com.company.apimonitoring.event.AlertsChangedEvent;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheEvictionServiceTest {

    @Test
    void onAlertsChanged_ClearsSummaryCache() {
        // Given
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(AlertSummaryService.CACHE_NAME);
        Cache cache = cacheManager.getCache(AlertSummaryService.CACHE_NAME);
        cache.put("all-all", "stale");
        CacheEvictionService service = new CacheEvictionService(cacheManager);

        // When
        service.onAlertsChanged(new AlertsChangedEvent(List.of("alert-1"), "acknowledge"));

        // Then
        assertNull(cache.get("all-all"));
    }

    @Test
    void onAlertsChanged_CacheNotConfigured_DoesNothing() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager("other");
        CacheEvictionService service = new CacheEvictionService(cacheManager);

        assertDoesNotThrow(() -> service.onAlertsChanged(new AlertsChangedEvent(List.of(), "creation")));
    }
}
