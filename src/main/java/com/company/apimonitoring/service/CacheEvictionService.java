package com.company.apimonitoring.service;

import com.company.apimonitoring.event.AlertsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    private final CacheManager cacheManager;

    @EventListener
    public void onAlertsChanged(AlertsChangedEvent event) {
        Cache summaryCache = cacheManager.getCache(AlertSummaryService.CACHE_NAME);
        if (summaryCache == null) {
            return;
        }
        try {
            summaryCache.clear();
            log.debug("Cleared {} cache after {} of {} alerts",
                    AlertSummaryService.CACHE_NAME, event.getReason(), event.getAlertIds().size());
        } catch (RuntimeException e) {
            log.warn("Failed to clear {} cache: {}", AlertSummaryService.CACHE_NAME, e.getMessage());
        }
    }
}
