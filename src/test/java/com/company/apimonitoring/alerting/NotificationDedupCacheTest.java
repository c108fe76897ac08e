package com.company.apimonitoring.alerting;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotificationDedupCacheTest {

    @Test
    void markNotified_SameIdTwice_SecondCallReturnsFalse() {
        NotificationDedupCache cache = new NotificationDedupCache();

        assertTrue(cache.markNotified("alert-1"));
        assertFalse(cache.markNotified("alert-1"));
        assertEquals(1, cache.size());
    }

    @Test
    void markNotified_PastMaxEntries_TrimsToMostRecent() {
        // Given
        NotificationDedupCache cache = new NotificationDedupCache();

        // When
        for (int i = 0; i < 1001; i++) {
            cache.markNotified("alert-" + i);
        }

        // Then
        assertEquals(500, cache.size());
        assertFalse(cache.contains("alert-0"));
        assertFalse(cache.contains("alert-500"));
        assertTrue(cache.contains("alert-501"));
        assertTrue(cache.contains("alert-1000"));
    }

    @Test
    void markNotified_AfterTrim_EvictedIdCanNotifyAgain() {
        NotificationDedupCache cache = new NotificationDedupCache(4, 2);
        for (String id : List.of("a", "b", "c", "d", "e")) {
            cache.markNotified(id);
        }

        assertEquals(List.of("d", "e"), cache.snapshot());
        assertTrue(cache.markNotified("a"));
    }

    @Test
    void remove_NotifiedId_AllowsRenotification() {
        NotificationDedupCache cache = new NotificationDedupCache();
        cache.markNotified("alert-1");

        assertTrue(cache.remove("alert-1"));
        assertTrue(cache.markNotified("alert-1"));
    }

    @Test
    void constructor_RetainLargerThanMax_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new NotificationDedupCache(10, 20));
    }
}
