package com.company.apimonitoring.alerting;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ids of alerts already notified during this run, in insertion order.
 * Past {@code maxEntries} the set is cut back to its most recent {@code retainEntries};
 * an alert evicted by a trim can be notified again.
 */
public class NotificationDedupCache {

    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final int DEFAULT_RETAIN_ENTRIES = 500;

    private final int maxEntries;
    private final int retainEntries;
    private final Set<String> alertIds = new LinkedHashSet<>();

    public NotificationDedupCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_RETAIN_ENTRIES);
    }

    public NotificationDedupCache(int maxEntries, int retainEntries) {
        if (retainEntries <= 0 || retainEntries > maxEntries) {
            throw new IllegalArgumentException("retainEntries must be in (0, maxEntries]");
        }
        this.maxEntries = maxEntries;
        this.retainEntries = retainEntries;
    }

    /**
     * @return true if the id was not present and has been recorded
     */
    public synchronized boolean markNotified(String alertId) {
        if (!alertIds.add(alertId)) {
            return false;
        }
        if (alertIds.size() > maxEntries) {
            trim();
        }
        return true;
    }

    public synchronized boolean contains(String alertId) {
        return alertIds.contains(alertId);
    }

    public synchronized boolean remove(String alertId) {
        return alertIds.remove(alertId);
    }

    public synchronized int size() {
        return alertIds.size();
    }

    public synchronized List<String> snapshot() {
        return new ArrayList<>(alertIds);
    }

    private void trim() {
        int toDrop = alertIds.size() - retainEntries;
        Iterator<String> oldest = alertIds.iterator();
        while (toDrop-- > 0 && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
