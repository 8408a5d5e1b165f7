package com.example.anchortargets.rpn.util;

import com.example.anchortargets.model.ImageRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Store of unmapped records keyed by {@link ImageRecord#getCacheKey()}.
 * Holds one complete database in build order; a new build replaces it whole.
 */
public class ImageRecordCache {
    private final Map<String, ImageRecord> cache = new LinkedHashMap<>();

    public synchronized ImageRecord get(String key) {
        return cache.get(key);
    }

    /**
     * Drop the previous database and store {@code records} in their given order
     */
    public synchronized void replaceAll(List<ImageRecord> records) {
        cache.clear();
        for (ImageRecord record : records) {
            cache.put(record.getCacheKey(), record);
        }
    }

    /** Records in build order */
    public synchronized List<ImageRecord> snapshot() {
        return new ArrayList<>(cache.values());
    }

    public synchronized int size() {
        return cache.size();
    }

    public synchronized void clear() {
        cache.clear();
    }
}
