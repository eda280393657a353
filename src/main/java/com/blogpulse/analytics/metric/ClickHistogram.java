package com.blogpulse.analytics.metric;

import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.StoreBatch;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 外链点击直方图：URL → 点击次数，TTL 到期后整体清空。
 */
@Component
public class ClickHistogram {

    private final AnalyticsStore store;
    private final AnalyticsProperties properties;

    public ClickHistogram(AnalyticsStore store, AnalyticsProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public void increment(StoreBatch batch, String itemId, String url) {
        String key = AnalyticsKeys.clicksKey(itemId);
        batch.incrementHash(key, url, 1)
                .expire(key, properties.getTtl().analyticsCache());
    }

    /**
     * 按点击数降序返回，同数按 URL 升序。
     */
    public Map<String, Long> counts(String itemId) {
        Map<String, Long> raw = store.hashCounts(AnalyticsKeys.clicksKey(itemId));
        Map<String, Long> sorted = new LinkedHashMap<>();
        raw.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }
}
