package com.blogpulse.analytics.metric;

import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.StoreBatch;
import org.springframework.stereotype.Component;

/**
 * 访客去重集合。
 * <p>
 * 重复写入同一访客不改变基数；每次写入重设整个集合的 TTL（默认 24 小时），集合整体过期而非按成员过期。
 */
@Component
public class VisitorSet {

    private final AnalyticsStore store;
    private final AnalyticsProperties properties;

    public VisitorSet(AnalyticsStore store, AnalyticsProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public void add(StoreBatch batch, String itemId, String visitorId) {
        String key = AnalyticsKeys.visitorsKey(itemId);
        batch.addToSet(key, visitorId)
                .expire(key, properties.getTtl().visitorHistory());
    }

    public long uniqueVisitors(String itemId) {
        return store.cardinality(AnalyticsKeys.visitorsKey(itemId));
    }
}
