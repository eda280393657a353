package com.blogpulse.analytics.metric;

import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.StoreBatch;
import org.springframework.stereotype.Component;

/**
 * 内容浏览计数：原子自增，键缺失视为 0。
 */
@Component
public class CounterStore {

    private final AnalyticsStore store;

    public CounterStore(AnalyticsStore store) {
        this.store = store;
    }

    public void increment(StoreBatch batch, String itemId) {
        batch.increment(AnalyticsKeys.viewsKey(itemId), 1);
    }

    public long views(String itemId) {
        return store.getCount(AnalyticsKeys.viewsKey(itemId));
    }
}
