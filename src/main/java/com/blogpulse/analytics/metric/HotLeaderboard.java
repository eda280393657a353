package com.blogpulse.analytics.metric;

import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.StoreBatch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 全局热榜：内容ID → 累计互动分数。
 * <p>
 * 每次加分都会重设整个榜单的 TTL（默认 10 分钟）。榜单到期后整体清空，下一次加分从零开始累积，
 * 不是滑动窗口。同分时按内容ID字典序降序（ZREVRANGE 的原生顺序）。
 */
@Component
public class HotLeaderboard {

    private final AnalyticsStore store;
    private final AnalyticsProperties properties;

    public HotLeaderboard(AnalyticsStore store, AnalyticsProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public void bump(StoreBatch batch, String itemId) {
        batch.incrementScore(AnalyticsKeys.HOT_BLOGS, itemId, properties.getViewWeight())
                .expire(AnalyticsKeys.HOT_BLOGS, properties.getTtl().hotBlogs());
    }

    public double score(String itemId) {
        Double score = store.score(AnalyticsKeys.HOT_BLOGS, itemId);
        return score == null ? 0D : score;
    }

    public boolean isHot(double score) {
        return score > properties.getHotThreshold();
    }

    public List<String> top(int limit) {
        return store.reverseRange(AnalyticsKeys.HOT_BLOGS, limit);
    }
}
