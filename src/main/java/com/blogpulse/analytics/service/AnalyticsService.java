package com.blogpulse.analytics.service;

import com.blogpulse.analytics.model.RealTimeStats;
import com.blogpulse.analytics.model.StreamEvent;

import java.util.List;
import java.util.Map;

/**
 * 实时分析服务：写路径（埋点）与读路径（统计/热榜）。
 * <p>
 * 所有方法均不抛出异常：写失败记录日志后丢弃，读失败返回零值或空结果。
 */
public interface AnalyticsService {

    int DEFAULT_HOT_LIMIT = 10;

    /**
     * 记录一次浏览：浏览数 +1、访客去重、热榜加分，同一批次提交。
     */
    void trackView(String itemId, String visitorId);

    /**
     * 记录一次阅读进度样本（不校验取值范围）。
     */
    void trackReadProgress(String itemId, double progress);

    void trackLinkClick(String itemId, String url);

    /**
     * 向实时事件流追加一条事件。
     */
    void streamEvent(StreamEvent event);

    /**
     * 获取实时统计，优先读取快照缓存。
     * @return 统计快照；内部失败时为 {@link RealTimeStats#ZERO}
     */
    RealTimeStats getRealTimeStats(String itemId);

    /**
     * 热榜前 limit 个内容ID，按分数降序。
     */
    List<String> getHotBlogs(int limit);

    default List<String> getHotBlogs() {
        return getHotBlogs(DEFAULT_HOT_LIMIT);
    }

    /**
     * 外链点击直方图，按点击数降序。
     */
    Map<String, Long> getLinkClicks(String itemId);

    /**
     * 最近的事件，新到旧。
     */
    List<StreamEvent> recentEvents(int limit);
}
