package com.blogpulse.analytics.schema;

/**
 * Redis Key 生成工具。
 * <p>
 * 单内容维度的键以 {itemId} 作为集群哈希标签，同一内容的各结构落在同一分片；
 * 热榜与事件流为全局单键。
 */
public final class AnalyticsKeys {
    private AnalyticsKeys() {}

    public static final String HOT_BLOGS = "analytics:hot:blogs"; // 全局热榜（ZSet）
    public static final String EVENT_STREAM = "analytics:stream:events"; // 实时事件流（Stream）

    public static String viewsKey(String itemId) {
        return String.format("analytics:views:{%s}", itemId); // 浏览计数（String）
    }

    public static String visitorsKey(String itemId) {
        return String.format("analytics:visitors:{%s}", itemId); // 访客去重集合（Set）
    }

    /**
     * 阅读进度序列：score=写入时间戳，member 编码样本值。
     * @param itemId 内容ID
     */
    public static String progressKey(String itemId) {
        return String.format("analytics:progress:{%s}", itemId);
    }

    public static String clicksKey(String itemId) {
        return String.format("analytics:clicks:{%s}", itemId); // 外链点击直方图（Hash）
    }

    // 实时统计快照缓存（String/JSON）
    public static String statsCacheKey(String itemId) {
        return String.format("analytics:cache:{%s}", itemId);
    }
}
