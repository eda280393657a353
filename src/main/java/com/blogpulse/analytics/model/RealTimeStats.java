package com.blogpulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 内容实时统计快照。
 *
 * @param views        浏览次数
 * @param uniqueViews  24 小时窗口内的去重访客数
 * @param readProgress 保留样本的平均阅读进度
 * @param hot          热榜分数是否超过阈值
 */
public record RealTimeStats(
        long views,
        long uniqueViews,
        double readProgress,
        @JsonProperty("isHot") boolean hot
) {
    public static final RealTimeStats ZERO = new RealTimeStats(0, 0, 0D, false);
}
