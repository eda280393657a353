package com.blogpulse.analytics.service.impl;

import com.blogpulse.analytics.metric.ClickHistogram;
import com.blogpulse.analytics.metric.CounterStore;
import com.blogpulse.analytics.metric.HotLeaderboard;
import com.blogpulse.analytics.metric.ReadProgressSeries;
import com.blogpulse.analytics.metric.VisitorSet;
import com.blogpulse.analytics.model.RealTimeStats;
import com.blogpulse.analytics.model.StreamEvent;
import com.blogpulse.analytics.model.StreamEventType;
import com.blogpulse.analytics.service.AnalyticsService;
import com.blogpulse.analytics.stream.EventStream;
import com.blogpulse.cache.StatsCache;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.metrics.AnalyticsMetrics;
import com.blogpulse.store.AnalyticsStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 实时分析服务实现。
 *
 * <p>职责：</p>
 * - 埋点写入：将一次埋点涉及的多个结构合并为一个批次提交，开启事件镜像时同批追加事件流；
 * - 统计读取：委托快照缓存，热榜/点击/事件流读取失败时降级为空结果；
 * - 失败策略：所有异常在此边界记录并吞掉，分析数据丢失不影响触发埋点的主流程；
 * - 指标：每次埋点与读取按类型和结果计数、计时。
 */
@Slf4j
@Service
public class AnalyticsServiceImpl implements AnalyticsService {

    private final AnalyticsStore store;
    private final CounterStore counterStore;
    private final VisitorSet visitorSet;
    private final ReadProgressSeries progressSeries;
    private final ClickHistogram clickHistogram;
    private final HotLeaderboard leaderboard;
    private final EventStream eventStream;
    private final StatsCache statsCache;
    private final AnalyticsProperties properties;
    private final AnalyticsMetrics metrics;

    public AnalyticsServiceImpl(AnalyticsStore store,
                                CounterStore counterStore,
                                VisitorSet visitorSet,
                                ReadProgressSeries progressSeries,
                                ClickHistogram clickHistogram,
                                HotLeaderboard leaderboard,
                                EventStream eventStream,
                                StatsCache statsCache,
                                AnalyticsProperties properties,
                                AnalyticsMetrics metrics) {
        this.store = store;
        this.counterStore = counterStore;
        this.visitorSet = visitorSet;
        this.progressSeries = progressSeries;
        this.clickHistogram = clickHistogram;
        this.leaderboard = leaderboard;
        this.eventStream = eventStream;
        this.statsCache = statsCache;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * 浏览：INCR 浏览数、SADD 访客并重设 24h TTL、ZINCRBY 热榜并重设榜单 TTL。
     * 访客标识为空时只计浏览与热度，不计入访客集合。批次失败时不回滚已生效的部分。
     */
    @Override
    public void trackView(String itemId, String visitorId) {
        String type = StreamEventType.VIEW.wireName();
        if (!StringUtils.hasText(itemId)) {
            log.debug("Skip view tracking: empty item id");
            metrics.eventSkipped(type);
            return;
        }
        boolean knownVisitor = StringUtils.hasText(visitorId);
        if (!knownVisitor) {
            log.debug("View without visitor id, item {}: unique visitors unchanged", itemId);
        }
        Timer.Sample sample = metrics.start();
        try {
            store.executeBatch("track-view", batch -> {
                counterStore.increment(batch, itemId);
                if (knownVisitor) {
                    visitorSet.add(batch, itemId, visitorId);
                }
                leaderboard.bump(batch, itemId);
                if (properties.getStream().isMirrorTracking()) {
                    eventStream.appendTo(batch, StreamEvent.of(itemId, StreamEventType.VIEW,
                            data("visitorId", visitorId)));
                }
            });
            metrics.eventProcessed(type, AnalyticsMetrics.SUCCESS, sample);
        } catch (Exception e) {
            metrics.eventProcessed(type, AnalyticsMetrics.ERROR, sample);
            log.error("Error tracking view, item {}: {}", itemId, e.getMessage());
        }
    }

    /**
     * 阅读进度：追加样本、裁剪到最近 batchSize 个、重设 TTL。
     * 进度达到完读阈值时额外镜像一条 read 事件。
     */
    @Override
    public void trackReadProgress(String itemId, double progress) {
        String type = StreamEventType.PROGRESS.wireName();
        if (!StringUtils.hasText(itemId)) {
            log.debug("Skip progress tracking: empty item id");
            metrics.eventSkipped(type);
            return;
        }
        Timer.Sample sample = metrics.start();
        try {
            store.executeBatch("track-progress", batch -> {
                progressSeries.append(batch, itemId, progress);
                if (properties.getStream().isMirrorTracking()) {
                    eventStream.appendTo(batch, StreamEvent.of(itemId, StreamEventType.PROGRESS,
                            data("progress", progress)));
                    if (progress >= properties.getReadCompleteThreshold()) {
                        eventStream.appendTo(batch, StreamEvent.of(itemId, StreamEventType.READ,
                                data("progress", progress)));
                    }
                }
            });
            metrics.eventProcessed(type, AnalyticsMetrics.SUCCESS, sample);
        } catch (Exception e) {
            metrics.eventProcessed(type, AnalyticsMetrics.ERROR, sample);
            log.error("Error tracking read progress, item {}: {}", itemId, e.getMessage());
        }
    }

    @Override
    public void trackLinkClick(String itemId, String url) {
        String type = StreamEventType.LINK.wireName();
        if (!StringUtils.hasText(itemId) || url == null) {
            log.debug("Skip link tracking: item={} url={}", itemId, url);
            metrics.eventSkipped(type);
            return;
        }
        Timer.Sample sample = metrics.start();
        try {
            store.executeBatch("track-link", batch -> {
                clickHistogram.increment(batch, itemId, url);
                if (properties.getStream().isMirrorTracking()) {
                    eventStream.appendTo(batch, StreamEvent.of(itemId, StreamEventType.LINK, data("url", url)));
                }
            });
            metrics.eventProcessed(type, AnalyticsMetrics.SUCCESS, sample);
        } catch (Exception e) {
            metrics.eventProcessed(type, AnalyticsMetrics.ERROR, sample);
            log.error("Error tracking link click, item {}: {}", itemId, e.getMessage());
        }
    }

    /**
     * 事件缺少内容ID或类型时跳过，与其他埋点入口一致。
     */
    @Override
    public void streamEvent(StreamEvent event) {
        if (event == null || !StringUtils.hasText(event.getItemId()) || event.getType() == null) {
            log.debug("Skip stream event: item={} type={}",
                    event == null ? null : event.getItemId(), event == null ? null : event.getType());
            metrics.eventSkipped("stream");
            return;
        }
        String type = event.getType().wireName();
        Timer.Sample sample = metrics.start();
        try {
            eventStream.append(event);
            metrics.eventProcessed(type, AnalyticsMetrics.SUCCESS, sample);
        } catch (Exception e) {
            metrics.eventProcessed(type, AnalyticsMetrics.ERROR, sample);
            log.error("Error streaming event, item {} type {}: {}", event.getItemId(), type, e.getMessage());
        }
    }

    @Override
    public RealTimeStats getRealTimeStats(String itemId) {
        if (!StringUtils.hasText(itemId)) {
            return RealTimeStats.ZERO;
        }
        return statsCache.get(itemId);
    }

    @Override
    public List<String> getHotBlogs(int limit) {
        Timer.Sample sample = metrics.start();
        try {
            List<String> top = leaderboard.top(limit);
            metrics.aggregation("hot_blogs", AnalyticsMetrics.SUCCESS, sample);
            return top;
        } catch (Exception e) {
            metrics.aggregation("hot_blogs", AnalyticsMetrics.ERROR, sample);
            metrics.error("aggregation");
            log.error("Error getting hot blogs, limit {}: {}", limit, e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public Map<String, Long> getLinkClicks(String itemId) {
        Timer.Sample sample = metrics.start();
        try {
            Map<String, Long> counts = clickHistogram.counts(itemId);
            metrics.aggregation("link_clicks", AnalyticsMetrics.SUCCESS, sample);
            return counts;
        } catch (Exception e) {
            metrics.aggregation("link_clicks", AnalyticsMetrics.ERROR, sample);
            metrics.error("aggregation");
            log.error("Error getting link clicks, item {}: {}", itemId, e.getMessage());
            return Collections.emptyMap();
        }
    }

    @Override
    public List<StreamEvent> recentEvents(int limit) {
        Timer.Sample sample = metrics.start();
        try {
            List<StreamEvent> events = eventStream.recent(limit);
            metrics.aggregation("recent_events", AnalyticsMetrics.SUCCESS, sample);
            return events;
        } catch (Exception e) {
            metrics.aggregation("recent_events", AnalyticsMetrics.ERROR, sample);
            metrics.error("aggregation");
            log.error("Error reading event stream, limit {}: {}", limit, e.getMessage());
            return Collections.emptyList();
        }
    }

    private static Map<String, Object> data(String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return data;
    }
}
