package com.blogpulse.cache;

import com.blogpulse.analytics.metric.CounterStore;
import com.blogpulse.analytics.metric.HotLeaderboard;
import com.blogpulse.analytics.metric.ReadProgressSeries;
import com.blogpulse.analytics.metric.VisitorSet;
import com.blogpulse.analytics.model.RealTimeStats;
import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.metrics.AnalyticsMetrics;
import com.blogpulse.store.AnalyticsStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 实时统计快照缓存（旁路缓存）。
 * <p>
 * 命中时原样返回缓存快照，不与底层结构对账，可能落后于快照写入之后的埋点（最长一个 TTL）。
 * 未命中时并发读取浏览数、访客基数、进度样本与热榜分数，计算后回写快照。
 * 任何读取失败均返回全零快照，不向调用方抛出异常。
 */
@Slf4j
@Component
public class StatsCache {

    public static final String OPERATION = "realtime";
    public static final String STATUS_HIT = "cache_hit";
    public static final String STATUS_RECOMPUTE = "recompute";
    public static final String STATUS_DEGRADED = "degraded";

    private final AnalyticsStore store;
    private final CounterStore counterStore;
    private final VisitorSet visitorSet;
    private final ReadProgressSeries progressSeries;
    private final HotLeaderboard leaderboard;
    private final ObjectMapper objectMapper;
    private final AnalyticsProperties properties;
    private final Executor readExecutor;
    private final AnalyticsMetrics metrics;

    public StatsCache(AnalyticsStore store,
                      CounterStore counterStore,
                      VisitorSet visitorSet,
                      ReadProgressSeries progressSeries,
                      HotLeaderboard leaderboard,
                      ObjectMapper objectMapper,
                      AnalyticsProperties properties,
                      @Qualifier("statsReadExecutor") Executor readExecutor,
                      AnalyticsMetrics metrics) {
        this.store = store;
        this.counterStore = counterStore;
        this.visitorSet = visitorSet;
        this.progressSeries = progressSeries;
        this.leaderboard = leaderboard;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.readExecutor = readExecutor;
        this.metrics = metrics;
    }

    public RealTimeStats get(String itemId) {
        String key = AnalyticsKeys.statsCacheKey(itemId);
        Timer.Sample sample = metrics.start();
        RealTimeStats stats;
        try {
            String cached = store.get(key);
            if (cached != null) {
                log.debug("stats source=cache key={}", key);
                RealTimeStats hit = objectMapper.readValue(cached, RealTimeStats.class);
                metrics.aggregation(OPERATION, STATUS_HIT, sample);
                return hit;
            }
            stats = recompute(itemId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Error getting real-time stats, item {}: interrupted", itemId);
            return degraded(sample);
        } catch (Exception e) {
            log.error("Error getting real-time stats, item {}: {}", itemId, e.getMessage());
            return degraded(sample);
        }

        try {
            store.set(key, objectMapper.writeValueAsString(stats), properties.getTtl().realTime());
        } catch (Exception e) {
            // 回写失败不影响本次结果，下次请求再回源
            metrics.error("cache_write");
            log.warn("Stats cache write-back failed, item {}: {}", itemId, e.getMessage());
        }
        log.debug("stats source=store key={}", key);
        metrics.aggregation(OPERATION, STATUS_RECOMPUTE, sample);
        return stats;
    }

    private RealTimeStats degraded(Timer.Sample sample) {
        metrics.aggregation(OPERATION, STATUS_DEGRADED, sample);
        metrics.error("aggregation");
        return RealTimeStats.ZERO;
    }

    private RealTimeStats recompute(String itemId)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Long> views = CompletableFuture.supplyAsync(() -> counterStore.views(itemId), readExecutor);
        CompletableFuture<Long> unique = CompletableFuture.supplyAsync(() -> visitorSet.uniqueVisitors(itemId), readExecutor);
        CompletableFuture<Double> progress = CompletableFuture.supplyAsync(() -> progressSeries.average(itemId), readExecutor);
        CompletableFuture<Double> score = CompletableFuture.supplyAsync(() -> leaderboard.score(itemId), readExecutor);

        CompletableFuture.allOf(views, unique, progress, score)
                .get(properties.getReadTimeoutMs(), TimeUnit.MILLISECONDS);

        return new RealTimeStats(
                views.join(),
                unique.join(),
                progress.join(),
                leaderboard.isHot(score.join()));
    }
}
