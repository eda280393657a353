package com.blogpulse.testutil;

import com.blogpulse.analytics.metric.ClickHistogram;
import com.blogpulse.analytics.metric.CounterStore;
import com.blogpulse.analytics.metric.HotLeaderboard;
import com.blogpulse.analytics.metric.ReadProgressSeries;
import com.blogpulse.analytics.metric.VisitorSet;
import com.blogpulse.analytics.service.impl.AnalyticsServiceImpl;
import com.blogpulse.analytics.stream.EventStream;
import com.blogpulse.cache.StatsCache;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.metrics.AnalyticsMetrics;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.local.CaffeineAnalyticsStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;

/**
 * 不启动 Spring 容器，基于进程内存储手工装配整个引擎。指标写入 SimpleMeterRegistry 以便断言。
 */
public final class AnalyticsFixture {

    public static final Instant START = Instant.parse("2026-01-24T12:00:00Z");

    public final ManualClock clock;
    public final AnalyticsProperties properties;
    public final AnalyticsStore store;
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AnalyticsMetrics metrics = new AnalyticsMetrics(meterRegistry);
    public final ReadProgressSeries progressSeries;
    public final EventStream eventStream;
    public final AnalyticsServiceImpl service;

    private AnalyticsFixture(AnalyticsProperties properties, AnalyticsStore store, ManualClock clock) {
        this.clock = clock;
        this.properties = properties;
        this.store = store;
        CounterStore counterStore = new CounterStore(store);
        VisitorSet visitorSet = new VisitorSet(store, properties);
        this.progressSeries = new ReadProgressSeries(store, properties, clock);
        ClickHistogram clickHistogram = new ClickHistogram(store, properties);
        HotLeaderboard leaderboard = new HotLeaderboard(store, properties);
        this.eventStream = new EventStream(store, objectMapper, properties, clock);
        // 同步执行回源读，测试结果确定
        StatsCache statsCache = new StatsCache(store, counterStore, visitorSet, progressSeries, leaderboard,
                objectMapper, properties, Runnable::run, metrics);
        this.service = new AnalyticsServiceImpl(store, counterStore, visitorSet, progressSeries, clickHistogram,
                leaderboard, eventStream, statsCache, properties, metrics);
    }

    public static AnalyticsFixture local() {
        return local(new AnalyticsProperties());
    }

    public static AnalyticsFixture local(AnalyticsProperties properties) {
        ManualClock clock = new ManualClock(START);
        return new AnalyticsFixture(properties, new CaffeineAnalyticsStore(clock, clock, 10_000), clock);
    }

    public static AnalyticsFixture over(AnalyticsStore store) {
        return new AnalyticsFixture(new AnalyticsProperties(), store, new ManualClock(START));
    }

    /**
     * 读取计数器当前值，未注册时为 0。
     */
    public double count(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0D : counter.count();
    }
}
