package com.blogpulse.cache;

import com.blogpulse.analytics.metric.CounterStore;
import com.blogpulse.analytics.metric.HotLeaderboard;
import com.blogpulse.analytics.metric.ReadProgressSeries;
import com.blogpulse.analytics.metric.VisitorSet;
import com.blogpulse.analytics.model.RealTimeStats;
import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import com.blogpulse.metrics.AnalyticsMetrics;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.local.CaffeineAnalyticsStore;
import com.blogpulse.testutil.AnalyticsFixture;
import com.blogpulse.testutil.ManualClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class StatsCacheTest {

    private final ManualClock clock = new ManualClock(AnalyticsFixture.START);
    private final AnalyticsProperties properties = new AnalyticsProperties();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void writeBackFailureStillReturnsComputedStats() {
        CaffeineAnalyticsStore store = new CaffeineAnalyticsStore(clock, clock, 100) {
            @Override
            public void set(String key, String value, Duration ttl) {
                throw new AnalyticsException(ErrorCode.STORE_COMMAND_FAILED, "READONLY");
            }
        };
        store.executeBatch("seed", b -> b.increment(AnalyticsKeys.viewsKey("post-1"), 7));

        RealTimeStats stats = statsCache(store, Runnable::run).get("post-1");

        assertThat(stats.views()).isEqualTo(7);
        assertThat(store.get(AnalyticsKeys.statsCacheKey("post-1"))).isNull();
        assertThat(registry.get(AnalyticsMetrics.ERRORS).tags("error_type", "cache_write").counter().count())
                .isEqualTo(1D);
        assertThat(statusCount(StatsCache.STATUS_RECOMPUTE)).isEqualTo(1D);
    }

    @Test
    void slowRecomputeTimesOutToZero() {
        properties.setReadTimeoutMs(50);
        CaffeineAnalyticsStore store = new CaffeineAnalyticsStore(clock, clock, 100);
        store.executeBatch("seed", b -> b.increment(AnalyticsKeys.viewsKey("post-1"), 7));
        Executor never = task -> { };

        assertThat(statsCache(store, never).get("post-1")).isEqualTo(RealTimeStats.ZERO);
        assertThat(store.get(AnalyticsKeys.statsCacheKey("post-1"))).isNull();
        assertThat(statusCount(StatsCache.STATUS_DEGRADED)).isEqualTo(1D);
    }

    @Test
    void unreadableSnapshotDegradesToZero() {
        CaffeineAnalyticsStore store = new CaffeineAnalyticsStore(clock, clock, 100);
        store.set(AnalyticsKeys.statsCacheKey("post-1"), "{not json", Duration.ofSeconds(60));

        assertThat(statsCache(store, Runnable::run).get("post-1")).isEqualTo(RealTimeStats.ZERO);
    }

    @Test
    void hitsAndRecomputesAreCountedSeparately() {
        CaffeineAnalyticsStore store = new CaffeineAnalyticsStore(clock, clock, 100);
        StatsCache cache = statsCache(store, Runnable::run);

        cache.get("post-1");
        cache.get("post-1");
        cache.get("post-1");

        assertThat(statusCount(StatsCache.STATUS_RECOMPUTE)).isEqualTo(1D);
        assertThat(statusCount(StatsCache.STATUS_HIT)).isEqualTo(2D);
        assertThat(registry.get(AnalyticsMetrics.AGGREGATION_DURATION)
                .tags("operation_type", StatsCache.OPERATION).timer().count()).isEqualTo(3L);
    }

    private double statusCount(String status) {
        Counter counter = registry.find(AnalyticsMetrics.AGGREGATION_OPERATIONS)
                .tags("operation_type", StatsCache.OPERATION, "status", status)
                .counter();
        return counter == null ? 0D : counter.count();
    }

    private StatsCache statsCache(AnalyticsStore store, Executor executor) {
        return new StatsCache(store,
                new CounterStore(store),
                new VisitorSet(store, properties),
                new ReadProgressSeries(store, properties, clock),
                new HotLeaderboard(store, properties),
                new ObjectMapper(),
                properties,
                executor,
                new AnalyticsMetrics(registry));
    }
}
