package com.blogpulse.analytics.service;

import com.blogpulse.analytics.model.RealTimeStats;
import com.blogpulse.analytics.model.StreamEvent;
import com.blogpulse.analytics.model.StreamEventType;
import com.blogpulse.metrics.AnalyticsMetrics;
import com.blogpulse.testutil.AnalyticsFixture;
import com.blogpulse.testutil.UnreachableAnalyticsStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * 存储不可达时：写入吞掉异常，读取降级为零值/空结果。
 */
class DegradedStoreTest {

    private final UnreachableAnalyticsStore store = new UnreachableAnalyticsStore();
    private final AnalyticsFixture fx = AnalyticsFixture.over(store);
    private final AnalyticsService service = fx.service;

    @Test
    void writesNeverThrow() {
        assertThatCode(() -> {
            service.trackView("post-1", "visitor-a");
            service.trackReadProgress("post-1", 0.95);
            service.trackLinkClick("post-1", "https://a.example");
            service.streamEvent(StreamEvent.of("post-1", StreamEventType.VIEW, null));
        }).doesNotThrowAnyException();
        assertThat(store.calls()).isEqualTo(4);
        assertThat(fx.count(AnalyticsMetrics.EVENTS_PROCESSED, "event_type", "view", "status", "error")).isEqualTo(2D);
        assertThat(fx.count(AnalyticsMetrics.EVENTS_PROCESSED, "event_type", "progress", "status", "error")).isEqualTo(1D);
        assertThat(fx.count(AnalyticsMetrics.EVENTS_PROCESSED, "event_type", "link", "status", "error")).isEqualTo(1D);
        assertThat(fx.count(AnalyticsMetrics.ERRORS, "error_type", "processing")).isEqualTo(4D);
    }

    @Test
    void readsDegradeToEmpty() {
        assertThat(service.getRealTimeStats("post-1")).isEqualTo(RealTimeStats.ZERO);
        assertThat(service.getHotBlogs()).isEmpty();
        assertThat(service.getLinkClicks("post-1")).isEmpty();
        assertThat(service.recentEvents(10)).isEmpty();
        assertThat(fx.count(AnalyticsMetrics.AGGREGATION_OPERATIONS,
                "operation_type", "realtime", "status", "degraded")).isEqualTo(1D);
        assertThat(fx.count(AnalyticsMetrics.ERRORS, "error_type", "aggregation")).isEqualTo(4D);
    }
}
