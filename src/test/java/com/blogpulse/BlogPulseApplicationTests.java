package com.blogpulse;

import com.blogpulse.analytics.model.RealTimeStats;
import com.blogpulse.analytics.service.AnalyticsService;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.local.CaffeineAnalyticsStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class BlogPulseApplicationTests {

    @Autowired
    private AnalyticsStore store;

    @Autowired
    private AnalyticsService analyticsService;

    @Test
    void localModeWiresInProcessStore() {
        assertThat(store).isInstanceOf(CaffeineAnalyticsStore.class);

        analyticsService.trackView("ctx-post", "visitor-a");
        analyticsService.trackView("ctx-post", "visitor-a");

        RealTimeStats stats = analyticsService.getRealTimeStats("ctx-post");
        assertThat(stats.views()).isEqualTo(2);
        assertThat(stats.uniqueViews()).isEqualTo(1);
        assertThat(analyticsService.getHotBlogs()).contains("ctx-post");
    }
}
