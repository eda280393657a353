package com.blogpulse.analytics.dispatch;

import com.blogpulse.analytics.model.StreamEvent;
import com.blogpulse.analytics.service.AnalyticsService;
import com.blogpulse.metrics.AnalyticsMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 埋点异步分发：供请求线程调用，立即返回，不等待存储往返。
 * <p>
 * 任务投递到有界的后台线程池；池满时任务被丢弃并记录日志。埋点不重试、不排队补发。
 */
@Slf4j
@Component
public class TrackingDispatcher {

    private final AnalyticsService analyticsService;
    private final Executor executor;
    private final AnalyticsMetrics metrics;

    public TrackingDispatcher(AnalyticsService analyticsService,
                              @Qualifier("trackingExecutor") Executor executor,
                              AnalyticsMetrics metrics) {
        this.analyticsService = analyticsService;
        this.executor = executor;
        this.metrics = metrics;
    }

    public void trackView(String itemId, String visitorId) {
        submit("view", itemId, () -> analyticsService.trackView(itemId, visitorId));
    }

    public void trackReadProgress(String itemId, double progress) {
        submit("progress", itemId, () -> analyticsService.trackReadProgress(itemId, progress));
    }

    public void trackLinkClick(String itemId, String url) {
        submit("link", itemId, () -> analyticsService.trackLinkClick(itemId, url));
    }

    public void streamEvent(StreamEvent event) {
        submit("stream", event == null ? null : event.getItemId(), () -> analyticsService.streamEvent(event));
    }

    private void submit(String kind, String itemId, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Tracking task {} failed, item {}: {}", kind, itemId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            // 线程池饱和或已关闭：唯一的丢弃出口
            metrics.dispatchDropped(kind);
            log.warn("Tracking task {} dropped, item {}: {}", kind, itemId, e.getMessage());
        }
    }
}
