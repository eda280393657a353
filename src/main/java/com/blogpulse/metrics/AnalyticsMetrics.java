package com.blogpulse.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * 分析引擎自身的运行指标（Micrometer，经 Actuator 导出为 Prometheus 格式）。
 *
 * <p>指标：</p>
 * - analytics.events.processed{event_type, status}：埋点处理次数，status 为 success/error/skipped；
 * - analytics.event.processing.duration{event_type}：埋点写入耗时；
 * - analytics.aggregation.operations{operation_type, status}：统计读取次数，
 *   实时统计的 status 为 cache_hit/recompute/degraded；
 * - analytics.aggregation.duration{operation_type}：统计读取耗时；
 * - analytics.errors{error_type}：错误次数；
 * - analytics.dispatch.dropped{kind}：线程池饱和时丢弃的埋点任务数。
 */
@Component
public class AnalyticsMetrics {

    public static final String EVENTS_PROCESSED = "analytics.events.processed";
    public static final String EVENT_DURATION = "analytics.event.processing.duration";
    public static final String AGGREGATION_OPERATIONS = "analytics.aggregation.operations";
    public static final String AGGREGATION_DURATION = "analytics.aggregation.duration";
    public static final String ERRORS = "analytics.errors";
    public static final String DISPATCH_DROPPED = "analytics.dispatch.dropped";

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String SKIPPED = "skipped";

    private final MeterRegistry registry;

    public AnalyticsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public Timer.Sample start() {
        return Timer.start(registry);
    }

    public void eventProcessed(String eventType, String status, Timer.Sample sample) {
        registry.counter(EVENTS_PROCESSED, "event_type", eventType, "status", status).increment();
        sample.stop(Timer.builder(EVENT_DURATION)
                .description("Time taken to write a tracking event")
                .tag("event_type", eventType)
                .register(registry));
        if (ERROR.equals(status)) {
            error("processing");
        }
    }

    public void eventSkipped(String eventType) {
        registry.counter(EVENTS_PROCESSED, "event_type", eventType, "status", SKIPPED).increment();
    }

    public void aggregation(String operationType, String status, Timer.Sample sample) {
        registry.counter(AGGREGATION_OPERATIONS, "operation_type", operationType, "status", status).increment();
        sample.stop(Timer.builder(AGGREGATION_DURATION)
                .description("Time taken to read aggregated analytics")
                .tag("operation_type", operationType)
                .register(registry));
    }

    public void error(String errorType) {
        registry.counter(ERRORS, "error_type", errorType).increment();
    }

    public void dispatchDropped(String kind) {
        registry.counter(DISPATCH_DROPPED, "kind", kind).increment();
    }
}
