package com.blogpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 分析模块配置：时钟、埋点后台线程池与统计回源读线程池。
 */
@Configuration
public class AnalyticsConfig {

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }

    /**
     * 埋点写入线程池：有界队列，队列满时拒绝任务（默认 AbortPolicy），由 TrackingDispatcher 丢弃并告警。
     */
    @Bean("trackingExecutor")
    public ThreadPoolTaskExecutor trackingExecutor(AnalyticsProperties properties) {
        AnalyticsProperties.Dispatch d = properties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("analytics-track-");
        executor.setCorePoolSize(d.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(d.getCorePoolSize(), d.getMaxPoolSize()));
        executor.setQueueCapacity(d.getQueueCapacity());
        // 停机时尽量排空队列，超时后放弃剩余埋点
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(d.getAwaitTerminationSeconds());
        return executor;
    }

    @Bean("statsReadExecutor")
    public ThreadPoolTaskExecutor statsReadExecutor(AnalyticsProperties properties) {
        AnalyticsProperties.Dispatch d = properties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("analytics-read-");
        executor.setCorePoolSize(d.getReadPoolSize());
        executor.setMaxPoolSize(d.getReadPoolSize());
        executor.setQueueCapacity(d.getQueueCapacity());
        return executor;
    }
}
