package com.blogpulse.config;

import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.local.CaffeineAnalyticsStore;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 本地模式：不连接 Redis，使用进程内 Caffeine 存储。适用于开发与单实例部署。
 */
@Configuration
@ConditionalOnProperty(name = "analytics.store.mode", havingValue = "local")
public class LocalStoreConfig {

    @Bean
    public AnalyticsStore localAnalyticsStore(Clock clock,
                                              @Value("${analytics.store.local.max-keys:100000}") long maxKeys) {
        return new CaffeineAnalyticsStore(Ticker.systemTicker(), clock, maxKeys);
    }
}
