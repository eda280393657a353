package com.blogpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "analytics")
@Data
public class AnalyticsProperties {
    private Store store = new Store();
    private Ttl ttl = new Ttl();
    private Stream stream = new Stream();
    private Dispatch dispatch = new Dispatch();

    /** 读进度序列保留的样本上限 */
    private int batchSize = 1000;
    /** 热度分数严格大于该值视为热门 */
    private double hotThreshold = 100;
    /** 每次浏览对热榜分数的增量 */
    private double viewWeight = 1;
    /** 阅读进度达到该值时额外记一次 read 事件 */
    private double readCompleteThreshold = 0.9;
    /** 缓存未命中时并发回源的等待上限 */
    private long readTimeoutMs = 2000;

    @Data
    public static class Store {
        /** redis | local */
        private String mode = "redis";
        private List<String> nodes = new ArrayList<>(List.of("localhost:6379"));
        private String password;
        private boolean readFromReplica = true;
        private long connectTimeoutMs = 10_000;
        private long commandTimeoutMs = 2_000;
        private int maxRedirects = 16;
        private Retry retry = new Retry();

        public boolean isCluster() {
            return nodes != null && nodes.size() > 1;
        }
    }

    @Data
    public static class Retry {
        private long baseMs = 50;
        private long maxMs = 2000;
        private int maxAttempts = 3;
    }

    @Data
    public static class Ttl {
        private long visitorHistorySeconds = 86_400;
        private long analyticsCacheSeconds = 300;
        // 供外部持久化层的汇总任务使用
        private long aggregatedDataSeconds = 1_800;
        private long hotBlogsSeconds = 600;
        private long realTimeSeconds = 60;

        public Duration visitorHistory() {
            return Duration.ofSeconds(visitorHistorySeconds);
        }

        public Duration analyticsCache() {
            return Duration.ofSeconds(analyticsCacheSeconds);
        }

        public Duration hotBlogs() {
            return Duration.ofSeconds(hotBlogsSeconds);
        }

        public Duration realTime() {
            return Duration.ofSeconds(realTimeSeconds);
        }
    }

    @Data
    public static class Stream {
        private long maxLen = 1000;
        private boolean mirrorTracking = true;
    }

    @Data
    public static class Dispatch {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 10_000;
        private int readPoolSize = 4;
        private int awaitTerminationSeconds = 5;
    }
}
