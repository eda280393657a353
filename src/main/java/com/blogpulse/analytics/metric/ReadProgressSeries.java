package com.blogpulse.analytics.metric;

import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.ScoredMember;
import com.blogpulse.store.StoreBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 阅读进度样本序列。
 * <p>
 * 以有序集合存储：score 为写入时间戳（毫秒），member 为 {@code 时间戳:序号:节点:进度}。
 * 序号与节点标识保证同一毫秒内多次写入互不覆盖；按排名裁剪时淘汰最旧的样本，只保留最近 batchSize 个。
 * 进度值不做范围校验，按原值存储。
 */
@Slf4j
@Component
public class ReadProgressSeries {

    private static final char SEP = ':';

    private final AnalyticsStore store;
    private final AnalyticsProperties properties;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final String nodeTag = Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000, 0xFFFFF));

    public ReadProgressSeries(AnalyticsStore store, AnalyticsProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public void append(StoreBatch batch, String itemId, double progress) {
        String key = AnalyticsKeys.progressKey(itemId);
        long now = clock.millis();
        batch.addScored(key, member(now, progress), now)
                .retainTopRanked(key, properties.getBatchSize())
                .expire(key, properties.getTtl().analyticsCache());
    }

    /**
     * 按时间升序返回保留的进度样本。
     */
    public List<Double> samples(String itemId) {
        List<ScoredMember> members = store.rangeWithScores(AnalyticsKeys.progressKey(itemId));
        List<Double> out = new ArrayList<>(members.size());
        for (ScoredMember m : members) {
            Double value = parseProgress(m.member());
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    /**
     * 保留样本的算术平均，无样本时为 0。
     */
    public double average(String itemId) {
        List<Double> values = samples(itemId);
        if (values.isEmpty()) {
            return 0D;
        }
        double sum = 0D;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private String member(long timestamp, double progress) {
        // 序号定长补零，同一毫秒内按写入顺序排列
        long seq = sequence.incrementAndGet() % 1_000_000_000L;
        return String.format(Locale.ROOT, "%d%c%09d%c%s%c%s", timestamp, SEP, seq, SEP, nodeTag, SEP, progress);
    }

    static Double parseProgress(String member) {
        int idx = member == null ? -1 : member.lastIndexOf(SEP);
        if (idx < 0) {
            return null;
        }
        try {
            return Double.parseDouble(member.substring(idx + 1));
        } catch (NumberFormatException e) {
            log.debug("Skip malformed progress sample {}", member);
            return null;
        }
    }
}
