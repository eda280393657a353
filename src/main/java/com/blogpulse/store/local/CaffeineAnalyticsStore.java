package com.blogpulse.store.local;

import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.ScoredMember;
import com.blogpulse.store.StoreBatch;
import com.blogpulse.store.StreamEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 进程内分析数据存储（本地/开发模式）。
 * <p>
 * 设计说明：
 * - 键值统一放在一个 Caffeine 缓存中，按键可变过期（EXPIRE 语义：重设整个键的剩余存活时间）；
 * - 新建的键默认永不过期，直到调用 expire 或带 TTL 的 set；
 * - 定长日志使用进程内环形队列，超过上限时从最旧一端裁剪；
 * - 批量写在同一把锁内执行，对本进程内的读者原子可见。
 * <p>
 * 有序集合的排序规则与 Redis 一致：分数升序，同分按成员字典序升序。
 */
public class CaffeineAnalyticsStore implements AnalyticsStore {

    private static final Comparator<Map.Entry<String, Double>> RANK_ORDER =
            Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey());

    private final Cache<String, Object> data;
    private final Policy.VarExpiration<String, Object> expiration;
    private final Map<String, Deque<StreamEntry>> streams = new HashMap<>();
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private long lastStreamMillis = -1;
    private long streamSeq;

    public CaffeineAnalyticsStore(Ticker ticker, Clock clock, long maximumSize) {
        this.clock = clock;
        this.data = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .maximumSize(maximumSize)
                .expireAfter(new KeyExpiry())
                .build();
        this.expiration = data.policy().expireVariably()
                .orElseThrow(() -> new IllegalStateException("variable expiration not enabled"));
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public void executeBatch(String operation, Consumer<StoreBatch> commands) {
        LocalBatch batch = new LocalBatch();
        commands.accept(batch);
        lock.lock();
        try {
            for (Runnable command : batch.commands) {
                command.run();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getCount(String key) {
        lock.lock();
        try {
            Object v = data.getIfPresent(key);
            if (v == null) {
                return 0L;
            }
            if (v instanceof long[] counter) {
                return counter[0];
            }
            if (v instanceof String s) {
                return Long.parseLong(s);
            }
            throw wrongType(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long cardinality(String key) {
        lock.lock();
        try {
            VisitorMembers set = existing(key, VisitorMembers.class);
            return set == null ? 0L : set.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ScoredMember> rangeWithScores(String key) {
        lock.lock();
        try {
            ScoredSet zset = existing(key, ScoredSet.class);
            if (zset == null) {
                return Collections.emptyList();
            }
            List<ScoredMember> out = new ArrayList<>(zset.size());
            zset.entrySet().stream()
                    .sorted(RANK_ORDER)
                    .forEach(e -> out.add(new ScoredMember(e.getKey(), e.getValue())));
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Double score(String key, String member) {
        lock.lock();
        try {
            ScoredSet zset = existing(key, ScoredSet.class);
            return zset == null ? null : zset.get(member);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> reverseRange(String key, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        lock.lock();
        try {
            ScoredSet zset = existing(key, ScoredSet.class);
            if (zset == null) {
                return Collections.emptyList();
            }
            return zset.entrySet().stream()
                    .sorted(RANK_ORDER.reversed())
                    .limit(limit)
                    .map(Map.Entry::getKey)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Long> hashCounts(String key) {
        lock.lock();
        try {
            HashCounts hash = existing(key, HashCounts.class);
            return hash == null ? new LinkedHashMap<>() : new LinkedHashMap<>(hash);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String get(String key) {
        lock.lock();
        try {
            Object v = data.getIfPresent(key);
            if (v == null) {
                return null;
            }
            if (v instanceof String s) {
                return s;
            }
            if (v instanceof long[] counter) {
                return String.valueOf(counter[0]);
            }
            throw wrongType(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        lock.lock();
        try {
            expiration.put(key, value, ttl);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String appendToStream(String key, Map<String, String> fields, long maxLen) {
        lock.lock();
        try {
            return doAppend(key, fields, maxLen);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long streamLength(String key) {
        lock.lock();
        try {
            Deque<StreamEntry> stream = streams.get(key);
            return stream == null ? 0L : stream.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StreamEntry> reverseStream(String key, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        lock.lock();
        try {
            Deque<StreamEntry> stream = streams.get(key);
            if (stream == null) {
                return Collections.emptyList();
            }
            List<StreamEntry> out = new ArrayList<>(Math.min(limit, stream.size()));
            Iterator<StreamEntry> it = stream.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    // ---- 以下方法均在持锁状态下调用 ----

    private <T> T existing(String key, Class<T> type) {
        Object v = data.getIfPresent(key);
        if (v == null) {
            return null;
        }
        if (!type.isInstance(v)) {
            throw wrongType(key);
        }
        return type.cast(v);
    }

    private <T> T getOrCreate(String key, Class<T> type, Supplier<T> factory) {
        T v = existing(key, type);
        if (v == null) {
            v = factory.get();
            data.put(key, v);
        }
        return v;
    }

    private String doAppend(String key, Map<String, String> fields, long maxLen) {
        long now = clock.millis();
        if (now <= lastStreamMillis) {
            streamSeq++;
            now = lastStreamMillis;
        } else {
            streamSeq = 0;
            lastStreamMillis = now;
        }
        String id = now + "-" + streamSeq;
        Deque<StreamEntry> stream = streams.computeIfAbsent(key, k -> new ArrayDeque<>());
        stream.addLast(new StreamEntry(id, Map.copyOf(fields)));
        while (stream.size() > Math.max(0, maxLen)) {
            stream.pollFirst();
        }
        return id;
    }

    private static AnalyticsException wrongType(String key) {
        return new AnalyticsException(ErrorCode.WRONG_TYPE,
                "WRONGTYPE Operation against a key holding the wrong kind of value: " + key);
    }

    /** 集合结构 */
    private static final class VisitorMembers extends HashSet<String> {
    }

    /** 哈希计数结构，独立类型以便与有序集合区分 */
    private static final class HashCounts extends LinkedHashMap<String, Long> {
    }

    /** 有序集合结构：成员 → 分数 */
    private static final class ScoredSet extends HashMap<String, Double> {
    }

    private final class LocalBatch implements StoreBatch {
        private final List<Runnable> commands = new ArrayList<>();

        @Override
        public StoreBatch increment(String key, long delta) {
            commands.add(() -> {
                if (data.getIfPresent(key) instanceof String s) {
                    // 与 SET 写入的数值字符串兼容
                    data.put(key, new long[]{Long.parseLong(s)});
                }
                long[] counter = getOrCreate(key, long[].class, () -> new long[1]);
                counter[0] += delta;
            });
            return this;
        }

        @Override
        public StoreBatch addToSet(String key, String member) {
            commands.add(() -> {
                VisitorMembers set = getOrCreate(key, VisitorMembers.class, VisitorMembers::new);
                set.add(member);
            });
            return this;
        }

        @Override
        public StoreBatch expire(String key, Duration ttl) {
            commands.add(() -> {
                if (data.getIfPresent(key) != null) {
                    expiration.setExpiresAfter(key, ttl);
                }
            });
            return this;
        }

        @Override
        public StoreBatch incrementScore(String key, String member, double delta) {
            commands.add(() -> {
                ScoredSet zset = getOrCreate(key, ScoredSet.class, ScoredSet::new);
                zset.merge(member, delta, Double::sum);
            });
            return this;
        }

        @Override
        public StoreBatch addScored(String key, String member, double score) {
            commands.add(() -> {
                ScoredSet zset = getOrCreate(key, ScoredSet.class, ScoredSet::new);
                zset.put(member, score);
            });
            return this;
        }

        @Override
        public StoreBatch retainTopRanked(String key, long keep) {
            commands.add(() -> {
                ScoredSet zset = existing(key, ScoredSet.class);
                if (zset == null || zset.size() <= keep) {
                    return;
                }
                long excess = zset.size() - Math.max(0, keep);
                List<String> evicted = zset.entrySet().stream()
                        .sorted(RANK_ORDER)
                        .limit(excess)
                        .map(Map.Entry::getKey)
                        .toList();
                evicted.forEach(zset::remove);
            });
            return this;
        }

        @Override
        public StoreBatch incrementHash(String key, String field, long delta) {
            commands.add(() -> {
                HashCounts hash = getOrCreate(key, HashCounts.class, HashCounts::new);
                hash.merge(field, delta, Long::sum);
            });
            return this;
        }

        @Override
        public StoreBatch appendToStream(String key, Map<String, String> fields, long maxLen) {
            commands.add(() -> doAppend(key, fields, maxLen));
            return this;
        }
    }

    /**
     * 新建键永不过期；更新与读取不改变剩余存活时间，只有 expire/set(ttl) 会重设。
     */
    private static final class KeyExpiry implements Expiry<String, Object> {
        @Override
        public long expireAfterCreate(String key, Object value, long currentTime) {
            return Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, Object value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, Object value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
