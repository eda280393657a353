package com.blogpulse.store.redis;

import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.ScoredMember;
import com.blogpulse.store.StoreBatch;
import com.blogpulse.store.StreamEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.RedisStreamCommands.XAddOptions;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 基于 Redis（集群或单机）的分析数据存储。
 * <p>
 * 键空间见 {@link com.blogpulse.analytics.schema.AnalyticsKeys}。批量写通过 {@link ClusterClient}
 * 以管道提交；读命令在启用副本读时可能由副本返回，存在短暂滞后。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "analytics.store.mode", havingValue = "redis", matchIfMissing = true)
public class RedisAnalyticsStore implements AnalyticsStore {

    private final ClusterClient client;

    public RedisAnalyticsStore(ClusterClient client) {
        this.client = client;
    }

    @Override
    public boolean ping() {
        return client.ping();
    }

    @Override
    public void executeBatch(String operation, Consumer<StoreBatch> commands) {
        RedisStoreBatch batch = new RedisStoreBatch();
        commands.accept(batch);
        client.executeBatch(operation, batch.commands);
    }

    @Override
    public long getCount(String key) {
        String raw = client.read("get-count", r -> r.opsForValue().get(key));
        return raw == null ? 0L : Long.parseLong(raw);
    }

    @Override
    public long cardinality(String key) {
        Long size = client.read("scard", r -> r.opsForSet().size(key));
        return size == null ? 0L : size;
    }

    @Override
    public List<ScoredMember> rangeWithScores(String key) {
        Set<ZSetOperations.TypedTuple<String>> tuples =
                client.read("zrange", r -> r.opsForZSet().rangeWithScores(key, 0, -1));
        if (tuples == null || tuples.isEmpty()) {
            return Collections.emptyList();
        }
        List<ScoredMember> out = new ArrayList<>(tuples.size());
        for (ZSetOperations.TypedTuple<String> t : tuples) {
            out.add(new ScoredMember(t.getValue(), t.getScore() == null ? 0D : t.getScore()));
        }
        return out;
    }

    @Override
    public Double score(String key, String member) {
        return client.read("zscore", r -> r.opsForZSet().score(key, member));
    }

    @Override
    public List<String> reverseRange(String key, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        Set<String> members = client.read("zrevrange", r -> r.opsForZSet().reverseRange(key, 0, limit - 1));
        return members == null ? Collections.emptyList() : new ArrayList<>(members);
    }

    @Override
    public Map<String, Long> hashCounts(String key) {
        Map<Object, Object> entries = client.read("hgetall", r -> r.opsForHash().entries(key));
        Map<String, Long> out = new LinkedHashMap<>();
        if (entries == null) {
            return out;
        }
        for (Map.Entry<Object, Object> e : entries.entrySet()) {
            try {
                out.put(String.valueOf(e.getKey()), Long.parseLong(String.valueOf(e.getValue())));
            } catch (NumberFormatException nfe) {
                log.debug("Skip non-numeric hash field {} in {}", e.getKey(), key);
            }
        }
        return out;
    }

    @Override
    public String get(String key) {
        return client.read("get", r -> r.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        client.write("setex", r -> {
            r.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public String appendToStream(String key, Map<String, String> fields, long maxLen) {
        RecordId id = client.write("xadd", r -> r.execute((RedisCallback<RecordId>) connection ->
                ((StringRedisConnection) connection).xAdd(
                        StreamRecords.string(fields).withStreamKey(key),
                        XAddOptions.maxlen(maxLen).approximateTrimming(true))));
        return id == null ? null : id.getValue();
    }

    @Override
    public long streamLength(String key) {
        Long size = client.read("xlen", r -> r.opsForStream().size(key));
        return size == null ? 0L : size;
    }

    @Override
    public List<StreamEntry> reverseStream(String key, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<MapRecord<String, Object, Object>> records = client.read("xrevrange",
                r -> r.opsForStream().reverseRange(key, Range.unbounded(), Limit.limit().count(limit)));
        if (records == null) {
            return Collections.emptyList();
        }
        List<StreamEntry> out = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> rec : records) {
            Map<String, String> fields = new LinkedHashMap<>();
            rec.getValue().forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
            out.add(new StreamEntry(rec.getId().getValue(), fields));
        }
        return out;
    }

    /**
     * 将批量命令暂存为针对字符串连接的回调，由 ClusterClient 在一次管道中执行。
     */
    private static final class RedisStoreBatch implements StoreBatch {
        private final List<Consumer<StringRedisConnection>> commands = new ArrayList<>();

        @Override
        public StoreBatch increment(String key, long delta) {
            commands.add(c -> c.incrBy(key, delta));
            return this;
        }

        @Override
        public StoreBatch addToSet(String key, String member) {
            commands.add(c -> c.sAdd(key, member));
            return this;
        }

        @Override
        public StoreBatch expire(String key, Duration ttl) {
            commands.add(c -> c.expire(key, ttl.toSeconds()));
            return this;
        }

        @Override
        public StoreBatch incrementScore(String key, String member, double delta) {
            commands.add(c -> c.zIncrBy(key, delta, member));
            return this;
        }

        @Override
        public StoreBatch addScored(String key, String member, double score) {
            commands.add(c -> c.zAdd(key, score, member));
            return this;
        }

        @Override
        public StoreBatch retainTopRanked(String key, long keep) {
            // ZREMRANGEBYRANK key 0 -(keep+1)：移除排名最低的成员，仅保留 keep 个
            commands.add(c -> c.zRemRange(key, 0, -(keep + 1)));
            return this;
        }

        @Override
        public StoreBatch incrementHash(String key, String field, long delta) {
            commands.add(c -> c.hIncrBy(key, field, delta));
            return this;
        }

        @Override
        public StoreBatch appendToStream(String key, Map<String, String> fields, long maxLen) {
            commands.add(c -> c.xAdd(StreamRecords.string(fields).withStreamKey(key),
                    XAddOptions.maxlen(maxLen).approximateTrimming(true)));
            return this;
        }
    }
}
