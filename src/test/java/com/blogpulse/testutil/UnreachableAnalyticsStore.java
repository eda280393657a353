package com.blogpulse.testutil;

import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.ScoredMember;
import com.blogpulse.store.StoreBatch;
import com.blogpulse.store.StreamEntry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 模拟集群不可达：每次调用都抛出 STORE_UNAVAILABLE，并记录调用次数。
 */
public class UnreachableAnalyticsStore implements AnalyticsStore {

    private final AtomicInteger calls = new AtomicInteger();

    public int calls() {
        return calls.get();
    }

    private AnalyticsException down() {
        calls.incrementAndGet();
        return new AnalyticsException(ErrorCode.STORE_UNAVAILABLE, "cluster unreachable");
    }

    @Override
    public boolean ping() {
        throw down();
    }

    @Override
    public void executeBatch(String operation, Consumer<StoreBatch> commands) {
        throw down();
    }

    @Override
    public long getCount(String key) {
        throw down();
    }

    @Override
    public long cardinality(String key) {
        throw down();
    }

    @Override
    public List<ScoredMember> rangeWithScores(String key) {
        throw down();
    }

    @Override
    public Double score(String key, String member) {
        throw down();
    }

    @Override
    public List<String> reverseRange(String key, int limit) {
        throw down();
    }

    @Override
    public Map<String, Long> hashCounts(String key) {
        throw down();
    }

    @Override
    public String get(String key) {
        throw down();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        throw down();
    }

    @Override
    public String appendToStream(String key, Map<String, String> fields, long maxLen) {
        throw down();
    }

    @Override
    public long streamLength(String key) {
        throw down();
    }

    @Override
    public List<StreamEntry> reverseStream(String key, int limit) {
        throw down();
    }
}
