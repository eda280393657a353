package com.blogpulse.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 分析数据存储接口。
 * <p>
 * 提供计数、集合、有序集合、哈希、字符串与定长日志五类原语。写操作通过 {@link #executeBatch}
 * 组成一次批量提交；读操作均为单键读取。实现可使用 Redis 集群或进程内缓存。
 * 失败时抛出 {@link com.blogpulse.exception.AnalyticsException}。
 */
public interface AnalyticsStore {

    /**
     * 探测存储是否可达。
     *
     * @return 可达返回 true。
     */
    boolean ping();

    /**
     * 以一次批量提交执行若干写命令。
     *
     * @param operation 操作名（用于日志与异常上下文）。
     * @param commands  向批次追加命令的回调。
     */
    void executeBatch(String operation, Consumer<StoreBatch> commands);

    /**
     * 读取整数计数，键不存在时返回 0。
     */
    long getCount(String key);

    /**
     * 集合基数，键不存在时返回 0。
     */
    long cardinality(String key);

    /**
     * 按分数升序返回有序集合的全部成员。
     */
    List<ScoredMember> rangeWithScores(String key);

    /**
     * 成员分数，成员或键不存在时返回 null。
     */
    Double score(String key, String member);

    /**
     * 按分数降序返回前 limit 个成员；同分时按成员字典序降序。
     */
    List<String> reverseRange(String key, int limit);

    Map<String, Long> hashCounts(String key);

    String get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * 追加一条日志记录并按近似长度裁剪。
     *
     * @return 存储生成的记录 ID。
     */
    String appendToStream(String key, Map<String, String> fields, long maxLen);

    long streamLength(String key);

    /**
     * 最新的 limit 条日志记录，按新到旧排列。
     */
    List<StreamEntry> reverseStream(String key, int limit);
}
