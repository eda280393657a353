package com.blogpulse.store;

import java.time.Duration;
import java.util.Map;

/**
 * 批量写命令构建器，命令按追加顺序执行。
 */
public interface StoreBatch {

    StoreBatch increment(String key, long delta);

    StoreBatch addToSet(String key, String member);

    /**
     * 重新设置整个键的过期时间，键不存在时无效果。
     */
    StoreBatch expire(String key, Duration ttl);

    StoreBatch incrementScore(String key, String member, double delta);

    StoreBatch addScored(String key, String member, double score);

    /**
     * 仅保留分数最高的 keep 个成员，其余按排名从低到高移除。
     */
    StoreBatch retainTopRanked(String key, long keep);

    StoreBatch incrementHash(String key, String field, long delta);

    StoreBatch appendToStream(String key, Map<String, String> fields, long maxLen);
}
