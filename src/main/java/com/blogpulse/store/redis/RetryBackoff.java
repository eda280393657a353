package com.blogpulse.store.redis;

import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.function.Supplier;

/**
 * 单次请求的有界重试：读请求对连接失败与命令超时重试，非幂等写只对连接失败重试，间隔按指数递增并封顶。
 * 重试耗尽后抛出 {@link ErrorCode#STORE_UNAVAILABLE}。
 */
@Slf4j
public class RetryBackoff {

    private final long baseMs;
    private final long maxMs;
    private final int maxAttempts;

    public RetryBackoff(long baseMs, long maxMs, int maxAttempts) {
        this.baseMs = Math.max(0, baseMs);
        this.maxMs = Math.max(this.baseMs, maxMs);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * 第 attempt 次失败后的等待时长：base * 2^(attempt-1)，不超过 max。
     * @param attempt 已失败次数（从 1 起）
     * @return 毫秒
     */
    public long delayFor(int attempt) {
        int exp = Math.min(Math.max(attempt - 1, 0), 20);
        return Math.min(baseMs * (1L << exp), maxMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String operation, Supplier<T> action) {
        return call(operation, action, true);
    }

    /**
     * 非幂等写（XADD、管道批次）：仅在连接失败时重试，此时命令尚未送达。
     * 命令超时可能已在服务端生效，不重试，直接抛出 STORE_UNAVAILABLE。
     */
    public <T> T callWrite(String operation, Supplier<T> action) {
        return call(operation, action, false);
    }

    private <T> T call(String operation, Supplier<T> action, boolean retryTimeouts) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RedisConnectionFailureException | QueryTimeoutException e) {
                if (e instanceof QueryTimeoutException && !retryTimeouts) {
                    throw new AnalyticsException(ErrorCode.STORE_UNAVAILABLE,
                            "Store " + operation + " timed out, not retried", e);
                }
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayFor(attempt);
                log.warn("Store {} failed (attempt {}/{}), retry in {}ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new AnalyticsException(ErrorCode.STORE_UNAVAILABLE,
                            "Interrupted while retrying " + operation, ie);
                }
            }
        }
        throw new AnalyticsException(ErrorCode.STORE_UNAVAILABLE,
                "Store " + operation + " failed after " + maxAttempts + " attempts", last);
    }
}
