package com.blogpulse.store.redis;

import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryBackoffTest {

    @Test
    void delayGrowsExponentiallyAndCaps() {
        RetryBackoff backoff = new RetryBackoff(50, 2000, 10);

        assertThat(backoff.delayFor(1)).isEqualTo(50);
        assertThat(backoff.delayFor(2)).isEqualTo(100);
        assertThat(backoff.delayFor(3)).isEqualTo(200);
        assertThat(backoff.delayFor(6)).isEqualTo(1600);
        assertThat(backoff.delayFor(7)).isEqualTo(2000);
        assertThat(backoff.delayFor(40)).isEqualTo(2000);
    }

    @Test
    void retriesTransientFailureThenSucceeds() {
        RetryBackoff backoff = new RetryBackoff(1, 2, 3);
        AtomicInteger calls = new AtomicInteger();

        String result = backoff.call("get", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new RedisConnectionFailureException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void exhaustedRetriesSurfaceAsUnavailable() {
        RetryBackoff backoff = new RetryBackoff(1, 2, 2);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> backoff.call("get", () -> {
            calls.incrementAndGet();
            throw new QueryTimeoutException("timed out");
        }))
                .isInstanceOf(AnalyticsException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class)
                .satisfies(e -> assertThat(((AnalyticsException) e).getErrorCode())
                        .isEqualTo(ErrorCode.STORE_UNAVAILABLE));
        assertThat(calls).hasValue(2);
    }

    @Test
    void nonTransientFailureIsNotRetried() {
        RetryBackoff backoff = new RetryBackoff(1, 2, 5);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> backoff.call("get", () -> {
            calls.incrementAndGet();
            throw new InvalidDataAccessApiUsageException("WRONGTYPE");
        })).isInstanceOf(InvalidDataAccessApiUsageException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void writeIsNotResentAfterTimeout() {
        RetryBackoff backoff = new RetryBackoff(1, 2, 3);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> backoff.callWrite("xadd", () -> {
            calls.incrementAndGet();
            throw new QueryTimeoutException("reply lost");
        }))
                .isInstanceOf(AnalyticsException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void writeIsRetriedWhenConnectionFailed() {
        RetryBackoff backoff = new RetryBackoff(1, 2, 3);
        AtomicInteger calls = new AtomicInteger();

        String id = backoff.callWrite("xadd", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new RedisConnectionFailureException("connection refused");
            }
            return "2-0";
        });

        assertThat(id).isEqualTo("2-0");
        assertThat(calls).hasValue(2);
    }
}
