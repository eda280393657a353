package com.blogpulse.store.redis;

import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import io.lettuce.core.event.Event;
import io.lettuce.core.event.connection.ConnectedEvent;
import io.lettuce.core.event.connection.DisconnectedEvent;
import io.lettuce.core.event.connection.ReconnectFailedEvent;
import io.lettuce.core.resource.ClientResources;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Redis 集群连接句柄。
 *
 * <p>职责：</p>
 * - 启动探活并记录连接状态变化（连接、断开、重连失败）；
 * - 写命令以管道批量提交，单机模式下额外包裹 MULTI/EXEC；
 * - 读请求在连接失败或超时时按指数退避重试；写请求只在连接失败时重试，超时不重发；
 *   耗尽后抛出 STORE_UNAVAILABLE。
 * <p>
 * 读请求是否路由到副本由连接工厂的 ReadFrom 决定（见 RedisClusterConfig）。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "analytics.store.mode", havingValue = "redis", matchIfMissing = true)
public class ClusterClient {

    private final StringRedisTemplate redis;
    private final RetryBackoff retry;
    private final boolean cluster;
    private final Disposable eventSubscription;

    public ClusterClient(StringRedisTemplate redis, ClientResources clientResources, AnalyticsProperties properties) {
        this.redis = redis;
        AnalyticsProperties.Retry r = properties.getStore().getRetry();
        this.retry = new RetryBackoff(r.getBaseMs(), r.getMaxMs(), r.getMaxAttempts());
        this.cluster = properties.getStore().isCluster();
        this.eventSubscription = clientResources.eventBus().get().subscribe(this::onConnectionEvent);
    }

    /**
     * 应用就绪后探活一次。不可达时仅记录错误，引擎继续以降级结果服务。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void connect() {
        try {
            if (ping()) {
                log.info("Redis {} connected successfully", cluster ? "cluster" : "standalone");
            }
        } catch (AnalyticsException e) {
            log.error("Redis {} unreachable at startup, serving degraded results: {}",
                    cluster ? "cluster" : "standalone", e.getMessage());
        }
    }

    public boolean ping() {
        String pong = call("ping", () -> redis.execute((RedisCallback<String>) RedisConnection::ping));
        return "PONG".equalsIgnoreCase(pong);
    }

    /**
     * 管道批量执行写命令。集群模式下不保证跨分片原子性。
     * @param operation 操作名
     * @param commands 针对字符串连接的命令列表
     */
    public void executeBatch(String operation, List<Consumer<StringRedisConnection>> commands) {
        if (commands.isEmpty()) {
            return;
        }
        callWrite(operation, () -> redis.executePipelined((RedisCallback<Object>) connection -> {
            StringRedisConnection conn = (StringRedisConnection) connection;
            // 集群模式不支持事务，仅单机模式使用 MULTI/EXEC
            if (!cluster) {
                conn.multi();
            }
            for (Consumer<StringRedisConnection> command : commands) {
                command.accept(conn);
            }
            if (!cluster) {
                conn.exec();
            }
            return null;
        }));
    }

    public <T> T read(String operation, Function<StringRedisTemplate, T> reader) {
        return call(operation, () -> reader.apply(redis));
    }

    /**
     * 单条写命令。超时不重试，避免非幂等命令重复生效。
     */
    public <T> T write(String operation, Function<StringRedisTemplate, T> writer) {
        return callWrite(operation, () -> writer.apply(redis));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return retry.call(operation, action);
        } catch (AnalyticsException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new AnalyticsException(ErrorCode.STORE_COMMAND_FAILED,
                    "Store " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private <T> T callWrite(String operation, Supplier<T> action) {
        try {
            return retry.callWrite(operation, action);
        } catch (AnalyticsException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new AnalyticsException(ErrorCode.STORE_COMMAND_FAILED,
                    "Store " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private void onConnectionEvent(Event event) {
        if (event instanceof ConnectedEvent connected) {
            log.info("Redis connection established: {}", connected.remoteAddress());
        } else if (event instanceof DisconnectedEvent disconnected) {
            log.warn("Redis connection lost: {}", disconnected.remoteAddress());
        } else if (event instanceof ReconnectFailedEvent failed) {
            log.error("Redis reconnect attempt {} to {} failed: {}",
                    failed.getAttempt(), failed.remoteAddress(), String.valueOf(failed.getCause()));
        }
    }

    @PreDestroy
    public void close() {
        log.info("Redis client shutting down");
        eventSubscription.dispose();
    }
}
