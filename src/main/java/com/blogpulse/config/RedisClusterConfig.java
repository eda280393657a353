package com.blogpulse.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.ReadFrom;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import io.lettuce.core.resource.Delay;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Redis 连接配置：节点数大于 1 时使用集群模式，否则使用单机模式。
 * 集群模式下允许读请求路由到副本，并开启拓扑自适应刷新。
 */
@Configuration
@ConditionalOnProperty(name = "analytics.store.mode", havingValue = "redis", matchIfMissing = true)
public class RedisClusterConfig {

    @Bean(destroyMethod = "shutdown")
    public ClientResources lettuceClientResources(AnalyticsProperties properties) {
        AnalyticsProperties.Retry retry = properties.getStore().getRetry();
        // 断线重连：指数退避，下限 base 上限 max
        return DefaultClientResources.builder()
                .reconnectDelay(Delay.exponential(
                        Duration.ofMillis(retry.getBaseMs()),
                        Duration.ofMillis(retry.getMaxMs()),
                        2,
                        TimeUnit.MILLISECONDS))
                .build();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(AnalyticsProperties properties, ClientResources clientResources) {
        AnalyticsProperties.Store store = properties.getStore();
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofMillis(store.getConnectTimeoutMs()))
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .clientResources(clientResources)
                .commandTimeout(Duration.ofMillis(store.getCommandTimeoutMs()));

        if (store.isCluster()) {
            ClusterClientOptions options = ClusterClientOptions.builder()
                    .maxRedirects(store.getMaxRedirects())
                    .socketOptions(socketOptions)
                    .topologyRefreshOptions(ClusterTopologyRefreshOptions.builder()
                            .enableAllAdaptiveRefreshTriggers()
                            .build())
                    .build();
            client.clientOptions(options);
            if (store.isReadFromReplica()) {
                client.readFrom(ReadFrom.REPLICA_PREFERRED);
            }

            RedisClusterConfiguration cluster = new RedisClusterConfiguration(store.getNodes());
            cluster.setMaxRedirects(store.getMaxRedirects());
            if (store.getPassword() != null && !store.getPassword().isEmpty()) {
                cluster.setPassword(RedisPassword.of(store.getPassword()));
            }
            return new LettuceConnectionFactory(cluster, client.build());
        }

        client.clientOptions(ClientOptions.builder().socketOptions(socketOptions).build());
        String node = store.getNodes().isEmpty() ? "localhost:6379" : store.getNodes().get(0);
        int sep = node.lastIndexOf(':');
        String host = sep > 0 ? node.substring(0, sep) : node;
        int port = sep > 0 ? Integer.parseInt(node.substring(sep + 1)) : 6379;
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(host, port);
        if (store.getPassword() != null && !store.getPassword().isEmpty()) {
            standalone.setPassword(RedisPassword.of(store.getPassword()));
        }
        return new LettuceConnectionFactory(standalone, client.build());
    }
}
