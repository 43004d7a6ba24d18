package tsproxy.server.configuration;

import java.time.Clock;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import tsproxy.client.http.HttpClient;
import tsproxy.client.upstream.KairosHttpClient;
import tsproxy.common.configuration.CacheProperties;
import tsproxy.common.configuration.HttpProperties;
import tsproxy.common.configuration.RedisProperties;
import tsproxy.common.configuration.ServerProperties;
import tsproxy.common.configuration.StoreProperties;
import tsproxy.common.configuration.UpstreamProperties;
import tsproxy.server.Server;
import tsproxy.server.cache.BackendProxy;
import tsproxy.server.cache.QueryOrchestrator;
import tsproxy.server.store.CacheStore;
import tsproxy.server.store.memory.MemoryCacheStore;
import tsproxy.server.store.redis.RedisCacheStore;

@Configuration
public class TsProxyConfiguration {

    private static final long MEMORY_PURGE_INTERVAL = 60000;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "tsproxy.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public JedisPool jedisPool(StoreProperties storeProperties) {
        RedisProperties redis = storeProperties.getRedis();
        GenericObjectPoolConfig<Jedis> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(redis.getMaxTotal());
        poolConfig.setMaxIdle(redis.getMaxIdle());
        String password = StringUtils.isBlank(redis.getPassword()) ? null : redis.getPassword();
        return new JedisPool(poolConfig, redis.getHost(), redis.getPort(), redis.getTimeout(), password,
                redis.getDatabase());
    }

    @Bean
    @ConditionalOnProperty(prefix = "tsproxy.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(JedisPool jedisPool) {
        return new RedisCacheStore(jedisPool);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "tsproxy.store", name = "type", havingValue = "memory")
    public MemoryCacheStore memoryCacheStore(Clock clock) {
        MemoryCacheStore store = new MemoryCacheStore(clock);
        store.start(MEMORY_PURGE_INTERVAL);
        return store;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KairosHttpClient kairosHttpClient(UpstreamProperties upstreamProperties) {
        return new KairosHttpClient(
                HttpClient.get(upstreamProperties.getConnectTimeout(), upstreamProperties.getSocketTimeout()));
    }

    @Bean
    public BackendProxy backendProxy(KairosHttpClient kairosHttpClient, UpstreamProperties upstreamProperties) {
        return new BackendProxy(kairosHttpClient, upstreamProperties.getHost(), upstreamProperties.getPort());
    }

    @Bean
    public QueryOrchestrator queryOrchestrator(CacheStore cacheStore, BackendProxy backendProxy,
            CacheProperties cacheProperties, Clock clock) {
        return new QueryOrchestrator(cacheStore, backendProxy, cacheProperties, clock);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public Server server(ApplicationContext applicationContext, QueryOrchestrator queryOrchestrator,
            ServerProperties serverProperties, HttpProperties httpProperties) {
        Server server = new Server(applicationContext, queryOrchestrator, serverProperties, httpProperties);
        server.start();
        return server;
    }
}
