package cn.bafuka.geoarmor.autoconfigure;

import cn.bafuka.geoarmor.config.GeoArmorProperties;
import cn.bafuka.geoarmor.consistency.RateLimitNotifier;
import cn.bafuka.geoarmor.consistency.impl.RedisRateLimitNotifier;
import cn.bafuka.geoarmor.dataplane.LocalCache;
import cn.bafuka.geoarmor.dataplane.RateLimiter;
import cn.bafuka.geoarmor.dataplane.RemoteCacheClient;
import cn.bafuka.geoarmor.dataplane.RequestQueue;
import cn.bafuka.geoarmor.dataplane.impl.CaffeineLocalCache;
import cn.bafuka.geoarmor.dataplane.impl.DefaultRateLimiter;
import cn.bafuka.geoarmor.dataplane.impl.DefaultRequestQueue;
import cn.bafuka.geoarmor.dataplane.impl.HttpRemoteCacheClient;
import cn.bafuka.geoarmor.resolver.LocationResolver;
import cn.bafuka.geoarmor.resolver.impl.DefaultLocationResolver;
import cn.bafuka.geoarmor.spi.DurableStore;
import cn.bafuka.geoarmor.spi.RemoteTransport;
import cn.bafuka.geoarmor.spi.UpstreamFetcher;
import cn.bafuka.geoarmor.spi.ValueVocabulary;
import cn.bafuka.geoarmor.spi.impl.CountryVocabulary;
import cn.bafuka.geoarmor.spi.impl.FileDurableStore;
import cn.bafuka.geoarmor.spi.impl.RedisDurableStore;
import cn.bafuka.geoarmor.spi.impl.RestTemplateRemoteTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.file.Paths;

/**
 * GeoArmor 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GeoArmorProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@ConditionalOnProperty(prefix = "geoarmor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GeoArmorAutoConfiguration {

    public GeoArmorAutoConfiguration() {
        log.info("GeoArmor auto-configuration initializing...");
    }

    /**
     * 国家词表
     */
    @Bean
    @ConditionalOnMissingBean
    public ValueVocabulary valueVocabulary() {
        return CountryVocabulary.loadDefault();
    }

    /**
     * 文件持久化存储（默认）
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(DurableStore.class)
    @ConditionalOnProperty(prefix = "geoarmor.local", name = "store-type", havingValue = "file", matchIfMissing = true)
    public FileDurableStore fileDurableStore(GeoArmorProperties properties) {
        return new FileDurableStore(Paths.get(properties.getLocal().getStorePath()));
    }

    /**
     * 本地持久缓存，创建后立即从存储导入
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnBean(DurableStore.class)
    public CaffeineLocalCache caffeineLocalCache(DurableStore durableStore, GeoArmorProperties properties) {
        CaffeineLocalCache localCache = new CaffeineLocalCache(durableStore, properties.getLocal());
        localCache.load().join();
        return localCache;
    }

    /**
     * 远程缓存传输层
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(RemoteTransport.class)
    public RestTemplateRemoteTransport restTemplateRemoteTransport(GeoArmorProperties properties) {
        GeoArmorProperties.RemoteCacheConfig remote = properties.getRemote();
        if (remote.getBaseUrl() == null || remote.getBaseUrl().trim().isEmpty()) {
            log.warn("geoarmor.remote.base-url 未配置，共享远程缓存层将始终未命中");
        }
        return new RestTemplateRemoteTransport(remote.getBaseUrl(), remote.getTimeoutMs());
    }

    /**
     * 共享远程缓存客户端
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(LocalCache.class)
    public HttpRemoteCacheClient httpRemoteCacheClient(RemoteTransport transport,
                                                       LocalCache localCache,
                                                       ValueVocabulary vocabulary,
                                                       GeoArmorProperties properties) {
        return new HttpRemoteCacheClient(transport, localCache, vocabulary, properties.getRemote());
    }

    /**
     * 全局限流窗口
     */
    @Bean
    @ConditionalOnMissingBean
    public DefaultRateLimiter defaultRateLimiter() {
        return new DefaultRateLimiter();
    }

    /**
     * 上游请求队列（需要使用方提供 UpstreamFetcher）
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnBean(UpstreamFetcher.class)
    public DefaultRequestQueue defaultRequestQueue(UpstreamFetcher upstreamFetcher,
                                                   RateLimiter rateLimiter,
                                                   @Autowired(required = false) RateLimitNotifier rateLimitNotifier,
                                                   GeoArmorProperties properties) {
        return new DefaultRequestQueue(upstreamFetcher, rateLimiter, rateLimitNotifier, properties.getQueue());
    }

    /**
     * 位置解析器
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({RequestQueue.class, RemoteCacheClient.class})
    public LocationResolver locationResolver(LocalCache localCache,
                                             RemoteCacheClient remoteCacheClient,
                                             RequestQueue requestQueue) {
        log.info("GeoArmor location resolver initialized");
        return new DefaultLocationResolver(localCache, remoteCacheClient, requestQueue);
    }

    /**
     * Redis 相关配置（仅当 Spring Data Redis 存在时生效）
     */
    @Configuration
    @ConditionalOnClass(StringRedisTemplate.class)
    public static class RedisSupportConfiguration {

        /**
         * Redis 持久化存储
         */
        @Bean(destroyMethod = "shutdown")
        @ConditionalOnMissingBean(DurableStore.class)
        @ConditionalOnBean(StringRedisTemplate.class)
        @ConditionalOnProperty(prefix = "geoarmor.local", name = "store-type", havingValue = "redis")
        public RedisDurableStore redisDurableStore(StringRedisTemplate redisTemplate) {
            return new RedisDurableStore(redisTemplate, "geoarmor:store:");
        }

        /**
         * Redis 消息监听容器
         */
        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(RedisConnectionFactory.class)
        @ConditionalOnProperty(prefix = "geoarmor.rate-limit", name = "broadcast", havingValue = "true")
        public RedisMessageListenerContainer geoArmorListenerContainer(RedisConnectionFactory connectionFactory) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            return container;
        }

        /**
         * 限流广播通知器
         */
        @Bean(destroyMethod = "unsubscribe")
        @ConditionalOnMissingBean(RateLimitNotifier.class)
        @ConditionalOnBean({StringRedisTemplate.class, RedisMessageListenerContainer.class})
        @ConditionalOnProperty(prefix = "geoarmor.rate-limit", name = "broadcast", havingValue = "true")
        public RedisRateLimitNotifier redisRateLimitNotifier(StringRedisTemplate redisTemplate,
                                                             RedisMessageListenerContainer listenerContainer,
                                                             RateLimiter rateLimiter,
                                                             GeoArmorProperties properties) {
            RedisRateLimitNotifier notifier = new RedisRateLimitNotifier(
                    redisTemplate, listenerContainer, properties.getRateLimit().getChannel());
            notifier.subscribe(rateLimiter);
            return notifier;
        }
    }
}
