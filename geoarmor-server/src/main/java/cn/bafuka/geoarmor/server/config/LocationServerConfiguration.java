package cn.bafuka.geoarmor.server.config;

import cn.bafuka.geoarmor.server.provider.LocationProvider;
import cn.bafuka.geoarmor.spi.ValueVocabulary;
import cn.bafuka.geoarmor.spi.impl.CountryVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;

/**
 * 共享位置服务配置
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LocationServerProperties.class)
public class LocationServerConfiguration {

    /**
     * Redisson 客户端，连接信息复用 spring.redis.*
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        SingleServerConfig serverConfig = config.useSingleServer()
                .setAddress("redis://" + redisProperties.getHost() + ":" + redisProperties.getPort())
                .setDatabase(redisProperties.getDatabase());
        if (StringUtils.hasText(redisProperties.getPassword())) {
            serverConfig.setPassword(redisProperties.getPassword());
        }

        log.info("创建 RedissonClient: host={}, port={}, database={}",
                redisProperties.getHost(), redisProperties.getPort(), redisProperties.getDatabase());
        return Redisson.create(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ValueVocabulary valueVocabulary() {
        return CountryVocabulary.loadDefault();
    }

    /**
     * 未接入真实数据源时，回源一律返回未找到
     */
    @Bean
    @ConditionalOnMissingBean
    public LocationProvider locationProvider() {
        log.warn("未配置 LocationProvider，/check 对未知用户将返回空位置");
        return username -> null;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
