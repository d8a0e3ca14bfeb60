package cn.bafuka.geoarmor.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.concurrent.TimeUnit;

/**
 * 共享位置服务配置属性
 */
@Data
@ConfigurationProperties(prefix = "geoarmor.server")
public class LocationServerProperties {

    /**
     * 记录有效期（天）
     */
    private int cacheTtlDays = 7;

    /**
     * 位置记录的 Redis 键前缀
     */
    private String keyPrefix = "geoarmor:location:";

    /**
     * 回源锁的键前缀
     */
    private String lockPrefix = "geoarmor:lock:location:";

    /**
     * 获取回源锁的等待时间（毫秒）
     */
    private long lockWaitTimeMs = 3000;

    /**
     * 回源锁的持有时间（毫秒）
     */
    private long lockLeaseTimeMs = 5000;

    public long getCacheTtlMs() {
        return TimeUnit.DAYS.toMillis(cacheTtlDays);
    }
}
