package cn.bafuka.geoarmor.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * GeoArmor 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "geoarmor")
public class GeoArmorProperties {

    /**
     * 是否启用 GeoArmor
     */
    private boolean enabled = true;

    /**
     * 本地持久缓存配置
     */
    private LocalCacheConfig local = new LocalCacheConfig();

    /**
     * 共享远程缓存配置
     */
    private RemoteCacheConfig remote = new RemoteCacheConfig();

    /**
     * 上游请求队列配置
     */
    private QueueConfig queue = new QueueConfig();

    /**
     * 限流广播配置
     */
    private RateLimitConfig rateLimit = new RateLimitConfig();

    /**
     * 本地持久缓存配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LocalCacheConfig {
        /**
         * 条目保留时间（毫秒），默认 30 天
         */
        @Builder.Default
        private long retentionMs = 30L * 24 * 60 * 60 * 1000;

        /**
         * 写入合并窗口（毫秒），窗口内的多次 put 只触发一次落盘
         */
        @Builder.Default
        private long flushDelayMs = 5000;

        /**
         * 最大条目数
         */
        @Builder.Default
        private int maximumSize = 100000;

        /**
         * 持久化存储中的键名
         */
        @Builder.Default
        private String storageKey = "geoarmor_location_cache";

        /**
         * 持久化存储类型：file 或 redis
         */
        @Builder.Default
        private String storeType = "file";

        /**
         * 文件存储路径
         */
        @Builder.Default
        private String storePath = System.getProperty("user.home") + "/.geoarmor/location-cache.json";
    }

    /**
     * 共享远程缓存配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RemoteCacheConfig {
        /**
         * 远程缓存服务地址，为空时远程层整体失效
         */
        @Builder.Default
        private String baseUrl = "";

        /**
         * 单次调用超时（毫秒）
         */
        @Builder.Default
        private long timeoutMs = 5000;

        /**
         * 查询结果备忘时长（毫秒），默认 15 分钟
         */
        @Builder.Default
        private long lookupTtlMs = 15 * 60 * 1000;

        /**
         * 同一个 key 两次回写之间的最小间隔（毫秒），默认 3 分钟
         */
        @Builder.Default
        private long upsertIntervalMs = 3 * 60 * 1000;
    }

    /**
     * 上游请求队列配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueueConfig {
        /**
         * 相邻两次派发的最小间隔（毫秒）
         */
        @Builder.Default
        private long minDispatchIntervalMs = 500;

        /**
         * 最大并发上游请求数
         */
        @Builder.Default
        private int maxConcurrent = 4;

        /**
         * 单个请求超时（毫秒）
         */
        @Builder.Default
        private long requestTimeoutMs = 10000;

        /**
         * 请求完成后再次派发的延迟（毫秒）
         */
        @Builder.Default
        private long redispatchDelayMs = 200;

        /**
         * 限流期间重新检查的最长间隔（毫秒）
         */
        @Builder.Default
        private long rateLimitCheckIntervalMs = 60000;
    }

    /**
     * 限流广播配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimitConfig {
        /**
         * 是否通过 Redis 在节点间广播限流窗口
         */
        @Builder.Default
        private boolean broadcast = false;

        /**
         * Redis 广播频道
         */
        @Builder.Default
        private String channel = "geoarmor:rate-limit";
    }
}
