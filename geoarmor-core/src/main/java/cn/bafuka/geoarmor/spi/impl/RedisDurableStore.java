package cn.bafuka.geoarmor.spi.impl;

import cn.bafuka.geoarmor.exception.GeoArmorException;
import cn.bafuka.geoarmor.spi.DurableStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 基于 Redis 的持久化存储
 * 适用于多个进程共用同一份本地缓存快照的部署
 */
@Slf4j
public class RedisDurableStore implements DurableStore {

    /**
     * Redis 模板
     */
    private final StringRedisTemplate redisTemplate;

    /**
     * Redis 键前缀
     */
    private final String keyPrefix;

    private final ExecutorService ioExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "geoarmor-redis-store");
        thread.setDaemon(true);
        return thread;
    });

    public RedisDurableStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public CompletableFuture<Map<String, String>> get(Collection<String> keys) {
        return CompletableFuture.supplyAsync(() -> {
            List<String> keyList = new ArrayList<>(keys);
            List<String> redisKeys = new ArrayList<>(keyList.size());
            for (String key : keyList) {
                redisKeys.add(getRedisKey(key));
            }

            List<String> values;
            try {
                values = redisTemplate.opsForValue().multiGet(redisKeys);
            } catch (Exception e) {
                throw new GeoArmorException("从 Redis 读取失败: keys=" + keyList, e,
                        GeoArmorException.FailureReason.STORAGE_UNAVAILABLE);
            }

            Map<String, String> result = new HashMap<>();
            if (values == null) {
                return result;
            }
            for (int i = 0; i < keyList.size() && i < values.size(); i++) {
                if (values.get(i) != null) {
                    result.put(keyList.get(i), values.get(i));
                }
            }
            return result;
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> set(Map<String, String> entries) {
        return CompletableFuture.runAsync(() -> {
            Map<String, String> redisEntries = new HashMap<>();
            entries.forEach((key, value) -> redisEntries.put(getRedisKey(key), value));
            try {
                redisTemplate.opsForValue().multiSet(redisEntries);
                log.debug("Redis 存储写入完成: keys={}", redisEntries.keySet());
            } catch (Exception e) {
                throw new GeoArmorException("写入 Redis 失败: keys=" + entries.keySet(), e,
                        GeoArmorException.FailureReason.STORAGE_UNAVAILABLE);
            }
        }, ioExecutor);
    }

    @Override
    public String getType() {
        return "redis";
    }

    public void shutdown() {
        ioExecutor.shutdown();
    }

    public String getRedisKey(String key) {
        return keyPrefix + key;
    }
}
