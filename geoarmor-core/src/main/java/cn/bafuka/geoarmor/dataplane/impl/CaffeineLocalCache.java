package cn.bafuka.geoarmor.dataplane.impl;

import cn.bafuka.geoarmor.config.GeoArmorProperties;
import cn.bafuka.geoarmor.core.CacheEntry;
import cn.bafuka.geoarmor.dataplane.LocalCache;
import cn.bafuka.geoarmor.spi.DurableStore;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.TypeReference;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 本地持久缓存实现
 * 内存部分基于 Caffeine，按条目的 expiresAt 过期；持久化通过 DurableStore 整体导入导出，
 * 写入在合并窗口内只触发一次落盘
 */
@Slf4j
public class CaffeineLocalCache implements LocalCache {

    /**
     * 关闭时等待最后一次落盘的时长（秒）
     */
    private static final long SHUTDOWN_FLUSH_TIMEOUT_SECONDS = 10;

    private final Cache<String, CacheEntry> cache;

    private final DurableStore durableStore;

    private final GeoArmorProperties.LocalCacheConfig config;

    private final Clock clock;

    /**
     * 合并落盘调度器
     */
    private final ScheduledExecutorService flushScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "geoarmor-local-flush");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * 是否已有待执行的落盘
     */
    private final AtomicBoolean flushScheduled = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> pendingFlush;

    private volatile boolean shutdown = false;

    public CaffeineLocalCache(DurableStore durableStore, GeoArmorProperties.LocalCacheConfig config) {
        this(durableStore, config, Clock.systemUTC());
    }

    public CaffeineLocalCache(DurableStore durableStore, GeoArmorProperties.LocalCacheConfig config, Clock clock) {
        this.durableStore = durableStore;
        this.config = config;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getMaximumSize())
                .expireAfter(new EntryExpiry())
                .recordStats()
                .build();

        log.info("构建本地缓存，配置: maximumSize={}, retentionMs={}, flushDelayMs={}, store={}",
                config.getMaximumSize(), config.getRetentionMs(), config.getFlushDelayMs(), durableStore.getType());
    }

    @Override
    public String get(String key) {
        if (key == null) {
            return null;
        }

        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            log.debug("本地缓存未命中: key={}", key);
            return null;
        }

        // 读时惰性淘汰
        if (!entry.isUsable(clock.millis())) {
            log.debug("本地缓存条目已失效，移除: key={}, expiresAt={}", key, entry.getExpiresAt());
            cache.asMap().remove(key, entry);
            return null;
        }

        log.debug("本地缓存命中: key={}, value={}", key, entry.getValue());
        return entry.getValue();
    }

    @Override
    public void put(String key, String value) {
        if (key == null || value == null) {
            log.warn("拒绝写入空值到本地缓存: key={}", key);
            return;
        }

        long now = clock.millis();
        cache.put(key, new CacheEntry(key, value, now, now + config.getRetentionMs()));
        log.debug("本地缓存写入: key={}, value={}", key, value);

        scheduleFlush();
    }

    @Override
    public void invalidate(String key) {
        if (key == null) {
            return;
        }
        cache.invalidate(key);
        log.debug("本地缓存失效: key={}", key);
        scheduleFlush();
    }

    @Override
    public CompletableFuture<Integer> load() {
        CompletableFuture<Map<String, String>> stored;
        try {
            stored = durableStore.get(Collections.singletonList(config.getStorageKey()));
        } catch (Exception e) {
            stored = CompletableFuture.failedFuture(e);
        }

        return stored
                .thenApply(values -> importEntries(values.get(config.getStorageKey())))
                .exceptionally(e -> {
                    log.warn("持久化存储不可用，跳过本地缓存加载: store={}, error={}",
                            durableStore.getType(), e.getMessage());
                    return 0;
                });
    }

    @Override
    public synchronized CompletableFuture<Void> flush() {
        Map<String, CacheEntry> snapshot = new HashMap<>();
        long now = clock.millis();
        cache.asMap().forEach((key, entry) -> {
            if (entry.isUsable(now)) {
                snapshot.put(key, entry);
            }
        });

        String payload = JSON.toJSONString(snapshot);
        CompletableFuture<Void> written;
        try {
            written = durableStore.set(Collections.singletonMap(config.getStorageKey(), payload));
        } catch (Exception e) {
            written = CompletableFuture.failedFuture(e);
        }

        return written.handle((ignored, e) -> {
            if (e != null) {
                log.warn("持久化存储不可用，本次落盘跳过: store={}, entries={}, error={}",
                        durableStore.getType(), snapshot.size(), e.getMessage());
            } else {
                log.debug("本地缓存落盘完成: entries={}", snapshot.size());
            }
            return null;
        });
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("关闭本地缓存，执行最后一次落盘...");

        ScheduledFuture<?> scheduled = pendingFlush;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        flushScheduler.shutdown();

        try {
            flush().get(SHUTDOWN_FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.error("本地缓存关闭落盘被中断", e);
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.error("本地缓存关闭落盘失败", e);
        }
    }

    /**
     * 获取统计信息
     */
    public String getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return String.format(
                "Local Cache Stats: size=%d, hitRate=%.2f%%, hitCount=%d, missCount=%d, evictionCount=%d",
                cache.estimatedSize(),
                stats.hitRate() * 100,
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount()
        );
    }

    /**
     * 合并窗口内只安排一次落盘；落盘开始前清除标记，落盘期间的新写入会安排下一次
     */
    private void scheduleFlush() {
        if (shutdown || !flushScheduled.compareAndSet(false, true)) {
            return;
        }

        try {
            pendingFlush = flushScheduler.schedule(() -> {
                flushScheduled.set(false);
                flush();
            }, config.getFlushDelayMs(), TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            // 调度器已关闭，交给 shutdown 的最后一次落盘
            flushScheduled.set(false);
            log.debug("落盘调度失败: error={}", e.getMessage());
        }
    }

    private int importEntries(String payload) {
        if (payload == null || payload.isEmpty()) {
            log.info("持久化存储中没有本地缓存快照");
            return 0;
        }

        Map<String, CacheEntry> stored;
        try {
            stored = JSON.parseObject(payload, new TypeReference<Map<String, CacheEntry>>() {
            });
        } catch (JSONException e) {
            log.warn("本地缓存快照格式错误，已忽略: error={}", e.getMessage());
            return 0;
        }
        if (stored == null) {
            return 0;
        }

        long now = clock.millis();
        int loaded = 0;
        for (Map.Entry<String, CacheEntry> item : stored.entrySet()) {
            CacheEntry entry = item.getValue();
            // 过期和空值条目不导入，允许重试
            if (entry == null || !entry.isUsable(now)) {
                continue;
            }
            entry.setKey(item.getKey());
            // 内存中已有的条目更新，不覆盖
            if (cache.asMap().putIfAbsent(item.getKey(), entry) == null) {
                loaded++;
            }
        }

        log.info("已加载 {} 条本地缓存（已排除过期和空值条目）", loaded);
        return loaded;
    }

    /**
     * 按条目的 expiresAt 计算剩余存活时间
     */
    private class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry entry) {
            long remainingMs = Math.max(0, entry.getExpiresAt() - clock.millis());
            return TimeUnit.MILLISECONDS.toNanos(remainingMs);
        }
    }
}
