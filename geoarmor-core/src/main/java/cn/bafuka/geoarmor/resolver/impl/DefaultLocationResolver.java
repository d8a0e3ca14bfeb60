package cn.bafuka.geoarmor.resolver.impl;

import cn.bafuka.geoarmor.core.FetchResult;
import cn.bafuka.geoarmor.core.ResolveStats;
import cn.bafuka.geoarmor.dataplane.LocalCache;
import cn.bafuka.geoarmor.dataplane.RemoteCacheClient;
import cn.bafuka.geoarmor.dataplane.RequestQueue;
import cn.bafuka.geoarmor.exception.GeoArmorException.FailureReason;
import cn.bafuka.geoarmor.resolver.LocationResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.LongAdder;

/**
 * 位置解析器默认实现
 * <p>
 * 执行流程：
 * 1. 查本地缓存，命中则刷新共享缓存后返回
 * 2. 查共享远程缓存，命中则刷新共享缓存后返回
 * 3. 进入上游请求队列，拿到值则写本地缓存、回写共享缓存后返回
 * 4. 上游限流或超时，强制刷新共享远程缓存作为兜底
 */
@Slf4j
public class DefaultLocationResolver implements LocationResolver {

    private final LocalCache localCache;

    private final RemoteCacheClient remoteCacheClient;

    private final RequestQueue requestQueue;

    private final LongAdder localHitCount = new LongAdder();
    private final LongAdder remoteHitCount = new LongAdder();
    private final LongAdder upstreamHitCount = new LongAdder();
    private final LongAdder fallbackHitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();

    public DefaultLocationResolver(LocalCache localCache,
                                   RemoteCacheClient remoteCacheClient,
                                   RequestQueue requestQueue) {
        this.localCache = localCache;
        this.remoteCacheClient = remoteCacheClient;
        this.requestQueue = requestQueue;
    }

    @Override
    public CompletableFuture<String> resolve(String key) {
        if (key == null || key.trim().isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        try {
            return checkLocal(key).exceptionally(e -> {
                log.error("位置解析异常，按未找到处理: key={}, reason={}", key, FailureReason.UNKNOWN, e);
                missCount.increment();
                return null;
            });
        } catch (Exception e) {
            log.error("位置解析异常，按未找到处理: key={}, reason={}", key, FailureReason.UNKNOWN, e);
            missCount.increment();
            return CompletableFuture.completedFuture(null);
        }
    }

    @Override
    public ResolveStats getStats() {
        return ResolveStats.builder()
                .localHitCount(localHitCount.sum())
                .remoteHitCount(remoteHitCount.sum())
                .upstreamHitCount(upstreamHitCount.sum())
                .fallbackHitCount(fallbackHitCount.sum())
                .missCount(missCount.sum())
                .build();
    }

    private CompletableFuture<String> checkLocal(String key) {
        String local = localCache.get(key);
        if (local != null) {
            log.debug("使用本地缓存位置: key={}, value={}", key, local);
            localHitCount.increment();
            return refreshShared(key, local);
        }
        return checkRemote(key);
    }

    private CompletableFuture<String> checkRemote(String key) {
        return remoteCacheClient.lookup(key).thenCompose(remote -> {
            if (remote != null) {
                log.debug("使用远程缓存位置: key={}, value={}", key, remote);
                remoteHitCount.increment();
                return refreshShared(key, remote);
            }
            return enqueueUpstream(key);
        });
    }

    private CompletableFuture<String> enqueueUpstream(String key) {
        log.debug("上游请求排队: key={}", key);
        return requestQueue.enqueue(key).thenCompose(result -> {
            if (!result.isCacheable()) {
                return forcedRemoteRefresh(key, result);
            }

            String value = result.getValue();
            if (value == null) {
                log.debug("上游未返回位置: key={}", key);
                missCount.increment();
                return CompletableFuture.completedFuture(null);
            }

            log.debug("上游返回位置，写入缓存: key={}, value={}", key, value);
            upstreamHitCount.increment();
            localCache.put(key, value);
            return refreshShared(key, value);
        });
    }

    private CompletableFuture<String> forcedRemoteRefresh(String key, FetchResult result) {
        log.info("上游{}，强制刷新远程缓存: key={}", result.failureReason().getDescription(), key);
        return remoteCacheClient.lookup(key, true).thenApply(remote -> {
            if (remote == null) {
                missCount.increment();
                return null;
            }
            fallbackHitCount.increment();
            localCache.put(key, remote);
            return remote;
        });
    }

    /**
     * 刷新共享缓存的新鲜度，回写结果不影响返回值
     */
    private CompletableFuture<String> refreshShared(String key, String value) {
        return remoteCacheClient.ensureUpsert(key, value).handle((ignored, e) -> {
            if (e != null) {
                log.warn("共享缓存刷新失败: key={}, error={}", key, e.getMessage());
            }
            return value;
        });
    }
}
