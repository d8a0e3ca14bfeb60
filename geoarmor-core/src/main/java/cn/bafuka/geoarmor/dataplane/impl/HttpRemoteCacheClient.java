package cn.bafuka.geoarmor.dataplane.impl;

import cn.bafuka.geoarmor.config.GeoArmorProperties;
import cn.bafuka.geoarmor.core.LookupMemo;
import cn.bafuka.geoarmor.core.TransportResponse;
import cn.bafuka.geoarmor.core.UpsertThrottle;
import cn.bafuka.geoarmor.dataplane.LocalCache;
import cn.bafuka.geoarmor.dataplane.RemoteCacheClient;
import cn.bafuka.geoarmor.exception.GeoArmorException.FailureReason;
import cn.bafuka.geoarmor.spi.RemoteTransport;
import cn.bafuka.geoarmor.spi.ValueVocabulary;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 共享远程缓存客户端实现
 * 走 HTTP 协议：GET /check?a=&lt;username&gt; 查询，POST /add 回写
 */
@Slf4j
public class HttpRemoteCacheClient implements RemoteCacheClient {

    static final String CHECK_PATH = "/check?a=";
    static final String ADD_PATH = "/add";

    /**
     * 备忘和节流记录最多跟踪的 key 数
     */
    static final long MAX_TRACKED_KEYS = 100000;

    private final RemoteTransport transport;

    private final LocalCache localCache;

    private final ValueVocabulary vocabulary;

    private final GeoArmorProperties.RemoteCacheConfig config;

    private final Clock clock;

    /**
     * 查询备忘，key 为用户名，超过 TTL 后自动淘汰
     */
    private final Cache<String, LookupMemo> lookupMemos;

    /**
     * 回写节流记录，key 为用户名，超过节流间隔后自动淘汰
     */
    private final Cache<String, UpsertThrottle> upsertThrottles;

    public HttpRemoteCacheClient(RemoteTransport transport,
                                 LocalCache localCache,
                                 ValueVocabulary vocabulary,
                                 GeoArmorProperties.RemoteCacheConfig config) {
        this(transport, localCache, vocabulary, config, Clock.systemUTC());
    }

    public HttpRemoteCacheClient(RemoteTransport transport,
                                 LocalCache localCache,
                                 ValueVocabulary vocabulary,
                                 GeoArmorProperties.RemoteCacheConfig config,
                                 Clock clock) {
        this.transport = transport;
        this.localCache = localCache;
        this.vocabulary = vocabulary;
        this.config = config;
        this.clock = clock;
        this.lookupMemos = buildRegistry(config.getLookupTtlMs());
        this.upsertThrottles = buildRegistry(config.getUpsertIntervalMs());
    }

    @Override
    public CompletableFuture<String> lookup(String key, boolean force) {
        if (key == null) {
            return CompletableFuture.completedFuture(null);
        }

        long now = clock.millis();
        CompletableFuture<String> placeholder = new CompletableFuture<>();

        // 检查与登记必须是一个原子操作，否则并发调用会各自发出请求
        LookupMemo memo = lookupMemos.asMap().compute(key, (k, existing) -> {
            if (existing != null) {
                if (existing.isPending()) {
                    return existing;
                }
                if (!force && existing.isFresh(now, config.getLookupTtlMs())) {
                    return existing;
                }
            }
            String previous = existing != null ? existing.getValue() : null;
            return new LookupMemo(k, now, previous, placeholder);
        });

        if (memo.getPendingFuture() != placeholder) {
            if (memo.isPending()) {
                log.debug("加入进行中的远程查询: key={}", key);
                return memo.getPendingFuture();
            }
            log.debug("远程查询备忘命中: key={}, value={}", key, memo.getValue());
            return CompletableFuture.completedFuture(memo.getValue());
        }

        fetchRemote(key).whenComplete((value, e) -> {
            String normalized = e == null ? value : null;
            lookupMemos.put(key, new LookupMemo(key, clock.millis(), normalized, null));
            if (normalized != null) {
                localCache.put(key, normalized);
            }
            placeholder.complete(normalized);
        });
        return placeholder;
    }

    @Override
    public CompletableFuture<Void> upsert(String key, String value) {
        if (key == null || value == null) {
            return CompletableFuture.completedFuture(null);
        }

        // 只回写词表认识的值
        if (!vocabulary.isRecognized(value)) {
            log.debug("跳过远程回写: key={}, value={}, reason={}", key, value, FailureReason.UNRECOGNIZED_VALUE);
            return CompletableFuture.completedFuture(null);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("username", key);
        body.put("location", value);

        return callSafely(ADD_PATH, "POST", body)
                .thenAccept(resp -> {
                    if (resp.isOk()) {
                        log.debug("远程缓存已更新: key={}, value={}", key, value);
                    } else {
                        log.warn("远程回写失败: key={}, status={}, error={}, reason={}",
                                key, resp.getStatus(), resp.getError(), FailureReason.NETWORK_FAILURE);
                    }
                });
    }

    @Override
    public CompletableFuture<Void> ensureUpsert(String key, String value) {
        if (key == null || value == null) {
            return CompletableFuture.completedFuture(null);
        }

        long now = clock.millis();
        CompletableFuture<Void> placeholder = new CompletableFuture<>();

        UpsertThrottle throttle = upsertThrottles.asMap().compute(key, (k, existing) -> {
            if (existing != null
                    && (existing.isPending() || existing.isThrottled(now, config.getUpsertIntervalMs()))) {
                return existing;
            }
            return new UpsertThrottle(k, now, placeholder);
        });

        if (throttle.getPendingFuture() != placeholder) {
            if (throttle.isPending()) {
                return throttle.getPendingFuture();
            }
            log.debug("远程回写节流中，跳过: key={}", key);
            return CompletableFuture.completedFuture(null);
        }

        upsert(key, value).whenComplete((ignored, e) -> {
            if (e != null) {
                log.warn("远程回写异常: key={}, error={}", key, e.getMessage());
            }
            upsertThrottles.put(key, new UpsertThrottle(key, clock.millis(), null));
            placeholder.complete(null);
        });
        return placeholder;
    }

    /**
     * 清空备忘和节流记录
     */
    public void clear() {
        lookupMemos.invalidateAll();
        upsertThrottles.invalidateAll();
    }

    /**
     * 当前跟踪的查询备忘数（已过期的不计）
     */
    public long lookupMemoCount() {
        lookupMemos.cleanUp();
        return lookupMemos.estimatedSize();
    }

    /**
     * 当前跟踪的回写节流记录数（已过期的不计）
     */
    public long upsertThrottleCount() {
        upsertThrottles.cleanUp();
        return upsertThrottles.estimatedSize();
    }

    /**
     * 构建按写入时间过期的登记表，计时使用注入的时钟
     *
     * @param windowMs 记录的有效窗口
     */
    private <V> Cache<String, V> buildRegistry(long windowMs) {
        return Caffeine.newBuilder()
                .expireAfterWrite(windowMs, TimeUnit.MILLISECONDS)
                .maximumSize(MAX_TRACKED_KEYS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    private CompletableFuture<String> fetchRemote(String key) {
        String path = CHECK_PATH + URLEncoder.encode(key, StandardCharsets.UTF_8);
        return callSafely(path, "GET", null).thenApply(resp -> {
            if (!resp.isOk()) {
                log.warn("远程缓存未命中或出错: key={}, status={}, error={}, reason={}",
                        key, resp.getStatus(), resp.getError(), FailureReason.NETWORK_FAILURE);
                return null;
            }
            String location = resp.getData() != null ? resp.getData().getString("location") : null;
            if (location == null || location.isEmpty()) {
                log.debug("远程缓存无记录: key={}", key);
                return null;
            }
            log.debug("远程缓存命中: key={}, value={}", key, location);
            return location;
        });
    }

    /**
     * 传输层约定不抛异常，这里再兜底一次
     */
    private CompletableFuture<TransportResponse> callSafely(String path, String method, Object body) {
        CompletableFuture<TransportResponse> call;
        try {
            call = transport.call(path, method, body);
        } catch (Exception e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            return CompletableFuture.completedFuture(TransportResponse.failure(0, "no-response"));
        }
        return call.exceptionally(e -> TransportResponse.failure(0, String.valueOf(e.getMessage())))
                .thenApply(resp -> resp != null ? resp : TransportResponse.failure(0, "no-response"));
    }
}
