package cn.bafuka.geoarmor.dataplane.impl;

import cn.bafuka.geoarmor.config.GeoArmorProperties;
import cn.bafuka.geoarmor.consistency.RateLimitNotifier;
import cn.bafuka.geoarmor.core.FetchResult;
import cn.bafuka.geoarmor.core.QueueItem;
import cn.bafuka.geoarmor.dataplane.RateLimiter;
import cn.bafuka.geoarmor.dataplane.RequestQueue;
import cn.bafuka.geoarmor.exception.GeoArmorException.FailureReason;
import cn.bafuka.geoarmor.spi.UpstreamFetcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 上游请求队列默认实现
 * <p>
 * 严格按入队顺序派发，同时在途的上游请求不超过 maxConcurrent，相邻派发间隔不小于 minDispatchInterval。
 * 限流窗口内暂停派发，按不超过 rateLimitCheckInterval 的间隔重新检查。
 * 每个派发出去的请求单独计时，超时后以 timedOut=true 结算调用方，但不取消真实请求（软取消）。
 * 同一个 key 在排队或在途期间再次入队，会加入已有的结果。
 */
@Slf4j
public class DefaultRequestQueue implements RequestQueue {

    private final UpstreamFetcher fetcher;

    private final RateLimiter rateLimiter;

    /**
     * 限流通知器，可为 null
     */
    private final RateLimitNotifier rateLimitNotifier;

    private final GeoArmorProperties.QueueConfig config;

    private final Clock clock;

    /**
     * 派发调度器：派发间隔、超时、限流重检都在这里计时
     */
    private final ScheduledExecutorService dispatcher = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "geoarmor-dispatcher");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * 排队或在途的请求，用于入队去重
     */
    private final Map<String, QueueItem> queuedItems = new ConcurrentHashMap<>();

    // 以下状态由 this 锁保护
    private final Deque<QueueItem> waiting = new ArrayDeque<>();
    private int active = 0;
    private long lastDispatchAt = Long.MIN_VALUE / 2;
    private ScheduledFuture<?> drainTask;
    private boolean shutdown = false;

    public DefaultRequestQueue(UpstreamFetcher fetcher,
                               RateLimiter rateLimiter,
                               RateLimitNotifier rateLimitNotifier,
                               GeoArmorProperties.QueueConfig config) {
        this(fetcher, rateLimiter, rateLimitNotifier, config, Clock.systemUTC());
    }

    public DefaultRequestQueue(UpstreamFetcher fetcher,
                               RateLimiter rateLimiter,
                               RateLimitNotifier rateLimitNotifier,
                               GeoArmorProperties.QueueConfig config,
                               Clock clock) {
        this.fetcher = fetcher;
        this.rateLimiter = rateLimiter;
        this.rateLimitNotifier = rateLimitNotifier;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<FetchResult> enqueue(String key) {
        if (key == null) {
            return CompletableFuture.completedFuture(FetchResult.absent());
        }

        synchronized (this) {
            if (shutdown) {
                log.warn("请求队列已关闭，直接返回空结果: key={}", key);
                return CompletableFuture.completedFuture(FetchResult.absent());
            }

            QueueItem existing = queuedItems.get(key);
            if (existing != null) {
                log.debug("加入已排队的上游请求: key={}", key);
                return existing.getResultPromise();
            }

            QueueItem item = new QueueItem(key, clock.millis());
            queuedItems.put(key, item);
            waiting.addLast(item);
            log.debug("上游请求入队: key={}, waiting={}, active={}", key, waiting.size(), active);

            scheduleDrain(0);
            return item.getResultPromise();
        }
    }

    @Override
    public synchronized int pendingCount() {
        return waiting.size();
    }

    @Override
    public synchronized int activeCount() {
        return active;
    }

    @Override
    public void shutdown() {
        List<QueueItem> abandoned;
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (drainTask != null) {
                drainTask.cancel(false);
            }

            log.info("关闭请求队列: waiting={}, active={}", waiting.size(), active);
            abandoned = new ArrayList<>(waiting);
            waiting.clear();
            abandoned.forEach(item -> queuedItems.remove(item.getKey(), item));
        }
        abandoned.forEach(item -> item.settle(FetchResult.absent()));
        // 已安排的超时任务在关闭后仍会执行，在途请求照常结算
        dispatcher.shutdown();
    }

    /**
     * 尽可能多地派发等待中的请求
     */
    private synchronized void drain() {
        drainTask = null;
        if (shutdown) {
            return;
        }

        while (!waiting.isEmpty()) {
            Instant now = clock.instant();

            if (rateLimiter.isBlocked(now)) {
                Instant resumeAt = rateLimiter.getResumeAt();
                long remaining = resumeAt != null ? resumeAt.toEpochMilli() - now.toEpochMilli() : 0;
                long wait = Math.min(Math.max(remaining, 1), config.getRateLimitCheckIntervalMs());
                log.info("上游限流中，暂停派发: waiting={}, resumeAt={}, recheckInMs={}", waiting.size(), resumeAt, wait);
                scheduleDrain(wait);
                return;
            }

            // 并发已满，等请求完成后再派发
            if (active >= config.getMaxConcurrent()) {
                return;
            }

            long sinceLast = now.toEpochMilli() - lastDispatchAt;
            if (sinceLast < config.getMinDispatchIntervalMs()) {
                scheduleDrain(config.getMinDispatchIntervalMs() - sinceLast);
                return;
            }

            dispatch(waiting.pollFirst(), now.toEpochMilli());
        }
    }

    private void dispatch(QueueItem item, long now) {
        active++;
        lastDispatchAt = now;
        log.debug("派发上游请求: key={}, queuedMs={}, active={}", item.getKey(), now - item.getEnqueuedAt(), active);

        CompletableFuture<FetchResult> fetch;
        try {
            fetch = fetcher.fetch(item.getKey());
        } catch (Exception e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.completedFuture(FetchResult.absent());
        }

        ScheduledFuture<?> timeout = dispatcher.schedule(() -> {
            FetchResult timedOut = FetchResult.timedOut();
            log.info("上游请求超时，不缓存: key={}, timeoutMs={}, reason={}",
                    item.getKey(), config.getRequestTimeoutMs(), timedOut.failureReason());
            settle(item, timedOut);
        }, config.getRequestTimeoutMs(), TimeUnit.MILLISECONDS);

        fetch.whenComplete((result, e) -> {
            timeout.cancel(false);
            FetchResult outcome = toOutcome(item.getKey(), result, e);
            if (outcome.isRateLimited()) {
                onRateLimited(item.getKey(), outcome);
            }
            submit(() -> settle(item, outcome));
        });
    }

    /**
     * 结算调用方结果；超时后迟到的真实结果直接丢弃
     * 调用方的后续逻辑在锁外执行
     */
    private void settle(QueueItem item, FetchResult result) {
        synchronized (this) {
            // 只有第一次结算能从登记表中移除该项
            if (!queuedItems.remove(item.getKey(), item)) {
                log.debug("丢弃超时后迟到的上游结果: key={}, value={}", item.getKey(), result.getValue());
                return;
            }
            active--;

            // 不立即循环，稍后再派发
            scheduleDrain(config.getRedispatchDelayMs());
        }
        item.settle(result);
    }

    private FetchResult toOutcome(String key, FetchResult result, Throwable e) {
        if (e != null) {
            log.warn("上游请求失败，按未命中处理: key={}, error={}, reason={}", key, e.getMessage(),
                    FailureReason.NETWORK_FAILURE);
            return FetchResult.absent();
        }
        return result != null ? result : FetchResult.absent();
    }

    private void onRateLimited(String key, FetchResult outcome) {
        Instant resumeAt = outcome.getResumeAt();
        if (resumeAt == null) {
            log.warn("上游返回限流但未给出恢复时间: key={}, reason={}", key, outcome.failureReason());
            return;
        }

        rateLimiter.setResumeAt(resumeAt);
        if (rateLimitNotifier != null) {
            rateLimitNotifier.publish(resumeAt);
        }
    }

    /**
     * 安排一次派发；已有更早的安排时保留原安排
     */
    private synchronized void scheduleDrain(long delayMs) {
        if (shutdown) {
            return;
        }
        if (drainTask != null && !drainTask.isDone()) {
            if (drainTask.getDelay(TimeUnit.MILLISECONDS) <= delayMs) {
                return;
            }
            drainTask.cancel(false);
        }
        try {
            drainTask = dispatcher.schedule(this::drain, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("派发调度器已关闭: error={}", e.getMessage());
        }
    }

    private void submit(Runnable task) {
        try {
            dispatcher.execute(task);
        } catch (RejectedExecutionException e) {
            task.run();
        }
    }
}
