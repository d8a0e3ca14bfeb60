package cn.bafuka.geoarmor.dataplane;

import cn.bafuka.geoarmor.config.GeoArmorProperties;
import cn.bafuka.geoarmor.consistency.RateLimitNotifier;
import cn.bafuka.geoarmor.core.FetchResult;
import cn.bafuka.geoarmor.dataplane.impl.DefaultRateLimiter;
import cn.bafuka.geoarmor.dataplane.impl.DefaultRequestQueue;
import cn.bafuka.geoarmor.spi.UpstreamFetcher;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DefaultRequestQueue 单元测试
 * 使用较短的派发间隔和超时，验证顺序、并发、间隔、超时和限流
 */
public class DefaultRequestQueueTest {

    @Mock
    private RateLimitNotifier rateLimitNotifier;

    private DefaultRateLimiter rateLimiter;

    private DefaultRequestQueue queue;

    /**
     * 每个 key 的上游调用顺序
     */
    private final List<String> fetched = new CopyOnWriteArrayList<>();

    /**
     * 每次派发的时间（纳秒）
     */
    private final List<Long> fetchedAt = new CopyOnWriteArrayList<>();

    /**
     * 手动控制的上游结果
     */
    private final Map<String, CompletableFuture<FetchResult>> pending = new ConcurrentHashMap<>();

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        rateLimiter = new DefaultRateLimiter();
    }

    @After
    public void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    /**
     * 测试严格按入队顺序派发
     */
    @Test
    public void testFifoOrder() {
        queue = newQueue(config(0, 1, 5000), recording(key -> completed(FetchResult.of(key + "-loc"))));

        List<CompletableFuture<FetchResult>> results = new ArrayList<>();
        for (String key : Arrays.asList("a", "b", "c", "d")) {
            results.add(queue.enqueue(key));
        }

        assertEquals("a-loc", results.get(0).join().getValue());
        assertEquals("d-loc", results.get(3).join().getValue());
        assertEquals(Arrays.asList("a", "b", "c", "d"), fetched);
    }

    /**
     * 测试并发上限：10 个请求最多同时在途 4 个
     */
    @Test
    public void testConcurrencyCap() throws Exception {
        queue = newQueue(config(0, 4, 5000), recording(this::manual));

        List<CompletableFuture<FetchResult>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(queue.enqueue("user" + i));
        }

        awaitTrue(() -> fetched.size() == 4);
        Thread.sleep(100);
        assertEquals(4, fetched.size());
        assertEquals(4, queue.activeCount());
        assertEquals(6, queue.pendingCount());

        // 完成一个后补派一个
        pending.get("user0").complete(FetchResult.of("France"));
        assertEquals("France", results.get(0).get(1, TimeUnit.SECONDS).getValue());
        awaitTrue(() -> fetched.size() == 5);
        assertEquals("user4", fetched.get(4));
        assertEquals(4, queue.activeCount());
    }

    /**
     * 测试相邻派发的最小间隔
     */
    @Test
    public void testMinDispatchInterval() {
        queue = newQueue(config(100, 4, 5000), recording(key -> completed(FetchResult.absent())));

        CompletableFuture<FetchResult> last = null;
        for (String key : Arrays.asList("a", "b", "c")) {
            last = queue.enqueue(key);
        }
        last.join();

        assertEquals(3, fetchedAt.size());
        for (int i = 1; i < fetchedAt.size(); i++) {
            long gapMs = TimeUnit.NANOSECONDS.toMillis(fetchedAt.get(i) - fetchedAt.get(i - 1));
            assertTrue("派发间隔过短: " + gapMs, gapMs >= 90);
        }
    }

    /**
     * 测试超时软取消：调用方拿到 timedOut，迟到的结果被丢弃
     */
    @Test
    public void testTimeoutSoftCancel() throws Exception {
        queue = newQueue(config(0, 1, 100), recording(this::manual));

        FetchResult result = queue.enqueue("slow").get(2, TimeUnit.SECONDS);
        assertTrue(result.isTimedOut());
        assertFalse(result.isCacheable());
        assertNull(result.getValue());

        // 超时释放了并发名额，后续请求可以派发
        CompletableFuture<FetchResult> next = queue.enqueue("next");
        awaitTrue(() -> fetched.contains("next"));

        // 迟到的真实结果不影响已结算的调用方
        pending.get("slow").complete(FetchResult.of("Japan"));
        pending.get("next").complete(FetchResult.of("India"));
        assertEquals("India", next.get(1, TimeUnit.SECONDS).getValue());
        assertTrue(result.isTimedOut());
        awaitTrue(() -> queue.activeCount() == 0);
    }

    /**
     * 测试同一个 key 排队期间再次入队，共享同一个结果
     */
    @Test
    public void testDuplicateEnqueueJoins() {
        queue = newQueue(config(0, 1, 5000), recording(this::manual));

        CompletableFuture<FetchResult> first = queue.enqueue("alice");
        CompletableFuture<FetchResult> second = queue.enqueue("alice");
        assertSame(first, second);

        awaitTrue(() -> pending.containsKey("alice"));
        pending.get("alice").complete(FetchResult.of("India"));
        assertEquals("India", second.join().getValue());
        assertEquals(1, fetched.size());
    }

    /**
     * 测试上游失败按未命中处理
     */
    @Test
    public void testUpstreamErrorIsAbsent() {
        CompletableFuture<FetchResult> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("upstream down"));
        queue = newQueue(config(0, 1, 5000), recording(key -> failed));

        FetchResult result = queue.enqueue("bob").join();
        assertNull(result.getValue());
        assertTrue(result.isCacheable());
    }

    /**
     * 测试上游同步抛异常同样按未命中处理
     */
    @Test
    public void testUpstreamThrowsIsAbsent() {
        queue = newQueue(config(0, 1, 5000), key -> {
            throw new IllegalStateException("boom");
        });

        FetchResult result = queue.enqueue("bob").join();
        assertNull(result.getValue());
        assertTrue(result.isCacheable());
    }

    /**
     * 测试限流：设置限流窗口、广播、窗口内暂停派发
     */
    @Test
    public void testRateLimitFreezesDispatch() throws Exception {
        Instant resumeAt = Instant.now().plusMillis(400);
        queue = newQueue(config(0, 4, 5000), recording(key -> "first".equals(key)
                ? completed(FetchResult.rateLimited(resumeAt))
                : completed(FetchResult.of("Brazil"))));

        FetchResult limited = queue.enqueue("first").join();
        assertTrue(limited.isRateLimited());
        assertFalse(limited.isCacheable());
        assertEquals(resumeAt, rateLimiter.getResumeAt());
        verify(rateLimitNotifier).publish(resumeAt);

        CompletableFuture<FetchResult> second = queue.enqueue("second");
        Thread.sleep(150);
        assertFalse(fetched.contains("second"));
        assertEquals(1, queue.pendingCount());

        assertEquals("Brazil", second.get(2, TimeUnit.SECONDS).getValue());
        long dispatchedAt = System.currentTimeMillis();
        assertTrue(dispatchedAt >= resumeAt.toEpochMilli());
    }

    /**
     * 测试限流窗口被外部清除后，在一个检查间隔左右恢复派发
     */
    @Test
    public void testExternallyClearedWindowResumesDispatch() throws Exception {
        rateLimiter.setResumeAt(Instant.now().plusSeconds(3600));
        queue = newQueue(config(0, 1, 5000), recording(key -> completed(FetchResult.of("Brazil"))));

        CompletableFuture<FetchResult> waiting = queue.enqueue("bob");
        Thread.sleep(150);
        assertFalse(fetched.contains("bob"));
        assertEquals(1, queue.pendingCount());

        long clearedAt = System.currentTimeMillis();
        rateLimiter.setResumeAt(null);

        assertEquals("Brazil", waiting.get(2, TimeUnit.SECONDS).getValue());
        long waitedMs = System.currentTimeMillis() - clearedAt;
        assertTrue("清除窗口后派发等待过久: " + waitedMs + "ms", waitedMs < 500);
        assertEquals(0, queue.pendingCount());
    }

    /**
     * 测试限流但没有恢复时间：不设置窗口
     */
    @Test
    public void testRateLimitWithoutResumeAt() {
        queue = newQueue(config(0, 1, 5000), recording(key -> completed(FetchResult.rateLimited(null))));

        FetchResult result = queue.enqueue("bob").join();
        assertTrue(result.isRateLimited());
        assertNull(rateLimiter.getResumeAt());
        verify(rateLimitNotifier, never()).publish(any());
    }

    /**
     * 测试关闭：等待中的请求以空结果结算，之后的入队直接返回空结果
     */
    @Test
    public void testShutdown() throws Exception {
        queue = newQueue(config(0, 1, 5000), recording(this::manual));

        queue.enqueue("busy");
        CompletableFuture<FetchResult> waiting = queue.enqueue("waiting");
        awaitTrue(() -> fetched.contains("busy"));

        queue.shutdown();

        FetchResult abandoned = waiting.get(1, TimeUnit.SECONDS);
        assertNull(abandoned.getValue());
        assertTrue(abandoned.isCacheable());
        assertNull(queue.enqueue("late").join().getValue());
        assertFalse(fetched.contains("waiting"));
    }

    private DefaultRequestQueue newQueue(GeoArmorProperties.QueueConfig config, UpstreamFetcher fetcher) {
        return new DefaultRequestQueue(fetcher, rateLimiter, rateLimitNotifier, config);
    }

    private static GeoArmorProperties.QueueConfig config(long minIntervalMs, int maxConcurrent, long timeoutMs) {
        return GeoArmorProperties.QueueConfig.builder()
                .minDispatchIntervalMs(minIntervalMs)
                .maxConcurrent(maxConcurrent)
                .requestTimeoutMs(timeoutMs)
                .redispatchDelayMs(10)
                .rateLimitCheckIntervalMs(50)
                .build();
    }

    private UpstreamFetcher recording(Function<String, CompletableFuture<FetchResult>> delegate) {
        return key -> {
            fetched.add(key);
            fetchedAt.add(System.nanoTime());
            return delegate.apply(key);
        };
    }

    private CompletableFuture<FetchResult> manual(String key) {
        return pending.computeIfAbsent(key, k -> new CompletableFuture<>());
    }

    private static CompletableFuture<FetchResult> completed(FetchResult result) {
        return CompletableFuture.completedFuture(result);
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("等待条件超时");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("等待被中断");
            }
        }
    }
}
