package cn.bafuka.geoarmor.dataplane;

import cn.bafuka.geoarmor.config.GeoArmorProperties;
import cn.bafuka.geoarmor.core.CacheEntry;
import cn.bafuka.geoarmor.dataplane.impl.CaffeineLocalCache;
import cn.bafuka.geoarmor.spi.DurableStore;
import cn.bafuka.geoarmor.support.InMemoryDurableStore;
import cn.bafuka.geoarmor.support.MutableClock;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

/**
 * CaffeineLocalCache 单元测试
 */
public class CaffeineLocalCacheTest {

    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private InMemoryDurableStore store;

    private MutableClock clock;

    private GeoArmorProperties.LocalCacheConfig config;

    private CaffeineLocalCache localCache;

    @Before
    public void setUp() {
        store = new InMemoryDurableStore();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        config = GeoArmorProperties.LocalCacheConfig.builder()
                .flushDelayMs(200)
                .build();
        localCache = new CaffeineLocalCache(store, config, clock);
    }

    @After
    public void tearDown() {
        localCache.shutdown();
    }

    /**
     * 测试基本的 get/put 操作
     */
    @Test
    public void testGetAndPut() {
        localCache.put("bob", "France");
        assertEquals("France", localCache.get("bob"));
    }

    /**
     * 测试缓存未命中
     */
    @Test
    public void testGetMiss() {
        assertNull(localCache.get("nobody"));
        assertNull(localCache.get(null));
    }

    /**
     * 测试空值不会被写入
     */
    @Test
    public void testNullValueIgnored() {
        localCache.put("bob", null);
        assertNull(localCache.get("bob"));
        assertEquals(0, localCache.size());
    }

    /**
     * 测试覆盖写入
     */
    @Test
    public void testOverwrite() {
        localCache.put("bob", "France");
        localCache.put("bob", "Spain");
        assertEquals("Spain", localCache.get("bob"));
    }

    /**
     * 测试 30 天后读时淘汰
     */
    @Test
    public void testExpiration() {
        localCache.put("bob", "France");

        clock.advance(Duration.ofDays(29));
        assertEquals("France", localCache.get("bob"));

        clock.advance(Duration.ofDays(2));
        assertNull(localCache.get("bob"));
    }

    /**
     * 测试失效
     */
    @Test
    public void testInvalidate() {
        localCache.put("bob", "France");
        localCache.invalidate("bob");
        assertNull(localCache.get("bob"));
    }

    /**
     * 测试导入时丢弃过期和空值条目
     */
    @Test
    public void testLoadDiscardsExpiredAndNullEntries() {
        long now = clock.millis();
        Map<String, CacheEntry> stored = new HashMap<>();
        stored.put("alice", new CacheEntry("alice", "Japan", now - DAY_MS, now + DAY_MS));
        stored.put("bob", new CacheEntry("bob", "France", now - 31 * DAY_MS, now - DAY_MS));
        stored.put("carol", new CacheEntry("carol", null, now, now + DAY_MS));
        store.putRaw(config.getStorageKey(), JSON.toJSONString(stored));

        int loaded = localCache.load().join();

        assertEquals(1, loaded);
        assertEquals("Japan", localCache.get("alice"));
        assertNull(localCache.get("bob"));
        assertNull(localCache.get("carol"));
    }

    /**
     * 测试导入不覆盖内存中更新的条目
     */
    @Test
    public void testLoadKeepsNewerInMemoryEntries() {
        long now = clock.millis();
        Map<String, CacheEntry> stored = new HashMap<>();
        stored.put("alice", new CacheEntry("alice", "Japan", now, now + DAY_MS));
        store.putRaw(config.getStorageKey(), JSON.toJSONString(stored));

        localCache.put("alice", "Korea");
        localCache.load().join();

        assertEquals("Korea", localCache.get("alice"));
    }

    /**
     * 测试导入损坏的快照
     */
    @Test
    public void testLoadMalformedSnapshot() {
        store.putRaw(config.getStorageKey(), "{not json");
        assertEquals(Integer.valueOf(0), localCache.load().join());
    }

    /**
     * 测试落盘写出完整快照
     */
    @Test
    public void testFlushWritesSnapshot() {
        localCache.put("bob", "France");
        localCache.flush().join();

        JSONObject snapshot = JSON.parseObject(store.getRaw(config.getStorageKey()));
        JSONObject bob = snapshot.getJSONObject("bob");
        assertEquals("France", bob.getString("value"));
        assertEquals(clock.millis() + 30 * DAY_MS, bob.getLongValue("expiresAt"));
    }

    /**
     * 测试合并窗口内的多次写入只触发一次落盘
     */
    @Test
    public void testDebouncedFlush() throws InterruptedException {
        localCache.put("a", "France");
        localCache.put("b", "Spain");
        localCache.put("c", "Italy");

        assertEquals(0, store.getSetCount());
        Thread.sleep(600);

        assertEquals(1, store.getSetCount());
        JSONObject snapshot = JSON.parseObject(store.getRaw(config.getStorageKey()));
        assertEquals(3, snapshot.size());
    }

    /**
     * 测试关闭时执行最后一次落盘
     */
    @Test
    public void testShutdownFlushes() {
        localCache.put("bob", "France");
        localCache.shutdown();

        assertEquals(1, store.getSetCount());
        assertTrue(store.getRaw(config.getStorageKey()).contains("France"));

        // 再次关闭不重复落盘
        localCache.shutdown();
        assertEquals(1, store.getSetCount());
    }

    /**
     * 测试存储不可用时降级为空操作
     */
    @Test
    public void testStorageUnavailable() {
        store.setUnavailable(true);

        assertEquals(Integer.valueOf(0), localCache.load().join());

        localCache.put("bob", "France");
        localCache.flush().join();
        assertEquals("France", localCache.get("bob"));
    }

    /**
     * 测试存储同步抛出异常（如关闭后的拒绝执行）时加载降级为空操作
     */
    @Test
    public void testLoadStoreThrowsSynchronously() {
        DurableStore rejecting = mock(DurableStore.class);
        when(rejecting.getType()).thenReturn("file");
        when(rejecting.get(anyCollection())).thenThrow(new RejectedExecutionException("store shut down"));
        when(rejecting.set(anyMap())).thenThrow(new RejectedExecutionException("store shut down"));

        CaffeineLocalCache cache = new CaffeineLocalCache(rejecting, config, clock);
        try {
            assertEquals(Integer.valueOf(0), cache.load().join());
            assertEquals(0, cache.size());

            cache.put("bob", "France");
            cache.flush().join();
            assertEquals("France", cache.get("bob"));
        } finally {
            cache.shutdown();
        }
    }

    /**
     * 测试统计信息
     */
    @Test
    public void testStats() {
        localCache.put("bob", "France");
        localCache.get("bob");
        localCache.get("alice");

        String stats = localCache.getStats();
        assertTrue(stats.contains("Local Cache Stats"));
        assertTrue(stats.contains("hitCount=1"));
    }
}
