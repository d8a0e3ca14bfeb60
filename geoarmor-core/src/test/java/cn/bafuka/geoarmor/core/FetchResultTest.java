package cn.bafuka.geoarmor.core;

import cn.bafuka.geoarmor.exception.GeoArmorException.FailureReason;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.*;

/**
 * FetchResult 单元测试
 */
public class FetchResultTest {

    /**
     * 测试正常结果可缓存且没有失败原因
     */
    @Test
    public void testCacheableResults() {
        FetchResult found = FetchResult.of("France");
        assertTrue(found.isCacheable());
        assertNull(found.failureReason());

        FetchResult absent = FetchResult.absent();
        assertTrue(absent.isCacheable());
        assertNull(absent.getValue());
        assertNull(absent.failureReason());
    }

    /**
     * 测试限流结果不可缓存，原因为 RATE_LIMITED
     */
    @Test
    public void testRateLimited() {
        Instant resumeAt = Instant.parse("2026-01-01T00:01:00Z");
        FetchResult result = FetchResult.rateLimited(resumeAt);

        assertFalse(result.isCacheable());
        assertEquals(resumeAt, result.getResumeAt());
        assertEquals(FailureReason.RATE_LIMITED, result.failureReason());

        // 上游未给出恢复时间时原因不变
        assertEquals(FailureReason.RATE_LIMITED, FetchResult.rateLimited(null).failureReason());
    }

    /**
     * 测试超时结果不可缓存，原因为 TIMEOUT
     */
    @Test
    public void testTimedOut() {
        FetchResult result = FetchResult.timedOut();

        assertFalse(result.isCacheable());
        assertNull(result.getValue());
        assertEquals(FailureReason.TIMEOUT, result.failureReason());
    }
}
