package cn.bafuka.geoarmor.core;

import cn.bafuka.geoarmor.exception.GeoArmorException.FailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 上游查询结果
 * 由 UpstreamFetcher 产生，经 RequestQueue 交还给调用方
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchResult {

    /**
     * 位置值，未查到为 null
     */
    private String value;

    /**
     * 上游是否返回了限流信号
     */
    private boolean rateLimited;

    /**
     * 是否本地超时（软取消）
     */
    private boolean timedOut;

    /**
     * 限流恢复时间，上游未给出时为 null
     */
    private Instant resumeAt;

    public static FetchResult of(String value) {
        return new FetchResult(value, false, false, null);
    }

    public static FetchResult absent() {
        return new FetchResult(null, false, false, null);
    }

    public static FetchResult rateLimited(Instant resumeAt) {
        return new FetchResult(null, true, false, resumeAt);
    }

    public static FetchResult timedOut() {
        return new FetchResult(null, false, true, null);
    }

    /**
     * 结果是否可以写入缓存
     * 限流和超时的结果必须保持可重试
     */
    public boolean isCacheable() {
        return !rateLimited && !timedOut;
    }

    /**
     * 不可缓存的原因
     *
     * @return 限流或超时对应的原因，可缓存时返回 null
     */
    public FailureReason failureReason() {
        if (rateLimited) {
            return FailureReason.RATE_LIMITED;
        }
        return timedOut ? FailureReason.TIMEOUT : null;
    }
}
