package cn.bafuka.geoarmor.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 解析统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveStats {

    private long localHitCount;
    private long remoteHitCount;
    private long upstreamHitCount;
    private long fallbackHitCount;
    private long missCount;

    public long requestCount() {
        return localHitCount + remoteHitCount + upstreamHitCount + fallbackHitCount + missCount;
    }

    /**
     * 计算缓存命中率（本地 + 远程）
     *
     * @return 命中率（0.0 ~ 1.0）
     */
    public double cacheHitRate() {
        long requestCount = requestCount();
        return requestCount == 0 ? 1.0 : (double) (localHitCount + remoteHitCount) / requestCount;
    }
}
