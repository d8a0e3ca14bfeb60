package cn.bafuka.geoarmor.consistency;

import cn.bafuka.geoarmor.dataplane.RateLimiter;

import java.time.Instant;

/**
 * 限流通知器接口
 * 外部信道：收到限流窗口后写入 RateLimiter，也可把本节点遇到的限流广播给其他节点
 */
public interface RateLimitNotifier {

    /**
     * 广播限流窗口
     *
     * @param resumeAt 恢复时间
     */
    void publish(Instant resumeAt);

    /**
     * 订阅限流窗口，收到后调用 limiter.setResumeAt
     *
     * @param limiter 本地限流窗口
     */
    void subscribe(RateLimiter limiter);

    /**
     * 取消订阅
     */
    void unsubscribe();
}
