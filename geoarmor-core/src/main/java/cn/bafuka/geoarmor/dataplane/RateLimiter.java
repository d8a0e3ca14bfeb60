package cn.bafuka.geoarmor.dataplane;

import java.time.Instant;

/**
 * 全局限流窗口
 * 恢复时间由外部信号设置，到点后自动清除
 */
public interface RateLimiter {

    /**
     * 设置恢复时间，传 null 表示清除
     *
     * @param resumeAt 恢复时间
     */
    void setResumeAt(Instant resumeAt);

    /**
     * 当前是否处于限流窗口内；now >= resumeAt 时清除窗口
     *
     * @param now 当前时间
     * @return 限流中返回 true
     */
    boolean isBlocked(Instant now);

    /**
     * 获取恢复时间
     *
     * @return 恢复时间，无限流时为 null
     */
    Instant getResumeAt();
}
