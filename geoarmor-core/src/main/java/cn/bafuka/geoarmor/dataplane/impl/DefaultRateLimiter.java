package cn.bafuka.geoarmor.dataplane.impl;

import cn.bafuka.geoarmor.dataplane.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 限流窗口默认实现
 * 进程内唯一的 resumeAt，由外部通知设置
 */
@Slf4j
public class DefaultRateLimiter implements RateLimiter {

    private final AtomicReference<Instant> resumeAt = new AtomicReference<>();

    @Override
    public void setResumeAt(Instant resumeAt) {
        Instant previous = this.resumeAt.getAndSet(resumeAt);
        if (resumeAt == null) {
            if (previous != null) {
                log.info("限流窗口已被清除");
            }
            return;
        }
        log.info("检测到上游限流，将在 {} 恢复请求（约 {} 分钟）",
                resumeAt, Math.max(0, Duration.between(Instant.now(), resumeAt).toMinutes()));
    }

    @Override
    public boolean isBlocked(Instant now) {
        Instant current = resumeAt.get();
        if (current == null) {
            return false;
        }
        if (now.isBefore(current)) {
            return true;
        }
        // 到点后清除，期间若有新的窗口写入则保留
        if (resumeAt.compareAndSet(current, null)) {
            log.info("限流窗口已结束，恢复请求");
        }
        return false;
    }

    @Override
    public Instant getResumeAt() {
        return resumeAt.get();
    }
}
