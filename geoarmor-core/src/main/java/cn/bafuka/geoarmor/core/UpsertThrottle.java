package cn.bafuka.geoarmor.core;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.concurrent.CompletableFuture;

/**
 * 回写节流记录
 * 同一个 key 在节流间隔内最多回写一次
 */
@Data
@AllArgsConstructor
public class UpsertThrottle {

    private String key;

    /**
     * 最近一次回写尝试的时间
     */
    private long lastAttemptAt;

    /**
     * 进行中的回写，没有时为 null
     */
    private CompletableFuture<Void> pendingFuture;

    public boolean isPending() {
        return pendingFuture != null;
    }

    public boolean isThrottled(long nowMillis, long intervalMs) {
        return nowMillis - lastAttemptAt < intervalMs;
    }
}
