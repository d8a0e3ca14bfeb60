package cn.bafuka.geoarmor.core;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.concurrent.CompletableFuture;

/**
 * 远程缓存查询备忘
 * 记录最近一次查询结果（可以为空值）以及进行中的请求
 */
@Data
@AllArgsConstructor
public class LookupMemo {

    private String key;

    /**
     * 最近一次查询完成的时间
     */
    private long checkedAt;

    /**
     * 查询到的值，空值也会在 TTL 窗口内被记住
     */
    private String value;

    /**
     * 进行中的查询，没有时为 null
     */
    private CompletableFuture<String> pendingFuture;

    public boolean isPending() {
        return pendingFuture != null;
    }

    public boolean isFresh(long nowMillis, long ttlMs) {
        return nowMillis - checkedAt < ttlMs;
    }
}
