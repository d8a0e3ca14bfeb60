package cn.bafuka.geoarmor.core;

import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * 请求队列中的一项
 * 远程缓存未命中时创建，完成或超时后销毁
 */
@Getter
public class QueueItem {

    private final String key;

    private final long enqueuedAt;

    private final CompletableFuture<FetchResult> resultPromise = new CompletableFuture<>();

    public QueueItem(String key, long enqueuedAt) {
        this.key = key;
        this.enqueuedAt = enqueuedAt;
    }

    /**
     * 结算调用方的结果，只有第一次结算生效
     *
     * @return 本次是否真正完成了结果
     */
    public boolean settle(FetchResult result) {
        return resultPromise.complete(result);
    }
}
