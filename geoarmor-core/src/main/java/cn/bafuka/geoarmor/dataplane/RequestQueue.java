package cn.bafuka.geoarmor.dataplane;

import cn.bafuka.geoarmor.core.FetchResult;

import java.util.concurrent.CompletableFuture;

/**
 * 上游请求队列接口
 * FIFO 派发，限制并发数和派发间隔，受全局限流窗口控制
 */
public interface RequestQueue {

    /**
     * 入队
     *
     * @param key 用户名
     * @return 查询结果；超时时 timedOut=true，限流时 rateLimited=true
     */
    CompletableFuture<FetchResult> enqueue(String key);

    /**
     * 等待派发的请求数
     */
    int pendingCount();

    /**
     * 正在执行的上游请求数
     */
    int activeCount();

    /**
     * 关闭队列，尚未派发的请求以空结果结算
     */
    void shutdown();
}
