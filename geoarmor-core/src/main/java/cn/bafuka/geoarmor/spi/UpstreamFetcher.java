package cn.bafuka.geoarmor.spi;

import cn.bafuka.geoarmor.core.FetchResult;

import java.util.concurrent.CompletableFuture;

/**
 * 上游（权威数据源）查询 SPI
 * 由使用方提供，每次队列派发调用一次
 */
public interface UpstreamFetcher {

    /**
     * 查询用户位置
     *
     * @param key 用户名
     * @return 查询结果；上游限流时返回 rateLimited=true，可附带 resumeAt
     */
    CompletableFuture<FetchResult> fetch(String key);
}
