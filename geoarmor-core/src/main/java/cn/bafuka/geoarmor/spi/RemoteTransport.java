package cn.bafuka.geoarmor.spi;

import cn.bafuka.geoarmor.core.TransportResponse;

import java.util.concurrent.CompletableFuture;

/**
 * 远程缓存传输层 SPI
 * 实现必须带固定超时，且从不抛出异常：任何失败都以 ok=false 的响应返回
 */
public interface RemoteTransport {

    /**
     * 发起一次调用
     *
     * @param path   请求路径（含查询串）
     * @param method HTTP 方法
     * @param body   请求体，GET 时为 null
     * @return 响应
     */
    CompletableFuture<TransportResponse> call(String path, String method, Object body);
}
