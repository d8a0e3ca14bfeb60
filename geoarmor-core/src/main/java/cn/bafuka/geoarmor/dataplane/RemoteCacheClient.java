package cn.bafuka.geoarmor.dataplane;

import java.util.concurrent.CompletableFuture;

/**
 * 共享远程缓存客户端接口
 * 查询带短 TTL 备忘和进行中请求去重，回写带节流
 */
public interface RemoteCacheClient {

    /**
     * 查询远程缓存（不强制）
     *
     * @param key 用户名
     * @return 位置值，未命中为 null
     */
    default CompletableFuture<String> lookup(String key) {
        return lookup(key, false);
    }

    /**
     * 查询远程缓存
     * 有进行中的查询时无论 force 与否都直接加入；非强制且备忘未过期时不发请求
     *
     * @param key   用户名
     * @param force 是否忽略备忘
     * @return 位置值，未命中为 null
     */
    CompletableFuture<String> lookup(String key, boolean force);

    /**
     * 回写远程缓存（尽力而为，失败只记日志）
     * 值不在词表内时直接跳过
     *
     * @param key   用户名
     * @param value 位置值
     * @return 回写完成（从不异常完成）
     */
    CompletableFuture<Void> upsert(String key, String value);

    /**
     * 带节流和去重的回写
     *
     * @param key   用户名
     * @param value 位置值
     * @return 回写完成（从不异常完成）
     */
    CompletableFuture<Void> ensureUpsert(String key, String value);
}
