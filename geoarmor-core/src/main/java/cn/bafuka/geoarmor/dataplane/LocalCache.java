package cn.bafuka.geoarmor.dataplane;

import java.util.concurrent.CompletableFuture;

/**
 * 本地持久缓存接口
 * 带逐条过期时间的 key -> value 存储，从不保存空值
 */
public interface LocalCache {

    /**
     * 获取缓存值
     *
     * @param key 用户名
     * @return 缓存值，不存在或已过期返回 null
     */
    String get(String key);

    /**
     * 写入缓存，覆盖已有条目，过期时间为 now + 保留时长
     *
     * @param key   用户名
     * @param value 位置值，必须非空
     */
    void put(String key, String value);

    /**
     * 删除缓存条目
     *
     * @param key 用户名
     */
    void invalidate(String key);

    /**
     * 从持久化存储导入，丢弃已过期或值为空的条目
     *
     * @return 导入的条目数，存储不可用时为 0
     */
    CompletableFuture<Integer> load();

    /**
     * 导出到持久化存储，存储不可用时降级为空操作
     *
     * @return 导出完成（从不异常完成）
     */
    CompletableFuture<Void> flush();

    /**
     * 当前条目数
     */
    long size();

    /**
     * 关闭：取消待执行的合并落盘，并做最后一次落盘
     */
    void shutdown();
}
