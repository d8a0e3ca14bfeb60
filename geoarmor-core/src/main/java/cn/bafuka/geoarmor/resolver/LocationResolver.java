package cn.bafuka.geoarmor.resolver;

import cn.bafuka.geoarmor.core.ResolveStats;

import java.util.concurrent.CompletableFuture;

/**
 * 位置解析器
 * 唯一对外入口：本地缓存 -> 共享远程缓存 -> 限流上游
 */
public interface LocationResolver {

    /**
     * 解析用户名对应的位置
     * 返回的 future 总会完成且从不异常完成，未找到时结果为 null
     *
     * @param key 用户名
     * @return 位置值
     */
    CompletableFuture<String> resolve(String key);

    /**
     * 获取解析统计信息
     *
     * @return 统计快照
     */
    ResolveStats getStats();
}
