package cn.bafuka.geoarmor.spi;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 持久化存储 SPI
 * 本地缓存通过它做整体导入导出；失败以 GeoArmorException(STORAGE_UNAVAILABLE) 的异常 future 表示
 */
public interface DurableStore {

    /**
     * 批量读取
     *
     * @param keys 存储键
     * @return 存在的键值映射，不存在的键不出现在结果中
     */
    CompletableFuture<Map<String, String>> get(Collection<String> keys);

    /**
     * 批量写入（覆盖）
     *
     * @param entries 键值映射
     * @return 写入完成
     */
    CompletableFuture<Void> set(Map<String, String> entries);

    /**
     * 存储类型标识
     *
     * @return 类型名称（如 "file", "redis"）
     */
    String getType();
}
