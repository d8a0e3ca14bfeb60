package cn.bafuka.geoarmor.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 本地缓存条目
 * 只为非空的位置值创建，空结果从不落盘，保证下次可以重试
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    /**
     * 用户名
     */
    private String key;

    /**
     * 位置字符串
     */
    private String value;

    /**
     * 写入时间（毫秒时间戳）
     */
    private long cachedAt;

    /**
     * 过期时间（毫秒时间戳）
     */
    private long expiresAt;

    /**
     * 是否已过期
     *
     * @param nowMillis 当前时间
     * @return expiresAt <= now 时返回 true
     */
    public boolean isExpired(long nowMillis) {
        return expiresAt <= nowMillis;
    }

    /**
     * 条目是否可用（有值且未过期）
     *
     * @param nowMillis 当前时间
     * @return 可用返回 true
     */
    public boolean isUsable(long nowMillis) {
        return value != null && !isExpired(nowMillis);
    }
}
