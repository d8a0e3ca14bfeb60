package cn.bafuka.geoarmor.server.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 位置记录
 * 以 JSON 形式存放在 Redis 中，键为小写用户名
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 小写用户名
     */
    private String username;

    /**
     * 标准国家名，未找到为 null
     */
    private String location;

    /**
     * 获取时间（毫秒时间戳）
     */
    private long fetchedAt;

    public boolean isFresh(long now, long ttlMs) {
        return now - fetchedAt < ttlMs;
    }
}
