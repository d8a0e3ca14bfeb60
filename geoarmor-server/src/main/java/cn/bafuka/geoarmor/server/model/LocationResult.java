package cn.bafuka.geoarmor.server.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * /check 与 /add 的返回结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationResult {

    private String username;

    private String location;

    /**
     * 是否来自已有记录
     */
    private boolean cached;

    private long lastChecked;

    private long expiresAt;
}
