package cn.bafuka.geoarmor.server.dto;

import lombok.Data;

/**
 * POST /add 请求体
 */
@Data
public class LocationCreateRequest {

    private String username;

    /**
     * 可为 null，表示明确记录为未找到
     */
    private String location;
}
