package cn.bafuka.geoarmor.core;

import com.alibaba.fastjson.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 远程调用的统一响应
 * 传输层从不抛异常，失败一律表现为 ok=false
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransportResponse {

    private boolean ok;

    /**
     * HTTP 状态码，网络失败时为 0
     */
    private int status;

    /**
     * 响应体，非 JSON 或为空时为 null
     */
    private JSONObject data;

    /**
     * 失败描述
     */
    private String error;

    public static TransportResponse failure(int status, String error) {
        return new TransportResponse(false, status, null, error);
    }
}
