package cn.bafuka.geoarmor.consistency;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 限流广播消息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 恢复时间（毫秒时间戳），0 表示清除限流
     */
    private long resumeAt;

    /**
     * 发送节点标识
     */
    private String source;
}
