package cn.bafuka.geoarmor.exception;

/**
 * GeoArmor 异常
 * 各组件在边界处吸收该异常，resolve 永远不会因此失败
 *
 * @author GeoArmor Team
 * @since 1.0
 */
public class GeoArmorException extends RuntimeException {

    /**
     * 失败原因
     */
    private final FailureReason reason;

    public GeoArmorException(String message, FailureReason reason) {
        super(message);
        this.reason = reason;
    }

    public GeoArmorException(String message, Throwable cause, FailureReason reason) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * 失败原因枚举
     */
    public enum FailureReason {
        /**
         * 网络错误，按未命中处理
         */
        NETWORK_FAILURE("网络错误"),

        /**
         * 上游限流
         */
        RATE_LIMITED("上游限流"),

        /**
         * 本地超时
         */
        TIMEOUT("超时"),

        /**
         * 值不在词表内
         */
        UNRECOGNIZED_VALUE("无法识别的值"),

        /**
         * 持久化存储不可用
         */
        STORAGE_UNAVAILABLE("存储不可用"),

        /**
         * 未知错误
         */
        UNKNOWN("未知错误");

        private final String description;

        FailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "GeoArmorException{" +
                "reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
