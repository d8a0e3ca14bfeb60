package cn.bafuka.geoarmor.server.exception;

import org.springframework.http.HttpStatus;

/**
 * 位置服务异常，携带返回给客户端的 HTTP 状态
 */
public class LocationServiceException extends RuntimeException {

    private final HttpStatus status;

    public LocationServiceException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public LocationServiceException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
