package cn.bafuka.geoarmor.server.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Collections;
import java.util.Map;

/**
 * 统一错误响应：{"detail": "..."}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LocationServiceException.class)
    public ResponseEntity<Map<String, Object>> handleLocationServiceException(LocationServiceException e) {
        log.debug("请求处理失败: status={}, detail={}", e.getStatus().value(), e.getMessage());
        return detail(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessException(DataAccessException e) {
        log.error("Redis 访问失败", e);
        return detail(HttpStatus.SERVICE_UNAVAILABLE, "database unavailable");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return detail(HttpStatus.UNPROCESSABLE_ENTITY, "invalid request body");
    }

    static ResponseEntity<Map<String, Object>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Collections.singletonMap("detail", message));
    }
}
