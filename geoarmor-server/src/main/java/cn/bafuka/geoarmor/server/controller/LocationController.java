package cn.bafuka.geoarmor.server.controller;

import cn.bafuka.geoarmor.server.dto.LocationCreateRequest;
import cn.bafuka.geoarmor.server.model.LocationResult;
import cn.bafuka.geoarmor.server.service.LocationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 共享位置缓存控制器
 */
@Slf4j
@RestController
public class LocationController {

    @Autowired
    private LocationService locationService;

    /**
     * 查询用户位置
     */
    @GetMapping("/check")
    public Map<String, Object> check(@RequestParam(value = "a", required = false) String username) {
        return toResponse(locationService.check(username));
    }

    /**
     * 写入用户位置
     */
    @PostMapping("/add")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> add(@RequestBody LocationCreateRequest request) {
        return toResponse(locationService.add(request.getUsername(), request.getLocation()));
    }

    /**
     * 健康检查
     */
    @GetMapping("/healthcheck")
    public ResponseEntity<Map<String, Object>> healthcheck() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (!locationService.isStorageAvailable()) {
            result.put("detail", "database unavailable");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        result.put("status", "ok");
        result.put("database", "available");
        return ResponseEntity.ok(result);
    }

    private static Map<String, Object> toResponse(LocationResult locationResult) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("username", locationResult.getUsername());
        result.put("location", locationResult.getLocation());
        result.put("cached", locationResult.isCached());
        result.put("last_checked", Instant.ofEpochMilli(locationResult.getLastChecked()).toString());
        result.put("expires_at", Instant.ofEpochMilli(locationResult.getExpiresAt()).toString());
        return result;
    }
}
