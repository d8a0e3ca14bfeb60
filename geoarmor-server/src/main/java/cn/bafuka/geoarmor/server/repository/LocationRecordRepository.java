package cn.bafuka.geoarmor.server.repository;

import cn.bafuka.geoarmor.server.config.LocationServerProperties;
import cn.bafuka.geoarmor.server.model.LocationRecord;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.concurrent.TimeUnit;

/**
 * 位置记录存储
 * 每个用户一条 JSON 记录，Redis 过期时间与记录有效期一致
 */
@Slf4j
@Repository
public class LocationRecordRepository {

    private final StringRedisTemplate redisTemplate;

    private final LocationServerProperties properties;

    @Autowired
    public LocationRecordRepository(StringRedisTemplate redisTemplate, LocationServerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    /**
     * 查询记录
     *
     * @param username 小写用户名
     * @return 记录，不存在或格式错误返回 null
     */
    public LocationRecord find(String username) {
        String json = redisTemplate.opsForValue().get(getRedisKey(username));
        if (json == null) {
            return null;
        }
        try {
            return JSON.parseObject(json, LocationRecord.class);
        } catch (JSONException e) {
            log.warn("位置记录格式错误，按不存在处理: username={}, error={}", username, e.getMessage());
            return null;
        }
    }

    /**
     * 写入或覆盖记录
     */
    public void save(LocationRecord record) {
        redisTemplate.opsForValue().set(getRedisKey(record.getUsername()), JSON.toJSONString(record),
                properties.getCacheTtlDays(), TimeUnit.DAYS);
        log.debug("位置记录已保存: username={}, location={}", record.getUsername(), record.getLocation());
    }

    /**
     * 检查 Redis 是否可用
     */
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("Redis 健康检查失败: error={}", e.getMessage());
            return false;
        }
    }

    public String getRedisKey(String username) {
        return properties.getKeyPrefix() + username;
    }
}
