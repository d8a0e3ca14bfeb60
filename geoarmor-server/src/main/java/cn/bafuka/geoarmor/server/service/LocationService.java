package cn.bafuka.geoarmor.server.service;

import cn.bafuka.geoarmor.server.config.LocationServerProperties;
import cn.bafuka.geoarmor.server.exception.LocationServiceException;
import cn.bafuka.geoarmor.server.model.LocationRecord;
import cn.bafuka.geoarmor.server.model.LocationResult;
import cn.bafuka.geoarmor.server.provider.LocationProvider;
import cn.bafuka.geoarmor.server.repository.LocationRecordRepository;
import cn.bafuka.geoarmor.spi.ValueVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 位置服务
 * <p>
 * 记录按小写用户名存储。/check 遇到缺失或过期的记录时，在分布式锁保护下回源，
 * 回源结果经词表标准化后保存（未找到也保存，避免重复回源）。
 */
@Slf4j
@Service
public class LocationService {

    private final LocationRecordRepository repository;

    private final LocationProvider provider;

    private final ValueVocabulary vocabulary;

    private final RedissonClient redissonClient;

    private final LocationServerProperties properties;

    private final Clock clock;

    @Autowired
    public LocationService(LocationRecordRepository repository,
                           LocationProvider provider,
                           ValueVocabulary vocabulary,
                           RedissonClient redissonClient,
                           LocationServerProperties properties,
                           Clock clock) {
        this.repository = repository;
        this.provider = provider;
        this.vocabulary = vocabulary;
        this.redissonClient = redissonClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 查询用户位置
     *
     * @param rawUsername 用户名，返回结果保留原始大小写
     * @return 查询结果
     */
    public LocationResult check(String rawUsername) {
        String username = requireUsername(rawUsername);
        String normalized = username.toLowerCase(Locale.ROOT);

        // 1. 先查记录
        LocationRecord record = repository.find(normalized);
        if (record != null && record.isFresh(clock.millis(), properties.getCacheTtlMs())) {
            log.debug("位置记录命中: username={}, location={}", normalized, record.getLocation());
            return cached(username, record);
        }

        // 2. 未命中，使用分布式锁防止同一用户并发回源
        RLock lock = redissonClient.getLock(properties.getLockPrefix() + normalized);
        boolean locked;
        try {
            locked = lock.tryLock(properties.getLockWaitTimeMs(), properties.getLockLeaseTimeMs(),
                    TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LocationServiceException(HttpStatus.SERVICE_UNAVAILABLE, "location lookup interrupted", e);
        }

        if (!locked) {
            // 其他请求正在回源，等待超时后再查一次记录，仍没有则直接回源
            record = repository.find(normalized);
            if (record != null && record.isFresh(clock.millis(), properties.getCacheTtlMs())) {
                return cached(username, record);
            }
            log.warn("未获取到回源锁，直接回源: username={}", normalized);
            return fetchAndSave(username, normalized);
        }

        try {
            // Double-Check
            record = repository.find(normalized);
            if (record != null && record.isFresh(clock.millis(), properties.getCacheTtlMs())) {
                log.debug("回源二次检查命中: username={}", normalized);
                return cached(username, record);
            }
            return fetchAndSave(username, normalized);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    /**
     * 写入用户位置
     *
     * @param rawUsername 用户名
     * @param location    位置，可为 null
     * @return 写入结果，location 为提交的原始值
     */
    public LocationResult add(String rawUsername, String location) {
        String username = requireUsername(rawUsername);
        String normalized = username.toLowerCase(Locale.ROOT);

        String canonical = null;
        if (location != null) {
            canonical = vocabulary.canonicalize(location);
            if (canonical == null) {
                throw new LocationServiceException(HttpStatus.UNPROCESSABLE_ENTITY,
                        "location must be one of the allowed country names");
            }
        }

        long now = clock.millis();
        repository.save(new LocationRecord(normalized, canonical, now));
        log.info("位置记录已写入: username={}, location={}", normalized, canonical);
        // 返回客户端提交的原始值，存储的是标准名称
        return fresh(username, location, now);
    }

    /**
     * 存储是否可用
     */
    public boolean isStorageAvailable() {
        return repository.ping();
    }

    private LocationResult fetchAndSave(String username, String normalized) {
        String fetched;
        try {
            fetched = provider.fetchLocation(username);
        } catch (Exception e) {
            log.error("位置回源失败: username={}", username, e);
            throw new LocationServiceException(HttpStatus.BAD_GATEWAY, "location lookup failed", e);
        }

        String canonical = null;
        if (fetched != null) {
            canonical = vocabulary.canonicalize(fetched);
            if (canonical == null) {
                log.warn("回源位置不在国家列表中: username={}, location={}", username, fetched);
                throw new LocationServiceException(HttpStatus.BAD_GATEWAY, "location not in allowed country list");
            }
        }

        long now = clock.millis();
        repository.save(new LocationRecord(normalized, canonical, now));
        log.debug("回源完成: username={}, location={}", normalized, canonical);
        return fresh(username, canonical, now);
    }

    private LocationResult cached(String username, LocationRecord record) {
        return LocationResult.builder()
                .username(username)
                .location(record.getLocation())
                .cached(true)
                .lastChecked(record.getFetchedAt())
                .expiresAt(record.getFetchedAt() + properties.getCacheTtlMs())
                .build();
    }

    private LocationResult fresh(String username, String location, long now) {
        return LocationResult.builder()
                .username(username)
                .location(location)
                .cached(false)
                .lastChecked(now)
                .expiresAt(now + properties.getCacheTtlMs())
                .build();
    }

    private static String requireUsername(String rawUsername) {
        String username = rawUsername != null ? rawUsername.trim() : "";
        if (username.isEmpty()) {
            throw new LocationServiceException(HttpStatus.BAD_REQUEST, "username must not be blank");
        }
        return username;
    }
}
