package com.example.ingestion.service;

import com.example.ingestion.config.ProgressCacheConfig;
import com.example.ingestion.config.RedisKeyConstants;
import com.example.ingestion.dto.ProgressResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis进度快照缓存
 * 
 * <p>轮询接口的读路径优先命中这里，未命中时回落到数据库。
 * 缓存只是加速层，Redis不可用时所有操作降级为无操作，不影响任务处理。
 * </p>
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.progress.cache", name = "enabled", havingValue = "true")
public class ProgressSnapshotCache {

    private static final Logger logger = LoggerFactory.getLogger(ProgressSnapshotCache.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final ProgressCacheConfig cacheConfig;

    public ProgressSnapshotCache(RedisTemplate<String, String> redisTemplate,
                                 ObjectMapper objectMapper,
                                 ProgressCacheConfig cacheConfig) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.cacheConfig = cacheConfig;
    }

    public void put(ProgressResponse snapshot) {
        String key = RedisKeyConstants.buildProgressKey(snapshot.subjectId());
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(key, json, Duration.ofHours(cacheConfig.getTtlHours()));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize progress snapshot for subject {}", snapshot.subjectId(), e);
        } catch (DataAccessException e) {
            logger.warn("Failed to write progress snapshot for subject {}: {}", snapshot.subjectId(), e.getMessage());
        }
    }

    public Optional<ProgressResponse> get(String subjectId) {
        String key = RedisKeyConstants.buildProgressKey(subjectId);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ProgressResponse.class));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable progress snapshot for subject {}", subjectId, e);
            evict(subjectId);
            return Optional.empty();
        } catch (DataAccessException e) {
            logger.warn("Failed to read progress snapshot for subject {}: {}", subjectId, e.getMessage());
            return Optional.empty();
        }
    }

    public void evict(String subjectId) {
        try {
            redisTemplate.delete(RedisKeyConstants.buildProgressKey(subjectId));
        } catch (DataAccessException e) {
            logger.warn("Failed to evict progress snapshot for subject {}: {}", subjectId, e.getMessage());
        }
    }
}
