package com.example.ingestion.service;

import com.example.ingestion.config.ProgressCacheConfig;
import com.example.ingestion.dto.ProgressResponse;
import com.example.ingestion.model.ProgressStage;
import com.example.ingestion.model.ProgressStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressSnapshotCacheTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private ProgressSnapshotCache cache;

    @BeforeEach
    void setUp() {
        ProgressCacheConfig config = new ProgressCacheConfig();
        config.setTtlHours(6);
        cache = new ProgressSnapshotCache(redisTemplate, objectMapper, config);
    }

    @Test
    void putWritesJsonWithTtl() throws Exception {
        // given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        ProgressResponse snapshot = snapshot();

        // when
        cache.put(snapshot);

        // then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("ingestion:progress:subject-1"), json.capture(), eq(Duration.ofHours(6)));
        assertThat(objectMapper.readValue(json.getValue(), ProgressResponse.class)).isEqualTo(snapshot);
    }

    @Test
    void getReadsSnapshot() throws Exception {
        // given
        ProgressResponse snapshot = snapshot();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("ingestion:progress:subject-1")).thenReturn(objectMapper.writeValueAsString(snapshot));

        // when
        Optional<ProgressResponse> cached = cache.get("subject-1");

        // then
        assertThat(cached).contains(snapshot);
    }

    @Test
    void unreadableSnapshotIsEvicted() {
        // given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn("{not json");

        // when
        Optional<ProgressResponse> cached = cache.get("subject-1");

        // then
        assertThat(cached).isEmpty();
        verify(redisTemplate).delete("ingestion:progress:subject-1");
    }

    @Test
    void redisFailureDegradesToMiss() {
        // given
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("connection refused"));

        // when / then
        assertThat(cache.get("subject-1")).isEmpty();
    }

    private static ProgressResponse snapshot() {
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 12, 0);
        return new ProgressResponse("subject-1", "task-1", "agent-1", ProgressStage.EMBEDDING,
                ProgressStatus.IN_PROGRESS, null, "file-1", 0, 2, 1, 4, 10, 40, 0, 0, 27.5,
                Map.of("last_completed_file", "file-0"), Map.of(), null, now, now, null);
    }
}
