package com.example.ingestion.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * 任务队列配置
 * 
 * <p>从配置文件读取重试与崩溃恢复相关的参数。
 * </p>
 */
@Configuration
@Validated
@ConfigurationProperties(prefix = "ingestion.queue")
public class QueueConfig {

    /**
     * 新任务的最大重试次数，至少为1
     */
    @Min(1)
    private int defaultMaxRetries = 3;

    /**
     * 失败重新入队后的退避时间（秒），0表示立即可被认领
     */
    @Min(0)
    private long retryBackoffSeconds = 0;

    /**
     * PROCESSING状态超过该时长（分钟）即视为上次进程崩溃遗留的任务
     */
    @Min(1)
    private long staleProcessingTimeoutMinutes = 30;

    /**
     * 每轮认领时读取的候选任务数
     */
    @Min(1)
    private int claimCandidateBatch = 10;

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public long getRetryBackoffSeconds() {
        return retryBackoffSeconds;
    }

    public void setRetryBackoffSeconds(long retryBackoffSeconds) {
        this.retryBackoffSeconds = retryBackoffSeconds;
    }

    public long getStaleProcessingTimeoutMinutes() {
        return staleProcessingTimeoutMinutes;
    }

    public void setStaleProcessingTimeoutMinutes(long staleProcessingTimeoutMinutes) {
        this.staleProcessingTimeoutMinutes = staleProcessingTimeoutMinutes;
    }

    public int getClaimCandidateBatch() {
        return claimCandidateBatch;
    }

    public void setClaimCandidateBatch(int claimCandidateBatch) {
        this.claimCandidateBatch = claimCandidateBatch;
    }
}
