package com.example.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 进度快照缓存配置
 * 
 * <p>开启后，进度记录会以JSON快照形式写入Redis，轮询接口优先读取缓存。
 * </p>
 */
@Configuration
@ConfigurationProperties(prefix = "ingestion.progress.cache")
public class ProgressCacheConfig {

    private boolean enabled = false;

    /**
     * 快照过期时间（小时）
     */
    private long ttlHours = 24;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTtlHours() {
        return ttlHours;
    }

    public void setTtlHours(long ttlHours) {
        this.ttlHours = ttlHours;
    }
}
