package com.example.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 后台Worker配置
 */
@Configuration
@ConfigurationProperties(prefix = "ingestion.worker")
public class WorkerConfig {

    /**
     * 应用启动后是否自动启动Worker
     */
    private boolean autoStart = true;

    /**
     * 队列为空时的轮询间隔（毫秒）
     */
    private long pollIntervalMs = 2000;

    /**
     * 优雅停机时等待当前任务完成的最长时间（秒）
     */
    private long shutdownTimeoutSeconds = 60;

    /**
     * 定期巡检崩溃遗留任务的间隔（毫秒）
     */
    private long recoveryIntervalMs = 300000;

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    public long getRecoveryIntervalMs() {
        return recoveryIntervalMs;
    }

    public void setRecoveryIntervalMs(long recoveryIntervalMs) {
        this.recoveryIntervalMs = recoveryIntervalMs;
    }
}
