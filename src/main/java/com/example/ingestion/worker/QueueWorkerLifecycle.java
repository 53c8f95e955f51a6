package com.example.ingestion.worker;

import com.example.ingestion.config.WorkerConfig;
import com.example.ingestion.model.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * 把 {@link QueueWorker} 接入Spring容器的生命周期
 * 
 * <p>容器刷新完成后启动Worker，关闭时请求停止并等待当前任务完成。
 * </p>
 */
public class QueueWorkerLifecycle implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(QueueWorkerLifecycle.class);

    private final QueueWorker queueWorker;
    private final WorkerConfig workerConfig;

    public QueueWorkerLifecycle(QueueWorker queueWorker, WorkerConfig workerConfig) {
        this.queueWorker = queueWorker;
        this.workerConfig = workerConfig;
    }

    @Override
    public boolean isAutoStartup() {
        return workerConfig.isAutoStart();
    }

    @Override
    public void start() {
        queueWorker.start();
    }

    @Override
    public void stop() {
        queueWorker.stop();
        Duration timeout = Duration.ofSeconds(workerConfig.getShutdownTimeoutSeconds());
        try {
            queueWorker.awaitTermination(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for queue worker to stop");
        }
    }

    @Override
    public boolean isRunning() {
        return queueWorker.getState() != WorkerState.STOPPED;
    }
}
