package com.example.ingestion.config;

import com.example.ingestion.pipeline.IngestionPipeline;
import com.example.ingestion.pipeline.UnconfiguredIngestionPipeline;
import com.example.ingestion.service.ProgressService;
import com.example.ingestion.service.QueueService;
import com.example.ingestion.worker.QueueWorker;
import com.example.ingestion.worker.QueueWorkerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Worker装配
 * 
 * <p>Worker本身是普通对象，由这里创建并交给 {@link QueueWorkerLifecycle} 管理启动和停止。
 * 容器中没有 {@link IngestionPipeline} 实现时使用占位实现，所有任务都会以不可重试错误失败。
 * </p>
 */
@Configuration
public class WorkerLifecycleConfig {

    private static final Logger logger = LoggerFactory.getLogger(WorkerLifecycleConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public QueueWorker queueWorker(QueueService queueService,
                                   ProgressService progressService,
                                   ObjectProvider<IngestionPipeline> pipelineProvider,
                                   WorkerConfig workerConfig) {
        IngestionPipeline pipeline = pipelineProvider.getIfAvailable(() -> {
            logger.warn("No IngestionPipeline bean found, every ingestion task will fail");
            return new UnconfiguredIngestionPipeline();
        });
        return new QueueWorker(queueService, progressService, pipeline, workerConfig);
    }

    @Bean
    public QueueWorkerLifecycle queueWorkerLifecycle(QueueWorker queueWorker, WorkerConfig workerConfig) {
        return new QueueWorkerLifecycle(queueWorker, workerConfig);
    }
}
