package com.example.ingestion.dto;

import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.TaskStatus;

import java.time.LocalDateTime;

/**
 * 队列中任务的概要信息
 */
public record QueuedTaskResponse(
        String taskId,
        String subjectId,
        String resourceId,
        TaskStatus status,
        int priority,
        Integer queuePosition,
        int retryCount,
        int maxRetries,
        String errorMessage,
        LocalDateTime queuedAt,
        LocalDateTime availableAt
) {

    public static QueuedTaskResponse from(IngestionTaskEntity task) {
        return new QueuedTaskResponse(
                task.getId(),
                task.getSubjectId(),
                task.getResourceId(),
                task.getStatus(),
                task.getPriority(),
                task.getQueuePosition(),
                task.getRetryCount(),
                task.getMaxRetries(),
                task.getErrorMessage(),
                task.getQueuedAt(),
                task.getAvailableAt()
        );
    }
}
