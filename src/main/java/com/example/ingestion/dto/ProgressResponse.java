package com.example.ingestion.dto;

import com.example.ingestion.entity.ProgressRecordEntity;
import com.example.ingestion.model.ProgressStage;
import com.example.ingestion.model.ProgressStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 进度查询的响应DTO，也是Redis中进度快照的JSON结构
 */
public record ProgressResponse(
        String subjectId,
        String taskId,
        String resourceId,
        ProgressStage stage,
        ProgressStatus status,
        Integer queuePosition,
        String currentFile,
        int currentFileIndex,
        int totalFiles,
        int currentBatch,
        int totalBatches,
        int currentChunk,
        int totalChunks,
        int processedFiles,
        int failedFiles,
        double progressPercentage,
        Map<String, Object> details,
        Map<String, Object> processingMetadata,
        String errorMessage,
        LocalDateTime startedAt,
        LocalDateTime updatedAt,
        LocalDateTime completedAt
) {

    public static ProgressResponse from(ProgressRecordEntity entity) {
        return new ProgressResponse(
                entity.getSubjectId(),
                entity.getTaskId(),
                entity.getResourceId(),
                entity.getStage(),
                entity.getStatus(),
                entity.getQueuePosition(),
                entity.getCurrentFile(),
                entity.getCurrentFileIndex(),
                entity.getTotalFiles(),
                entity.getCurrentBatch(),
                entity.getTotalBatches(),
                entity.getCurrentChunk(),
                entity.getTotalChunks(),
                entity.getProcessedFiles(),
                entity.getFailedFiles(),
                entity.getProgressPercentage(),
                entity.getDetails() == null ? Map.of() : entity.getDetails(),
                entity.getProcessingMetadata() == null ? Map.of() : entity.getProcessingMetadata(),
                entity.getErrorMessage(),
                entity.getStartedAt(),
                entity.getUpdatedAt(),
                entity.getCompletedAt()
        );
    }

    /**
     * 替换排队位置后的副本
     */
    public ProgressResponse withQueuePosition(Integer position) {
        return new ProgressResponse(subjectId, taskId, resourceId, stage, status, position,
                currentFile, currentFileIndex, totalFiles, currentBatch, totalBatches,
                currentChunk, totalChunks, processedFiles, failedFiles, progressPercentage,
                details, processingMetadata, errorMessage, startedAt, updatedAt, completedAt);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
