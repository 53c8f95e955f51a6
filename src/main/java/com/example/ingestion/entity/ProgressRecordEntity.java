package com.example.ingestion.entity;

import com.example.ingestion.model.ProgressStage;
import com.example.ingestion.model.ProgressStatus;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 摄取进度记录实体
 * 
 * <p>每个主体最多一条记录，保存最近一次任务的细粒度进度，供界面轮询。
 * </p>
 */
@Entity
@Table(name = "ingestion_progress",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_ingestion_progress_subject", columnNames = "subject_id"),
        indexes = @Index(name = "idx_ingestion_progress_status", columnList = "status"))
public class ProgressRecordEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    @Column(name = "task_id", length = 36)
    private String taskId;

    @Column(name = "resource_id", length = 128)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ProgressStage stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProgressStatus status;

    @Column(name = "queue_position")
    private Integer queuePosition;

    @Column(name = "current_file", length = 512)
    private String currentFile;

    @Column(name = "current_file_index", nullable = false)
    private int currentFileIndex;

    @Column(name = "total_files", nullable = false)
    private int totalFiles;

    @Column(name = "current_batch", nullable = false)
    private int currentBatch;

    @Column(name = "total_batches", nullable = false)
    private int totalBatches;

    @Column(name = "current_chunk", nullable = false)
    private int currentChunk;

    @Column(name = "total_chunks", nullable = false)
    private int totalChunks;

    @Column(name = "processed_files", nullable = false)
    private int processedFiles;

    @Column(name = "failed_files", nullable = false)
    private int failedFiles;

    /**
     * 0到100之间；处理中单调不减
     */
    @Column(name = "progress_percentage", nullable = false)
    private double progressPercentage;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> details;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "processing_metadata", columnDefinition = "TEXT")
    private Map<String, Object> processingMetadata;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public ProgressRecordEntity() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public ProgressStage getStage() {
        return stage;
    }

    public void setStage(ProgressStage stage) {
        this.stage = stage;
    }

    public ProgressStatus getStatus() {
        return status;
    }

    public void setStatus(ProgressStatus status) {
        this.status = status;
    }

    public Integer getQueuePosition() {
        return queuePosition;
    }

    public void setQueuePosition(Integer queuePosition) {
        this.queuePosition = queuePosition;
    }

    public String getCurrentFile() {
        return currentFile;
    }

    public void setCurrentFile(String currentFile) {
        this.currentFile = currentFile;
    }

    public int getCurrentFileIndex() {
        return currentFileIndex;
    }

    public void setCurrentFileIndex(int currentFileIndex) {
        this.currentFileIndex = currentFileIndex;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public void setTotalFiles(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    public int getCurrentBatch() {
        return currentBatch;
    }

    public void setCurrentBatch(int currentBatch) {
        this.currentBatch = currentBatch;
    }

    public int getTotalBatches() {
        return totalBatches;
    }

    public void setTotalBatches(int totalBatches) {
        this.totalBatches = totalBatches;
    }

    public int getCurrentChunk() {
        return currentChunk;
    }

    public void setCurrentChunk(int currentChunk) {
        this.currentChunk = currentChunk;
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    public void setTotalChunks(int totalChunks) {
        this.totalChunks = totalChunks;
    }

    public int getProcessedFiles() {
        return processedFiles;
    }

    public void setProcessedFiles(int processedFiles) {
        this.processedFiles = processedFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public void setFailedFiles(int failedFiles) {
        this.failedFiles = failedFiles;
    }

    public double getProgressPercentage() {
        return progressPercentage;
    }

    public void setProgressPercentage(double progressPercentage) {
        this.progressPercentage = progressPercentage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }

    public Map<String, Object> getProcessingMetadata() {
        return processingMetadata;
    }

    public void setProcessingMetadata(Map<String, Object> processingMetadata) {
        this.processingMetadata = processingMetadata;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }
}
