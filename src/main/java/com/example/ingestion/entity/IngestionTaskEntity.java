package com.example.ingestion.entity;

import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.model.TaskType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 摄取队列任务实体
 * 
 * <p>一行即一个排队中的工作单元。状态迁移只通过 {@code IngestionTaskRepository}
 * 中带条件的单行更新完成，本实体本身不包含业务逻辑。
 * </p>
 */
@Entity
@Table(name = "ingestion_task",
        indexes = {
                @Index(name = "idx_ingestion_task_status", columnList = "status"),
                @Index(name = "idx_ingestion_task_subject", columnList = "subject_id")
        },
        uniqueConstraints = @UniqueConstraint(
                name = "uk_ingestion_task_active_subject", columnNames = "active_subject_id"))
public class IngestionTaskEntity {

    /**
     * 任务唯一标识符（UUID格式）
     */
    @Id
    @Column(length = 36)
    private String id;

    /**
     * 任务所属主体（例如知识库的拥有者记录）
     */
    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    /**
     * 结果的下游消费方（例如已开通的语音智能体）
     */
    @Column(name = "resource_id", nullable = false, length = 128)
    private String resourceId;

    /**
     * 任务处于非终态时等于subjectId，进入终态后置空；
     * 借助唯一约束保证同一主体最多只有一个活动任务
     */
    @Column(name = "active_subject_id", length = 64)
    private String activeSubjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 32)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    /**
     * 优先级，数值越大越先处理
     */
    @Column(nullable = false)
    private int priority;

    /**
     * 排队位置（1表示下一个），只在QUEUED状态下有意义
     */
    @Column(name = "queue_position")
    private Integer queuePosition;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> payload;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * 排序键：入队时写入，每次重新入队时刷新
     */
    @Column(name = "queued_at", nullable = false)
    private LocalDateTime queuedAt;

    /**
     * 最早可被认领的时间（重试退避）
     */
    @Column(name = "available_at", nullable = false)
    private LocalDateTime availableAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public IngestionTaskEntity() {
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

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public String getActiveSubjectId() {
        return activeSubjectId;
    }

    public void setActiveSubjectId(String activeSubjectId) {
        this.activeSubjectId = activeSubjectId;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public void setTaskType(TaskType taskType) {
        this.taskType = taskType;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Integer getQueuePosition() {
        return queuePosition;
    }

    public void setQueuePosition(Integer queuePosition) {
        this.queuePosition = queuePosition;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public LocalDateTime getQueuedAt() {
        return queuedAt;
    }

    public void setQueuedAt(LocalDateTime queuedAt) {
        this.queuedAt = queuedAt;
    }

    public LocalDateTime getAvailableAt() {
        return availableAt;
    }

    public void setAvailableAt(LocalDateTime availableAt) {
        this.availableAt = availableAt;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
