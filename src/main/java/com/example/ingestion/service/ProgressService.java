package com.example.ingestion.service;

import com.example.ingestion.dto.ProgressResponse;
import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.entity.ProgressRecordEntity;
import com.example.ingestion.exception.ProgressNotFoundException;
import com.example.ingestion.model.ProgressStage;
import com.example.ingestion.model.ProgressStatus;
import com.example.ingestion.model.ProgressUpdate;
import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.repository.IngestionTaskRepository;
import com.example.ingestion.repository.ProgressRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 摄取进度服务
 * 
 * <p>进度记录是任务状态对外唯一可见的形式，客户端只轮询这里，不直接查询任务表。
 * 规则：
 * <ul>
 *   <li>处理中（IN_PROGRESS）的进度百分比只增不减</li>
 *   <li>阶段在同一文件内只能前进，切换到后一个文件时重新开始阶段循环</li>
 *   <li>终态（COMPLETED、FAILED）只能通过 markCompleted / markFailed 写入，写入后不再接受更新</li>
 * </ul>
 * </p>
 */
@Service
public class ProgressService {

    private static final Logger logger = LoggerFactory.getLogger(ProgressService.class);

    private final ProgressRecordRepository progressRepository;
    private final IngestionTaskRepository taskRepository;
    private final Clock clock;
    private final Optional<ProgressSnapshotCache> snapshotCache;

    public ProgressService(ProgressRecordRepository progressRepository,
                           IngestionTaskRepository taskRepository,
                           Clock clock,
                           Optional<ProgressSnapshotCache> snapshotCache) {
        this.progressRepository = progressRepository;
        this.taskRepository = taskRepository;
        this.clock = clock;
        this.snapshotCache = snapshotCache;
    }

    /**
     * 为新入队的任务创建进度记录
     * 
     * <p>每个主体只保留一条记录，已有记录会被重置并关联到新任务。
     * </p>
     */
    @Transactional
    public ProgressRecordEntity create(String subjectId, String resourceId, String taskId,
                                       int totalFiles, Integer queuePosition) {
        ProgressRecordEntity record = progressRepository.findBySubjectId(subjectId).orElse(null);
        if (record == null) {
            record = new ProgressRecordEntity();
            record.setId(UUID.randomUUID().toString());
            record.setSubjectId(subjectId);
        } else if (!record.getStatus().isTerminal() && !Objects.equals(record.getTaskId(), taskId)) {
            logger.warn("Replacing unfinished progress record of subject {} (task {} -> {})",
                    subjectId, record.getTaskId(), taskId);
        }

        record.setTaskId(taskId);
        record.setResourceId(resourceId);
        record.setStage(ProgressStage.QUEUED);
        record.setStatus(ProgressStatus.PENDING);
        record.setQueuePosition(queuePosition);
        record.setTotalFiles(totalFiles);
        resetCounters(record);
        record.setProgressPercentage(0.0);
        record.setDetails(new LinkedHashMap<>());
        record.setProcessingMetadata(null);
        record.setErrorMessage(null);
        record.setStartedAt(null);
        record.setCompletedAt(null);
        record.setUpdatedAt(now());

        ProgressRecordEntity saved = progressRepository.save(record);
        logger.info("Created progress record for subject {} with {} files, task {}", subjectId, totalFiles, taskId);
        cache(saved);
        return saved;
    }

    /**
     * 部分更新进度
     * 
     * @return 是否应用了更新；记录不存在或已处于终态时返回false
     * @throws IllegalArgumentException 试图通过update写入终态阶段
     */
    @Transactional
    public boolean update(String subjectId, ProgressUpdate update) {
        ProgressStage requested = update.getStage();
        if (requested != null && requested.isTerminal()) {
            throw new IllegalArgumentException("Stage " + requested + " can only be set by markCompleted/markFailed");
        }

        Optional<ProgressRecordEntity> found = progressRepository.findBySubjectId(subjectId);
        if (found.isEmpty()) {
            logger.warn("No progress record found for subject {}", subjectId);
            return false;
        }
        ProgressRecordEntity record = found.get();
        if (record.getStatus().isTerminal()) {
            logger.debug("Ignoring progress update for finished subject {}: {}", subjectId, update);
            return false;
        }

        boolean nextFile = update.getCurrentFileIndex() != null
                && update.getCurrentFileIndex() > record.getCurrentFileIndex();

        if (update.getCurrentFile() != null) {
            record.setCurrentFile(update.getCurrentFile());
        }
        if (update.getCurrentFileIndex() != null) {
            record.setCurrentFileIndex(update.getCurrentFileIndex());
        }
        if (update.getTotalFiles() != null) {
            record.setTotalFiles(update.getTotalFiles());
        }
        if (update.getCurrentBatch() != null) {
            record.setCurrentBatch(update.getCurrentBatch());
        }
        if (update.getTotalBatches() != null) {
            record.setTotalBatches(update.getTotalBatches());
        }
        if (update.getCurrentChunk() != null) {
            record.setCurrentChunk(update.getCurrentChunk());
        }
        if (update.getTotalChunks() != null) {
            record.setTotalChunks(update.getTotalChunks());
        }
        if (update.getProcessedFiles() != null) {
            record.setProcessedFiles(update.getProcessedFiles());
        }
        if (update.getFailedFiles() != null) {
            record.setFailedFiles(update.getFailedFiles());
        }

        if (requested != null) {
            if (nextFile || !requested.isBefore(record.getStage())) {
                record.setStage(requested);
            } else {
                logger.debug("Ignoring stage regression {} -> {} for subject {}", record.getStage(), requested, subjectId);
            }
        }

        if (record.getStatus() == ProgressStatus.PENDING) {
            record.setStatus(ProgressStatus.IN_PROGRESS);
            record.setQueuePosition(null);
            if (record.getStartedAt() == null) {
                record.setStartedAt(now());
            }
        }

        double candidate = update.getProgressPercentage() != null
                ? ProgressCalculator.clamp(update.getProgressPercentage())
                : ProgressCalculator.overallPercentage(record.getStage(), record.getCurrentFileIndex(),
                        record.getTotalFiles(), record.getCurrentChunk(), record.getTotalChunks());
        record.setProgressPercentage(Math.max(record.getProgressPercentage(), candidate));

        if (update.getDetails() != null) {
            record.setDetails(merge(record.getDetails(), update.getDetails()));
        }
        record.setUpdatedAt(now());

        ProgressRecordEntity saved = progressRepository.save(record);
        logger.debug("Updated progress for subject {}: {} -> {}%", subjectId, update, saved.getProgressPercentage());
        cache(saved);
        return true;
    }

    /**
     * Worker认领任务后调用：进入FILE_PROCESSING / IN_PROGRESS
     */
    @Transactional
    public boolean markStarted(String subjectId) {
        Optional<ProgressRecordEntity> found = progressRepository.findBySubjectId(subjectId);
        if (found.isEmpty()) {
            logger.warn("No progress record found for subject {}", subjectId);
            return false;
        }
        ProgressRecordEntity record = found.get();
        if (record.getStatus().isTerminal()) {
            logger.warn("Progress record of subject {} is already {}, not restarting", subjectId, record.getStatus());
            return false;
        }

        record.setStatus(ProgressStatus.IN_PROGRESS);
        record.setStage(ProgressStage.FILE_PROCESSING);
        record.setQueuePosition(null);
        record.setStartedAt(now());
        record.setUpdatedAt(now());

        cache(progressRepository.save(record));
        logger.info("Processing started for subject {}", subjectId);
        return true;
    }

    /**
     * 任务失败后重新入队：进度回到QUEUED / PENDING，保留上一次的错误信息
     */
    @Transactional
    public boolean markRequeued(String subjectId, Integer queuePosition, String lastError) {
        Optional<ProgressRecordEntity> found = progressRepository.findBySubjectId(subjectId);
        if (found.isEmpty()) {
            logger.warn("No progress record found for subject {}", subjectId);
            return false;
        }
        ProgressRecordEntity record = found.get();
        if (record.getStatus().isTerminal()) {
            logger.warn("Progress record of subject {} is already {}, not requeueing", subjectId, record.getStatus());
            return false;
        }

        record.setStatus(ProgressStatus.PENDING);
        record.setStage(ProgressStage.QUEUED);
        record.setQueuePosition(queuePosition);
        resetCounters(record);
        record.setProgressPercentage(0.0);
        record.setErrorMessage(lastError);
        record.setUpdatedAt(now());

        cache(progressRepository.save(record));
        logger.info("Progress of subject {} returned to queue at position {}", subjectId, queuePosition);
        return true;
    }

    @Transactional
    public boolean markCompleted(String subjectId, Map<String, Object> metadata) {
        Optional<ProgressRecordEntity> found = progressRepository.findBySubjectId(subjectId);
        if (found.isEmpty()) {
            logger.warn("No progress record found for subject {}", subjectId);
            return false;
        }
        ProgressRecordEntity record = found.get();
        if (record.getStatus().isTerminal()) {
            logger.warn("Progress record of subject {} is already {}", subjectId, record.getStatus());
            return false;
        }

        LocalDateTime now = now();
        record.setStatus(ProgressStatus.COMPLETED);
        record.setStage(ProgressStage.COMPLETE);
        record.setProgressPercentage(100.0);
        record.setQueuePosition(null);
        record.setErrorMessage(null);
        record.setCompletedAt(now);
        record.setUpdatedAt(now);
        if (metadata != null) {
            record.setProcessingMetadata(merge(record.getProcessingMetadata(), metadata));
        }

        progressRepository.save(record);
        evict(subjectId);
        logger.info("Marked processing as completed for subject {}", subjectId);
        return true;
    }

    @Transactional
    public boolean markFailed(String subjectId, String errorMessage, Map<String, Object> metadata) {
        Optional<ProgressRecordEntity> found = progressRepository.findBySubjectId(subjectId);
        if (found.isEmpty()) {
            logger.warn("No progress record found for subject {}", subjectId);
            return false;
        }
        ProgressRecordEntity record = found.get();
        if (record.getStatus().isTerminal()) {
            logger.warn("Progress record of subject {} is already {}", subjectId, record.getStatus());
            return false;
        }

        LocalDateTime now = now();
        record.setStatus(ProgressStatus.FAILED);
        record.setStage(ProgressStage.FAILED);
        record.setQueuePosition(null);
        record.setErrorMessage(errorMessage);
        record.setCompletedAt(now);
        record.setUpdatedAt(now);
        if (metadata != null) {
            record.setProcessingMetadata(merge(record.getProcessingMetadata(), metadata));
        }

        progressRepository.save(record);
        evict(subjectId);
        logger.error("Marked processing as failed for subject {}: {}", subjectId, errorMessage);
        return true;
    }

    /**
     * 查询主体的进度
     * 
     * <p>优先读取Redis快照；排队中的记录在返回值里换上任务表中的当前排队位置。
     * 只读，不回写进度记录，Worker同时写入的进度不会被覆盖。
     * </p>
     */
    @Transactional(readOnly = true)
    public Optional<ProgressResponse> get(String subjectId) {
        if (snapshotCache.isPresent()) {
            Optional<ProgressResponse> cached = snapshotCache.get().get(subjectId);
            if (cached.isPresent() && cached.get().stage() != ProgressStage.QUEUED) {
                return cached;
            }
        }

        Optional<ProgressRecordEntity> found = progressRepository.findBySubjectId(subjectId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ProgressRecordEntity record = found.get();
        ProgressResponse fromRecord = ProgressResponse.from(record);

        if (record.getStage() == ProgressStage.QUEUED && record.getTaskId() != null) {
            Optional<IngestionTaskEntity> task = taskRepository.findById(record.getTaskId());
            if (task.isPresent() && task.get().getStatus() == TaskStatus.QUEUED
                    && !Objects.equals(task.get().getQueuePosition(), record.getQueuePosition())) {
                fromRecord = fromRecord.withQueuePosition(task.get().getQueuePosition());
            }
        }

        ProgressResponse response = fromRecord;
        if (!response.isTerminal()) {
            snapshotCache.ifPresent(cache -> cache.put(response));
        }
        return Optional.of(response);
    }

    @Transactional(readOnly = true)
    public List<ProgressResponse> listActive() {
        return progressRepository
                .findByStatusInOrderByUpdatedAtDesc(EnumSet.of(ProgressStatus.PENDING, ProgressStatus.IN_PROGRESS))
                .stream()
                .map(ProgressResponse::from)
                .toList();
    }

    /**
     * 删除进度记录，仅允许删除已结束的记录
     * 
     * @throws ProgressNotFoundException 记录不存在
     * @throws IllegalStateException 记录仍处于PENDING或IN_PROGRESS
     */
    @Transactional
    public void delete(String subjectId) {
        ProgressRecordEntity record = progressRepository.findBySubjectId(subjectId)
                .orElseThrow(() -> new ProgressNotFoundException(subjectId));
        if (!record.getStatus().isTerminal()) {
            throw new IllegalStateException("Progress of subject " + subjectId + " is still " + record.getStatus());
        }
        progressRepository.delete(record);
        evict(subjectId);
        logger.info("Deleted progress record for subject {}", subjectId);
    }

    private void resetCounters(ProgressRecordEntity record) {
        record.setCurrentFile(null);
        record.setCurrentFileIndex(0);
        record.setCurrentBatch(0);
        record.setTotalBatches(0);
        record.setCurrentChunk(0);
        record.setTotalChunks(0);
        record.setProcessedFiles(0);
        record.setFailedFiles(0);
    }

    private Map<String, Object> merge(Map<String, Object> current, Map<String, Object> additions) {
        Map<String, Object> merged = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
        merged.putAll(additions);
        return merged;
    }

    private void cache(ProgressRecordEntity record) {
        snapshotCache.ifPresent(cache -> cache.put(ProgressResponse.from(record)));
    }

    private void evict(String subjectId) {
        snapshotCache.ifPresent(cache -> cache.evict(subjectId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
