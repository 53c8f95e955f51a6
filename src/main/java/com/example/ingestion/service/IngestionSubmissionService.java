package com.example.ingestion.service;

import com.example.ingestion.dto.CancelTaskResponse;
import com.example.ingestion.dto.SubmitIngestionRequest;
import com.example.ingestion.dto.SubmitIngestionResponse;
import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.IngestionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * 摄取任务提交入口
 * 
 * <p>执行流程：
 * <ol>
 *   <li>校验请求</li>
 *   <li>任务入队（同一主体已有活动任务时拒绝）</li>
 *   <li>创建PENDING状态的进度记录</li>
 *   <li>立即返回taskId和排队位置，不等待任何处理</li>
 * </ol>
 * 入队与创建进度记录在同一个事务中完成。
 * </p>
 */
@Service
public class IngestionSubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionSubmissionService.class);

    static final String CANCELLED_MESSAGE = "Task cancelled before processing";

    private final QueueService queueService;
    private final ProgressService progressService;

    public IngestionSubmissionService(QueueService queueService, ProgressService progressService) {
        this.queueService = queueService;
        this.progressService = progressService;
    }

    @Transactional
    public SubmitIngestionResponse submit(SubmitIngestionRequest request) {
        if (request.selectedFiles() == null) {
            throw new IllegalArgumentException("selectedFiles must not be null");
        }
        for (String file : request.selectedFiles()) {
            if (file == null || file.isBlank()) {
                throw new IllegalArgumentException("selectedFiles must not contain blank file ids");
            }
        }

        int priority = request.priority() == null ? 0 : request.priority();
        IngestionPayload payload = new IngestionPayload(request.selectedFiles(), request.options());
        logger.info("Submitting ingestion for subject {} with {} files, priority {}",
                request.subjectId(), payload.fileCount(), priority);

        IngestionTaskEntity task = queueService.enqueue(request.subjectId(), request.resourceId(), payload, priority);
        progressService.create(request.subjectId(), request.resourceId(), task.getId(),
                payload.fileCount(), task.getQueuePosition());

        return new SubmitIngestionResponse(task.getId(), task.getQueuePosition());
    }

    /**
     * 取消排队中的任务，并把对应的进度记录标记为失败
     */
    public CancelTaskResponse cancel(String taskId) {
        IngestionTaskEntity task = queueService.cancel(taskId);
        progressService.markFailed(task.getSubjectId(), CANCELLED_MESSAGE, Map.of("cancelled", true));
        return new CancelTaskResponse(task.getId(), task.getStatus());
    }
}
