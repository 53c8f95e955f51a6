package com.example.ingestion.service;

import com.example.ingestion.config.QueueConfig;
import com.example.ingestion.dto.QueueStatsResponse;
import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.entity.QueueLockEntity;
import com.example.ingestion.exception.DuplicateActiveJobException;
import com.example.ingestion.exception.TaskNotCancellableException;
import com.example.ingestion.exception.TaskNotFoundException;
import com.example.ingestion.model.FailureOutcome;
import com.example.ingestion.model.IngestionPayload;
import com.example.ingestion.model.RecoveredTask;
import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.model.TaskType;
import com.example.ingestion.repository.IngestionTaskRepository;
import com.example.ingestion.repository.QueueLockRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 摄取任务队列服务
 * 
 * <p>封装任务表上的全部操作：
 * <ul>
 *   <li>入队（同一主体最多一个活动任务）</li>
 *   <li>原子认领下一个任务</li>
 *   <li>完成、失败重试、取消等状态迁移</li>
 *   <li>排队位置重算与统计</li>
 *   <li>崩溃遗留任务的恢复</li>
 * </ul>
 * 服务顺序为优先级降序、入队时间升序、ID升序。每次入队、认领、完成、失败和取消之后，
 * 所有QUEUED任务的排队位置都会被重新计算为连续的1..N。
 * 重算前先锁住队列锁行，并发的迁移依次重算，后一个总能读到前一个提交后的队列。
 * </p>
 */
@Service
public class QueueService {

    private static final Logger logger = LoggerFactory.getLogger(QueueService.class);

    public static final String CRASH_RECOVERY_ERROR = "Task was interrupted by a worker restart";

    static final String QUEUE_LOCK_ID = "ingestion-queue";

    private final IngestionTaskRepository taskRepository;
    private final QueueLockRepository lockRepository;
    private final QueueConfig queueConfig;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate lockCreationTemplate;

    public QueueService(IngestionTaskRepository taskRepository,
                        QueueLockRepository lockRepository,
                        QueueConfig queueConfig,
                        Clock clock,
                        ApplicationEventPublisher eventPublisher,
                        PlatformTransactionManager transactionManager) {
        this.taskRepository = taskRepository;
        this.lockRepository = lockRepository;
        this.queueConfig = queueConfig;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.lockCreationTemplate = new TransactionTemplate(transactionManager);
        this.lockCreationTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 启动时创建队列锁行，之后的事务只加锁不插入
     */
    @PostConstruct
    public void initializeQueueLock() {
        if (lockRepository.existsById(QUEUE_LOCK_ID)) {
            return;
        }
        try {
            lockCreationTemplate.executeWithoutResult(status ->
                    lockRepository.saveAndFlush(new QueueLockEntity(QUEUE_LOCK_ID, now())));
            logger.info("Created queue lock row {}", QUEUE_LOCK_ID);
        } catch (DataIntegrityViolationException e) {
            logger.debug("Queue lock row {} was created by another instance", QUEUE_LOCK_ID);
        }
    }

    /**
     * 入队一个文件摄取任务
     * 
     * @param subjectId 主体ID
     * @param resourceId 下游消费方ID
     * @param payload 任务载荷
     * @param priority 优先级，越大越先处理
     * @return 已入队的任务，queuePosition为重算后的位置
     * @throws IllegalArgumentException 参数不合法
     * @throws DuplicateActiveJobException 主体已有QUEUED或PROCESSING的任务
     */
    public IngestionTaskEntity enqueue(String subjectId, String resourceId, IngestionPayload payload, int priority) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        return transactionTemplate.execute(status -> insertQueuedTask(subjectId, resourceId, payload, priority));
    }

    private IngestionTaskEntity insertQueuedTask(String subjectId, String resourceId,
                                                 IngestionPayload payload, int priority) {
        // 先锁队列再读写，保证重算时能看到此前所有已提交的入队
        lockQueue();

        Optional<IngestionTaskEntity> active = taskRepository.findByActiveSubjectId(subjectId);
        if (active.isPresent()) {
            throw new DuplicateActiveJobException(subjectId, active.get().getId());
        }

        LocalDateTime now = now();
        IngestionTaskEntity task = new IngestionTaskEntity();
        task.setId(UUID.randomUUID().toString());
        task.setSubjectId(subjectId);
        task.setActiveSubjectId(subjectId);
        task.setResourceId(resourceId);
        task.setTaskType(TaskType.FILE_INGESTION);
        task.setStatus(TaskStatus.QUEUED);
        task.setPriority(priority);
        task.setPayload(payload.toMap());
        task.setRetryCount(0);
        task.setMaxRetries(queueConfig.getDefaultMaxRetries());
        task.setQueuedAt(now);
        task.setAvailableAt(now);

        try {
            taskRepository.saveAndFlush(task);
        } catch (DataIntegrityViolationException e) {
            // 并发提交时由唯一约束兜底
            logger.warn("Concurrent submission detected for subject {}", subjectId);
            throw new DuplicateActiveJobException(subjectId, null);
        }

        String taskId = task.getId();
        recomputeQueuePositions();
        IngestionTaskEntity saved = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        logger.info("Task enqueued: taskId={}, subjectId={}, priority={}, position={}",
                taskId, subjectId, priority, saved.getQueuePosition());
        eventPublisher.publishEvent(new TaskEnqueuedEvent(taskId, subjectId, priority));
        return saved;
    }

    /**
     * 原子认领下一个可执行任务
     * 
     * <p>按服务顺序读取候选，对每个候选执行带状态条件的UPDATE；
     * 只有把QUEUED改为PROCESSING成功的调用方才拿到任务。
     * 候选全部被他人抢走时重新读取，直到认领成功或没有候选。
     * </p>
     * 
     * @return 认领到的任务（状态PROCESSING），队列为空时返回empty
     */
    public Optional<IngestionTaskEntity> claimNext() {
        LocalDateTime now = now();
        int batch = Math.max(1, queueConfig.getClaimCandidateBatch());

        while (true) {
            List<String> candidates = taskRepository.findClaimCandidates(now, PageRequest.of(0, batch));
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            for (String taskId : candidates) {
                if (taskRepository.claim(taskId, now) == 1) {
                    logger.info("Task claimed: {}", taskId);
                    recomputeQuietly();
                    return taskRepository.findById(taskId);
                }
                logger.debug("Task {} was claimed by another caller", taskId);
            }
        }
    }

    /**
     * 标记任务完成
     * 
     * @return 是否发生了迁移；任务不在PROCESSING时返回false
     */
    public boolean complete(String taskId) {
        if (taskRepository.complete(taskId, now()) == 1) {
            logger.info("Task completed: {}", taskId);
            recomputeQuietly();
            return true;
        }
        IngestionTaskEntity task = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        logger.warn("Task {} not completed, current status is {}", taskId, task.getStatus());
        return false;
    }

    /**
     * 上报一次可重试的失败
     */
    public FailureOutcome fail(String taskId, String error) {
        return fail(taskId, error, true);
    }

    /**
     * 上报任务失败
     * 
     * <p>重试次数加一；可重试且次数未达上限时重新入队到同优先级的队尾，
     * 否则进入终态FAILED。
     * </p>
     * 
     * @param taskId 任务ID
     * @param error 错误信息
     * @param retryable 是否可重试，false时无视剩余次数直接失败
     * @return 任务的新去向
     */
    public FailureOutcome fail(String taskId, String error, boolean retryable) {
        IngestionTaskEntity task = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.getStatus() != TaskStatus.PROCESSING) {
            logger.warn("Ignoring failure report for task {} in status {}", taskId, task.getStatus());
            return new FailureOutcome(task.getStatus(), task.getQueuePosition(), task.getRetryCount());
        }

        int retryCount = task.getRetryCount() + 1;
        LocalDateTime now = now();

        if (retryable && retryCount < task.getMaxRetries()) {
            LocalDateTime availableAt = now.plusSeconds(queueConfig.getRetryBackoffSeconds());
            if (taskRepository.requeue(taskId, retryCount, error, now, availableAt) == 1) {
                Integer position = recomputeQuietly().get(taskId);
                logger.warn("Task {} failed (attempt {}/{}), requeued at position {}: {}",
                        taskId, retryCount, task.getMaxRetries(), position, error);
                return new FailureOutcome(TaskStatus.QUEUED, position, retryCount);
            }
        } else if (taskRepository.failTerminal(taskId, retryCount, error, now) == 1) {
            logger.error("Task {} failed permanently after {} attempt(s): {}", taskId, retryCount, error);
            recomputeQuietly();
            return new FailureOutcome(TaskStatus.FAILED, null, retryCount);
        }

        IngestionTaskEntity current = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        logger.warn("Task {} changed concurrently while recording failure, now {}", taskId, current.getStatus());
        return new FailureOutcome(current.getStatus(), current.getQueuePosition(), current.getRetryCount());
    }

    /**
     * 取消排队中的任务；已被认领或已结束的任务不可取消
     * 
     * @throws TaskNotFoundException 任务不存在
     * @throws TaskNotCancellableException 任务不处于QUEUED
     */
    public IngestionTaskEntity cancel(String taskId) {
        taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));

        if (taskRepository.cancel(taskId, now()) == 0) {
            IngestionTaskEntity current = taskRepository.findById(taskId)
                    .orElseThrow(() -> new TaskNotFoundException(taskId));
            throw new TaskNotCancellableException(taskId, current.getStatus());
        }

        logger.info("Task cancelled: {}", taskId);
        recomputeQuietly();
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * 恢复上次进程崩溃遗留的PROCESSING任务
     * 
     * <p>started_at早于超时阈值的任务直接回到QUEUED，排到同优先级队尾并立即可被认领。
     * 崩溃不是任务自身上报的失败，不消耗重试次数。
     * </p>
     * 
     * @param excludeTaskId 当前Worker正持有的任务，不参与恢复，可为null
     * @return 被恢复的任务及其去向
     */
    public List<RecoveredTask> recoverStaleTasks(String excludeTaskId) {
        LocalDateTime now = now();
        LocalDateTime threshold = now.minusMinutes(queueConfig.getStaleProcessingTimeoutMinutes());
        List<IngestionTaskEntity> stale = taskRepository.findByStatusAndStartedAtBefore(TaskStatus.PROCESSING, threshold);

        List<IngestionTaskEntity> requeued = new ArrayList<>();
        for (IngestionTaskEntity task : stale) {
            if (Objects.equals(task.getId(), excludeTaskId)) {
                continue;
            }
            if (taskRepository.requeue(task.getId(), task.getRetryCount(), CRASH_RECOVERY_ERROR, now, now) == 1) {
                logger.warn("Recovered stale task {} (subject {}), started at {}",
                        task.getId(), task.getSubjectId(), task.getStartedAt());
                requeued.add(task);
            } else {
                logger.debug("Stale task {} changed state before recovery", task.getId());
            }
        }
        if (requeued.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> positions = recomputeQuietly();
        List<RecoveredTask> recovered = new ArrayList<>();
        for (IngestionTaskEntity task : requeued) {
            FailureOutcome outcome = new FailureOutcome(TaskStatus.QUEUED, positions.get(task.getId()), task.getRetryCount());
            recovered.add(new RecoveredTask(task.getId(), task.getSubjectId(), outcome));
        }
        logger.info("Recovered {} stale task(s)", recovered.size());
        return recovered;
    }

    /**
     * 重新计算所有QUEUED任务的排队位置
     * 
     * <p>在调用方事务中执行（没有事务时新开一个），先锁住队列锁行，只更新位置发生变化的行。
     * </p>
     * 
     * @return 任务ID到新位置的映射，按服务顺序排列
     */
    public Map<String, Integer> recomputeQueuePositions() {
        return transactionTemplate.execute(status -> {
            lockQueue();
            List<IngestionTaskEntity> queued =
                    taskRepository.findByStatusOrderByPriorityDescQueuedAtAscIdAsc(TaskStatus.QUEUED);
            Map<String, Integer> positions = new LinkedHashMap<>();
            int position = 1;
            int changed = 0;
            for (IngestionTaskEntity task : queued) {
                positions.put(task.getId(), position);
                if (!Integer.valueOf(position).equals(task.getQueuePosition())) {
                    changed += taskRepository.updateQueuePosition(task.getId(), position);
                }
                position++;
            }
            logger.debug("Queue positions recomputed: {} queued, {} changed", queued.size(), changed);
            return positions;
        });
    }

    public QueueStatsResponse stats() {
        long queued = taskRepository.countByStatus(TaskStatus.QUEUED);
        long processing = taskRepository.countByStatus(TaskStatus.PROCESSING);
        long completed = taskRepository.countByStatus(TaskStatus.COMPLETED);
        long failed = taskRepository.countByStatus(TaskStatus.FAILED);
        long cancelled = taskRepository.countByStatus(TaskStatus.CANCELLED);
        return new QueueStatsResponse(queued, processing, completed, failed, cancelled, queued + processing);
    }

    public Optional<IngestionTaskEntity> findTask(String taskId) {
        return taskRepository.findById(taskId);
    }

    public Optional<IngestionTaskEntity> findActiveTask(String subjectId) {
        return taskRepository.findByActiveSubjectId(subjectId);
    }

    public List<IngestionTaskEntity> listQueued() {
        return taskRepository.findByStatusOrderByPriorityDescQueuedAtAscIdAsc(TaskStatus.QUEUED);
    }

    /**
     * 状态迁移已经提交后的位置重算，失败只记录日志，下一次重算会修正位置
     */
    private Map<String, Integer> recomputeQuietly() {
        try {
            return recomputeQueuePositions();
        } catch (DataAccessException | TransactionException e) {
            logger.warn("Failed to recompute queue positions, will retry on next transition", e);
            return Map.of();
        }
    }

    private void lockQueue() {
        lockRepository.lockById(QUEUE_LOCK_ID)
                .orElseThrow(() -> new IllegalStateException("Queue lock row " + QUEUE_LOCK_ID + " is missing"));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
