package com.example.ingestion.worker;

import com.example.ingestion.config.WorkerConfig;
import com.example.ingestion.dto.WorkerStatusResponse;
import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.FailureOutcome;
import com.example.ingestion.model.IngestionPayload;
import com.example.ingestion.model.ProgressUpdate;
import com.example.ingestion.model.RecoveredTask;
import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.model.WorkerState;
import com.example.ingestion.pipeline.IngestionPipeline;
import com.example.ingestion.pipeline.PipelineException;
import com.example.ingestion.pipeline.PipelineRequest;
import com.example.ingestion.pipeline.PipelineResult;
import com.example.ingestion.service.ProgressService;
import com.example.ingestion.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 摄取队列的后台Worker
 * 
 * <p>单线程消费者，一次只持有一个任务：
 * <ul>
 *   <li>认领下一个任务，进度进入FILE_PROCESSING</li>
 *   <li>在自己的线程上同步调用流水线，并把流水线的进度回调转发给进度服务</li>
 *   <li>根据结果完成任务，或者上报失败（重新入队或终态失败）</li>
 * </ul>
 * 队列为空时按轮询间隔休眠，{@link #wakeUp()} 可以提前结束休眠。
 * 停止时不会打断正在执行的任务，当前任务结束后循环退出。
 * </p>
 * 
 * <p>生命周期：STOPPED → RUNNING → STOPPING → STOPPED。
 * </p>
 */
public class QueueWorker {

    private static final Logger logger = LoggerFactory.getLogger(QueueWorker.class);

    static final String ALL_FILES_FAILED = "All files failed to process";

    private final QueueService queueService;
    private final ProgressService progressService;
    private final IngestionPipeline pipeline;
    private final WorkerConfig workerConfig;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.STOPPED);
    private final Semaphore wakeSignal = new Semaphore(0);
    private final AtomicLong processedTasks = new AtomicLong();

    private volatile String currentTaskId;
    private volatile ExecutorService executor;

    public QueueWorker(QueueService queueService,
                       ProgressService progressService,
                       IngestionPipeline pipeline,
                       WorkerConfig workerConfig) {
        this.queueService = queueService;
        this.progressService = progressService;
        this.pipeline = pipeline;
        this.workerConfig = workerConfig;
    }

    /**
     * 启动Worker，已在运行时为无操作
     * 
     * @return 是否真正启动了新的轮询循环
     */
    public boolean start() {
        if (!state.compareAndSet(WorkerState.STOPPED, WorkerState.RUNNING)) {
            logger.warn("Queue worker not started, current state is {}", state.get());
            return false;
        }

        try {
            recoverStaleTasks();
        } catch (RuntimeException e) {
            logger.error("Stale task recovery failed at worker start", e);
        }

        wakeSignal.drainPermits();
        ExecutorService loopExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("ingestion-worker-"));
        executor = loopExecutor;
        loopExecutor.execute(this::runLoop);
        loopExecutor.shutdown();

        logger.info("Queue worker started, poll interval {} ms", workerConfig.getPollIntervalMs());
        return true;
    }

    /**
     * 请求停止；当前任务会执行完毕，配合 {@link #awaitTermination(Duration)} 等待循环退出
     */
    public void stop() {
        if (state.compareAndSet(WorkerState.RUNNING, WorkerState.STOPPING)) {
            logger.info("Stopping queue worker, in-flight task: {}", currentTaskId);
            wakeSignal.release();
        }
    }

    /**
     * 等待轮询循环退出
     * 
     * @return 是否在超时前退出
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService loopExecutor = executor;
        if (loopExecutor == null) {
            return true;
        }
        boolean terminated = loopExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
            logger.warn("Queue worker did not stop within {}, in-flight task: {}", timeout, currentTaskId);
        }
        return terminated;
    }

    /**
     * 结束当前的空闲等待，立即检查队列
     */
    public void wakeUp() {
        if (wakeSignal.availablePermits() == 0) {
            wakeSignal.release();
        }
    }

    /**
     * 恢复崩溃遗留的任务，跳过本Worker正在处理的任务，并同步更新对应的进度记录
     * 
     * @return 恢复的任务数
     */
    public int recoverStaleTasks() {
        List<RecoveredTask> recovered = queueService.recoverStaleTasks(currentTaskId);
        for (RecoveredTask task : recovered) {
            applyFailureToProgress(task.subjectId(), task.outcome(), QueueService.CRASH_RECOVERY_ERROR, null);
        }
        return recovered.size();
    }

    public WorkerStatusResponse status() {
        return new WorkerStatusResponse(state.get(), currentTaskId,
                workerConfig.getPollIntervalMs(), processedTasks.get());
    }

    public WorkerState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == WorkerState.RUNNING;
    }

    public String getCurrentTaskId() {
        return currentTaskId;
    }

    private void runLoop() {
        try {
            while (state.get() == WorkerState.RUNNING) {
                boolean processed = false;
                try {
                    processed = processNextTask();
                } catch (Throwable e) {
                    logger.error("Unexpected error in queue worker loop", e);
                }
                if (!processed && state.get() == WorkerState.RUNNING) {
                    awaitWork();
                }
            }
        } finally {
            state.set(WorkerState.STOPPED);
            logger.info("Queue worker stopped after {} task(s)", processedTasks.get());
        }
    }

    private void awaitWork() {
        try {
            if (wakeSignal.tryAcquire(workerConfig.getPollIntervalMs(), TimeUnit.MILLISECONDS)) {
                wakeSignal.drainPermits();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Queue worker interrupted while idle, stopping");
            state.compareAndSet(WorkerState.RUNNING, WorkerState.STOPPING);
        }
    }

    /**
     * 认领并处理一个任务
     * 
     * @return 是否处理了任务；队列为空时返回false
     */
    boolean processNextTask() {
        Optional<IngestionTaskEntity> claimed = queueService.claimNext();
        if (claimed.isEmpty()) {
            return false;
        }

        IngestionTaskEntity task = claimed.get();
        currentTaskId = task.getId();
        try {
            execute(task);
        } finally {
            currentTaskId = null;
            processedTasks.incrementAndGet();
        }
        return true;
    }

    private void execute(IngestionTaskEntity task) {
        String taskId = task.getId();
        String subjectId = task.getSubjectId();
        IngestionPayload payload = IngestionPayload.fromMap(task.getPayload());
        int attempt = task.getRetryCount() + 1;

        logger.info("Processing task {} for subject {} ({} files, attempt {}/{})",
                taskId, subjectId, payload.fileCount(), attempt, task.getMaxRetries());

        try {
            progressService.markStarted(subjectId);
        } catch (RuntimeException e) {
            logger.warn("Failed to mark progress started for subject {}: {}", subjectId, e.getMessage());
        }

        if (payload.fileCount() == 0) {
            logger.warn("No files to process for task {}, completing immediately", taskId);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("processed_count", 0);
            metadata.put("total_files", 0);
            metadata.put("success_rate", 0.0);
            finishSuccessfully(taskId, subjectId, metadata);
            return;
        }

        PipelineResult result;
        try {
            PipelineRequest request = new PipelineRequest(taskId, subjectId, task.getResourceId(), payload, attempt);
            result = pipeline.run(request, update -> forwardProgress(subjectId, update));
        } catch (PipelineException e) {
            logger.error("Pipeline failed for task {} (retryable={}): {}", taskId, e.isRetryable(), e.getMessage(), e);
            handleFailure(taskId, subjectId, e.getMessage(), e.isRetryable(), null);
            return;
        } catch (Throwable e) {
            // Error和绕过编译检查抛出的受检异常同样按可重试失败处理，任务不能停留在PROCESSING
            logger.error("Unexpected pipeline error for task {}", taskId, e);
            handleFailure(taskId, subjectId, "Unexpected pipeline error: " + e.getMessage(), true, null);
            return;
        }

        if (result == null) {
            handleFailure(taskId, subjectId, "Pipeline returned no result", true, null);
            return;
        }

        int totalFiles = payload.fileCount();
        int processed = result.processedFiles();
        List<Map<String, Object>> failures = describeFailures(result.failures());

        if (processed == 0) {
            logger.error("All {} file(s) failed for task {}", totalFiles, taskId);
            handleFailure(taskId, subjectId, ALL_FILES_FAILED, true, Map.of("failed_files", failures));
            return;
        }

        double successRate = processed * 100.0 / totalFiles;
        ProgressUpdate.Builder counters = ProgressUpdate.builder()
                .processedFiles(processed)
                .failedFiles(failures.size());
        if (!failures.isEmpty()) {
            logger.warn("Task {} finished with {} failed file(s)", taskId, failures.size());
            counters.detail("partial_success", true).detail("failed_files", failures);
        }
        forwardProgress(subjectId, counters.build());

        Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
        metadata.put("processed_count", processed);
        metadata.put("total_files", totalFiles);
        metadata.put("success_rate", successRate);
        finishSuccessfully(taskId, subjectId, metadata);

        logger.info("Task {} completed: {}/{} files processed ({}%)",
                taskId, processed, totalFiles, String.format("%.1f", successRate));
    }

    private void finishSuccessfully(String taskId, String subjectId, Map<String, Object> metadata) {
        if (queueService.complete(taskId)) {
            progressService.markCompleted(subjectId, metadata);
        } else {
            logger.warn("Task {} was no longer held by this worker, progress left unchanged", taskId);
        }
    }

    private void handleFailure(String taskId, String subjectId, String error, boolean retryable,
                               Map<String, Object> metadata) {
        FailureOutcome outcome = queueService.fail(taskId, error, retryable);
        applyFailureToProgress(subjectId, outcome, error, metadata);
    }

    private void applyFailureToProgress(String subjectId, FailureOutcome outcome, String error,
                                        Map<String, Object> metadata) {
        if (outcome.isRequeued()) {
            progressService.markRequeued(subjectId, outcome.queuePosition(), error);
        } else if (outcome.status() == TaskStatus.FAILED) {
            Map<String, Object> failureMetadata = new LinkedHashMap<>();
            if (metadata != null) {
                failureMetadata.putAll(metadata);
            }
            failureMetadata.put("retry_count", outcome.retryCount());
            progressService.markFailed(subjectId, error, failureMetadata);
        }
    }

    private void forwardProgress(String subjectId, ProgressUpdate update) {
        try {
            progressService.update(subjectId, update);
        } catch (RuntimeException e) {
            logger.warn("Failed to record progress for subject {}: {}", subjectId, e.getMessage());
        }
    }

    private List<Map<String, Object>> describeFailures(List<PipelineResult.FileFailure> failures) {
        List<Map<String, Object>> described = new ArrayList<>();
        for (PipelineResult.FileFailure failure : failures) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("file_id", failure.file());
            entry.put("error", failure.error());
            described.add(entry);
        }
        return described;
    }
}
