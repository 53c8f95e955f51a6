package com.example.ingestion.worker;

import com.example.ingestion.config.WorkerConfig;
import com.example.ingestion.dto.WorkerStatusResponse;
import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.FailureOutcome;
import com.example.ingestion.model.IngestionPayload;
import com.example.ingestion.model.ProgressStage;
import com.example.ingestion.model.ProgressUpdate;
import com.example.ingestion.model.RecoveredTask;
import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.model.WorkerState;
import com.example.ingestion.pipeline.IngestionPipeline;
import com.example.ingestion.pipeline.PipelineException;
import com.example.ingestion.pipeline.PipelineResult;
import com.example.ingestion.pipeline.ProgressListener;
import com.example.ingestion.service.ProgressService;
import com.example.ingestion.service.QueueService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueWorkerTest {

    @Mock
    private QueueService queueService;

    @Mock
    private ProgressService progressService;

    @Mock
    private IngestionPipeline pipeline;

    private WorkerConfig workerConfig;

    private QueueWorker worker;

    @BeforeEach
    void setUp() {
        workerConfig = new WorkerConfig();
        workerConfig.setPollIntervalMs(50);
        worker = new QueueWorker(queueService, progressService, pipeline, workerConfig);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        worker.stop();
        worker.awaitTermination(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("队列为空时不处理任何任务")
    void emptyQueueProcessesNothing() {
        when(queueService.claimNext()).thenReturn(Optional.empty());

        assertThat(worker.processNextTask()).isFalse();
        verifyNoInteractions(progressService, pipeline);
    }

    @Test
    @DisplayName("流水线成功后完成任务并写入处理元数据")
    void successfulRunCompletesTask() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1", "file-2")));
        when(pipeline.run(any(), any())).thenAnswer(invocation -> {
            ProgressListener listener = invocation.getArgument(1);
            listener.onProgress(ProgressUpdate.stage(ProgressStage.EMBEDDING));
            return new PipelineResult(2, List.of(), Map.of("total_chunks", 12));
        });
        when(queueService.complete("task-1")).thenReturn(true);

        // when
        boolean processed = worker.processNextTask();

        // then
        assertThat(processed).isTrue();
        verify(progressService).markStarted("subject-1");

        ArgumentCaptor<ProgressUpdate> updates = ArgumentCaptor.forClass(ProgressUpdate.class);
        verify(progressService, times(2)).update(eq("subject-1"), updates.capture());
        assertThat(updates.getAllValues().get(0).getStage()).isEqualTo(ProgressStage.EMBEDDING);
        assertThat(updates.getAllValues().get(1).getProcessedFiles()).isEqualTo(2);
        assertThat(updates.getAllValues().get(1).getFailedFiles()).isZero();

        ArgumentCaptor<Map<String, Object>> metadata = metadataCaptor();
        verify(progressService).markCompleted(eq("subject-1"), metadata.capture());
        assertThat(metadata.getValue())
                .containsEntry("processed_count", 2)
                .containsEntry("total_files", 2)
                .containsEntry("success_rate", 100.0)
                .containsEntry("total_chunks", 12);
        assertThat(worker.status().processedTasks()).isEqualTo(1);
        assertThat(worker.getCurrentTaskId()).isNull();
    }

    @Test
    @DisplayName("可重试的失败会重新入队，进度回到QUEUED")
    void retryableFailureRequeues() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")));
        when(pipeline.run(any(), any()))
                .thenThrow(PipelineException.transientError("embedding service unavailable", null));
        when(queueService.fail("task-1", "embedding service unavailable", true))
                .thenReturn(new FailureOutcome(TaskStatus.QUEUED, 1, 1));

        // when
        worker.processNextTask();

        // then
        verify(progressService).markRequeued("subject-1", 1, "embedding service unavailable");
        verify(progressService, never()).markFailed(anyString(), anyString(), anyMap());
        verify(queueService, never()).complete(anyString());
    }

    @Test
    @DisplayName("永久性失败直接进入终态")
    void permanentFailureMarksProgressFailed() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")));
        when(pipeline.run(any(), any())).thenThrow(PipelineException.permanent("unsupported file type"));
        when(queueService.fail("task-1", "unsupported file type", false))
                .thenReturn(new FailureOutcome(TaskStatus.FAILED, null, 1));

        // when
        worker.processNextTask();

        // then
        verify(progressService).markFailed("subject-1", "unsupported file type", Map.of("retry_count", 1));
        verify(progressService, never()).markRequeued(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("所有文件都失败时按可重试失败处理")
    void allFilesFailedIsRetryableFailure() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1", "file-2")));
        when(pipeline.run(any(), any())).thenReturn(new PipelineResult(0, List.of(
                new PipelineResult.FileFailure("file-1", "empty document"),
                new PipelineResult.FileFailure("file-2", "timeout")), null));
        when(queueService.fail("task-1", QueueWorker.ALL_FILES_FAILED, true))
                .thenReturn(new FailureOutcome(TaskStatus.FAILED, null, 3));

        // when
        worker.processNextTask();

        // then
        ArgumentCaptor<Map<String, Object>> metadata = metadataCaptor();
        verify(progressService).markFailed(eq("subject-1"), eq(QueueWorker.ALL_FILES_FAILED), metadata.capture());
        assertThat(metadata.getValue()).containsEntry("retry_count", 3);
        assertThat((List<?>) metadata.getValue().get("failed_files")).hasSize(2);
        verify(queueService, never()).complete(anyString());
    }

    @Test
    @DisplayName("部分文件失败时任务仍然完成，并记录失败明细")
    void partialSuccessCompletesWithDetails() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1", "file-2")));
        when(pipeline.run(any(), any())).thenReturn(new PipelineResult(1,
                List.of(new PipelineResult.FileFailure("file-2", "corrupt pdf")), null));
        when(queueService.complete("task-1")).thenReturn(true);

        // when
        worker.processNextTask();

        // then
        ArgumentCaptor<ProgressUpdate> update = ArgumentCaptor.forClass(ProgressUpdate.class);
        verify(progressService).update(eq("subject-1"), update.capture());
        assertThat(update.getValue().getFailedFiles()).isEqualTo(1);
        assertThat(update.getValue().getDetails())
                .containsEntry("partial_success", true)
                .containsEntry("failed_files", List.of(Map.of("file_id", "file-2", "error", "corrupt pdf")));

        ArgumentCaptor<Map<String, Object>> metadata = metadataCaptor();
        verify(progressService).markCompleted(eq("subject-1"), metadata.capture());
        assertThat(metadata.getValue()).containsEntry("success_rate", 50.0);
    }

    @Test
    @DisplayName("空文件列表不调用流水线，直接完成")
    void emptyPayloadCompletesWithoutPipeline() {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task()));
        when(queueService.complete("task-1")).thenReturn(true);

        // when
        worker.processNextTask();

        // then
        verifyNoInteractions(pipeline);
        verify(progressService).markCompleted("subject-1",
                Map.of("processed_count", 0, "total_files", 0, "success_rate", 0.0));
    }

    @Test
    @DisplayName("流水线抛出未预期的异常时按可重试失败处理")
    void unexpectedExceptionIsRetryable() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")));
        when(pipeline.run(any(), any())).thenThrow(new IllegalStateException("boom"));
        when(queueService.fail("task-1", "Unexpected pipeline error: boom", true))
                .thenReturn(new FailureOutcome(TaskStatus.QUEUED, 2, 1));

        // when
        worker.processNextTask();

        // then
        verify(progressService).markRequeued("subject-1", 2, "Unexpected pipeline error: boom");
    }

    @Test
    @DisplayName("流水线抛出Error时任务按可重试失败处理，Worker继续运行")
    void pipelineErrorIsRoutedToFailureAndLoopSurvives() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")), Optional.empty());
        when(pipeline.run(any(), any())).thenThrow(new StackOverflowError("deep document"));
        when(queueService.fail("task-1", "Unexpected pipeline error: deep document", true))
                .thenReturn(new FailureOutcome(TaskStatus.QUEUED, 1, 1));

        // when
        worker.start();

        // then
        verify(progressService, timeout(2000)).markRequeued("subject-1", 1, "Unexpected pipeline error: deep document");
        verify(queueService, timeout(2000).atLeast(2)).claimNext();
        assertThat(worker.isRunning()).isTrue();
        assertThat(worker.getCurrentTaskId()).isNull();
    }

    @Test
    @DisplayName("循环内部的Error只记录日志，下一轮继续轮询")
    void loopSurvivesErrorOutsidePipeline() {
        // given
        when(queueService.claimNext())
                .thenThrow(new AssertionError("driver mismatch"))
                .thenReturn(Optional.empty());

        // when
        worker.start();

        // then
        verify(queueService, timeout(2000).atLeast(2)).claimNext();
        assertThat(worker.getState()).isEqualTo(WorkerState.RUNNING);
    }

    @Test
    @DisplayName("进度写入失败不影响任务完成")
    void progressWriteFailureDoesNotFailTask() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")));
        when(pipeline.run(any(), any())).thenAnswer(invocation -> {
            ProgressListener listener = invocation.getArgument(1);
            listener.onProgress(ProgressUpdate.stage(ProgressStage.TEXT_EXTRACTION));
            return PipelineResult.success(1);
        });
        when(progressService.update(eq("subject-1"), any())).thenThrow(new IllegalStateException("db down"));
        when(queueService.complete("task-1")).thenReturn(true);

        // when
        worker.processNextTask();

        // then
        verify(queueService).complete("task-1");
        verify(queueService, never()).fail(anyString(), anyString(), anyBoolean());
    }

    @Test
    @DisplayName("任务已不归本Worker持有时不修改进度")
    void lostTaskLeavesProgressUnchanged() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")));
        when(pipeline.run(any(), any())).thenReturn(PipelineResult.success(1));
        when(queueService.complete("task-1")).thenReturn(false);

        // when
        worker.processNextTask();

        // then
        verify(progressService, never()).markCompleted(anyString(), anyMap());
    }

    @Test
    @DisplayName("崩溃恢复的结果同步到进度记录")
    void recoveredTasksUpdateProgress() {
        // given
        when(queueService.recoverStaleTasks(null)).thenReturn(List.of(
                new RecoveredTask("task-1", "subject-1", new FailureOutcome(TaskStatus.QUEUED, 1, 0)),
                new RecoveredTask("task-2", "subject-2", new FailureOutcome(TaskStatus.QUEUED, 2, 2))));

        // when
        int recovered = worker.recoverStaleTasks();

        // then
        assertThat(recovered).isEqualTo(2);
        verify(progressService).markRequeued("subject-1", 1, QueueService.CRASH_RECOVERY_ERROR);
        verify(progressService).markRequeued("subject-2", 2, QueueService.CRASH_RECOVERY_ERROR);
        verify(progressService, never()).markFailed(anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("启动后在后台线程处理任务，停止后回到STOPPED")
    void startProcessesInBackgroundAndStops() throws Exception {
        // given
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")), Optional.empty());
        when(pipeline.run(any(), any())).thenReturn(PipelineResult.success(1));
        when(queueService.complete("task-1")).thenReturn(true);

        // when
        assertThat(worker.start()).isTrue();
        assertThat(worker.start()).isFalse();

        // then
        verify(progressService, timeout(2000)).markCompleted(eq("subject-1"), anyMap());
        assertThat(worker.isRunning()).isTrue();

        worker.stop();
        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
        verify(queueService).recoverStaleTasks(null);
    }

    @Test
    @DisplayName("wakeUp提前结束空闲等待")
    void wakeUpCutsIdleWait() throws Exception {
        // given
        workerConfig.setPollIntervalMs(60_000);
        when(queueService.claimNext()).thenReturn(Optional.empty());
        worker.start();
        verify(queueService, timeout(2000)).claimNext();

        // when
        worker.wakeUp();

        // then
        verify(queueService, timeout(2000).times(2)).claimNext();
    }

    @Test
    @DisplayName("停止时等待正在执行的任务结束")
    void stopWaitsForInFlightTask() throws Exception {
        // given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(queueService.claimNext()).thenReturn(Optional.of(task("file-1")), Optional.empty());
        when(pipeline.run(any(), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return PipelineResult.success(1);
        });
        when(queueService.complete("task-1")).thenReturn(true);

        worker.start();
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        // when
        worker.stop();

        // then
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPING);
        assertThat(worker.getCurrentTaskId()).isEqualTo("task-1");
        assertThat(worker.awaitTermination(Duration.ofMillis(100))).isFalse();

        release.countDown();
        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
        verify(queueService).complete("task-1");
        verify(queueService, times(1)).claimNext();
    }

    @Test
    void statusReportsIdleWorker() {
        WorkerStatusResponse status = worker.status();

        assertThat(status.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(status.currentTaskId()).isNull();
        assertThat(status.pollIntervalMs()).isEqualTo(50);
        assertThat(status.processedTasks()).isZero();
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<Map<String, Object>> metadataCaptor() {
        return ArgumentCaptor.forClass(Map.class);
    }

    private static IngestionTaskEntity task(String... files) {
        IngestionTaskEntity task = new IngestionTaskEntity();
        task.setId("task-1");
        task.setSubjectId("subject-1");
        task.setResourceId("agent-1");
        task.setStatus(TaskStatus.PROCESSING);
        task.setMaxRetries(3);
        task.setPayload(new IngestionPayload(List.of(files), Map.of()).toMap());
        return task;
    }
}
