package com.example.ingestion;

import com.example.ingestion.dto.ProgressResponse;
import com.example.ingestion.dto.QueueStatsResponse;
import com.example.ingestion.dto.SubmitIngestionRequest;
import com.example.ingestion.dto.SubmitIngestionResponse;
import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.ProgressStage;
import com.example.ingestion.model.ProgressStatus;
import com.example.ingestion.model.ProgressUpdate;
import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.pipeline.IngestionPipeline;
import com.example.ingestion.pipeline.PipelineException;
import com.example.ingestion.pipeline.PipelineRequest;
import com.example.ingestion.pipeline.PipelineResult;
import com.example.ingestion.pipeline.ProgressListener;
import com.example.ingestion.service.IngestionSubmissionService;
import com.example.ingestion.service.ProgressService;
import com.example.ingestion.service.QueueService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 提交 → Worker处理 → 进度查询的完整流程
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:ingestion-flow;DB_CLOSE_DELAY=-1",
        "ingestion.worker.auto-start=true"
})
class IngestionFlowTest {

    @Autowired
    private IngestionSubmissionService submissionService;

    @Autowired
    private ProgressService progressService;

    @Autowired
    private QueueService queueService;

    @Autowired
    private ScriptedPipeline pipeline;

    @Test
    @DisplayName("提交的任务被后台Worker依次处理，失败一次的任务重试后完成")
    void submittedJobsAreProcessedInBackground() throws Exception {
        // given
        pipeline.failOnce("subject-b");

        // when
        SubmitIngestionResponse a = submissionService.submit(
                new SubmitIngestionRequest("subject-a", "agent-1", List.of("file-1", "file-2"), null, 0));
        SubmitIngestionResponse b = submissionService.submit(
                new SubmitIngestionRequest("subject-b", "agent-1", List.of("file-3"), null, 0));
        submissionService.submit(new SubmitIngestionRequest("subject-c", "agent-2", List.of(), null, 0));

        // then
        ProgressResponse progressA = awaitCompletion("subject-a");
        ProgressResponse progressB = awaitCompletion("subject-b");
        ProgressResponse progressC = awaitCompletion("subject-c");

        assertThat(progressA.stage()).isEqualTo(ProgressStage.COMPLETE);
        assertThat(progressA.progressPercentage()).isEqualTo(100.0);
        assertThat(progressA.processedFiles()).isEqualTo(2);
        assertThat(progressA.processingMetadata()).containsEntry("total_files", 2);
        assertThat(progressB.processedFiles()).isEqualTo(1);
        assertThat(progressC.processingMetadata()).containsEntry("processed_count", 0);

        IngestionTaskEntity taskA = queueService.findTask(a.taskId()).orElseThrow();
        IngestionTaskEntity taskB = queueService.findTask(b.taskId()).orElseThrow();
        assertThat(taskA.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(taskA.getRetryCount()).isZero();
        assertThat(taskB.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(taskB.getRetryCount()).isEqualTo(1);
        assertThat(taskB.getActiveSubjectId()).isNull();

        QueueStatsResponse stats = queueService.stats();
        assertThat(stats.completed()).isEqualTo(3);
        assertThat(stats.total()).isZero();
    }

    private ProgressResponse awaitCompletion(String subjectId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            ProgressResponse progress = progressService.get(subjectId).orElseThrow();
            if (progress.status() == ProgressStatus.COMPLETED) {
                return progress;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Ingestion of " + subjectId + " did not complete in time");
    }

    @TestConfiguration
    static class PipelineTestConfig {

        @Bean
        ScriptedPipeline scriptedPipeline() {
            return new ScriptedPipeline();
        }
    }

    /**
     * 逐个文件上报阶段进度的流水线，指定的主体第一次执行时以可重试错误失败
     */
    static class ScriptedPipeline implements IngestionPipeline {

        private final Set<String> failingSubjects = ConcurrentHashMap.newKeySet();

        void failOnce(String subjectId) {
            failingSubjects.add(subjectId);
        }

        @Override
        public PipelineResult run(PipelineRequest request, ProgressListener listener) throws PipelineException {
            if (failingSubjects.remove(request.subjectId())) {
                throw PipelineException.transientError("vector store timeout", null);
            }
            List<String> files = request.payload().selectedFiles();
            for (int i = 0; i < files.size(); i++) {
                listener.onProgress(ProgressUpdate.builder()
                        .stage(ProgressStage.FILE_PROCESSING)
                        .currentFile(files.get(i))
                        .currentFileIndex(i)
                        .build());
                listener.onProgress(ProgressUpdate.stage(ProgressStage.TEXT_EXTRACTION));
                listener.onProgress(ProgressUpdate.embeddingBatch(1, 1, 4, 4));
                listener.onProgress(ProgressUpdate.stage(ProgressStage.STORAGE));
            }
            return PipelineResult.success(files.size());
        }
    }
}
