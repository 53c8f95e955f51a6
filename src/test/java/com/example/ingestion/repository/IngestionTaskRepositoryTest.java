package com.example.ingestion.repository;

import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.IngestionPayload;
import com.example.ingestion.model.TaskStatus;
import com.example.ingestion.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class IngestionTaskRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 12, 0);

    @Autowired
    private IngestionTaskRepository taskRepository;

    @Test
    @DisplayName("认领只对QUEUED任务生效，第二次认领返回0")
    void claimIsConditionalOnQueuedStatus() {
        // given
        IngestionTaskEntity task = taskRepository.saveAndFlush(queuedTask("subject-1", 0, T0));

        // when
        int first = taskRepository.claim(task.getId(), T0.plusMinutes(1));
        int second = taskRepository.claim(task.getId(), T0.plusMinutes(2));

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        IngestionTaskEntity claimed = taskRepository.findById(task.getId()).orElseThrow();
        assertThat(claimed.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(claimed.getStartedAt()).isEqualTo(T0.plusMinutes(1));
        assertThat(claimed.getQueuePosition()).isNull();
    }

    @Test
    @DisplayName("终态迁移要求任务处于PROCESSING，并释放活动主体")
    void terminalTransitionsRequireProcessing() {
        // given
        IngestionTaskEntity task = taskRepository.saveAndFlush(queuedTask("subject-1", 0, T0));

        // when
        int completeWhileQueued = taskRepository.complete(task.getId(), T0);
        taskRepository.claim(task.getId(), T0);
        int completeWhileProcessing = taskRepository.complete(task.getId(), T0.plusMinutes(5));
        int failAfterComplete = taskRepository.failTerminal(task.getId(), 1, "late", T0.plusMinutes(6));

        // then
        assertThat(completeWhileQueued).isZero();
        assertThat(completeWhileProcessing).isEqualTo(1);
        assertThat(failAfterComplete).isZero();
        IngestionTaskEntity completed = taskRepository.findById(task.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(completed.getActiveSubjectId()).isNull();
        assertThat(completed.getCompletedAt()).isEqualTo(T0.plusMinutes(5));
    }

    @Test
    @DisplayName("重新入队刷新排序键并保留优先级")
    void requeueResetsOrderingKey() {
        // given
        IngestionTaskEntity task = taskRepository.saveAndFlush(queuedTask("subject-1", 7, T0));
        taskRepository.claim(task.getId(), T0.plusMinutes(1));

        // when
        int updated = taskRepository.requeue(task.getId(), 1, "rate limited",
                T0.plusMinutes(2), T0.plusMinutes(3));

        // then
        assertThat(updated).isEqualTo(1);
        IngestionTaskEntity requeued = taskRepository.findById(task.getId()).orElseThrow();
        assertThat(requeued.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(requeued.getPriority()).isEqualTo(7);
        assertThat(requeued.getRetryCount()).isEqualTo(1);
        assertThat(requeued.getErrorMessage()).isEqualTo("rate limited");
        assertThat(requeued.getQueuedAt()).isEqualTo(T0.plusMinutes(2));
        assertThat(requeued.getAvailableAt()).isEqualTo(T0.plusMinutes(3));
        assertThat(requeued.getStartedAt()).isNull();
        assertThat(requeued.getActiveSubjectId()).isEqualTo("subject-1");
    }

    @Test
    @DisplayName("候选任务按优先级降序、入队时间升序返回，并跳过退避中的任务")
    void claimCandidatesFollowServiceOrder() {
        // given
        IngestionTaskEntity low = taskRepository.save(queuedTask("subject-low", 0, T0));
        IngestionTaskEntity highLate = taskRepository.save(queuedTask("subject-high-late", 5, T0.plusSeconds(10)));
        IngestionTaskEntity highEarly = taskRepository.save(queuedTask("subject-high-early", 5, T0.plusSeconds(5)));
        IngestionTaskEntity backingOff = queuedTask("subject-backoff", 9, T0);
        backingOff.setAvailableAt(T0.plusHours(1));
        taskRepository.saveAndFlush(backingOff);

        // when
        List<String> candidates = taskRepository.findClaimCandidates(T0.plusMinutes(1), PageRequest.of(0, 10));

        // then
        assertThat(candidates).containsExactly(highEarly.getId(), highLate.getId(), low.getId());
    }

    @Test
    @DisplayName("取消只对QUEUED任务生效")
    void cancelOnlyQueued() {
        // given
        IngestionTaskEntity queued = taskRepository.save(queuedTask("subject-1", 0, T0));
        IngestionTaskEntity processing = taskRepository.saveAndFlush(queuedTask("subject-2", 0, T0));
        taskRepository.claim(processing.getId(), T0);

        // when / then
        assertThat(taskRepository.cancel(queued.getId(), T0.plusMinutes(1))).isEqualTo(1);
        assertThat(taskRepository.cancel(processing.getId(), T0.plusMinutes(1))).isZero();
        assertThat(taskRepository.countByStatus(TaskStatus.CANCELLED)).isEqualTo(1);
        assertThat(taskRepository.findByActiveSubjectId("subject-1")).isEmpty();
        assertThat(taskRepository.findByActiveSubjectId("subject-2")).isPresent();
    }

    @Test
    @DisplayName("同一主体结束后可以再次拥有活动任务")
    void subjectCanBeReusedAfterTerminalState() {
        // given
        IngestionTaskEntity first = taskRepository.saveAndFlush(queuedTask("subject-1", 0, T0));
        taskRepository.cancel(first.getId(), T0);

        // when
        IngestionTaskEntity second = taskRepository.saveAndFlush(queuedTask("subject-1", 0, T0.plusMinutes(1)));

        // then
        assertThat(taskRepository.findByActiveSubjectId("subject-1"))
                .get()
                .extracting(IngestionTaskEntity::getId)
                .isEqualTo(second.getId());
    }

    @Test
    @DisplayName("唯一约束拒绝同一主体的第二个活动任务")
    void uniqueConstraintRejectsSecondActiveTask() {
        // given
        taskRepository.saveAndFlush(queuedTask("subject-1", 0, T0));

        // when / then
        assertThatThrownBy(() -> taskRepository.saveAndFlush(queuedTask("subject-1", 0, T0.plusSeconds(1))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    static IngestionTaskEntity queuedTask(String subjectId, int priority, LocalDateTime queuedAt) {
        IngestionTaskEntity task = new IngestionTaskEntity();
        task.setId(UUID.randomUUID().toString());
        task.setSubjectId(subjectId);
        task.setActiveSubjectId(subjectId);
        task.setResourceId("agent-" + subjectId);
        task.setTaskType(TaskType.FILE_INGESTION);
        task.setStatus(TaskStatus.QUEUED);
        task.setPriority(priority);
        task.setPayload(new IngestionPayload(List.of("file-1"), Map.of()).toMap());
        task.setRetryCount(0);
        task.setMaxRetries(3);
        task.setQueuedAt(queuedAt);
        task.setAvailableAt(queuedAt);
        return task;
    }
}
